package io.dynamis.optics.api;

/**
 * Result of sampling one pixel over one spectral channel.
 *
 * @param spectrum mean spectral radiance over all pixel samples; never null
 * @param rayCount number of rays traced to produce it; diagnostic only, never used for weighting
 */
public record SpectralSample(SampledSpectrum spectrum, long rayCount) {

    public SpectralSample {
        if (spectrum == null) {
            throw new NullPointerException("spectrum must not be null");
        }
        if (rayCount < 0) {
            throw new IllegalArgumentException("rayCount must be >= 0; got " + rayCount);
        }
    }
}
