package io.dynamis.optics.api;

/**
 * Colour matching curves resampled onto one channel's wavelength grid.
 *
 * Built once per channel per pass and shared read-only by all workers.
 */
public interface SpectralResponse {

    /** The channel these curves were resampled for. */
    SpectralChannel channel();

    /**
     * Integrates {@code spectrum} against the resampled curves.
     *
     * @param spectrum radiance on this response's channel grid
     * @return the XYZ tristimulus of the spectrum over this channel's band only
     */
    Tristimulus toTristimulus(SampledSpectrum spectrum);
}
