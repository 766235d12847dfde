package io.dynamis.optics.api;

/**
 * One wavelength sub-band of an observation pass.
 *
 * @param minWavelength   lower bound in nanometres
 * @param maxWavelength   upper bound in nanometres; strictly greater than minWavelength
 * @param spectralSamples number of spectral bins sampled across the band; >= 1
 */
public record SpectralChannel(double minWavelength, double maxWavelength, int spectralSamples) {

    public SpectralChannel {
        if (!(maxWavelength > minWavelength)) {
            throw new InvalidConfigurationException(
                "maxWavelength must be > minWavelength; got [" + minWavelength + ", " + maxWavelength + "]");
        }
        if (spectralSamples < 1) {
            throw new InvalidConfigurationException(
                "spectralSamples must be >= 1; got " + spectralSamples);
        }
    }

    /** Width of the band in nanometres. */
    public double width() {
        return maxWavelength - minWavelength;
    }
}
