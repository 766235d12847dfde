package io.dynamis.optics.api;

import java.util.Arrays;

/**
 * Spectral radiance sampled on a uniform wavelength grid.
 *
 * Bin i covers [min + i*delta, min + (i+1)*delta]; its value is the mean radiance over the bin.
 *
 * THREAD SAFETY: not thread-safe. A spectrum is built and consumed by a single thread;
 * only the derived Tristimulus crosses thread boundaries.
 */
public final class SampledSpectrum {

    private final double minWavelength;
    private final double maxWavelength;
    private final double delta;
    private final double[] samples;

    /**
     * Creates a zeroed spectrum.
     *
     * @param minWavelength lower bound in nanometres
     * @param maxWavelength upper bound in nanometres
     * @param bins          number of bins; must be >= 1
     */
    public SampledSpectrum(double minWavelength, double maxWavelength, int bins) {
        if (bins < 1) {
            throw new IllegalArgumentException("bins must be >= 1; got " + bins);
        }
        if (!(maxWavelength > minWavelength)) {
            throw new IllegalArgumentException(
                "maxWavelength must be > minWavelength; got [" + minWavelength + ", " + maxWavelength + "]");
        }
        this.minWavelength = minWavelength;
        this.maxWavelength = maxWavelength;
        this.delta = (maxWavelength - minWavelength) / bins;
        this.samples = new double[bins];
    }

    /** Creates a zeroed spectrum covering the given channel. */
    public static SampledSpectrum forChannel(SpectralChannel channel) {
        return new SampledSpectrum(
            channel.minWavelength(), channel.maxWavelength(), channel.spectralSamples());
    }

    /** Creates a spectrum with every bin set to {@code value}. */
    public static SampledSpectrum constant(SpectralChannel channel, double value) {
        SampledSpectrum s = forChannel(channel);
        Arrays.fill(s.samples, value);
        return s;
    }

    public double minWavelength() { return minWavelength; }

    public double maxWavelength() { return maxWavelength; }

    /** Bin width in nanometres. */
    public double delta() { return delta; }

    /** Number of bins. */
    public int bins() { return samples.length; }

    /** Centre wavelength of bin {@code index}, in nanometres. */
    public double wavelength(int index) {
        return minWavelength + (index + 0.5) * delta;
    }

    public double get(int index) { return samples[index]; }

    public void set(int index, double value) { samples[index] = value; }

    /**
     * Adds {@code other} bin-by-bin into this spectrum.
     *
     * @throws IllegalArgumentException if the two spectra do not share the same grid
     */
    public SampledSpectrum add(SampledSpectrum other) {
        if (other.samples.length != samples.length
                || other.minWavelength != minWavelength
                || other.maxWavelength != maxWavelength) {
            throw new IllegalArgumentException("spectra must share the same wavelength grid");
        }
        for (int i = 0; i < samples.length; i++) {
            samples[i] += other.samples[i];
        }
        return this;
    }

    /** Multiplies every bin by {@code factor}. */
    public SampledSpectrum scale(double factor) {
        for (int i = 0; i < samples.length; i++) {
            samples[i] *= factor;
        }
        return this;
    }

    /** Sum of bin values weighted by bin width (radiance integrated over the band). */
    public double integrate() {
        double total = 0.0;
        for (double s : samples) {
            total += s;
        }
        return total * delta;
    }
}
