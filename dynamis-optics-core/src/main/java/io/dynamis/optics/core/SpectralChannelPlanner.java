package io.dynamis.optics.core;

import io.dynamis.optics.api.InvalidConfigurationException;
import io.dynamis.optics.api.SpectralChannel;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Stateless utility that partitions a wavelength range into equal-width channels.
 *
 * Channel i covers [min + i*delta, min + (i+1)*delta] with delta = (max - min) / channels.
 * Bounds are computed from the index rather than by repeated addition, and the last
 * channel ends exactly at max, so the channels are contiguous and cover the range exactly.
 *
 * Every channel carries the same spectral sample count.
 */
public final class SpectralChannelPlanner {

    private SpectralChannelPlanner() {}

    /**
     * Builds the channel plan for one observation pass.
     *
     * @param minWavelength   lower bound of the full range, in nanometres
     * @param maxWavelength   upper bound of the full range; must be > minWavelength
     * @param channels        number of channels; must be >= 1
     * @param spectralSamples bins per channel; must be >= 1
     * @return immutable list of channels in ascending wavelength order
     * @throws InvalidConfigurationException if any argument is out of range
     */
    public static List<SpectralChannel> plan(double minWavelength, double maxWavelength,
                                             int channels, int spectralSamples) {
        if (channels < 1) {
            throw new InvalidConfigurationException("channels must be >= 1; got " + channels);
        }
        if (spectralSamples < 1) {
            throw new InvalidConfigurationException(
                "spectralSamples must be >= 1; got " + spectralSamples);
        }
        if (!(maxWavelength > minWavelength)) {
            throw new InvalidConfigurationException(
                "maxWavelength must be > minWavelength; got [" + minWavelength + ", " + maxWavelength + "]");
        }

        double delta = (maxWavelength - minWavelength) / channels;
        List<SpectralChannel> plan = new ArrayList<>(channels);
        double lower = minWavelength;
        for (int i = 0; i < channels; i++) {
            double upper = (i == channels - 1) ? maxWavelength : minWavelength + delta * (i + 1);
            plan.add(new SpectralChannel(lower, upper, spectralSamples));
            lower = upper;
        }
        return Collections.unmodifiableList(plan);
    }
}
