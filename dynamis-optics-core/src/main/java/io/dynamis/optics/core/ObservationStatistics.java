package io.dynamis.optics.core;

/**
 * Summary of one completed observation pass.
 *
 * @param elapsedNanos  wall time from pass start to completion
 * @param totalRays     rays traced across all channels
 * @param pixelsSampled pixel results folded across all channels
 * @param channels      number of spectral channels in the pass
 */
public record ObservationStatistics(long elapsedNanos, long totalRays, long pixelsSampled, int channels) {

    public double elapsedSeconds() {
        return elapsedNanos / 1.0e9;
    }
}
