package io.dynamis.optics.core;

import io.dynamis.optics.api.Tristimulus;

/**
 * Message on a parallel engine's result channel. Results arrive in no particular order
 * and are addressed by pixel coordinate.
 */
public sealed interface SamplingResult
    permits SamplingResult.Sampled, SamplingResult.Failed {

    int x();

    int y();

    /**
     * A successfully sampled pixel.
     *
     * @param rayCount diagnostic only; feeds statistics, never the accumulation weights
     */
    record Sampled(int x, int y, Tristimulus xyz, long rayCount) implements SamplingResult {}

    /**
     * Sampling of (x, y) failed. Fatal to the whole observe() call.
     *
     * @param cause a SamplingException carrying the pixel, or the Error the sampler raised
     */
    record Failed(int x, int y, Throwable cause) implements SamplingResult {}
}
