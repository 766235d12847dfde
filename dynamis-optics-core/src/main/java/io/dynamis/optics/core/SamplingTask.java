package io.dynamis.optics.core;

/**
 * Message on a parallel engine's task channel: a pixel to sample, or the shutdown sentinel.
 *
 * Exactly one Shutdown reaches each worker, and only after the coordinator has received
 * every result of the current channel.
 */
public sealed interface SamplingTask
    permits SamplingTask.PixelTask, SamplingTask.Shutdown {

    /** Sample pixel (x, y) for the worker's channel. */
    record PixelTask(int x, int y) implements SamplingTask {}

    /** Sentinel: no more work, the receiving worker terminates. */
    enum Shutdown implements SamplingTask {
        INSTANCE
    }
}
