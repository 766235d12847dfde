package io.dynamis.optics.core;

/**
 * Receives the frame whenever a camera refreshes its live display.
 *
 * Invoked on the coordinating thread between pixel folds. Implementations must copy
 * anything they keep and must not block for long: sampling does not continue until
 * the call returns.
 */
@FunctionalInterface
public interface FrameListener {

    void frameUpdated(FrameBuffer frame);
}
