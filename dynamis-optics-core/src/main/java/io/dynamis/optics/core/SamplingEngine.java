package io.dynamis.optics.core;

import io.dynamis.optics.api.SamplingException;

/**
 * Samples every pixel of every channel of one pass and folds the results into the
 * pass's accumulator.
 *
 * The thread calling sample() is the coordinator: it is the only thread that touches
 * the accumulation pass and the progress reporter.
 */
public interface SamplingEngine {

    /**
     * Runs the pass. Returns once every pixel of every channel has been folded.
     *
     * @throws SamplingException    if any pixel fails; the pass is left partially folded
     * @throws InterruptedException if the coordinating thread is interrupted while waiting
     */
    void sample(PassContext context) throws SamplingException, InterruptedException;
}
