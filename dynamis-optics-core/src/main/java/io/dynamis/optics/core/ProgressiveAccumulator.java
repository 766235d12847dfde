package io.dynamis.optics.core;

import io.dynamis.optics.api.ColourConversion;
import io.dynamis.optics.api.InvalidConfigurationException;
import io.dynamis.optics.api.Tristimulus;

/**
 * Owns the frame buffer and the weighted running-mean algebra that lets observation
 * passes of different sizes combine into one unbiased estimate.
 *
 * PASS PROTOCOL:
 *   1. AccumulationPass pass = beginPass(N)
 *        total = A + N; the whole frame is scaled by A / total (the only attenuation step)
 *   2. pass.fold(x, y, contribution) for every contribution received during the pass
 *        cell += (N / total) * contribution, then the display colour of the cell is refreshed
 *   3. pass.complete()  -> A = total
 *   An aborted pass calls abandon() instead: A is left unchanged, the frame stays in its
 *   scaled-but-partially-refolded state and the display grid is recomputed to match it.
 *   The pass, not the pixel, is the unit of atomicity.
 *
 * MULTI-CHANNEL WEIGHTING:
 *   N counts pixel samples times channel count. Every channel of the pass folds with the
 *   same added weight and channel contributions sum into the same cell. Tristimulus values
 *   are additive over disjoint wavelength bands, so the channel sum of one pass is the
 *   full-band value of that pass and no division by channel count is applied.
 *
 * INVARIANT: after any sequence of completed passes the frame holds the sample-weighted
 * mean of every pass result, independent of how samples were split across calls.
 *
 * THREAD SAFETY: single writer. Only the coordinating thread of the active engine calls
 * into an accumulator or its open pass.
 */
public final class ProgressiveAccumulator {

    private FrameBuffer frame;
    private final ColourConversion colour;
    private final double[] rgbScratch = new double[3];
    private final FrameBuffer.DisplayMapping displayMapping = this::toDisplay;

    private double sensitivity;
    private long accumulatedSamples = 0L;
    private AccumulationPass openPass = null;

    /**
     * @param width       frame width in pixels
     * @param height      frame height in pixels
     * @param colour      display colour conversion; must not be null
     * @param sensitivity linear gain applied to XYZ before display conversion; must be > 0
     */
    public ProgressiveAccumulator(int width, int height, ColourConversion colour, double sensitivity) {
        if (colour == null) {
            throw new NullPointerException("colour must not be null");
        }
        this.frame = new FrameBuffer(width, height);
        this.colour = colour;
        setSensitivity(sensitivity);
    }

    // -- Pass lifecycle -------------------------------------------------------

    /**
     * Opens a pass that will fold {@code newSamples} sample units into the frame.
     * Scales existing content by A / (A + N) before returning.
     *
     * @param newSamples sample units contributed by this pass; must be >= 1
     * @return the open pass handle
     * @throws IllegalArgumentException if newSamples < 1
     * @throws IllegalStateException    if a pass is already open
     */
    public AccumulationPass beginPass(long newSamples) {
        if (newSamples < 1) {
            throw new IllegalArgumentException("newSamples must be >= 1; got " + newSamples);
        }
        if (openPass != null) {
            throw new IllegalStateException("a pass is already open; complete or abandon it first");
        }
        long total = accumulatedSamples + newSamples;
        double previousWeight = accumulatedSamples == 0L ? 0.0 : (double) accumulatedSamples / total;
        double addedWeight = (double) newSamples / total;

        frame.scaleXyz(previousWeight);

        openPass = new AccumulationPass(total, addedWeight);
        return openPass;
    }

    /** Discards all accumulated content. Not allowed while a pass is open. */
    public void reset() {
        requireNoOpenPass("reset");
        frame.clear();
        accumulatedSamples = 0L;
    }

    /**
     * Replaces the frame with one of new dimensions and resets accumulation.
     *
     * @throws IllegalArgumentException if either dimension is < 1
     */
    public void resize(int width, int height) {
        requireNoOpenPass("resize");
        frame = new FrameBuffer(width, height);
        accumulatedSamples = 0L;
    }

    // -- Snapshot / restore ---------------------------------------------------

    /** Captures the frame and sample count so a caller can undo an aborted pass. */
    public Snapshot snapshot() {
        requireNoOpenPass("snapshot");
        return new Snapshot(frame.copy(), accumulatedSamples);
    }

    /**
     * Restores a snapshot taken from this accumulator.
     *
     * @throws IllegalArgumentException if the snapshot has different frame dimensions
     */
    public void restore(Snapshot snapshot) {
        requireNoOpenPass("restore");
        frame.copyFrom(snapshot.frame());
        accumulatedSamples = snapshot.accumulatedSamples();
        // the snapshot's display grid may predate a sensitivity change
        refreshDisplay();
    }

    /** Frame content and sample count at one point in time. */
    public record Snapshot(FrameBuffer frame, long accumulatedSamples) {}

    // -- Display --------------------------------------------------------------

    /**
     * Sets the display gain and recomputes the whole display grid.
     *
     * @throws InvalidConfigurationException if sensitivity is not a positive finite number
     */
    public void setSensitivity(double sensitivity) {
        if (!(sensitivity > 0.0) || Double.isInfinite(sensitivity)) {
            throw new InvalidConfigurationException(
                "sensitivity must be a positive finite number; got " + sensitivity);
        }
        this.sensitivity = sensitivity;
        refreshDisplay();
    }

    /** Recomputes the display colour of every pixel from its XYZ cell. */
    public void refreshDisplay() {
        for (int y = 0; y < frame.height(); y++) {
            for (int x = 0; x < frame.width(); x++) {
                frame.refreshRgb(x, y, displayMapping, rgbScratch);
            }
        }
    }

    private void toDisplay(double x, double y, double z, double[] outRgb) {
        colour.toDisplay(x * sensitivity, y * sensitivity, z * sensitivity, outRgb);
    }

    // -- Accessors ------------------------------------------------------------

    /** Sample units folded into the frame by completed passes. */
    public long accumulatedSamples() { return accumulatedSamples; }

    public FrameBuffer frame() { return frame; }

    public double sensitivity() { return sensitivity; }

    /** True while a pass has begun but neither completed nor been abandoned. */
    public boolean isPassOpen() { return openPass != null; }

    private void requireNoOpenPass(String operation) {
        if (openPass != null) {
            throw new IllegalStateException("cannot " + operation + " while a pass is open");
        }
    }

    // -- Pass handle ----------------------------------------------------------

    /**
     * One open accumulation pass. Valid until complete() or abandon().
     */
    public final class AccumulationPass {

        private final long totalSamples;
        private final double addedWeight;
        private boolean closed = false;

        private AccumulationPass(long totalSamples, double addedWeight) {
            this.totalSamples = totalSamples;
            this.addedWeight = addedWeight;
        }

        /** Weight N / (A + N) applied to every contribution of this pass. */
        public double addedWeight() { return addedWeight; }

        /**
         * Adds {@code addedWeight * contribution} into cell (x, y) and refreshes its display colour.
         *
         * @throws IllegalStateException if the pass is closed
         */
        public void fold(int x, int y, Tristimulus contribution) {
            requireOpen();
            frame.addXyz(x, y, addedWeight, contribution);
            frame.refreshRgb(x, y, displayMapping, rgbScratch);
        }

        /** Marks the pass done and advances the accumulated sample count. */
        public void complete() {
            requireOpen();
            accumulatedSamples = totalSamples;
            close();
        }

        /**
         * Closes the pass without advancing the sample count. The display grid is recomputed,
         * since cells not refolded before the abort still hold their pre-pass colour.
         */
        public void abandon() {
            requireOpen();
            close();
            refreshDisplay();
        }

        public boolean isClosed() { return closed; }

        private void close() {
            closed = true;
            openPass = null;
        }

        private void requireOpen() {
            if (closed) {
                throw new IllegalStateException("accumulation pass is already closed");
            }
        }
    }
}
