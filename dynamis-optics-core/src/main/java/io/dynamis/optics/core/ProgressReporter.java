package io.dynamis.optics.core;

import io.dynamis.optics.api.OpticsConstants;
import java.util.Locale;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks pass progress and drives the periodic progress log and live display refresh.
 *
 * Called only by the coordinating thread, once per folded pixel result. Purely
 * observational: it never throws and never waits on sampling state.
 *
 * CADENCE:
 *   Progress line   - when more than PROGRESS_INTERVAL_NANOS has passed since the last one.
 *                     Reports completion percentage, channel, line, pixel and the rays traced
 *                     since the previous line; the rolling ray counter then restarts.
 *   Display refresh - at start(), whenever displayIntervalNanos has passed, and at finish().
 *                     Skipped entirely when no refresh callback is supplied.
 */
public final class ProgressReporter {

    private static final Logger LOG = LoggerFactory.getLogger(ProgressReporter.class);

    private final int width;
    private final int height;
    private final int totalPixels;
    private final int channelCount;
    private final long totalWork;
    private final Runnable displayRefresh;
    private final long displayIntervalNanos;
    private final LongSupplier clock;

    private long startTime;
    private long progressTimer;
    private long displayTimer;
    private long rollingRays = 0L;
    private long totalRays = 0L;
    private long pixelsReported = 0L;

    /**
     * @param width                frame width in pixels
     * @param height               frame height in pixels
     * @param channelCount         channels in the pass; must be >= 1
     * @param displayRefresh       live display callback, or null to disable refreshes
     * @param displayIntervalNanos minimum interval between display refreshes
     * @param clock                monotonic nanosecond time source
     */
    public ProgressReporter(int width, int height, int channelCount,
                            Runnable displayRefresh, long displayIntervalNanos,
                            LongSupplier clock) {
        if (channelCount < 1) {
            throw new IllegalArgumentException("channelCount must be >= 1; got " + channelCount);
        }
        if (clock == null) {
            throw new NullPointerException("clock must not be null");
        }
        this.width = width;
        this.height = height;
        this.totalPixels = width * height;
        this.channelCount = channelCount;
        this.totalWork = (long) totalPixels * channelCount;
        this.displayRefresh = displayRefresh;
        this.displayIntervalNanos = displayIntervalNanos;
        this.clock = clock;
    }

    // -- Pass lifecycle -------------------------------------------------------

    /** Starts the pass timers and performs the initial display refresh. */
    public void start() {
        long now = clock.getAsLong();
        startTime = now;
        progressTimer = now;
        displayTimer = now;
        if (displayRefresh != null) {
            displayRefresh.run();
        }
    }

    /**
     * Records one folded pixel result.
     *
     * @param channelIndex index of the channel being sampled, 0-based
     * @param pixelIndex   number of results already folded in this channel, 0-based
     * @param rayCount     rays traced for this pixel
     */
    public void update(int channelIndex, int pixelIndex, long rayCount) {
        rollingRays += rayCount;
        totalRays += rayCount;
        pixelsReported++;

        long now = clock.getAsLong();
        if (now - progressTimer > OpticsConstants.PROGRESS_INTERVAL_NANOS) {
            logProgress(channelIndex, pixelIndex);
            rollingRays = 0L;
            progressTimer = now;
        }
        if (displayRefresh != null && now - displayTimer > displayIntervalNanos) {
            LOG.debug("Refreshing display...");
            displayRefresh.run();
            displayTimer = now;
        }
    }

    /**
     * Ends the pass: performs the final display refresh and logs total elapsed time.
     *
     * @return statistics for the pass
     */
    public ObservationStatistics finish() {
        if (displayRefresh != null) {
            displayRefresh.run();
        }
        long elapsed = clock.getAsLong() - startTime;
        if (LOG.isInfoEnabled()) {
            LOG.info("Render complete - time elapsed {}s",
                String.format(Locale.ROOT, "%.3f", elapsed / 1.0e9));
        }
        return new ObservationStatistics(elapsed, totalRays, pixelsReported, channelCount);
    }

    // -- Accessors ------------------------------------------------------------

    /** Pixel results expected over the whole pass (pixels times channels). */
    public long totalWork() { return totalWork; }

    /** Rays recorded since start(). */
    public long totalRays() { return totalRays; }

    /** Rays recorded since the last progress line. */
    public long rollingRays() { return rollingRays; }

    private void logProgress(int channelIndex, int pixelIndex) {
        if (!LOG.isInfoEnabled()) {
            return;
        }
        long currentWork = (long) totalPixels * channelIndex + pixelIndex;
        double completion = 100.0 * currentWork / totalWork;
        int line = (int) Math.ceil((pixelIndex + 1) / (double) width);
        LOG.info("{}% complete (channel {}/{}, line {}/{}, pixel {}/{}, {}k rays)",
            String.format(Locale.ROOT, "%.2f", completion),
            channelIndex + 1, channelCount,
            line, height,
            pixelIndex + 1, totalPixels,
            String.format(Locale.ROOT, "%.1f", rollingRays / 1000.0));
    }
}
