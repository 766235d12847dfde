package io.dynamis.optics.core;

import io.dynamis.optics.api.ColourConversion;
import io.dynamis.optics.api.GeometryNotImplementedException;
import io.dynamis.optics.api.InvalidConfigurationException;
import io.dynamis.optics.api.NotConnectedException;
import io.dynamis.optics.api.OpticsConstants;
import io.dynamis.optics.api.PixelSampler;
import io.dynamis.optics.api.SamplingException;
import io.dynamis.optics.api.SceneRoot;
import io.dynamis.optics.api.SpectralChannel;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.SplittableRandom;
import java.util.concurrent.ThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base observer: a progressive, spectrally resolved image sampler attached to a scene root.
 *
 * OBSERVE PIPELINE:
 *   1. Require a scene root (NotConnectedException otherwise; nothing is touched).
 *   2. If progressive accumulation is off, reset the frame and sample count.
 *   3. Plan spectral channels over [minWavelength, maxWavelength].
 *   4. rebuildPixels() - the variant-specific geometry step; null means not implemented.
 *   5. workerCount == 1 -> SequentialSamplingEngine, otherwise ParallelSamplingEngine.
 *   6. Open an accumulation pass of pixelSamples * channels sample units, run the engine,
 *      complete the pass. A failing pass is abandoned: the frame keeps its partial state
 *      and the accumulated sample count does not advance.
 *
 * CONFIGURATION: every setter validates immediately and throws InvalidConfigurationException.
 * Values are never clamped.
 *
 * THREAD SAFETY: a camera is driven by one thread. observe() makes that thread the
 * coordinator; configuration must not change while observe() is running.
 */
public abstract class Camera {

    private static final Logger LOG = LoggerFactory.getLogger(Camera.class);

    // -- Spectral configuration -----------------------------------------------

    private double minWavelength = OpticsConstants.MIN_WAVELENGTH_NM;
    private double maxWavelength = OpticsConstants.MAX_WAVELENGTH_NM;
    private int spectralSamples;
    private int spectralChannels;

    // -- Sampling configuration -----------------------------------------------

    private int pixelSamples;
    private int workerCount;
    private boolean progressive;
    private ThreadFactory threadFactory = ParallelSamplingEngine::daemonThread;
    private SplittableRandom random = new SplittableRandom();

    // -- Display --------------------------------------------------------------

    private boolean displayProgress = true;
    private double displayUpdateSeconds = OpticsConstants.DEFAULT_DISPLAY_UPDATE_SECONDS;
    private FrameListener frameListener = null;

    // -- State ----------------------------------------------------------------

    private final ColourConversion colour;
    private final ProgressiveAccumulator accumulator;
    private SceneRoot scene = null;
    private ObservationStatistics lastStatistics = null;

    // -- Construction ---------------------------------------------------------

    /**
     * @param width            image width in pixels; >= 1
     * @param height           image height in pixels; >= 1
     * @param sensitivity      display gain; > 0
     * @param spectralSamples  spectral bins per channel; >= 1
     * @param spectralChannels spectral channels per pass; >= 1
     * @param pixelSamples     samples per pixel per channel; >= 1
     * @param workerCount      1 for sequential sampling, otherwise the worker pool size
     * @param progressive      true to fold each observe() into the previous result
     * @param colour           spectrum and display colour conversion; must not be null
     * @throws InvalidConfigurationException if any value is out of range
     */
    protected Camera(int width, int height, double sensitivity,
                     int spectralSamples, int spectralChannels, int pixelSamples,
                     int workerCount, boolean progressive,
                     ColourConversion colour) {
        if (colour == null) {
            throw new NullPointerException("colour must not be null");
        }
        requireDimensions(width, height);
        setSpectralSamples(spectralSamples);
        setSpectralChannels(spectralChannels);
        setPixelSamples(pixelSamples);
        setWorkerCount(workerCount);
        this.progressive = progressive;
        this.colour = colour;
        this.accumulator = new ProgressiveAccumulator(width, height, colour, sensitivity);
    }

    /** Constructs with the defaults from OpticsConstants. */
    protected Camera(ColourConversion colour) {
        this(OpticsConstants.DEFAULT_PIXEL_WIDTH, OpticsConstants.DEFAULT_PIXEL_HEIGHT,
             OpticsConstants.DEFAULT_SENSITIVITY,
             OpticsConstants.DEFAULT_SPECTRAL_SAMPLES, OpticsConstants.DEFAULT_SPECTRAL_CHANNELS,
             OpticsConstants.DEFAULT_PIXEL_SAMPLES, OpticsConstants.defaultWorkerCount(),
             false, colour);
    }

    // -- Variant hook ---------------------------------------------------------

    /**
     * Recomputes per-pixel sampling geometry from the current configuration.
     *
     * Runs at the start of every observe(), so property changes between calls take effect.
     * Work that does not vary per pixel sample belongs here rather than in the sampler.
     *
     * @return the sampler for this pass; null if the variant provides no geometry, which
     *         fails observe() with GeometryNotImplementedException
     */
    protected abstract PixelSampler rebuildPixels();

    // -- Observation ----------------------------------------------------------

    /**
     * Performs one observation pass.
     *
     * @return statistics for the pass
     * @throws NotConnectedException           if no scene root is attached
     * @throws GeometryNotImplementedException if rebuildPixels() supplied no sampler
     * @throws SamplingException               if any pixel fails; the pass is abandoned
     * @throws InterruptedException            if interrupted while waiting on workers
     */
    public final ObservationStatistics observe() throws SamplingException, InterruptedException {
        SceneRoot root = this.scene;
        if (root == null) {
            throw new NotConnectedException(
                "Observer is not connected to a scene root; call attach() before observe().");
        }

        if (!progressive) {
            accumulator.reset();
        }

        List<SpectralChannel> plan = SpectralChannelPlanner.plan(
            minWavelength, maxWavelength, spectralChannels, spectralSamples);

        PixelSampler sampler = rebuildPixels();
        if (sampler == null) {
            throw new GeometryNotImplementedException(getClass().getName());
        }

        SamplingEngine engine = workerCount == 1
            ? new SequentialSamplingEngine(random.split())
            : new ParallelSamplingEngine(workerCount, threadFactory, random.split());

        FrameBuffer frame = accumulator.frame();
        ProgressReporter reporter = new ProgressReporter(
            frame.width(), frame.height(), plan.size(),
            displayProgress ? this::display : null,
            (long) (displayUpdateSeconds * 1.0e9),
            System::nanoTime);

        long newSamples = (long) pixelSamples * plan.size();
        ProgressiveAccumulator.AccumulationPass pass = accumulator.beginPass(newSamples);
        LOG.debug("Observe: {}x{} pixels, {} channel(s), {} sample units, {} worker(s)",
            frame.width(), frame.height(), plan.size(), newSamples, workerCount);
        try {
            reporter.start();
            engine.sample(new PassContext(frame.width(), frame.height(), plan,
                sampler, root, colour, pass, reporter));
            pass.complete();
        } finally {
            if (!pass.isClosed()) {
                pass.abandon();
            }
        }

        lastStatistics = reporter.finish();
        return lastStatistics;
    }

    /** Pushes the current frame to the frame listener, if one is set. */
    public final void display() {
        FrameListener listener = this.frameListener;
        if (listener != null) {
            listener.frameUpdated(accumulator.frame());
        }
    }

    /**
     * Writes the current display grid to {@code path} as PNG.
     *
     * @throws IOException if the file cannot be written
     */
    public final void save(Path path) throws IOException {
        FrameImageWriter.writePng(accumulator.frame(), path);
    }

    // -- Scene attachment -----------------------------------------------------

    /** Attaches this observer to a scene root. */
    public final void attach(SceneRoot root) {
        if (root == null) {
            throw new NullPointerException("root must not be null");
        }
        this.scene = root;
    }

    /** Detaches this observer; observe() fails until re-attached. */
    public final void detach() {
        this.scene = null;
    }

    public final boolean isConnected() { return scene != null; }

    public final SceneRoot scene() { return scene; }

    // -- Frame state ----------------------------------------------------------

    /** The live frame. Read-only for callers; mutated only by observe(). */
    public final FrameBuffer frame() { return accumulator.frame(); }

    /** Sample units folded into the frame so far. */
    public final long accumulatedSamples() { return accumulator.accumulatedSamples(); }

    /** Statistics of the last completed observe(), or null. */
    public final ObservationStatistics lastStatistics() { return lastStatistics; }

    /** Captures frame and sample count, e.g. to undo an aborted pass. */
    public final ProgressiveAccumulator.Snapshot snapshot() { return accumulator.snapshot(); }

    /** Restores a snapshot taken by {@link #snapshot()}. */
    public final void restore(ProgressiveAccumulator.Snapshot snapshot) { accumulator.restore(snapshot); }

    /**
     * Changes the image dimensions. The frame is recreated and accumulation restarts.
     *
     * @throws InvalidConfigurationException if either dimension is < 1
     */
    public final void resize(int width, int height) {
        requireDimensions(width, height);
        accumulator.resize(width, height);
    }

    public final int width() { return accumulator.frame().width(); }

    public final int height() { return accumulator.frame().height(); }

    // -- Configuration --------------------------------------------------------

    public final double sensitivity() { return accumulator.sensitivity(); }

    /** @throws InvalidConfigurationException if sensitivity is not positive and finite */
    public final void setSensitivity(double sensitivity) {
        accumulator.setSensitivity(sensitivity);
    }

    public final int spectralSamples() { return spectralSamples; }

    public final void setSpectralSamples(int spectralSamples) {
        if (spectralSamples < 1) {
            throw new InvalidConfigurationException(
                "spectralSamples must be >= 1; got " + spectralSamples);
        }
        this.spectralSamples = spectralSamples;
    }

    public final int spectralChannels() { return spectralChannels; }

    public final void setSpectralChannels(int spectralChannels) {
        if (spectralChannels < 1) {
            throw new InvalidConfigurationException(
                "spectralChannels must be >= 1; got " + spectralChannels);
        }
        this.spectralChannels = spectralChannels;
    }

    public final int pixelSamples() { return pixelSamples; }

    public final void setPixelSamples(int pixelSamples) {
        if (pixelSamples < 1) {
            throw new InvalidConfigurationException("pixelSamples must be >= 1; got " + pixelSamples);
        }
        this.pixelSamples = pixelSamples;
    }

    public final int workerCount() { return workerCount; }

    public final void setWorkerCount(int workerCount) {
        if (workerCount < 1) {
            throw new InvalidConfigurationException("workerCount must be >= 1; got " + workerCount);
        }
        this.workerCount = workerCount;
    }

    public final boolean isProgressive() { return progressive; }

    /** When true, the next observe() folds into the existing frame instead of replacing it. */
    public final void setProgressive(boolean progressive) { this.progressive = progressive; }

    public final double minWavelength() { return minWavelength; }

    public final double maxWavelength() { return maxWavelength; }

    /**
     * Sets the sampled wavelength range, in nanometres.
     *
     * @throws InvalidConfigurationException unless 0 < minWavelength < maxWavelength
     */
    public final void setWavelengthRange(double minWavelength, double maxWavelength) {
        if (!(minWavelength > 0.0) || !(maxWavelength > minWavelength) || Double.isInfinite(maxWavelength)) {
            throw new InvalidConfigurationException(
                "wavelength range must satisfy 0 < min < max; got [" + minWavelength + ", " + maxWavelength + "]");
        }
        this.minWavelength = minWavelength;
        this.maxWavelength = maxWavelength;
    }

    public final boolean isDisplayProgress() { return displayProgress; }

    /** When true, the frame listener is refreshed during observe(). */
    public final void setDisplayProgress(boolean displayProgress) { this.displayProgress = displayProgress; }

    public final double displayUpdateSeconds() { return displayUpdateSeconds; }

    public final void setDisplayUpdateSeconds(double seconds) {
        if (!(seconds > 0.0) || Double.isInfinite(seconds)) {
            throw new InvalidConfigurationException(
                "displayUpdateSeconds must be a positive finite number; got " + seconds);
        }
        this.displayUpdateSeconds = seconds;
    }

    public final void setFrameListener(FrameListener listener) { this.frameListener = listener; }

    /** Thread factory for the producer and worker threads of the parallel engine. */
    public final void setThreadFactory(ThreadFactory threadFactory) {
        if (threadFactory == null) {
            throw new NullPointerException("threadFactory must not be null");
        }
        this.threadFactory = threadFactory;
    }

    /** Reseeds the root generator every engine and worker generator is split from. */
    public final void setRandomSeed(long seed) {
        this.random = new SplittableRandom(seed);
    }

    private static void requireDimensions(int width, int height) {
        if (width < 1 || height < 1) {
            throw new InvalidConfigurationException(
                "pixel dimensions must be >= 1; got " + width + "x" + height);
        }
    }
}
