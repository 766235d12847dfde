package io.dynamis.optics.api;

/**
 * Default configuration values for Dynamis Optics observers.
 *
 * These are the values a camera starts with before any setter is called.
 * Every one of them can be overridden per camera; none is a hard limit.
 *
 * Wavelength model: visible band 375 nm .. 740 nm, sampled on a uniform grid.
 */
public final class OpticsConstants {

    private OpticsConstants() {}

    // -- Spectral model -------------------------------------------------------

    /** Lower bound of the default wavelength range, in nanometres. */
    public static final double MIN_WAVELENGTH_NM = 375.0;

    /** Upper bound of the default wavelength range, in nanometres. */
    public static final double MAX_WAVELENGTH_NM = 740.0;

    /** Default number of spectral bins sampled per channel. */
    public static final int DEFAULT_SPECTRAL_SAMPLES = 20;

    /**
     * Default number of spectral channels (sub-bands traced independently).
     * Dispersive materials need ~15 or more channels before the effect is visible.
     */
    public static final int DEFAULT_SPECTRAL_CHANNELS = 1;

    // -- Pixel model ----------------------------------------------------------

    /** Default image width in pixels. */
    public static final int DEFAULT_PIXEL_WIDTH = 512;

    /** Default image height in pixels. */
    public static final int DEFAULT_PIXEL_HEIGHT = 512;

    /** Default number of primary samples per pixel per channel. */
    public static final int DEFAULT_PIXEL_SAMPLES = 100;

    /** Default linear gain applied to XYZ before display conversion. */
    public static final double DEFAULT_SENSITIVITY = 1.0;

    // -- Concurrency ----------------------------------------------------------

    /**
     * System property overriding the default worker count.
     * Set {@code -Ddynamis.optics.workers=1} to force the sequential engine.
     */
    public static final String WORKERS_PROPERTY = "dynamis.optics.workers";

    // -- Progress reporting ---------------------------------------------------

    /** Minimum interval between progress log lines, in nanoseconds (1 s). */
    public static final long PROGRESS_INTERVAL_NANOS = 1_000_000_000L;

    /** Default interval between live display refreshes, in seconds. */
    public static final double DEFAULT_DISPLAY_UPDATE_SECONDS = 10.0;

    /**
     * Returns the default worker count: the value of {@link #WORKERS_PROPERTY}
     * if set to a positive integer, otherwise the number of available processors.
     *
     * @throws InvalidConfigurationException if the property is set but is not a positive integer
     */
    public static int defaultWorkerCount() {
        String override = System.getProperty(WORKERS_PROPERTY, "");
        if (override.isBlank()) {
            return Runtime.getRuntime().availableProcessors();
        }
        int workers;
        try {
            workers = Integer.parseInt(override.trim());
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException(
                WORKERS_PROPERTY + " must be a positive integer; got '" + override + "'", e);
        }
        if (workers < 1) {
            throw new InvalidConfigurationException(
                WORKERS_PROPERTY + " must be >= 1; got " + workers);
        }
        return workers;
    }
}
