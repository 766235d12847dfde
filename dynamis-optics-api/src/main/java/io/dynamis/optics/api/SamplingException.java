package io.dynamis.optics.api;

/**
 * Thrown when sampling a pixel fails.
 *
 * Fatal to the current observe() call. In worker-pool mode the coordinator stops every
 * worker before rethrowing. Carries the failing pixel coordinate when known; both are
 * -1 otherwise.
 */
public final class SamplingException extends Exception {

    private final int pixelX;
    private final int pixelY;

    public SamplingException(String message) {
        super(message);
        this.pixelX = -1;
        this.pixelY = -1;
    }

    public SamplingException(String message, Throwable cause) {
        super(message, cause);
        this.pixelX = -1;
        this.pixelY = -1;
    }

    public SamplingException(String message, int pixelX, int pixelY, Throwable cause) {
        super(message + " (pixel " + pixelX + ", " + pixelY + ")", cause);
        this.pixelX = pixelX;
        this.pixelY = pixelY;
    }

    /** Column of the failing pixel, or -1 if unknown. */
    public int pixelX() { return pixelX; }

    /** Row of the failing pixel, or -1 if unknown. */
    public int pixelY() { return pixelY; }

    /**
     * Wraps {@code cause} with the failing coordinate attached.
     * A SamplingException that already names a pixel is returned unchanged.
     */
    public static SamplingException atPixel(int x, int y, Throwable cause) {
        if (cause instanceof SamplingException se && se.pixelX >= 0) {
            return se;
        }
        String detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new SamplingException("Pixel sampling failed: " + detail, x, y, cause);
    }
}
