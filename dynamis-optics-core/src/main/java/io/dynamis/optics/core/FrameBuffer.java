package io.dynamis.optics.core;

import io.dynamis.optics.api.Tristimulus;
import java.util.Arrays;

/**
 * Fixed-size image of XYZ tristimulus cells plus the derived display colour grid.
 *
 * Layout: row-major, three doubles per cell. Cell (x, y) starts at 3 * (y * width + x).
 *
 * THREAD SAFETY:
 *   Mutators are package-private and called only by ProgressiveAccumulator on the
 *   coordinating thread of the active sampling engine. No other thread ever reads or
 *   writes a live frame, so no synchronisation is used. Callers outside the pipeline
 *   see read-only accessors.
 */
public final class FrameBuffer {

    private final int width;
    private final int height;
    private final double[] xyz;
    private final double[] rgb;

    /**
     * @param width  image width in pixels; must be >= 1
     * @param height image height in pixels; must be >= 1
     * @throws IllegalArgumentException if either dimension is < 1
     */
    public FrameBuffer(int width, int height) {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException(
                "frame dimensions must be >= 1; got " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.xyz = new double[width * height * 3];
        this.rgb = new double[width * height * 3];
    }

    private FrameBuffer(FrameBuffer source) {
        this.width = source.width;
        this.height = source.height;
        this.xyz = source.xyz.clone();
        this.rgb = source.rgb.clone();
    }

    // -- Read access ----------------------------------------------------------

    public int width() { return width; }

    public int height() { return height; }

    /** Total number of pixels. */
    public int pixelCount() { return width * height; }

    /** Accumulated XYZ value of pixel (x, y). */
    public Tristimulus xyz(int x, int y) {
        int i = offset(x, y);
        return new Tristimulus(xyz[i], xyz[i + 1], xyz[i + 2]);
    }

    /**
     * Copies the display colour of pixel (x, y) into {@code outRgb}.
     *
     * @param outRgb pre-allocated double[3]
     */
    public void rgb(int x, int y, double[] outRgb) {
        int i = offset(x, y);
        outRgb[0] = rgb[i];
        outRgb[1] = rgb[i + 1];
        outRgb[2] = rgb[i + 2];
    }

    /**
     * Returns a deep copy of this frame.
     * Used to snapshot the buffer before a pass that may abort.
     */
    public FrameBuffer copy() {
        return new FrameBuffer(this);
    }

    // -- Mutation (accumulator only) -----------------------------------------

    void scaleXyz(double factor) {
        for (int i = 0; i < xyz.length; i++) {
            xyz[i] *= factor;
        }
    }

    void addXyz(int x, int y, double weight, Tristimulus value) {
        int i = offset(x, y);
        xyz[i] += weight * value.x();
        xyz[i + 1] += weight * value.y();
        xyz[i + 2] += weight * value.z();
    }

    /** Recomputes the display colour of (x, y) from its XYZ cell. */
    void refreshRgb(int x, int y, DisplayMapping mapping, double[] scratch) {
        int i = offset(x, y);
        mapping.map(xyz[i], xyz[i + 1], xyz[i + 2], scratch);
        rgb[i] = scratch[0];
        rgb[i + 1] = scratch[1];
        rgb[i + 2] = scratch[2];
    }

    void clear() {
        Arrays.fill(xyz, 0.0);
        Arrays.fill(rgb, 0.0);
    }

    void copyFrom(FrameBuffer source) {
        if (source.width != width || source.height != height) {
            throw new IllegalArgumentException(
                "cannot restore a " + source.width + "x" + source.height
                + " frame into a " + width + "x" + height + " frame");
        }
        System.arraycopy(source.xyz, 0, xyz, 0, xyz.length);
        System.arraycopy(source.rgb, 0, rgb, 0, rgb.length);
    }

    private int offset(int x, int y) {
        if (x < 0 || x >= width || y < 0 || y >= height) {
            throw new IndexOutOfBoundsException(
                "pixel (" + x + ", " + y + ") outside " + width + "x" + height + " frame");
        }
        return 3 * (y * width + x);
    }

    /** XYZ to display colour mapping used when refreshing the derived grid. */
    @FunctionalInterface
    interface DisplayMapping {
        void map(double x, double y, double z, double[] outRgb);
    }
}
