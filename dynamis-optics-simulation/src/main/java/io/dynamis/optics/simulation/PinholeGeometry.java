package io.dynamis.optics.simulation;

/**
 * Per-pass pinhole image plane layout.
 *
 * The image plane sits one unit in front of the pinhole along +Z. Its larger dimension
 * spans 2 * tan(fov / 2); pixels are spaced {@code delta} apart and the scan starts at
 * ({@code startX}, {@code startY}) so the image is centred on the optical axis.
 * A camera with a single pixel traces one on-axis ray.
 *
 * @param delta  pixel pitch on the image plane
 * @param startX image plane X of the left edge of column 0
 * @param startY image plane Y of the top edge of row 0
 */
public record PinholeGeometry(double delta, double startX, double startY) {

    /**
     * Computes the layout for a {@code width} x {@code height} image.
     *
     * @param fovDegrees field of view across the larger image dimension; must be > 0
     */
    public static PinholeGeometry compute(int width, int height, double fovDegrees) {
        int maxPixels = Math.max(width, height);
        if (maxPixels <= 1) {
            return new PinholeGeometry(0.0, 0.0, 0.0);
        }
        double imageMaxWidth = 2.0 * Math.tan(Math.toRadians(0.5 * fovDegrees));
        double delta = imageMaxWidth / (maxPixels - 1);
        return new PinholeGeometry(delta, 0.5 * width * delta, 0.5 * height * delta);
    }

    /**
     * Image plane X of a point inside column {@code x}.
     *
     * @param u offset within the pixel in [0..1); 0.5 is the pixel centre
     */
    public double planeX(int x, double u) {
        return startX - delta * (x + u);
    }

    /**
     * Image plane Y of a point inside row {@code y}.
     *
     * @param v offset within the pixel in [0..1); 0.5 is the pixel centre
     */
    public double planeY(int y, double v) {
        return startY - delta * (y + v);
    }
}
