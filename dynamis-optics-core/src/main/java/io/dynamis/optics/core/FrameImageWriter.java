package io.dynamis.optics.core;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.imageio.ImageIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the display grid of a frame to disk as an 8-bit PNG.
 *
 * Display values are clamped to [0..1] and quantised with rounding. Row 0 of the
 * frame is the top row of the image.
 */
public final class FrameImageWriter {

    private static final Logger LOG = LoggerFactory.getLogger(FrameImageWriter.class);

    private FrameImageWriter() {}

    /** Converts the display grid of {@code frame} to an RGB image. */
    public static BufferedImage toImage(FrameBuffer frame) {
        BufferedImage image = new BufferedImage(frame.width(), frame.height(), BufferedImage.TYPE_INT_RGB);
        double[] rgb = new double[3];
        for (int y = 0; y < frame.height(); y++) {
            for (int x = 0; x < frame.width(); x++) {
                frame.rgb(x, y, rgb);
                int packed = (quantise(rgb[0]) << 16) | (quantise(rgb[1]) << 8) | quantise(rgb[2]);
                image.setRGB(x, y, packed);
            }
        }
        return image;
    }

    /**
     * Writes {@code frame} to {@code path} as PNG, creating parent directories as needed.
     *
     * @throws IOException if the file cannot be written
     */
    public static void writePng(FrameBuffer frame, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        if (!ImageIO.write(toImage(frame), "png", path.toFile())) {
            throw new IOException("No PNG image writer available for " + path);
        }
        LOG.debug("Wrote {}x{} frame to {}", frame.width(), frame.height(), path);
    }

    static int quantise(double value) {
        double clamped = Math.max(0.0, Math.min(1.0, value));
        return (int) Math.round(clamped * 255.0);
    }
}
