package io.dynamis.optics.core;

import io.dynamis.optics.api.ColourConversion;
import io.dynamis.optics.api.PixelSampler;
import io.dynamis.optics.api.SceneRoot;
import io.dynamis.optics.api.SpectralChannel;
import java.util.List;

/**
 * Everything a sampling engine needs for one observation pass.
 *
 * @param width    frame width in pixels
 * @param height   frame height in pixels
 * @param plan     spectral channels to sample, in order
 * @param sampler  per-pixel sampler built by the camera's geometry rebuild
 * @param scene    read-only scene root
 * @param colour   spectrum to tristimulus conversion
 * @param pass     open accumulation pass; written only by the engine's coordinating thread
 * @param reporter progress reporter; called only by the engine's coordinating thread
 */
public record PassContext(int width, int height,
                          List<SpectralChannel> plan,
                          PixelSampler sampler,
                          SceneRoot scene,
                          ColourConversion colour,
                          ProgressiveAccumulator.AccumulationPass pass,
                          ProgressReporter reporter) {

    public PassContext {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException(
                "frame dimensions must be >= 1; got " + width + "x" + height);
        }
        if (plan == null || plan.isEmpty()) {
            throw new IllegalArgumentException("plan must contain at least one channel");
        }
        if (sampler == null || scene == null || colour == null || pass == null || reporter == null) {
            throw new NullPointerException("pass context collaborators must not be null");
        }
        plan = List.copyOf(plan);
    }

    /** Pixels sampled per channel. */
    public int pixelCount() {
        return width * height;
    }
}
