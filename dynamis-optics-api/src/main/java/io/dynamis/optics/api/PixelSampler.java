package io.dynamis.optics.api;

import java.util.random.RandomGenerator;

/**
 * Per-pixel sampling capability invoked by the sampling engines.
 *
 * A sampler is produced by a camera's geometry rebuild at the start of each observe()
 * call and captures whatever per-pixel geometry that camera needs.
 *
 * THREAD SAFETY CONTRACT:
 *   samplePixel() is called concurrently from isolated worker threads. It may read the
 *   sampler's captured geometry and the scene, but must not write any state shared with
 *   another caller. All entropy must be drawn from {@code random}, which belongs to the
 *   calling worker alone. Results need not be deterministic.
 */
@FunctionalInterface
public interface PixelSampler {

    /**
     * Samples the light arriving at one pixel over one spectral channel.
     *
     * @param x       pixel column, 0 .. width-1
     * @param y       pixel row, 0 .. height-1
     * @param channel wavelength band and bin count to sample
     * @param scene   read-only scene root
     * @param random  generator owned by the calling worker
     * @return mean spectral radiance for the pixel and the number of rays traced
     * @throws SamplingException if sampling fails; aborts the current observe() call
     */
    SpectralSample samplePixel(int x, int y,
                               SpectralChannel channel,
                               SceneRoot scene,
                               RandomGenerator random) throws SamplingException;
}
