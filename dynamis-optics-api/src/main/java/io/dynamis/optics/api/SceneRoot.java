package io.dynamis.optics.api;

import java.util.random.RandomGenerator;

/**
 * Root of a scene an observer can be attached to.
 *
 * Implementations own all intersection and light transport. An observer only hands
 * primary rays in and receives spectral radiance back.
 *
 * THREAD SAFETY CONTRACT: scene data is read-only for the duration of an observe() call.
 * traceRay() is invoked concurrently from every sampling worker and must not mutate
 * shared state. Per-call randomness must come from the supplied generator, never from
 * a generator shared across callers.
 */
public interface SceneRoot {

    /**
     * Traces one primary ray and returns the spectral radiance arriving along it.
     *
     * @param ox      ray origin X
     * @param oy      ray origin Y
     * @param oz      ray origin Z
     * @param dx      ray direction X (need not be normalised)
     * @param dy      ray direction Y
     * @param dz      ray direction Z
     * @param channel wavelength band and bin count of the returned spectrum
     * @param random  the calling worker's own generator
     * @return radiance over {@code channel} and the number of rays traced, including secondaries
     * @throws SamplingException if light transport fails for this ray
     */
    SpectralSample traceRay(double ox, double oy, double oz,
                            double dx, double dy, double dz,
                            SpectralChannel channel,
                            RandomGenerator random) throws SamplingException;
}
