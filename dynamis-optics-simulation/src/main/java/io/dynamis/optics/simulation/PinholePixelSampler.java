package io.dynamis.optics.simulation;

import io.dynamis.optics.api.PixelSampler;
import io.dynamis.optics.api.SampledSpectrum;
import io.dynamis.optics.api.SamplingException;
import io.dynamis.optics.api.SceneRoot;
import io.dynamis.optics.api.SpectralChannel;
import io.dynamis.optics.api.SpectralSample;
import java.util.random.RandomGenerator;

/**
 * Samples a pixel by averaging {@code pixelSamples} primary rays from the pinhole.
 *
 * With sub-sampling enabled each ray passes through a uniformly jittered point inside the
 * pixel; otherwise every ray passes through the pixel centre. Immutable once built, so a
 * single instance is shared by all workers of a pass.
 */
final class PinholePixelSampler implements PixelSampler {

    private final PinholeGeometry geometry;
    private final double originX;
    private final double originY;
    private final double originZ;
    private final int pixelSamples;
    private final boolean subSample;

    PinholePixelSampler(PinholeGeometry geometry,
                        double originX, double originY, double originZ,
                        int pixelSamples, boolean subSample) {
        this.geometry = geometry;
        this.originX = originX;
        this.originY = originY;
        this.originZ = originZ;
        this.pixelSamples = pixelSamples;
        this.subSample = subSample;
    }

    @Override
    public SpectralSample samplePixel(int x, int y,
                                      SpectralChannel channel,
                                      SceneRoot scene,
                                      RandomGenerator random) throws SamplingException {
        SampledSpectrum total = SampledSpectrum.forChannel(channel);
        long rays = 0L;
        for (int i = 0; i < pixelSamples; i++) {
            double u = subSample ? random.nextDouble() : 0.5;
            double v = subSample ? random.nextDouble() : 0.5;
            SpectralSample traced = scene.traceRay(
                originX, originY, originZ,
                geometry.planeX(x, u), geometry.planeY(y, v), 1.0,
                channel, random);
            total.add(traced.spectrum());
            rays += traced.rayCount();
        }
        total.scale(1.0 / pixelSamples);
        return new SpectralSample(total, rays);
    }

    PinholeGeometry geometry() { return geometry; }
}
