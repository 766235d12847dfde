package io.dynamis.optics.core;

import io.dynamis.optics.api.PixelSampler;
import io.dynamis.optics.api.SamplingException;
import io.dynamis.optics.api.SceneRoot;
import io.dynamis.optics.api.SpectralChannel;
import io.dynamis.optics.api.SpectralResponse;
import io.dynamis.optics.api.SpectralSample;
import java.util.concurrent.BlockingQueue;
import java.util.random.RandomGenerator;

/**
 * Worker loop of the parallel engine for one channel.
 *
 * Takes tasks until it receives the shutdown sentinel. Each pixel task is sampled,
 * converted to XYZ and pushed onto the result channel. A failure is pushed as a Failed
 * result and the loop continues, so the worker still consumes exactly one sentinel.
 *
 * Shares no mutable state with other workers: it owns its generator and touches only
 * the two queues, the read-only scene and the read-only spectral response.
 */
final class SamplingWorker implements Runnable {

    private final BlockingQueue<SamplingTask> tasks;
    private final BlockingQueue<SamplingResult> results;
    private final PixelSampler sampler;
    private final SceneRoot scene;
    private final SpectralChannel channel;
    private final SpectralResponse response;
    private final RandomGenerator random;

    SamplingWorker(BlockingQueue<SamplingTask> tasks,
                   BlockingQueue<SamplingResult> results,
                   PixelSampler sampler,
                   SceneRoot scene,
                   SpectralChannel channel,
                   SpectralResponse response,
                   RandomGenerator random) {
        this.tasks = tasks;
        this.results = results;
        this.sampler = sampler;
        this.scene = scene;
        this.channel = channel;
        this.response = response;
        this.random = random;
    }

    @Override
    public void run() {
        while (true) {
            SamplingTask task;
            try {
                task = tasks.take();
            } catch (InterruptedException e) {
                // Coordinator abort: exit without consuming a sentinel.
                Thread.currentThread().interrupt();
                return;
            }
            if (task instanceof SamplingTask.PixelTask pixel) {
                results.add(sample(pixel.x(), pixel.y()));
            } else {
                return;
            }
        }
    }

    private SamplingResult sample(int x, int y) {
        try {
            SpectralSample sample = sampler.samplePixel(x, y, channel, scene, random);
            return new SamplingResult.Sampled(x, y, response.toTristimulus(sample.spectrum()), sample.rayCount());
        } catch (SamplingException | RuntimeException e) {
            return new SamplingResult.Failed(x, y, SamplingException.atPixel(x, y, e));
        } catch (Error e) {
            // Every dispatched task yields exactly one result, Errors included.
            return new SamplingResult.Failed(x, y, e);
        }
    }
}
