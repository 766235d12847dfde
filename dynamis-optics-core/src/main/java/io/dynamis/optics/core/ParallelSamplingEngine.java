package io.dynamis.optics.core;

import io.dynamis.optics.api.SamplingException;
import io.dynamis.optics.api.SpectralChannel;
import io.dynamis.optics.api.SpectralResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.SplittableRandom;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Worker-pool sampling engine: one producer, W workers and the calling thread as coordinator,
 * connected by an unbounded task channel and an unbounded result channel.
 *
 * PROTOCOL (per channel; a fresh pool is spawned for every channel):
 *   1. Create the task and result channels.
 *   2. Producer enqueues every pixel once in raster order, then exits. It never sends a sentinel.
 *   3. W workers start, each with its own generator split from this engine's root generator.
 *   4. Coordinator takes exactly width*height results, in whatever order they arrive, folding
 *      each into the accumulation pass by coordinate and updating the reporter.
 *   5. Only then does it enqueue exactly W sentinels and join every worker and the producer.
 *   Sentinels are never sent early, so no worker can be starved of legitimate work.
 *
 * FAILURE:
 *   A Failed result ends draining. The coordinator joins the producer, discards undispatched
 *   tasks, sends W sentinels, joins every worker and only then rethrows the failure.
 *   A worker Error travels the same path and is rethrown unwrapped, as on the sequential engine.
 *   If the coordinator is interrupted, or fails itself (a throwing frame listener, a bad fold),
 *   producer and workers are interrupted and joined before the exception is rethrown.
 *
 * THREAD SAFETY:
 *   The accumulator, frame and reporter are touched only by the coordinator. Workers share
 *   nothing mutable; the queues are the only communication path. No locks are taken.
 *   A worker that hangs inside the sampler stalls the channel; there is no timeout.
 */
public final class ParallelSamplingEngine implements SamplingEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ParallelSamplingEngine.class);

    private final int workerCount;
    private final ThreadFactory threadFactory;
    private final SplittableRandom rootRandom;

    /**
     * @param workerCount   number of worker threads per channel; must be >= 1
     * @param threadFactory creates the producer and worker threads; must not be null
     * @param rootRandom    generator each worker's generator is split from; must not be null
     * @throws IllegalArgumentException if workerCount < 1
     */
    public ParallelSamplingEngine(int workerCount, ThreadFactory threadFactory, SplittableRandom rootRandom) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1; got " + workerCount);
        }
        if (threadFactory == null) {
            throw new NullPointerException("threadFactory must not be null");
        }
        if (rootRandom == null) {
            throw new NullPointerException("rootRandom must not be null");
        }
        this.workerCount = workerCount;
        this.threadFactory = threadFactory;
        this.rootRandom = rootRandom;
    }

    /** Constructs with daemon worker threads and a randomly seeded root generator. */
    public ParallelSamplingEngine(int workerCount) {
        this(workerCount, ParallelSamplingEngine::daemonThread, new SplittableRandom());
    }

    public int workerCount() { return workerCount; }

    @Override
    public void sample(PassContext context) throws SamplingException, InterruptedException {
        List<SpectralChannel> plan = context.plan();
        for (int channelIndex = 0; channelIndex < plan.size(); channelIndex++) {
            sampleChannel(context, channelIndex, plan.get(channelIndex));
        }
    }

    // -- Per-channel pool -----------------------------------------------------

    private void sampleChannel(PassContext context, int channelIndex, SpectralChannel channel)
            throws SamplingException, InterruptedException {
        SpectralResponse response = context.colour().resample(channel);
        BlockingQueue<SamplingTask> tasks = new LinkedBlockingQueue<>();
        BlockingQueue<SamplingResult> results = new LinkedBlockingQueue<>();
        int width = context.width();
        int height = context.height();
        int totalPixels = context.pixelCount();

        Thread producer = spawn(() -> produce(tasks, width, height),
            "optics-producer-c" + channelIndex);

        List<Thread> workers = new ArrayList<>(workerCount);
        for (int id = 0; id < workerCount; id++) {
            SamplingWorker worker = new SamplingWorker(tasks, results,
                context.sampler(), context.scene(), channel, response, rootRandom.split());
            workers.add(spawn(worker, "optics-worker-c" + channelIndex + "-" + id));
        }
        LOG.debug("Channel {}/{}: started producer and {} workers for {} pixels",
            channelIndex + 1, context.plan().size(), workerCount, totalPixels);

        Throwable failure = null;
        try {
            for (int received = 0; received < totalPixels; received++) {
                SamplingResult result = results.take();
                if (result instanceof SamplingResult.Failed failed) {
                    failure = failed.cause();
                    break;
                }
                SamplingResult.Sampled sampled = (SamplingResult.Sampled) result;
                context.pass().fold(sampled.x(), sampled.y(), sampled.xyz());
                context.reporter().update(channelIndex, received, sampled.rayCount());
            }

            if (failure != null) {
                LOG.warn("Channel {}/{}: {} - stopping {} workers",
                    channelIndex + 1, context.plan().size(), failure, workerCount);
                producer.join();
                tasks.clear();
            }
            for (int i = 0; i < workerCount; i++) {
                tasks.add(SamplingTask.Shutdown.INSTANCE);
            }
            producer.join();
            for (Thread worker : workers) {
                worker.join();
            }
        } catch (InterruptedException e) {
            LOG.warn("Channel {}/{}: sampling interrupted", channelIndex + 1, context.plan().size());
            abort(producer, workers);
            throw e;
        } catch (RuntimeException | Error e) {
            LOG.warn("Channel {}/{}: coordinator failed - {}", channelIndex + 1, context.plan().size(), e.toString());
            abort(producer, workers);
            throw e;
        }
        LOG.debug("Channel {}/{}: pool shut down", channelIndex + 1, context.plan().size());

        if (failure instanceof SamplingException samplingFailure) {
            throw samplingFailure;
        }
        if (failure instanceof Error error) {
            throw error;
        }
        if (failure != null) {
            throw new SamplingException("Pixel sampling failed", failure);
        }
    }

    private static void produce(BlockingQueue<SamplingTask> tasks, int width, int height) {
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                tasks.add(new SamplingTask.PixelTask(x, y));
            }
        }
    }

    private Thread spawn(Runnable body, String name) {
        Thread thread = threadFactory.newThread(body);
        thread.setName(name);
        thread.start();
        return thread;
    }

    /** Interrupts and joins every pool thread; restores the interrupt flag if interrupted again. */
    private static void abort(Thread producer, List<Thread> workers) {
        LOG.warn("Stopping producer and {} workers", workers.size());
        producer.interrupt();
        for (Thread worker : workers) {
            worker.interrupt();
        }
        boolean interrupted = false;
        List<Thread> all = new ArrayList<>(workers);
        all.add(producer);
        for (Thread thread : all) {
            while (thread.isAlive()) {
                try {
                    thread.join();
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    static Thread daemonThread(Runnable body) {
        Thread thread = new Thread(body);
        thread.setDaemon(true);
        return thread;
    }
}
