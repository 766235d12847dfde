package io.dynamis.optics.core;

import io.dynamis.optics.api.SamplingException;
import io.dynamis.optics.api.SpectralChannel;
import io.dynamis.optics.api.SpectralResponse;
import io.dynamis.optics.api.SpectralSample;
import io.dynamis.optics.api.Tristimulus;
import java.util.List;
import java.util.SplittableRandom;
import java.util.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-flow sampling engine: the calling thread samples and folds every pixel itself.
 *
 * Traversal: channel by channel, then row-major (y outer, x inner). Deterministic order.
 * The first sampler failure propagates immediately; pixels already folded stay folded.
 */
public final class SequentialSamplingEngine implements SamplingEngine {

    private static final Logger LOG = LoggerFactory.getLogger(SequentialSamplingEngine.class);

    private final RandomGenerator random;

    public SequentialSamplingEngine() {
        this(new SplittableRandom());
    }

    /** @param random generator used for every pixel of every pass; must not be null */
    public SequentialSamplingEngine(RandomGenerator random) {
        if (random == null) {
            throw new NullPointerException("random must not be null");
        }
        this.random = random;
    }

    @Override
    public void sample(PassContext context) throws SamplingException {
        List<SpectralChannel> plan = context.plan();
        for (int channelIndex = 0; channelIndex < plan.size(); channelIndex++) {
            SpectralChannel channel = plan.get(channelIndex);
            LOG.debug("Sampling channel {}/{} [{} nm, {} nm] on the calling thread",
                channelIndex + 1, plan.size(), channel.minWavelength(), channel.maxWavelength());
            sampleChannel(context, channelIndex, channel);
        }
    }

    private void sampleChannel(PassContext context, int channelIndex, SpectralChannel channel)
            throws SamplingException {
        SpectralResponse response = context.colour().resample(channel);
        ProgressiveAccumulator.AccumulationPass pass = context.pass();
        ProgressReporter reporter = context.reporter();

        int pixelIndex = 0;
        for (int y = 0; y < context.height(); y++) {
            for (int x = 0; x < context.width(); x++) {
                SpectralSample sample;
                Tristimulus xyz;
                try {
                    sample = context.sampler().samplePixel(x, y, channel, context.scene(), random);
                    xyz = response.toTristimulus(sample.spectrum());
                } catch (SamplingException | RuntimeException e) {
                    throw SamplingException.atPixel(x, y, e);
                }
                pass.fold(x, y, xyz);
                reporter.update(channelIndex, pixelIndex++, sample.rayCount());
            }
        }
    }
}
