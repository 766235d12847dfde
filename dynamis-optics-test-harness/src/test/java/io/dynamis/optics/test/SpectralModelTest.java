package io.dynamis.optics.test;

import io.dynamis.optics.api.InvalidConfigurationException;
import io.dynamis.optics.api.OpticsConstants;
import io.dynamis.optics.api.SampledSpectrum;
import io.dynamis.optics.api.SamplingException;
import io.dynamis.optics.api.SpectralChannel;
import io.dynamis.optics.api.SpectralSample;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class SpectralModelTest {

    private static final SpectralChannel CHANNEL = new SpectralChannel(400.0, 500.0, 10);

    @Test
    void spectrumBinsAreCentredInTheirInterval() {
        SampledSpectrum s = SampledSpectrum.forChannel(CHANNEL);

        assertThat(s.bins()).isEqualTo(10);
        assertThat(s.delta()).isCloseTo(10.0, within(1e-12));
        assertThat(s.wavelength(0)).isCloseTo(405.0, within(1e-12));
        assertThat(s.wavelength(9)).isCloseTo(495.0, within(1e-12));
    }

    @Test
    void constantSpectrumIntegratesToValueTimesWidth() {
        SampledSpectrum s = SampledSpectrum.constant(CHANNEL, 2.0);

        assertThat(s.integrate()).isCloseTo(200.0, within(1e-9));
    }

    @Test
    void addAndScaleWorkInPlace() {
        SampledSpectrum a = SampledSpectrum.constant(CHANNEL, 1.0);
        SampledSpectrum b = SampledSpectrum.constant(CHANNEL, 3.0);

        a.add(b).scale(0.5);

        assertThat(a.get(4)).isEqualTo(2.0);
        assertThat(b.get(4)).isEqualTo(3.0);
    }

    @Test
    void addRejectsDifferentGrid() {
        SampledSpectrum a = SampledSpectrum.forChannel(CHANNEL);
        SampledSpectrum b = SampledSpectrum.forChannel(new SpectralChannel(400.0, 500.0, 5));

        assertThatThrownBy(() -> a.add(b)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void channelRejectsEmptyRange() {
        assertThatThrownBy(() -> new SpectralChannel(500.0, 500.0, 10))
            .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> new SpectralChannel(400.0, 500.0, 0))
            .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void spectralSampleRejectsNegativeRayCount() {
        assertThatThrownBy(() -> new SpectralSample(SampledSpectrum.forChannel(CHANNEL), -1L))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void atPixelKeepsExistingPixelCoordinates() {
        SamplingException inner = new SamplingException("boom", 3, 4, null);

        SamplingException outer = SamplingException.atPixel(7, 8, inner);

        assertThat(outer).isSameAs(inner);
        assertThat(outer.pixelX()).isEqualTo(3);
        assertThat(outer.pixelY()).isEqualTo(4);
    }

    @Test
    void atPixelWrapsRuntimeFailures() {
        IllegalStateException cause = new IllegalStateException("bad material");

        SamplingException wrapped = SamplingException.atPixel(2, 5, cause);

        assertThat(wrapped.pixelX()).isEqualTo(2);
        assertThat(wrapped.pixelY()).isEqualTo(5);
        assertThat(wrapped).hasCause(cause).hasMessageContaining("bad material");
    }

    @Test
    void workerCountPropertyOverridesProcessorCount() {
        String previous = System.getProperty(OpticsConstants.WORKERS_PROPERTY);
        try {
            System.setProperty(OpticsConstants.WORKERS_PROPERTY, "3");
            assertThat(OpticsConstants.defaultWorkerCount()).isEqualTo(3);

            System.setProperty(OpticsConstants.WORKERS_PROPERTY, "zero");
            assertThatThrownBy(OpticsConstants::defaultWorkerCount)
                .isInstanceOf(InvalidConfigurationException.class);

            System.setProperty(OpticsConstants.WORKERS_PROPERTY, "0");
            assertThatThrownBy(OpticsConstants::defaultWorkerCount)
                .isInstanceOf(InvalidConfigurationException.class);

            System.clearProperty(OpticsConstants.WORKERS_PROPERTY);
            assertThat(OpticsConstants.defaultWorkerCount())
                .isEqualTo(Runtime.getRuntime().availableProcessors());
        } finally {
            if (previous == null) {
                System.clearProperty(OpticsConstants.WORKERS_PROPERTY);
            } else {
                System.setProperty(OpticsConstants.WORKERS_PROPERTY, previous);
            }
        }
    }
}
