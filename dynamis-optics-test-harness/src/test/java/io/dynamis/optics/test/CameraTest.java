package io.dynamis.optics.test;

import io.dynamis.optics.api.GeometryNotImplementedException;
import io.dynamis.optics.api.InvalidConfigurationException;
import io.dynamis.optics.api.NotConnectedException;
import io.dynamis.optics.api.PixelSampler;
import io.dynamis.optics.api.SamplingException;
import io.dynamis.optics.api.Tristimulus;
import io.dynamis.optics.core.Camera;
import io.dynamis.optics.core.ObservationStatistics;
import io.dynamis.optics.core.ProgressiveAccumulator;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import static org.assertj.core.api.Assertions.*;

@Timeout(30)
class CameraTest {

    /** Camera whose per-pass sampler is supplied by the test. */
    private static final class ScriptedCamera extends Camera {

        private PixelSampler sampler;
        private int rebuilds = 0;

        ScriptedCamera(int width, int height, int workers, boolean progressive, PixelSampler sampler) {
            super(width, height, 1.0, 4, 1, 1, workers, progressive, new OpticsStubs.LinearColour());
            this.sampler = sampler;
            setDisplayProgress(false);
        }

        @Override
        protected PixelSampler rebuildPixels() {
            rebuilds++;
            return sampler;
        }
    }

    private static ScriptedCamera attached(int workers, boolean progressive, PixelSampler sampler) {
        ScriptedCamera camera = new ScriptedCamera(2, 2, workers, progressive, sampler);
        camera.attach(OpticsStubs.FLAT_SCENE);
        return camera;
    }

    // -- Preconditions --------------------------------------------------------

    @Test
    void observeWithoutSceneFailsBeforeSampling() {
        ScriptedCamera camera = new ScriptedCamera(2, 2, 1, true, OpticsStubs.gradientSampler());

        assertThatThrownBy(camera::observe).isInstanceOf(NotConnectedException.class);
        assertThat(camera.rebuilds).isZero();
        assertThat(camera.accumulatedSamples()).isZero();
    }

    @Test
    void detachDisconnects() {
        ScriptedCamera camera = attached(1, false, OpticsStubs.gradientSampler());
        assertThat(camera.isConnected()).isTrue();

        camera.detach();

        assertThat(camera.isConnected()).isFalse();
        assertThatThrownBy(camera::observe).isInstanceOf(NotConnectedException.class);
    }

    @Test
    void missingGeometryIsReportedAsNotImplemented() {
        ScriptedCamera camera = attached(1, true, null);

        assertThatThrownBy(camera::observe)
            .isInstanceOf(GeometryNotImplementedException.class)
            .hasMessageContaining("ScriptedCamera");
        assertThat(camera.accumulatedSamples()).isZero();
    }

    @Test
    void invalidConfigurationIsRejected() {
        ScriptedCamera camera = attached(1, false, OpticsStubs.gradientSampler());

        assertThatThrownBy(() -> camera.setPixelSamples(0)).isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> camera.setSpectralSamples(0)).isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> camera.setSpectralChannels(-1)).isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> camera.setWorkerCount(0)).isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> camera.setSensitivity(0.0)).isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> camera.setWavelengthRange(700.0, 400.0))
            .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> camera.setDisplayUpdateSeconds(0.0))
            .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> camera.resize(0, 4)).isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> new ScriptedCamera(0, 2, 1, false, null))
            .isInstanceOf(InvalidConfigurationException.class);

        assertThat(camera.pixelSamples()).isEqualTo(1);
        assertThat(camera.minWavelength()).isEqualTo(375.0);
    }

    // -- Accumulation ---------------------------------------------------------

    @Test
    void repeatedIdenticalSamplesLeaveFrameUnchanged() throws Exception {
        ScriptedCamera camera = attached(1, true, OpticsStubs.constantSampler(0.5, 10L));

        ObservationStatistics first = camera.observe();
        assertThat(camera.accumulatedSamples()).isEqualTo(1);
        assertThat(first.totalRays()).isEqualTo(40L);
        assertEveryCell(camera, 0.5);

        camera.observe();
        assertThat(camera.accumulatedSamples()).isEqualTo(2);
        assertEveryCell(camera, 0.5);
    }

    private static void assertEveryCell(Camera camera, double expected) {
        for (int y = 0; y < camera.height(); y++) {
            for (int x = 0; x < camera.width(); x++) {
                Tristimulus cell = camera.frame().xyz(x, y);
                assertThat(cell.x()).isCloseTo(expected, within(1e-12));
                assertThat(cell.y()).isCloseTo(expected, within(1e-12));
                assertThat(cell.z()).isCloseTo(expected, within(1e-12));
            }
        }
    }

    @Test
    void progressiveObservationsFormWeightedMean() throws Exception {
        ScriptedCamera camera = attached(2, true, OpticsStubs.constantSampler(1.0, 1L));
        camera.observe();

        camera.setPixelSamples(3);
        camera.sampler = OpticsStubs.constantSampler(3.0, 1L);
        camera.observe();

        assertThat(camera.accumulatedSamples()).isEqualTo(4);
        assertThat(camera.frame().xyz(0, 1).y()).isCloseTo(2.5, within(1e-12));
    }

    @Test
    void nonProgressiveObservationStartsFresh() throws Exception {
        ScriptedCamera camera = attached(1, false, OpticsStubs.constantSampler(1.0, 1L));
        camera.observe();

        camera.sampler = OpticsStubs.constantSampler(4.0, 1L);
        camera.observe();

        assertThat(camera.accumulatedSamples()).isEqualTo(1);
        assertThat(camera.frame().xyz(0, 0).x()).isCloseTo(4.0, within(1e-12));
    }

    @Test
    void sampleUnitsCountEveryChannel() throws Exception {
        ScriptedCamera camera = attached(1, true, OpticsStubs.constantSampler(1.0, 1L));
        camera.setSpectralChannels(3);
        camera.setPixelSamples(2);

        ObservationStatistics stats = camera.observe();

        assertThat(camera.accumulatedSamples()).isEqualTo(6);
        assertThat(stats.channels()).isEqualTo(3);
        assertThat(stats.pixelsSampled()).isEqualTo(12L);
        assertThat(stats.totalRays()).isEqualTo(12L);
        assertThat(camera.lastStatistics()).isSameAs(stats);
    }

    @Test
    void failedPassLeavesSampleCountUnchanged() throws Exception {
        ScriptedCamera camera = attached(2, true, OpticsStubs.constantSampler(1.0, 1L));
        camera.observe();
        ProgressiveAccumulator.Snapshot before = camera.snapshot();

        camera.sampler = OpticsStubs.failingAt(1, 0);
        assertThatThrownBy(camera::observe).isInstanceOf(SamplingException.class);

        assertThat(camera.accumulatedSamples()).isEqualTo(1);
        camera.restore(before);
        assertThat(camera.frame().xyz(0, 0).x()).isCloseTo(1.0, within(1e-12));

        camera.sampler = OpticsStubs.constantSampler(1.0, 1L);
        camera.observe();
        assertThat(camera.accumulatedSamples()).isEqualTo(2);
    }

    @Test
    void geometryIsRebuiltEveryObservation() throws Exception {
        ScriptedCamera camera = attached(1, false, OpticsStubs.gradientSampler());

        camera.observe();
        camera.observe();

        assertThat(camera.rebuilds).isEqualTo(2);
    }

    @Test
    void resizeRestartsAccumulation() throws Exception {
        ScriptedCamera camera = attached(1, true, OpticsStubs.gradientSampler());
        camera.observe();

        camera.resize(3, 1);

        assertThat(camera.width()).isEqualTo(3);
        assertThat(camera.height()).isEqualTo(1);
        assertThat(camera.accumulatedSamples()).isZero();
        camera.observe();
        assertThat(camera.frame().xyz(2, 0).x()).isCloseTo(OpticsStubs.gradient(2, 0), within(1e-12));
    }

    // -- Display --------------------------------------------------------------

    @Test
    void frameListenerSeesStartAndEndOfPass() throws Exception {
        ScriptedCamera camera = attached(1, false, OpticsStubs.constantSampler(1.0, 1L));
        AtomicInteger updates = new AtomicInteger();
        camera.setFrameListener(frame -> updates.incrementAndGet());
        camera.setDisplayProgress(true);

        camera.observe();

        assertThat(updates.get()).isGreaterThanOrEqualTo(2);
    }

    @Test
    void throwingFrameListenerStopsWorkerPool() throws Exception {
        ScriptedCamera camera = attached(3, false, OpticsStubs.constantSampler(1.0, 1L));
        OpticsStubs.RecordingThreadFactory factory = new OpticsStubs.RecordingThreadFactory();
        camera.setThreadFactory(factory);
        camera.setDisplayProgress(true);
        camera.setDisplayUpdateSeconds(1.0e-9);
        camera.resize(16, 16);
        AtomicInteger updates = new AtomicInteger();
        camera.setFrameListener(frame -> {
            if (updates.incrementAndGet() == 2) {
                throw new IllegalStateException("display gone");
            }
        });

        assertThatThrownBy(camera::observe).isInstanceOf(IllegalStateException.class);

        assertThat(factory.threads()).isNotEmpty();
        assertThat(factory.allTerminated()).isTrue();
    }

    @Test
    void displayProgressOffSkipsListenerDuringObserve() throws Exception {
        ScriptedCamera camera = attached(1, false, OpticsStubs.constantSampler(1.0, 1L));
        AtomicInteger updates = new AtomicInteger();
        camera.setFrameListener(frame -> updates.incrementAndGet());

        camera.observe();
        assertThat(updates).hasValue(0);

        camera.display();
        assertThat(updates).hasValue(1);
    }

    @Test
    void seededCamerasProduceIdenticalFrames() throws Exception {
        PixelSampler noisy = (x, y, channel, scene, random) -> OpticsStubs.constantSampler(random.nextDouble(), 1L)
            .samplePixel(x, y, channel, scene, random);
        ScriptedCamera a = attached(1, false, noisy);
        ScriptedCamera b = attached(1, false, noisy);
        a.setRandomSeed(7L);
        b.setRandomSeed(7L);

        a.observe();
        b.observe();

        assertThat(a.frame().xyz(1, 0)).isEqualTo(b.frame().xyz(1, 0));
    }
}
