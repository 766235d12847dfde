package io.dynamis.optics.test;

import io.dynamis.optics.core.ObservationStatistics;
import io.dynamis.optics.core.ProgressReporter;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ProgressReporterTest {

    private static final long SECOND = 1_000_000_000L;

    private final AtomicLong clock = new AtomicLong(5 * SECOND);
    private final AtomicInteger refreshes = new AtomicInteger();

    private ProgressReporter reporter(long displayInterval) {
        return new ProgressReporter(4, 2, 3, refreshes::incrementAndGet, displayInterval, clock::get);
    }

    @Test
    void totalWorkCountsEveryPixelOfEveryChannel() {
        assertThat(reporter(SECOND).totalWork()).isEqualTo(24L);
    }

    @Test
    void startAndFinishRefreshTheDisplay() {
        ProgressReporter reporter = reporter(10 * SECOND);

        reporter.start();
        assertThat(refreshes).hasValue(1);
        reporter.finish();

        assertThat(refreshes).hasValue(2);
    }

    @Test
    void displayRefreshesOnlyAfterIntervalElapses() {
        ProgressReporter reporter = reporter(2 * SECOND);
        reporter.start();

        clock.addAndGet(SECOND);
        reporter.update(0, 0, 10L);
        assertThat(refreshes).hasValue(1);

        clock.addAndGet(SECOND + 1);
        reporter.update(0, 1, 10L);
        assertThat(refreshes).hasValue(2);

        clock.addAndGet(SECOND);
        reporter.update(0, 2, 10L);
        assertThat(refreshes).hasValue(2);
    }

    @Test
    void rollingRayCounterResetsEachProgressInterval() {
        ProgressReporter reporter = reporter(100 * SECOND);
        reporter.start();

        reporter.update(0, 0, 100L);
        reporter.update(0, 1, 50L);
        assertThat(reporter.rollingRays()).isEqualTo(150L);

        clock.addAndGet(SECOND + 1);
        reporter.update(1, 0, 25L);

        assertThat(reporter.rollingRays()).isZero();
        assertThat(reporter.totalRays()).isEqualTo(175L);
    }

    @Test
    void finishReportsElapsedTimeAndCounts() {
        ProgressReporter reporter = reporter(100 * SECOND);
        reporter.start();
        for (int i = 0; i < 8; i++) {
            reporter.update(0, i, 4L);
        }
        clock.addAndGet(3 * SECOND);

        ObservationStatistics stats = reporter.finish();

        assertThat(stats.elapsedNanos()).isEqualTo(3 * SECOND);
        assertThat(stats.elapsedSeconds()).isCloseTo(3.0, within(1e-9));
        assertThat(stats.totalRays()).isEqualTo(32L);
        assertThat(stats.pixelsSampled()).isEqualTo(8L);
        assertThat(stats.channels()).isEqualTo(3);
    }

    @Test
    void reporterWithoutDisplayStillCounts() {
        ProgressReporter reporter = new ProgressReporter(2, 2, 1, null, SECOND, clock::get);
        reporter.start();
        clock.addAndGet(5 * SECOND);

        reporter.update(0, 3, 7L);

        assertThat(reporter.finish().totalRays()).isEqualTo(7L);
    }
}
