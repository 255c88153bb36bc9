package dev.candor.scoring;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

import dev.candor.fixture.MutableClock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ScoringPoolTest {

  private static final CohortKey COHORT = new CohortKey("payments", "java");

  private MutableClock clock;
  private ScoringProperties properties;

  @BeforeEach
  void setUp() {
    clock = MutableClock.atEpochDay();
    properties = new ScoringProperties();
  }

  private ScoringPool pool() {
    return new ScoringPool(COHORT, properties, clock);
  }

  private static void recordAlternating(ScoringPool pool, int n) {
    for (int i = 0; i < n; i++) {
      pool.record(i % 2 == 0 ? 0.48 : 0.52);
    }
  }

  @Test
  void scoresOutsideUnitIntervalAreRejected() {
    ScoringPool pool = pool();

    assertThatThrownBy(() -> pool.record(1.01)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> pool.record(-0.1)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> pool.record(Double.NaN)).isInstanceOf(IllegalArgumentException.class);
    assertThat(pool.snapshot().count()).isZero();
  }

  @Test
  void emptyPoolReportsMedianAndIsProvisional() {
    PercentileResult result = pool().percentile("a-1", 0.9, false);

    assertThat(result.percentile()).isEqualTo(50.0);
    assertThat(result.poolSizeAtComputation()).isZero();
    assertThat(result.provisional()).isTrue();
  }

  @Test
  void percentileReflectsDistribution() {
    ScoringPool pool = pool();
    for (int i = 0; i < 100; i++) {
      pool.record(i / 100.0);
    }

    assertThat(pool.percentile("a", 0.25, false).percentile()).isCloseTo(25.5, offset(1.0));
    assertThat(pool.percentile("a", 0.9, false).percentile()).isCloseTo(90.5, offset(1.0));
    assertThat(pool.percentile("a", 0.9, false).provisional()).isFalse();
  }

  @Test
  void poolBelowMinimumSizeIsProvisional() {
    properties.setMinPoolSize(5);
    ScoringPool pool = pool();
    for (int i = 0; i < 4; i++) {
      pool.record(0.5);
    }

    assertThat(pool.percentile("a", 0.5, false).provisional()).isTrue();
    pool.record(0.5);
    assertThat(pool.percentile("a", 0.5, false).provisional()).isFalse();
  }

  @Test
  void firstBaselineIsCalibratedOnceWindowHasEnoughSamples() {
    ScoringPool pool = pool();
    for (int i = 0; i < properties.getOutlierMinSamples() - 1; i++) {
      assertThat(pool.record(0.5).recalibrated()).isFalse();
    }

    RecordOutcome outcome = pool.record(0.5);

    assertThat(outcome.recalibrated()).isTrue();
    assertThat(outcome.snapshot().calibrationVersion()).isEqualTo(1);
    assertThat(outcome.snapshot().baselineMean()).isCloseTo(0.5, offset(1e-9));
    assertThat(outcome.snapshot().lastRecalibratedAt()).isEqualTo(clock.instant());
  }

  @Test
  void outliersAreKeptOutOfTheBaseline() {
    ScoringPool pool = pool();
    recordAlternating(pool, 20);

    List<RecordOutcome> spikes = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      spikes.add(pool.record(1.0));
    }
    PoolSnapshot recalibrated = pool.recalibrate();

    assertThat(spikes).allMatch(RecordOutcome::outlier);
    assertThat(recalibrated.count()).isEqualTo(25);
    assertThat(recalibrated.histogram().count()).isEqualTo(25);
    assertThat(recalibrated.window()).hasSize(20).doesNotContain(1.0);
    assertThat(recalibrated.baselineMean()).isCloseTo(0.5, offset(0.01));
  }

  @Test
  void disabledOutlierDetectionLetsSpikesShiftBaseline() {
    properties.setOutlierK(0.0);
    ScoringPool pool = pool();
    recordAlternating(pool, 20);

    for (int i = 0; i < 5; i++) {
      assertThat(pool.record(1.0).outlier()).isFalse();
    }
    PoolSnapshot recalibrated = pool.recalibrate();

    assertThat(recalibrated.baselineMean()).isGreaterThan(0.55);
  }

  @Test
  void outlierPercentileIsStillComputedAgainstFullDistribution() {
    ScoringPool pool = pool();
    recordAlternating(pool, 20);

    RecordOutcome outcome = pool.record(1.0);
    PercentileResult result = pool.percentile("a", 1.0, outcome.outlier());

    assertThat(result.outlierExcluded()).isTrue();
    assertThat(result.percentile()).isGreaterThan(95.0);
    assertThat(result.poolSizeAtComputation()).isEqualTo(21);
  }

  @Test
  void recalibratesAfterConfiguredNumberOfInsertions() {
    properties.setRecalibrationInterval(5);
    ScoringPool pool = pool();
    recordAlternating(pool, properties.getOutlierMinSamples());
    assertThat(pool.snapshot().calibrationVersion()).isEqualTo(1);

    recordAlternating(pool, 4);
    assertThat(pool.snapshot().calibrationVersion()).isEqualTo(1);
    assertThat(pool.record(0.5).recalibrated()).isTrue();
    assertThat(pool.snapshot().calibrationVersion()).isEqualTo(2);
    assertThat(pool.snapshot().insertionsSinceCalibration()).isZero();
  }

  @Test
  void recalibratesAfterConfiguredPeriod() {
    ScoringPool pool = pool();
    recordAlternating(pool, properties.getOutlierMinSamples());
    clock.advance(properties.getRecalibrationPeriod().plus(Duration.ofSeconds(1)));

    RecordOutcome outcome = pool.record(0.5);

    assertThat(outcome.recalibrated()).isTrue();
    assertThat(outcome.snapshot().calibrationVersion()).isEqualTo(2);
  }

  @Test
  void recentSamplesWeighMoreThanOldOnes() {
    properties.setOutlierK(0.0);
    ScoringPool pool = pool();
    for (int i = 0; i < 50; i++) {
      pool.record(0.2);
    }
    for (int i = 0; i < 50; i++) {
      pool.record(0.8);
    }

    PoolSnapshot snapshot = pool.recalibrate();

    assertThat(snapshot.mean()).isCloseTo(0.5, offset(1e-9));
    assertThat(snapshot.baselineMean()).isGreaterThan(0.6);
  }

  @Test
  void windowIsBoundedBySize() {
    properties.setWindowSize(10);
    properties.setOutlierK(0.0);
    ScoringPool pool = pool();
    for (int i = 0; i < 30; i++) {
      pool.record(0.5);
    }

    assertThat(pool.snapshot().window()).hasSize(10);
    assertThat(pool.snapshot().count()).isEqualTo(30);
  }

  @Test
  void restoredPoolContinuesFromSnapshot() {
    ScoringPool pool = pool();
    recordAlternating(pool, 15);

    ScoringPool restored = new ScoringPool(pool.snapshot(), properties, clock);

    assertThat(restored.snapshot()).isEqualTo(pool.snapshot());
    assertThat(restored.record(0.5).snapshot().count()).isEqualTo(16);
  }

  @Test
  void concurrentWritersLoseNoSamples() throws Exception {
    properties.setOutlierK(0.0);
    ScoringPool pool = pool();
    ExecutorService executor = Executors.newFixedThreadPool(8);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int t = 0; t < 8; t++) {
        futures.add(
            executor.submit(
                () -> {
                  for (int i = 0; i < 500; i++) {
                    pool.record((i % 100) / 100.0);
                  }
                }));
      }
      for (Future<?> future : futures) {
        future.get(10, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    assertThat(pool.snapshot().count()).isEqualTo(4000);
    assertThat(pool.snapshot().histogram().count()).isEqualTo(4000);
  }
}
