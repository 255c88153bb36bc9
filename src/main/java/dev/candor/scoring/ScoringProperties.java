package dev.candor.scoring;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Scoring pool settings, bound from {@code candor.scoring.*}.
 *
 * <ul>
 *   <li>{@code bins} - histogram resolution (default 1000)
 *   <li>{@code outlier-k} - outlier threshold in baseline standard deviations (default 3.0; 0 or
 *       less disables exclusion)
 *   <li>{@code outlier-min-samples} - window size that establishes the first baseline (default 10)
 *   <li>{@code min-std-dev} - floor on the baseline standard deviation (default 0.01)
 *   <li>{@code min-pool-size} - below this, percentiles are provisional (default 30)
 *   <li>{@code recalibration-interval} - insertions between recalibrations (default 50)
 *   <li>{@code recalibration-period} - time between recalibrations (default 1h)
 *   <li>{@code decay} - weight ratio between consecutive window samples (default 0.98)
 *   <li>{@code window-size} - calibration window length (default 500)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "candor.scoring")
public class ScoringProperties {

  private int bins = 1000;
  private double outlierK = 3.0;
  private int outlierMinSamples = 10;
  private double minStdDev = 0.01;
  private int minPoolSize = 30;
  private int recalibrationInterval = 50;
  private Duration recalibrationPeriod = Duration.ofHours(1);
  private double decay = 0.98;
  private int windowSize = 500;

  @PostConstruct
  void validate() {
    if (bins < 10 || bins > 100_000) {
      throw new IllegalStateException("candor.scoring.bins must be in [10, 100000], got: " + bins);
    }
    if (decay <= 0.0 || decay > 1.0) {
      throw new IllegalStateException("candor.scoring.decay must be in (0, 1], got: " + decay);
    }
    if (windowSize < 2) {
      throw new IllegalStateException(
          "candor.scoring.window-size must be >= 2, got: " + windowSize);
    }
    if (outlierMinSamples < 2 || outlierMinSamples > windowSize) {
      throw new IllegalStateException(
          "candor.scoring.outlier-min-samples must be in [2, window-size], got: "
              + outlierMinSamples);
    }
    if (recalibrationInterval < 1) {
      throw new IllegalStateException(
          "candor.scoring.recalibration-interval must be >= 1, got: " + recalibrationInterval);
    }
    if (minPoolSize < 1 || minStdDev < 0.0) {
      throw new IllegalStateException(
          "candor.scoring.min-pool-size must be >= 1 and min-std-dev >= 0");
    }
  }

  public int getBins() {
    return bins;
  }

  public void setBins(int bins) {
    this.bins = bins;
  }

  public double getOutlierK() {
    return outlierK;
  }

  public void setOutlierK(double outlierK) {
    this.outlierK = outlierK;
  }

  public int getOutlierMinSamples() {
    return outlierMinSamples;
  }

  public void setOutlierMinSamples(int outlierMinSamples) {
    this.outlierMinSamples = outlierMinSamples;
  }

  public double getMinStdDev() {
    return minStdDev;
  }

  public void setMinStdDev(double minStdDev) {
    this.minStdDev = minStdDev;
  }

  public int getMinPoolSize() {
    return minPoolSize;
  }

  public void setMinPoolSize(int minPoolSize) {
    this.minPoolSize = minPoolSize;
  }

  public int getRecalibrationInterval() {
    return recalibrationInterval;
  }

  public void setRecalibrationInterval(int recalibrationInterval) {
    this.recalibrationInterval = recalibrationInterval;
  }

  public Duration getRecalibrationPeriod() {
    return recalibrationPeriod;
  }

  public void setRecalibrationPeriod(Duration recalibrationPeriod) {
    this.recalibrationPeriod = recalibrationPeriod;
  }

  public double getDecay() {
    return decay;
  }

  public void setDecay(double decay) {
    this.decay = decay;
  }

  public int getWindowSize() {
    return windowSize;
  }

  public void setWindowSize(int windowSize) {
    this.windowSize = windowSize;
  }
}
