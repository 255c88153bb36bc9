package dev.candor.scoring;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Arrays;

/**
 * Immutable fixed-resolution histogram over [0, 1]. Memory is bounded by the bin count and
 * percentile error by one bin width.
 */
public final class QuantileHistogram {

  private final long[] counts;
  private final long total;

  private QuantileHistogram(long[] counts) {
    this.counts = counts;
    long sum = 0;
    for (long c : counts) {
      sum += c;
    }
    this.total = sum;
  }

  public static QuantileHistogram empty(int bins) {
    if (bins < 1) {
      throw new IllegalArgumentException("bins must be >= 1, got: " + bins);
    }
    return new QuantileHistogram(new long[bins]);
  }

  @JsonCreator
  public static QuantileHistogram fromCounts(@JsonProperty("counts") long[] counts) {
    if (counts == null || counts.length == 0) {
      throw new IllegalArgumentException("counts must not be empty");
    }
    for (long c : counts) {
      if (c < 0) {
        throw new IllegalArgumentException("counts must not be negative");
      }
    }
    return new QuantileHistogram(counts.clone());
  }

  /** A copy with one more sample. */
  public QuantileHistogram withSample(double score) {
    long[] next = counts.clone();
    next[binOf(score)]++;
    return new QuantileHistogram(next);
  }

  /**
   * Mid-rank percentile of the score: {@code 100 * (below + sameBin / 2) / count}. Monotone
   * non-decreasing in the score. An empty histogram yields 50.
   */
  public double percentile(double score) {
    if (total == 0) {
      return 50.0;
    }
    int bin = binOf(score);
    long below = 0;
    for (int i = 0; i < bin; i++) {
      below += counts[i];
    }
    return 100.0 * (below + 0.5 * counts[bin]) / total;
  }

  int binOf(double score) {
    double clamped = Math.min(1.0, Math.max(0.0, score));
    return Math.min(counts.length - 1, (int) Math.floor(clamped * counts.length));
  }

  public long count() {
    return total;
  }

  public int bins() {
    return counts.length;
  }

  @JsonProperty("counts")
  public long[] counts() {
    return counts.clone();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof QuantileHistogram other && Arrays.equals(counts, other.counts);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(counts);
  }
}
