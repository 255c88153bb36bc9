package dev.candor.scoring;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class QuantileHistogramTest {

  @Test
  void emptyHistogramReportsMedian() {
    assertThat(QuantileHistogram.empty(10).percentile(0.3)).isEqualTo(50.0);
  }

  @Test
  void samplesAreBinnedAndBoundsClamped() {
    QuantileHistogram histogram = QuantileHistogram.empty(10);

    assertThat(histogram.binOf(0.0)).isZero();
    assertThat(histogram.binOf(0.35)).isEqualTo(3);
    assertThat(histogram.binOf(1.0)).isEqualTo(9);
    assertThat(histogram.binOf(-2.0)).isZero();
    assertThat(histogram.binOf(7.0)).isEqualTo(9);
  }

  @Test
  void withSampleLeavesOriginalUnchanged() {
    QuantileHistogram empty = QuantileHistogram.empty(10);

    QuantileHistogram one = empty.withSample(0.5);

    assertThat(empty.count()).isZero();
    assertThat(one.count()).isEqualTo(1);
    assertThat(one.counts()[5]).isEqualTo(1);
  }

  @Test
  void percentileUsesMidRank() {
    QuantileHistogram histogram =
        QuantileHistogram.empty(10)
            .withSample(0.15)
            .withSample(0.55)
            .withSample(0.55)
            .withSample(0.95);

    assertThat(histogram.percentile(0.05)).isZero();
    assertThat(histogram.percentile(0.15)).isEqualTo(12.5);
    assertThat(histogram.percentile(0.55)).isEqualTo(50.0);
    assertThat(histogram.percentile(0.99)).isEqualTo(87.5);
  }

  @Test
  void invalidCountsAreRejected() {
    assertThatThrownBy(() -> QuantileHistogram.fromCounts(new long[0]))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> QuantileHistogram.fromCounts(new long[] {1, -1}))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> QuantileHistogram.empty(0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void countsAreDefensivelyCopied() {
    long[] counts = {1, 2, 3};
    QuantileHistogram histogram = QuantileHistogram.fromCounts(counts);
    counts[0] = 100;
    histogram.counts()[1] = 100;

    assertThat(histogram.counts()).containsExactly(1, 2, 3);
  }

  @Test
  void serializesAsCounts() throws Exception {
    ObjectMapper mapper = new ObjectMapper();
    QuantileHistogram histogram = QuantileHistogram.fromCounts(new long[] {0, 4, 1});

    String json = mapper.writeValueAsString(histogram);

    assertThat(json).isEqualTo("{\"counts\":[0,4,1]}");
    assertThat(mapper.readValue(json, QuantileHistogram.class)).isEqualTo(histogram);
  }
}
