package dev.candor.explain;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Explanation settings, bound from {@code candor.explain.*}.
 *
 * <ul>
 *   <li>{@code low-confidence-threshold} - dimension confidence below which the explanation is
 *       flagged low confidence (default 0.6)
 *   <li>{@code max-spans} - excerpts quoted per polarity and dimension (default 3)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "candor.explain")
public class ExplainProperties {

  private double lowConfidenceThreshold = 0.6;
  private int maxSpans = 3;

  @PostConstruct
  void validate() {
    if (lowConfidenceThreshold < 0.0 || lowConfidenceThreshold > 1.0) {
      throw new IllegalStateException(
          "candor.explain.low-confidence-threshold must be in [0, 1], got: "
              + lowConfidenceThreshold);
    }
    if (maxSpans < 0) {
      throw new IllegalStateException("candor.explain.max-spans must be >= 0, got: " + maxSpans);
    }
  }

  public double getLowConfidenceThreshold() {
    return lowConfidenceThreshold;
  }

  public void setLowConfidenceThreshold(double lowConfidenceThreshold) {
    this.lowConfidenceThreshold = lowConfidenceThreshold;
  }

  public int getMaxSpans() {
    return maxSpans;
  }

  public void setMaxSpans(int maxSpans) {
    this.maxSpans = maxSpans;
  }
}
