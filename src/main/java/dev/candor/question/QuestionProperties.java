package dev.candor.question;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Question generation settings, bound from {@code candor.questions.*}.
 *
 * <ul>
 *   <li>{@code max-per-competency} - questions kept per competency request (default 3, [1, 3])
 *   <li>{@code similarity-threshold} - cosine similarity at which two questions are merged
 *       (default 0.92)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "candor.questions")
public class QuestionProperties {

  private int maxPerCompetency = 3;
  private double similarityThreshold = 0.92;

  @PostConstruct
  void validate() {
    if (maxPerCompetency < 1 || maxPerCompetency > 3) {
      throw new IllegalStateException(
          "candor.questions.max-per-competency must be in [1, 3], got: " + maxPerCompetency);
    }
    if (similarityThreshold <= 0.0 || similarityThreshold > 1.0) {
      throw new IllegalStateException(
          "candor.questions.similarity-threshold must be in (0, 1], got: " + similarityThreshold);
    }
  }

  public int getMaxPerCompetency() {
    return maxPerCompetency;
  }

  public void setMaxPerCompetency(int maxPerCompetency) {
    this.maxPerCompetency = maxPerCompetency;
  }

  public double getSimilarityThreshold() {
    return similarityThreshold;
  }

  public void setSimilarityThreshold(double similarityThreshold) {
    this.similarityThreshold = similarityThreshold;
  }
}
