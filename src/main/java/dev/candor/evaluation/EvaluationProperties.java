package dev.candor.evaluation;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Answer evaluation settings, bound from {@code candor.evaluation.*}.
 *
 * <ul>
 *   <li>{@code default-deadline} - deadline when the caller supplies none (default 60s)
 *   <li>{@code temperature} - sampling temperature for evaluator calls (default 0.0)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "candor.evaluation")
public class EvaluationProperties {

  private Duration defaultDeadline = Duration.ofSeconds(60);
  private double temperature = 0.0;

  @PostConstruct
  void validate() {
    if (defaultDeadline == null || defaultDeadline.isZero() || defaultDeadline.isNegative()) {
      throw new IllegalStateException(
          "candor.evaluation.default-deadline must be positive, got: " + defaultDeadline);
    }
    if (temperature < 0.0 || temperature > 2.0) {
      throw new IllegalStateException(
          "candor.evaluation.temperature must be in [0, 2], got: " + temperature);
    }
  }

  public Duration getDefaultDeadline() {
    return defaultDeadline;
  }

  public void setDefaultDeadline(Duration defaultDeadline) {
    this.defaultDeadline = defaultDeadline;
  }

  public double getTemperature() {
    return temperature;
  }

  public void setTemperature(double temperature) {
    this.temperature = temperature;
  }
}
