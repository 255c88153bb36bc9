package dev.candor.provider;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the provider gateway, bound from {@code candor.gateway.*}.
 *
 * <ul>
 *   <li>{@code temperature}, {@code max-output-tokens}, {@code provider-order}, {@code timeout},
 *       {@code max-retries} - the default {@link CompletionConfig}
 *   <li>{@code max-concurrent-calls} - process-wide cap on in-flight provider calls (default 8)
 *   <li>{@code backoff.*} - exponential backoff with jitter between retries
 *   <li>{@code circuit-breaker.*} - rolling-window failure isolation per provider
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}.
 */
@Configuration
@ConfigurationProperties(prefix = "candor.gateway")
public class GatewayProperties {

  private double temperature = 0.2;
  private int maxOutputTokens = 2048;
  private List<String> providerOrder = new ArrayList<>();
  private Duration timeout = Duration.ofSeconds(30);
  private int maxRetries = 2;
  private int maxConcurrentCalls = 8;
  private Backoff backoff = new Backoff();
  private CircuitBreaker circuitBreaker = new CircuitBreaker();

  @PostConstruct
  void validate() {
    defaultConfig();
    if (maxConcurrentCalls < 1) {
      throw new IllegalStateException(
          "candor.gateway.max-concurrent-calls must be >= 1, got: " + maxConcurrentCalls);
    }
    if (backoff.getMultiplier() < 1.0) {
      throw new IllegalStateException(
          "candor.gateway.backoff.multiplier must be >= 1.0, got: " + backoff.getMultiplier());
    }
    if (circuitBreaker.getFailureRateThreshold() <= 0
        || circuitBreaker.getFailureRateThreshold() > 100) {
      throw new IllegalStateException(
          "candor.gateway.circuit-breaker.failure-rate-threshold must be in (0, 100], got: "
              + circuitBreaker.getFailureRateThreshold());
    }
    if (circuitBreaker.getMinimumCalls() < 1 || circuitBreaker.getWindow().getSeconds() < 1) {
      throw new IllegalStateException(
          "candor.gateway.circuit-breaker minimum-calls and window must be positive");
    }
  }

  /** The default completion config assembled from these properties. */
  public CompletionConfig defaultConfig() {
    return new CompletionConfig(temperature, maxOutputTokens, providerOrder, timeout, maxRetries);
  }

  public double getTemperature() {
    return temperature;
  }

  public void setTemperature(double temperature) {
    this.temperature = temperature;
  }

  public int getMaxOutputTokens() {
    return maxOutputTokens;
  }

  public void setMaxOutputTokens(int maxOutputTokens) {
    this.maxOutputTokens = maxOutputTokens;
  }

  public List<String> getProviderOrder() {
    return providerOrder;
  }

  public void setProviderOrder(List<String> providerOrder) {
    this.providerOrder = providerOrder;
  }

  public Duration getTimeout() {
    return timeout;
  }

  public void setTimeout(Duration timeout) {
    this.timeout = timeout;
  }

  public int getMaxRetries() {
    return maxRetries;
  }

  public void setMaxRetries(int maxRetries) {
    this.maxRetries = maxRetries;
  }

  public int getMaxConcurrentCalls() {
    return maxConcurrentCalls;
  }

  public void setMaxConcurrentCalls(int maxConcurrentCalls) {
    this.maxConcurrentCalls = maxConcurrentCalls;
  }

  public Backoff getBackoff() {
    return backoff;
  }

  public void setBackoff(Backoff backoff) {
    this.backoff = backoff;
  }

  public CircuitBreaker getCircuitBreaker() {
    return circuitBreaker;
  }

  public void setCircuitBreaker(CircuitBreaker circuitBreaker) {
    this.circuitBreaker = circuitBreaker;
  }

  /** Backoff between retries of the same provider. */
  public static class Backoff {

    private Duration initial = Duration.ofMillis(500);
    private double multiplier = 2.0;
    private Duration max = Duration.ofSeconds(8);

    public Duration getInitial() {
      return initial;
    }

    public void setInitial(Duration initial) {
      this.initial = initial;
    }

    public double getMultiplier() {
      return multiplier;
    }

    public void setMultiplier(double multiplier) {
      this.multiplier = multiplier;
    }

    public Duration getMax() {
      return max;
    }

    public void setMax(Duration max) {
      this.max = max;
    }
  }

  /** Per-provider circuit breaker over a time-based rolling window. */
  public static class CircuitBreaker {

    private float failureRateThreshold = 50.0f;
    private int minimumCalls = 3;
    private Duration window = Duration.ofSeconds(60);
    private Duration coolDown = Duration.ofSeconds(30);

    public float getFailureRateThreshold() {
      return failureRateThreshold;
    }

    public void setFailureRateThreshold(float failureRateThreshold) {
      this.failureRateThreshold = failureRateThreshold;
    }

    public int getMinimumCalls() {
      return minimumCalls;
    }

    public void setMinimumCalls(int minimumCalls) {
      this.minimumCalls = minimumCalls;
    }

    public Duration getWindow() {
      return window;
    }

    public void setWindow(Duration window) {
      this.window = window;
    }

    public Duration getCoolDown() {
      return coolDown;
    }

    public void setCoolDown(Duration coolDown) {
      this.coolDown = coolDown;
    }
  }
}
