package dev.candor.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.ExponentialRandomBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

/**
 * Single entry point for every model call in the engine.
 *
 * <p>For each request the gateway walks the provider preference order. Per provider:
 *
 * <ol>
 *   <li>the provider's circuit breaker must grant a permit, otherwise the provider is skipped with
 *       {@link ProviderErrorKind#CIRCUIT_OPEN}
 *   <li>transient failures are retried with exponential backoff and jitter, up to {@link
 *       CompletionConfig#maxRetries()} times
 *   <li>non-transient failures and exhausted retries fail over to the next provider
 * </ol>
 *
 * <p>Structured requests that come back unparseable get exactly one strict-format retry on the
 * same provider; a second malformed response is terminal and is not failed over. All outbound calls
 * share one semaphore of {@code max-concurrent-calls} permits, and each call runs on the provider
 * executor so the per-call timeout is enforced and an interrupted caller cancels the in-flight
 * call.
 */
public class ProviderGateway {

  private static final Logger log = LoggerFactory.getLogger(ProviderGateway.class);

  static final String STRICT_FORMAT_INSTRUCTION =
      "\n\nIMPORTANT: your previous reply could not be parsed. Respond with a single valid JSON "
          + "object only. No Markdown, no code fences, no commentary.";

  private final Map<String, CompletionProvider> providers;
  private final Map<String, CircuitBreaker> breakers;
  private final GatewayProperties properties;
  private final JsonOutputParser parser;
  private final ExecutorService providerExecutor;
  private final Semaphore concurrency;
  private final Sleeper sleeper;

  public ProviderGateway(
      List<CompletionProvider> providers,
      GatewayProperties properties,
      ObjectMapper objectMapper,
      ExecutorService providerExecutor,
      Sleeper sleeper) {
    if (providers.isEmpty()) {
      throw new IllegalStateException("At least one completion provider must be configured");
    }
    this.providers = new LinkedHashMap<>();
    for (CompletionProvider provider : providers) {
      if (this.providers.putIfAbsent(provider.name(), provider) != null) {
        throw new IllegalStateException("Duplicate provider name: " + provider.name());
      }
    }
    this.properties = properties;
    this.parser = new JsonOutputParser(objectMapper);
    this.providerExecutor = providerExecutor;
    this.concurrency = new Semaphore(properties.getMaxConcurrentCalls(), true);
    this.sleeper = sleeper;
    this.breakers = new LinkedHashMap<>();
    CircuitBreakerConfig breakerConfig = breakerConfig(properties.getCircuitBreaker());
    for (String name : this.providers.keySet()) {
      CircuitBreaker breaker = CircuitBreaker.of(name, breakerConfig);
      breaker
          .getEventPublisher()
          .onStateTransition(
              event ->
                  log.warn(
                      "Circuit breaker for provider {}: {}",
                      event.getCircuitBreakerName(),
                      event.getStateTransition()));
      breakers.put(name, breaker);
    }
  }

  /** The default generation settings from {@code candor.gateway.*}. */
  public CompletionConfig defaultConfig() {
    return properties.defaultConfig();
  }

  /**
   * Plain-text completion.
   *
   * @throws ProviderException with kind {@link ProviderErrorKind#ALL_PROVIDERS_EXHAUSTED} when no
   *     provider answered
   * @throws CancellationException when the calling thread is interrupted
   */
  public CompletionResult complete(
      String prompt, @Nullable String modelHint, CompletionConfig config) {
    return execute(prompt, modelHint, config, null);
  }

  /**
   * Structured completion: the response must contain a JSON object with every required field.
   *
   * @throws ProviderException with kind {@link ProviderErrorKind#MALFORMED_RESPONSE} when the
   *     output stays unparseable after the strict-format retry, or {@link
   *     ProviderErrorKind#ALL_PROVIDERS_EXHAUSTED} when no provider answered
   * @throws CancellationException when the calling thread is interrupted
   */
  public CompletionResult completeStructured(
      String prompt,
      @Nullable String modelHint,
      CompletionConfig config,
      Set<String> requiredFields) {
    return execute(prompt, modelHint, config, Set.copyOf(requiredFields));
  }

  /** Current breaker state per provider, for diagnostics. */
  public Map<String, CircuitBreaker.State> breakerStates() {
    Map<String, CircuitBreaker.State> states = new LinkedHashMap<>();
    breakers.forEach((name, breaker) -> states.put(name, breaker.getState()));
    return states;
  }

  private CompletionResult execute(
      String prompt,
      @Nullable String modelHint,
      CompletionConfig config,
      @Nullable Set<String> requiredFields) {
    @Nullable ProviderException lastError = null;
    for (CompletionProvider provider : orderedProviders(config)) {
      try {
        return attempt(provider, prompt, modelHint, config, requiredFields);
      } catch (ProviderException e) {
        if (e.kind() == ProviderErrorKind.MALFORMED_RESPONSE) {
          throw e;
        }
        log.warn(
            "Provider {} failed with {}, failing over: {}",
            provider.name(),
            e.kind(),
            e.getMessage());
        lastError = e;
      }
    }
    throw new ProviderException(
        ProviderErrorKind.ALL_PROVIDERS_EXHAUSTED,
        null,
        lastError == null
            ? "All providers failed"
            : "All providers failed; last error "
                + lastError.kind()
                + ": "
                + lastError.getMessage(),
        lastError);
  }

  private List<CompletionProvider> orderedProviders(CompletionConfig config) {
    if (config.providerPreferenceOrder().isEmpty()) {
      return new ArrayList<>(providers.values());
    }
    List<CompletionProvider> ordered = new ArrayList<>();
    for (String name : config.providerPreferenceOrder()) {
      CompletionProvider provider = providers.get(name);
      if (provider == null) {
        log.warn("Unknown provider '{}' in preference order, skipping", name);
      } else if (!ordered.contains(provider)) {
        ordered.add(provider);
      }
    }
    return ordered;
  }

  private CompletionResult attempt(
      CompletionProvider provider,
      String prompt,
      @Nullable String modelHint,
      CompletionConfig config,
      @Nullable Set<String> requiredFields) {
    CircuitBreaker breaker = breakers.get(provider.name());
    AtomicInteger calls = new AtomicInteger();
    try {
      return retryTemplate(config.maxRetries())
          .execute(
              context -> {
                if (context.getRetryCount() > 0) {
                  log.debug(
                      "Retrying provider {} (retry {}/{})",
                      provider.name(),
                      context.getRetryCount(),
                      config.maxRetries());
                }
                return guarded(breaker, provider, prompt, modelHint, config, requiredFields, calls);
              });
    } catch (BackOffInterruptedException e) {
      Thread.currentThread().interrupt();
      CancellationException cancelled = new CancellationException("Interrupted during backoff");
      cancelled.initCause(e);
      throw cancelled;
    }
  }

  private CompletionResult guarded(
      CircuitBreaker breaker,
      CompletionProvider provider,
      String prompt,
      @Nullable String modelHint,
      CompletionConfig config,
      @Nullable Set<String> requiredFields,
      AtomicInteger calls) {
    if (!breaker.tryAcquirePermission()) {
      throw ProviderException.of(
          ProviderErrorKind.CIRCUIT_OPEN, provider.name(), "Circuit breaker is open", null);
    }
    long start = System.nanoTime();
    try {
      CompletionResult result =
          callOnce(provider, prompt, modelHint, config, requiredFields, calls);
      breaker.onSuccess(System.nanoTime() - start, TimeUnit.NANOSECONDS);
      return result;
    } catch (ProviderException e) {
      breaker.onError(System.nanoTime() - start, TimeUnit.NANOSECONDS, e);
      throw e;
    } catch (RuntimeException e) {
      breaker.releasePermission();
      throw e;
    }
  }

  private CompletionResult callOnce(
      CompletionProvider provider,
      String prompt,
      @Nullable String modelHint,
      CompletionConfig config,
      @Nullable Set<String> requiredFields,
      AtomicInteger calls) {
    long start = System.nanoTime();
    ProviderResponse response = invoke(provider, prompt, modelHint, config, calls);
    JsonNode structured = null;
    if (requiredFields != null) {
      try {
        structured = parser.parse(provider.name(), response.text(), requiredFields);
      } catch (ProviderException e) {
        log.info(
            "Malformed output from provider {}, retrying once with strict format: {}",
            provider.name(),
            e.getMessage());
        start = System.nanoTime();
        response = invoke(provider, prompt + STRICT_FORMAT_INSTRUCTION, modelHint, config, calls);
        structured = parser.parse(provider.name(), response.text(), requiredFields);
      }
    }
    Duration latency = Duration.ofNanos(System.nanoTime() - start);
    log.debug(
        "Provider {} answered with model {} in {}ms ({} call(s))",
        provider.name(),
        response.model(),
        latency.toMillis(),
        calls.get());
    return new CompletionResult(
        response.text(),
        structured,
        provider.name(),
        response.model(),
        new CompletionResult.Usage(response.inputTokens(), response.outputTokens()),
        latency,
        calls.get());
  }

  private ProviderResponse invoke(
      CompletionProvider provider,
      String prompt,
      @Nullable String modelHint,
      CompletionConfig config,
      AtomicInteger calls) {
    try {
      concurrency.acquire();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CancellationException("Interrupted while waiting for a provider slot");
    }
    Future<ProviderResponse> future = null;
    try {
      calls.incrementAndGet();
      future = providerExecutor.submit(() -> provider.complete(prompt, modelHint, config));
      return future.get(config.timeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw ProviderException.of(
          ProviderErrorKind.TIMEOUT,
          provider.name(),
          "No response within " + config.timeout().toMillis() + "ms",
          e);
    } catch (InterruptedException e) {
      if (future != null) {
        future.cancel(true);
      }
      Thread.currentThread().interrupt();
      throw new CancellationException("Interrupted while waiting for provider " + provider.name());
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() == null ? e : e.getCause();
      throw ProviderErrorClassifier.classify(provider.name(), cause);
    } finally {
      concurrency.release();
    }
  }

  private RetryTemplate retryTemplate(int maxRetries) {
    SimpleRetryPolicy retryPolicy =
        new SimpleRetryPolicy(
            maxRetries + 1, Map.of(TransientProviderException.class, true), true);
    GatewayProperties.Backoff backoff = properties.getBackoff();
    ExponentialRandomBackOffPolicy backOffPolicy = new ExponentialRandomBackOffPolicy();
    backOffPolicy.setInitialInterval(backoff.getInitial().toMillis());
    backOffPolicy.setMultiplier(backoff.getMultiplier());
    backOffPolicy.setMaxInterval(backoff.getMax().toMillis());
    backOffPolicy.setSleeper(sleeper);

    RetryTemplate template = new RetryTemplate();
    template.setRetryPolicy(retryPolicy);
    template.setBackOffPolicy(backOffPolicy);
    template.setThrowLastExceptionOnExhausted(true);
    return template;
  }

  private static CircuitBreakerConfig breakerConfig(GatewayProperties.CircuitBreaker props) {
    return CircuitBreakerConfig.custom()
        .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.TIME_BASED)
        .slidingWindowSize((int) Math.max(1, props.getWindow().getSeconds()))
        .minimumNumberOfCalls(props.getMinimumCalls())
        .failureRateThreshold(props.getFailureRateThreshold())
        .waitDurationInOpenState(props.getCoolDown())
        .permittedNumberOfCallsInHalfOpenState(1)
        .automaticTransitionFromOpenToHalfOpenEnabled(false)
        .recordExceptions(TransientProviderException.class)
        .build();
  }
}
