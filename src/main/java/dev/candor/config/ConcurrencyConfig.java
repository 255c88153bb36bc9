package dev.candor.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Thread pools shared by the engine.
 *
 * <ul>
 *   <li>{@code evaluationExecutor} runs per-item generation tasks and per-dimension evaluator
 *       tasks. Bounded; the provider semaphore is the real throttle on outbound calls.
 *   <li>{@code providerExecutor} runs individual provider calls so the gateway can enforce a
 *       per-call timeout and cancel on interrupt.
 * </ul>
 */
@Configuration
public class ConcurrencyConfig {

  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService evaluationExecutor(
      @Value("${candor.concurrency.evaluation-threads:16}") int threads) {
    if (threads < 1) {
      throw new IllegalStateException(
          "candor.concurrency.evaluation-threads must be >= 1, got: " + threads);
    }
    return Executors.newFixedThreadPool(threads, namedDaemonThreads("candor-eval-"));
  }

  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService providerExecutor() {
    return Executors.newCachedThreadPool(namedDaemonThreads("candor-provider-"));
  }

  private static ThreadFactory namedDaemonThreads(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}
