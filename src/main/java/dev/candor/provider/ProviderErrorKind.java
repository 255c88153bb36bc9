package dev.candor.provider;

/**
 * Normalized failure categories for provider calls. Provider-specific errors never leave the
 * gateway in any other shape.
 */
public enum ProviderErrorKind {
  /** No response within the configured per-call timeout. */
  TIMEOUT(true),
  /** Provider signalled throttling (HTTP 429 or equivalent). */
  RATE_LIMITED(true),
  /** Server-side or connection failure (HTTP 5xx, refused connection). */
  UNAVAILABLE(true),
  /** Provider refused the request (auth, bad request); retrying the same provider cannot help. */
  REJECTED(false),
  /** The provider's circuit breaker is open; the provider was skipped without a call. */
  CIRCUIT_OPEN(false),
  /** Structured output could not be parsed even after a strict-format retry. Terminal. */
  MALFORMED_RESPONSE(false),
  /** Every provider in the preference order failed. Terminal. */
  ALL_PROVIDERS_EXHAUSTED(false);

  private final boolean transientFailure;

  ProviderErrorKind(boolean transientFailure) {
    this.transientFailure = transientFailure;
  }

  /** Whether the same provider may be retried with backoff. */
  public boolean isTransient() {
    return transientFailure;
  }
}
