package dev.candor.provider;

import org.jspecify.annotations.Nullable;

/**
 * Normalized provider failure. Transient kinds are raised as {@link TransientProviderException} so
 * the retry policy can classify them by type.
 */
public class ProviderException extends RuntimeException {

  private final ProviderErrorKind kind;
  private final @Nullable String provider;

  public ProviderException(
      ProviderErrorKind kind,
      @Nullable String provider,
      String message,
      @Nullable Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.provider = provider;
  }

  /**
   * Creates the exception subtype matching the kind's retryability.
   *
   * @param kind the failure category
   * @param provider the provider name, or null for gateway-level failures
   * @param message human-readable detail
   * @param cause the underlying error, if any
   * @return a {@link TransientProviderException} for transient kinds, a plain one otherwise
   */
  public static ProviderException of(
      ProviderErrorKind kind,
      @Nullable String provider,
      String message,
      @Nullable Throwable cause) {
    if (kind.isTransient()) {
      return new TransientProviderException(kind, provider, message, cause);
    }
    return new ProviderException(kind, provider, message, cause);
  }

  public ProviderErrorKind kind() {
    return kind;
  }

  public @Nullable String provider() {
    return provider;
  }
}
