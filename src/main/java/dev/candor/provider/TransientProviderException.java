package dev.candor.provider;

import org.jspecify.annotations.Nullable;

/** A provider failure that may succeed on retry, such as a timeout or a rate limit. */
public class TransientProviderException extends ProviderException {

  public TransientProviderException(
      ProviderErrorKind kind,
      @Nullable String provider,
      String message,
      @Nullable Throwable cause) {
    super(kind, provider, message, cause);
    if (!kind.isTransient()) {
      throw new IllegalArgumentException(kind + " is not a transient failure kind");
    }
  }
}
