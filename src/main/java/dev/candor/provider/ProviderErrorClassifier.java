package dev.candor.provider;

import dev.langchain4j.exception.HttpException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Maps arbitrary provider errors onto the normalized {@link ProviderErrorKind} taxonomy.
 *
 * <p>Walks the whole cause chain: HTTP status codes win, then well-known timeout and connection
 * exception types, then message keywords. Unrecognized errors are treated as {@link
 * ProviderErrorKind#UNAVAILABLE} so they are retried rather than silently dropped.
 */
final class ProviderErrorClassifier {

  private static final int MAX_CHAIN_DEPTH = 20;

  private ProviderErrorClassifier() {}

  static ProviderException classify(String provider, Throwable error) {
    if (error instanceof ProviderException pe) {
      return pe;
    }
    List<Throwable> chain = causeChain(error);
    String message =
        error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();

    for (Throwable t : chain) {
      if (t instanceof HttpException http) {
        return fromStatus(provider, http.statusCode(), message, error);
      }
    }

    for (Throwable t : chain) {
      if (t instanceof TimeoutException
          || t instanceof SocketTimeoutException
          || t instanceof HttpTimeoutException) {
        return ProviderException.of(ProviderErrorKind.TIMEOUT, provider, message, error);
      }
      if (t instanceof ConnectException) {
        return ProviderException.of(ProviderErrorKind.UNAVAILABLE, provider, message, error);
      }
    }

    String lowerAll = joinedLowerMessages(chain);
    if (lowerAll.contains("rate limit") || lowerAll.contains("too many requests")) {
      return ProviderException.of(ProviderErrorKind.RATE_LIMITED, provider, message, error);
    }
    if (lowerAll.contains("timed out") || lowerAll.contains("timeout")) {
      return ProviderException.of(ProviderErrorKind.TIMEOUT, provider, message, error);
    }
    return ProviderException.of(ProviderErrorKind.UNAVAILABLE, provider, message, error);
  }

  private static ProviderException fromStatus(
      String provider, int status, String message, Throwable error) {
    if (status == 429) {
      return ProviderException.of(ProviderErrorKind.RATE_LIMITED, provider, message, error);
    }
    if (status == 408) {
      return ProviderException.of(ProviderErrorKind.TIMEOUT, provider, message, error);
    }
    if (status >= 500) {
      return ProviderException.of(ProviderErrorKind.UNAVAILABLE, provider, message, error);
    }
    return ProviderException.of(ProviderErrorKind.REJECTED, provider, message, error);
  }

  private static List<Throwable> causeChain(Throwable error) {
    List<Throwable> chain = new ArrayList<>();
    Throwable current = error;
    while (current != null && chain.size() < MAX_CHAIN_DEPTH) {
      chain.add(current);
      Throwable next = current.getCause();
      if (next == current) {
        break;
      }
      current = next;
    }
    return chain;
  }

  private static String joinedLowerMessages(List<Throwable> chain) {
    StringBuilder sb = new StringBuilder();
    for (Throwable t : chain) {
      if (t.getMessage() != null) {
        sb.append(t.getMessage().toLowerCase(Locale.ROOT)).append(" | ");
      }
    }
    return sb.toString();
  }
}
