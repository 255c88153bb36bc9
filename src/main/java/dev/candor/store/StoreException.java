package dev.candor.store;

/** A stored document could not be written or read back. */
public class StoreException extends RuntimeException {

  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
