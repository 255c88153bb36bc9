package dev.candor.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Static utility for SHA-256 fingerprints. Cache keys, entity ids and variant buckets are all
 * derived here so equal inputs map to equal keys across processes.
 */
public final class Fingerprints {

  /** Unit separator; cannot appear in normal prompt text, so part boundaries stay unambiguous. */
  private static final char SEPARATOR = '\u001F';

  private Fingerprints() {
    // utility class
  }

  /**
   * SHA-256 of the given content.
   *
   * @return lowercase hex string
   */
  public static String sha256(String content) {
    return HexFormat.of().formatHex(digest(content));
  }

  /** Fingerprint over several parts, in order. Null parts are treated as empty strings. */
  public static String of(String... parts) {
    StringBuilder joined = new StringBuilder();
    for (int i = 0; i < parts.length; i++) {
      if (i > 0) {
        joined.append(SEPARATOR);
      }
      joined.append(parts[i] == null ? "" : parts[i]);
    }
    return sha256(joined.toString());
  }

  /** First {@code length} hex characters of {@link #sha256(String)}, for readable ids. */
  public static String shortHash(String content, int length) {
    return sha256(content).substring(0, length);
  }

  /** Maps the parts onto a uniformly distributed double in {@code [0, 1)}. */
  public static double unitInterval(String... parts) {
    byte[] hash = digest(String.join(String.valueOf(SEPARATOR), parts));
    long bits = 0;
    for (int i = 0; i < 8; i++) {
      bits = (bits << 8) | (hash[i] & 0xFF);
    }
    return (bits >>> 11) * 0x1.0p-53;
  }

  private static byte[] digest(String content) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return digest.digest(content.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }
}
