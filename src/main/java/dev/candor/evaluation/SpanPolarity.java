package dev.candor.evaluation;

import java.util.Locale;

public enum SpanPolarity {
  POSITIVE,
  NEGATIVE,
  NEUTRAL;

  /** Lenient parse of model output; unknown values are neutral. */
  public static SpanPolarity parse(String value) {
    if (value == null) {
      return NEUTRAL;
    }
    return switch (value.trim().toUpperCase(Locale.ROOT)) {
      case "POSITIVE", "+", "STRENGTH" -> POSITIVE;
      case "NEGATIVE", "-", "WEAKNESS" -> NEGATIVE;
      default -> NEUTRAL;
    };
  }
}
