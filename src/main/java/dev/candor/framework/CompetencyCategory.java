package dev.candor.framework;

import java.util.Locale;

public enum CompetencyCategory {
  TECHNICAL,
  SOFT_SKILL,
  CULTURE_FIT;

  public boolean isTechnical() {
    return this == TECHNICAL;
  }

  /** Lenient parse of model output; anything unrecognized is treated as a soft skill. */
  public static CompetencyCategory parse(String value) {
    if (value == null) {
      return SOFT_SKILL;
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
    return switch (normalized) {
      case "TECHNICAL", "TECH", "HARD_SKILL" -> TECHNICAL;
      case "CULTURE_FIT", "CULTURE", "CULTURAL_FIT", "VALUES" -> CULTURE_FIT;
      default -> SOFT_SKILL;
    };
  }
}
