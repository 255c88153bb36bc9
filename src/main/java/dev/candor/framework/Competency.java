package dev.candor.framework;

import java.text.Normalizer;
import java.util.Locale;

/**
 * One weighted competency of a framework.
 *
 * @param id slug of the name, stable across regenerations
 * @param name display name
 * @param category competency category
 * @param weight share of the composite score, in [0, 1]
 * @param rationale why the role needs it
 */
public record Competency(
    String id, String name, CompetencyCategory category, double weight, String rationale) {

  public Competency {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Competency name must not be blank");
    }
    if (id == null || id.isBlank()) {
      id = slug(name);
    }
    if (category == null) {
      category = CompetencyCategory.SOFT_SKILL;
    }
    if (weight < 0.0 || weight > 1.0 || Double.isNaN(weight)) {
      throw new IllegalArgumentException("Competency weight must be in [0, 1], got: " + weight);
    }
    rationale = rationale == null ? "" : rationale;
  }

  public Competency withWeight(double newWeight) {
    return new Competency(id, name, category, newWeight, rationale);
  }

  /** Lowercase ASCII slug, e.g. {@code "Systems & Scale"} becomes {@code systems-scale}. */
  public static String slug(String name) {
    String ascii =
        Normalizer.normalize(name, Normalizer.Form.NFD).replaceAll("\\p{M}", "");
    String slug =
        ascii.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("(^-+|-+$)", "");
    return slug.isEmpty() ? "competency" : slug;
  }
}
