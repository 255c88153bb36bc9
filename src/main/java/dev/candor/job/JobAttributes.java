package dev.candor.job;

import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;

/**
 * Structured attributes of a role.
 *
 * @param seniority seniority level
 * @param domain business or technical domain, e.g. {@code payments}
 * @param companySize free-form size band, e.g. {@code 50-200}
 * @param cultureTags culture keywords the hiring team cares about
 * @param family job family; together with a competency id it names a scoring cohort. Defaults to
 *     the domain, or {@code general} when no domain is given
 */
public record JobAttributes(
    SeniorityLevel seniority,
    @Nullable String domain,
    @Nullable String companySize,
    List<String> cultureTags,
    String family) {

  public static final String DEFAULT_FAMILY = "general";

  public JobAttributes {
    if (seniority == null) {
      throw new IllegalArgumentException("seniority must not be null");
    }
    cultureTags = cultureTags == null ? List.of() : List.copyOf(cultureTags);
    if (family == null || family.isBlank()) {
      family = domain == null || domain.isBlank() ? DEFAULT_FAMILY : domain;
    }
    family = family.trim().toLowerCase(Locale.ROOT);
  }

  public JobAttributes(
      SeniorityLevel seniority,
      @Nullable String domain,
      @Nullable String companySize,
      List<String> cultureTags) {
    this(seniority, domain, companySize, cultureTags, null);
  }
}
