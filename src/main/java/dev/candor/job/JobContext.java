package dev.candor.job;

import dev.candor.cache.Fingerprints;

/**
 * A role to hire for. The id is derived from the whitespace-normalized description, so resubmitting
 * the same description yields the same id (and hits the same cache entries).
 */
public record JobContext(String id, String description, JobAttributes attributes) {

  public JobContext {
    if (description == null || description.isBlank()) {
      throw new IllegalArgumentException("Job description must not be blank");
    }
    if (attributes == null) {
      throw new IllegalArgumentException("Job attributes must not be null");
    }
    if (id == null || id.isBlank()) {
      id = idFor(description);
    }
  }

  public static JobContext of(String description, JobAttributes attributes) {
    return new JobContext(null, description, attributes);
  }

  public static String idFor(String description) {
    return "job-" + Fingerprints.shortHash(normalize(description), 16);
  }

  static String normalize(String description) {
    return description.strip().replaceAll("\\s+", " ");
  }
}
