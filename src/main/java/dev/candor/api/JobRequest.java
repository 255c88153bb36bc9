package dev.candor.api;

import dev.candor.job.JobAttributes;
import dev.candor.job.JobContext;
import dev.candor.job.SeniorityLevel;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Request body describing a role. */
public record JobRequest(
    @NotBlank @Size(max = 20_000) String description,
    @NotBlank String seniority,
    @Nullable String domain,
    @Nullable String companySize,
    @Nullable List<String> cultureTags,
    @Nullable String family) {

  /**
   * @throws IllegalArgumentException for an unknown seniority level
   */
  public JobContext toJobContext() {
    return JobContext.of(
        description,
        new JobAttributes(
            SeniorityLevel.parse(seniority),
            domain,
            companySize,
            cultureTags == null ? List.of() : cultureTags,
            family));
  }
}
