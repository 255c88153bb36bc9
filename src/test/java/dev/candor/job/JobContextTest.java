package dev.candor.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class JobContextTest {

  private static final JobAttributes SENIOR =
      new JobAttributes(SeniorityLevel.SENIOR, "payments", null, List.of());

  @Test
  void idIgnoresWhitespaceDifferences() {
    JobContext a = JobContext.of("Backend engineer,  payments\n team", SENIOR);
    JobContext b = JobContext.of("  Backend engineer, payments team ", SENIOR);

    assertThat(a.id()).isEqualTo(b.id()).startsWith("job-").hasSize(20);
  }

  @Test
  void differentDescriptionsGetDifferentIds() {
    assertThat(JobContext.of("Backend engineer", SENIOR).id())
        .isNotEqualTo(JobContext.of("Frontend engineer", SENIOR).id());
  }

  @Test
  void explicitIdIsKept() {
    assertThat(new JobContext("job-custom", "Backend engineer", SENIOR).id())
        .isEqualTo("job-custom");
  }

  @Test
  void blankDescriptionIsRejected() {
    assertThatThrownBy(() -> JobContext.of("  ", SENIOR))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> JobContext.of("Backend engineer", null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void familyDefaultsToDomainThenGeneral() {
    assertThat(SENIOR.family()).isEqualTo("payments");
    assertThat(new JobAttributes(SeniorityLevel.MID, "  ", null, null).family())
        .isEqualTo(JobAttributes.DEFAULT_FAMILY);
    assertThat(new JobAttributes(SeniorityLevel.MID, "payments", null, null, " Platform ").family())
        .isEqualTo("platform");
  }

  @Test
  void cultureTagsAreNeverNull() {
    assertThat(new JobAttributes(SeniorityLevel.MID, null, null, null).cultureTags()).isEmpty();
  }

  @ParameterizedTest
  @CsvSource({
    "junior, JUNIOR",
    "Graduate, JUNIOR",
    "mid, MID",
    "INTERMEDIATE, MID",
    " senior , SENIOR",
    "staff, LEAD",
    "Principal, LEAD"
  })
  void seniorityParsesAliases(String raw, SeniorityLevel expected) {
    assertThat(SeniorityLevel.parse(raw)).isEqualTo(expected);
  }

  @Test
  void unknownSeniorityIsRejected() {
    assertThatThrownBy(() -> SeniorityLevel.parse("wizard"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Unknown seniority level: wizard");
  }

  @Test
  void everyLevelCarriesAnExpectationBar() {
    for (SeniorityLevel level : SeniorityLevel.values()) {
      assertThat(level.expectationBar()).isNotBlank();
    }
  }
}
