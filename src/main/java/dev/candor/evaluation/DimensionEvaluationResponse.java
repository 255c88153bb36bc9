package dev.candor.evaluation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Shape of the {@code answer-evaluation} model output. */
@JsonIgnoreProperties(ignoreUnknown = true)
record DimensionEvaluationResponse(
    @Nullable Double score,
    @Nullable Double confidence,
    @Nullable String justification,
    @Nullable List<Span> spans) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Span(@Nullable String text, @Nullable String polarity) {}
}
