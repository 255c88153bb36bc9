package dev.candor.framework;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Shape of the {@code thought-chain} model output. */
@JsonIgnoreProperties(ignoreUnknown = true)
record ThoughtChainResponse(List<Item> competencies) {

  ThoughtChainResponse {
    competencies = competencies == null ? List.of() : competencies;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Item(
      @Nullable String name,
      @Nullable String category,
      @Nullable Double weight,
      @Nullable String rationale) {}
}
