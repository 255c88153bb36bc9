package dev.candor.prompt;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * Named values for one template rendering. Null values are kept so rendering can report them as
 * missing.
 */
public final class PromptVariables {

  private final Map<String, @Nullable Object> values;

  private PromptVariables(Map<String, @Nullable Object> values) {
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  public static Builder builder() {
    return new Builder();
  }

  public Map<String, @Nullable Object> asMap() {
    return values;
  }

  public static final class Builder {

    private final Map<String, @Nullable Object> values = new LinkedHashMap<>();

    private Builder() {}

    public Builder put(String name, @Nullable Object value) {
      values.put(name, value);
      return this;
    }

    /** Renders a collection as a Markdown bullet list; empty collections become {@code (none)}. */
    public Builder putList(String name, Collection<?> items) {
      values.put(
          name,
          items.isEmpty()
              ? "(none)"
              : items.stream().map(item -> "- " + item).collect(Collectors.joining("\n")));
      return this;
    }

    public PromptVariables build() {
      return new PromptVariables(values);
    }
  }
}
