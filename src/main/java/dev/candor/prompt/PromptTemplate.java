package dev.candor.prompt;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One immutable version of a named prompt. Placeholders use the {@code {{name}}} syntax.
 *
 * @param name template name, e.g. {@code thought-chain}
 * @param version version label, e.g. {@code v1}
 * @param text raw template text
 */
public record PromptTemplate(String name, String version, String text) {

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{([A-Za-z0-9_.]+)}}");

  public PromptTemplate {
    if (name == null || name.isBlank() || version == null || version.isBlank()) {
      throw new IllegalArgumentException("Template name and version must not be blank");
    }
    if (text == null) {
      throw new IllegalArgumentException("Template text must not be null");
    }
  }

  /** Placeholder names in order of first appearance. */
  public Set<String> placeholders() {
    Set<String> names = new LinkedHashSet<>();
    Matcher matcher = PLACEHOLDER.matcher(text);
    while (matcher.find()) {
      names.add(matcher.group(1));
    }
    return names;
  }

  /**
   * Renders the template.
   *
   * @throws TemplateRenderException if any placeholder has no value or a null value
   */
  public String render(PromptVariables variables) {
    Map<String, Object> values = new HashMap<>();
    List<String> missing = new ArrayList<>();
    for (String placeholder : placeholders()) {
      Object value = variables.asMap().get(placeholder);
      if (value == null) {
        missing.add(placeholder);
      } else {
        values.put(placeholder, value);
      }
    }
    if (!missing.isEmpty()) {
      throw new TemplateRenderException(name, missing);
    }
    if (values.isEmpty()) {
      return text;
    }
    return dev.langchain4j.model.input.PromptTemplate.from(text).apply(values).text();
  }

  /** {@code name@version}, used in fingerprints and stored artifacts. */
  public String qualifiedVersion() {
    return name + "@" + version;
  }
}
