package dev.candor.prompt;

import java.util.List;

/** Thrown when a template is rendered without a value for every placeholder. */
public class TemplateRenderException extends RuntimeException {

  private final List<String> missingPlaceholders;

  public TemplateRenderException(String templateName, List<String> missingPlaceholders) {
    super("Template '" + templateName + "' is missing values for " + missingPlaceholders);
    this.missingPlaceholders = List.copyOf(missingPlaceholders);
  }

  public List<String> missingPlaceholders() {
    return missingPlaceholders;
  }
}
