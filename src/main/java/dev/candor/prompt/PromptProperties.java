package dev.candor.prompt;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Live template versions, bound from {@code candor.prompts.*}.
 *
 * <pre>
 * candor.prompts.templates.thought-chain.experiment: tc-2025-q3
 * candor.prompts.templates.thought-chain.variants[0].version: v1
 * candor.prompts.templates.thought-chain.variants[0].weight: 1.0
 * </pre>
 *
 * <p>Each template text is loaded from {@code <location>/<name>/<version>.txt}.
 */
@Configuration
@ConfigurationProperties(prefix = "candor.prompts")
public class PromptProperties {

  private String location = "classpath:prompts";
  private Map<String, Template> templates = new LinkedHashMap<>();

  @PostConstruct
  void validate() {
    templates.forEach(
        (name, template) -> {
          if (template.getVariants().isEmpty()) {
            throw new IllegalStateException(
                "candor.prompts.templates." + name + " must declare at least one variant");
          }
          for (Variant variant : template.getVariants()) {
            if (variant.getVersion() == null || variant.getVersion().isBlank()) {
              throw new IllegalStateException(
                  "candor.prompts.templates." + name + " has a variant without a version");
            }
            if (variant.getWeight() <= 0.0) {
              throw new IllegalStateException(
                  "candor.prompts.templates."
                      + name
                      + " variant "
                      + variant.getVersion()
                      + " must have a positive weight, got: "
                      + variant.getWeight());
            }
          }
        });
  }

  public String getLocation() {
    return location;
  }

  public void setLocation(String location) {
    this.location = location;
  }

  public Map<String, Template> getTemplates() {
    return templates;
  }

  public void setTemplates(Map<String, Template> templates) {
    this.templates = templates;
  }

  /** An experiment window with its live variants. */
  public static class Template {

    private String experiment = "default";
    private List<Variant> variants = new ArrayList<>();

    public String getExperiment() {
      return experiment;
    }

    public void setExperiment(String experiment) {
      this.experiment = experiment;
    }

    public List<Variant> getVariants() {
      return variants;
    }

    public void setVariants(List<Variant> variants) {
      this.variants = variants;
    }
  }

  public static class Variant {

    private String version;
    private double weight = 1.0;

    public String getVersion() {
      return version;
    }

    public void setVersion(String version) {
      this.version = version;
    }

    public double getWeight() {
      return weight;
    }

    public void setWeight(double weight) {
      this.weight = weight;
    }
  }
}
