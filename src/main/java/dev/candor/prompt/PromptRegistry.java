package dev.candor.prompt;

import dev.candor.cache.Fingerprints;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

/**
 * Holds every live template version and assigns variants to subjects.
 *
 * <p>Assignment hashes {@code (subjectId, templateName, experiment)} onto {@code [0, 1)} and walks
 * the cumulative variant weights, so it is deterministic, stateless and stable across restarts.
 * Changing the experiment name reshuffles assignments.
 */
@Service
public class PromptRegistry {

  private static final Logger log = LoggerFactory.getLogger(PromptRegistry.class);

  private final Map<String, LiveTemplate> templates;

  @Autowired
  public PromptRegistry(PromptProperties properties, ResourceLoader resourceLoader) {
    Map<String, LiveTemplate> loaded = new LinkedHashMap<>();
    properties
        .getTemplates()
        .forEach(
            (name, declared) -> {
              List<WeightedVersion> versions = new ArrayList<>();
              for (PromptProperties.Variant variant : declared.getVariants()) {
                String location =
                    properties.getLocation() + "/" + name + "/" + variant.getVersion() + ".txt";
                String text = load(resourceLoader.getResource(location), location);
                versions.add(
                    new WeightedVersion(
                        new PromptTemplate(name, variant.getVersion(), text), variant.getWeight()));
              }
              loaded.put(name, new LiveTemplate(declared.getExperiment(), List.copyOf(versions)));
              log.info(
                  "Loaded template {} ({} live version(s), experiment {})",
                  name,
                  versions.size(),
                  declared.getExperiment());
            });
    this.templates = Collections.unmodifiableMap(loaded);
  }

  /** Registry over already-built templates, one experiment per name. */
  public static PromptRegistry of(Map<String, String> experiments, List<WeightedVersion> versions) {
    return new PromptRegistry(experiments, versions);
  }

  private PromptRegistry(Map<String, String> experiments, List<WeightedVersion> versions) {
    Map<String, List<WeightedVersion>> byName = new LinkedHashMap<>();
    for (WeightedVersion version : versions) {
      byName.computeIfAbsent(version.template().name(), n -> new ArrayList<>()).add(version);
    }
    Map<String, LiveTemplate> built = new LinkedHashMap<>();
    byName.forEach(
        (name, list) ->
            built.put(
                name,
                new LiveTemplate(experiments.getOrDefault(name, "default"), List.copyOf(list))));
    this.templates = Collections.unmodifiableMap(built);
  }

  /**
   * Picks the variant of {@code templateName} assigned to the selector's subject.
   *
   * @throws IllegalArgumentException if no template has that name
   */
  public PromptTemplate resolve(String templateName, VariantSelector selector) {
    LiveTemplate live = live(templateName);
    if (live.versions().size() == 1) {
      return live.versions().get(0).template();
    }
    double total = live.versions().stream().mapToDouble(WeightedVersion::weight).sum();
    double point =
        Fingerprints.unitInterval(selector.subjectId(), templateName, live.experiment()) * total;
    double cumulative = 0.0;
    for (WeightedVersion version : live.versions()) {
      cumulative += version.weight();
      if (point < cumulative) {
        return version.template();
      }
    }
    return live.versions().get(live.versions().size() - 1).template();
  }

  /**
   * Fetches one exact version.
   *
   * @throws IllegalArgumentException if the name or version is unknown
   */
  public PromptTemplate resolve(String templateName, String version) {
    return live(templateName).versions().stream()
        .map(WeightedVersion::template)
        .filter(t -> t.version().equals(version))
        .findFirst()
        .orElseThrow(
            () ->
                new IllegalArgumentException(
                    "Unknown version '" + version + "' of template '" + templateName + "'"));
  }

  /** Live versions of a template, in declaration order. */
  public List<String> versions(String templateName) {
    return live(templateName).versions().stream().map(v -> v.template().version()).toList();
  }

  private LiveTemplate live(String templateName) {
    LiveTemplate live = templates.get(templateName);
    if (live == null) {
      throw new IllegalArgumentException("Unknown template: " + templateName);
    }
    return live;
  }

  private static String load(Resource resource, String location) {
    if (!resource.exists()) {
      throw new IllegalStateException("Template resource not found: " + location);
    }
    try (InputStream in = resource.getInputStream()) {
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IllegalStateException("Cannot read template resource " + location, e);
    }
  }

  /** A live template version and its traffic weight. */
  public record WeightedVersion(PromptTemplate template, double weight) {

    public WeightedVersion {
      if (weight <= 0.0) {
        throw new IllegalArgumentException("weight must be positive, got: " + weight);
      }
    }
  }

  private record LiveTemplate(String experiment, List<WeightedVersion> versions) {}
}
