package dev.candor.framework;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.candor.cache.Fingerprints;
import dev.candor.cache.ResponseCache;
import dev.candor.job.JobAttributes;
import dev.candor.job.JobContext;
import dev.candor.prompt.PromptNames;
import dev.candor.prompt.PromptRegistry;
import dev.candor.prompt.PromptTemplate;
import dev.candor.prompt.PromptVariables;
import dev.candor.prompt.VariantSelector;
import dev.candor.provider.CompletionResult;
import dev.candor.provider.ProviderErrorKind;
import dev.candor.provider.ProviderException;
import dev.candor.provider.ProviderGateway;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns a job description into a weighted {@link CompetencyFramework}.
 *
 * <p>The model is asked to reason from the role to the competencies it needs. The result must
 * contain at least one technical and one non-technical competency; otherwise the request is
 * repeated once with a corrective instruction before failing with {@link
 * FrameworkValidationException}. Frameworks are cached by template version, rendered prompt and
 * job id.
 */
@Service
public class ThoughtChainGenerator {

  private static final Logger log = LoggerFactory.getLogger(ThoughtChainGenerator.class);

  static final String CORRECTIVE_INSTRUCTION =
      "\n\nYour previous answer was rejected: the framework must contain at least one competency"
          + " with category TECHNICAL and at least one with category SOFT_SKILL or CULTURE_FIT."
          + " Produce the complete framework again.";

  private static final Set<String> REQUIRED_FIELDS = Set.of("competencies");

  private final ProviderGateway gateway;
  private final PromptRegistry promptRegistry;
  private final ResponseCache responseCache;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public ThoughtChainGenerator(
      ProviderGateway gateway,
      PromptRegistry promptRegistry,
      ResponseCache responseCache,
      ObjectMapper objectMapper,
      Clock clock) {
    this.gateway = gateway;
    this.promptRegistry = promptRegistry;
    this.responseCache = responseCache;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  /**
   * Generates (or returns the cached) framework for a job.
   *
   * @throws FrameworkValidationException if both attempts lack a technical or a non-technical
   *     competency
   * @throws ProviderException if the gateway fails
   */
  public CompetencyFramework generate(JobContext job) {
    PromptTemplate template =
        promptRegistry.resolve(PromptNames.THOUGHT_CHAIN, VariantSelector.of(job.id()));
    String prompt = template.render(variables(job));
    String fingerprint = Fingerprints.of(template.qualifiedVersion(), prompt, job.id());
    return responseCache.getOrCompute(
        fingerprint, CompetencyFramework.class, () -> build(job, template, prompt));
  }

  private CompetencyFramework build(JobContext job, PromptTemplate template, String prompt) {
    List<Competency> competencies = request(prompt);
    if (!isBalanced(competencies)) {
      log.warn(
          "Framework for {} lacks a technical or non-technical competency ({}), retrying once",
          job.id(),
          names(competencies));
      competencies = request(prompt + CORRECTIVE_INSTRUCTION);
      if (!isBalanced(competencies)) {
        throw new FrameworkValidationException(
            "Framework for "
                + job.id()
                + " needs at least one technical and one non-technical competency, got "
                + names(competencies),
            competencies);
      }
    }
    CompetencyFramework framework =
        new CompetencyFramework(
            job.id(), competencies, template.qualifiedVersion(), clock.instant());
    log.info(
        "Generated framework {} with {} competencies", framework.id(), competencies.size());
    return framework;
  }

  private List<Competency> request(String prompt) {
    CompletionResult result =
        gateway.completeStructured(prompt, null, gateway.defaultConfig(), REQUIRED_FIELDS);
    ThoughtChainResponse response;
    try {
      response = objectMapper.treeToValue(result.structured(), ThoughtChainResponse.class);
    } catch (JsonProcessingException e) {
      throw new ProviderException(
          ProviderErrorKind.MALFORMED_RESPONSE,
          result.provider(),
          "Unexpected thought-chain shape: " + e.getOriginalMessage(),
          e);
    }
    return toCompetencies(response.competencies());
  }

  /** Merges items with the same slug and normalizes weights. */
  static List<Competency> toCompetencies(List<ThoughtChainResponse.Item> items) {
    Map<String, MergedItem> merged = new LinkedHashMap<>();
    for (ThoughtChainResponse.Item item : items) {
      if (item == null || item.name() == null || item.name().isBlank()) {
        continue;
      }
      String id = Competency.slug(item.name());
      MergedItem existing = merged.get(id);
      if (existing == null) {
        merged.put(
            id,
            new MergedItem(
                item.name().strip(),
                CompetencyCategory.parse(item.category()),
                item.weight(),
                item.rationale() == null ? "" : item.rationale().strip()));
      } else {
        merged.put(id, existing.absorb(item));
      }
    }
    List<MergedItem> values = new ArrayList<>(merged.values());
    List<@Nullable Double> raw = new ArrayList<>();
    values.forEach(v -> raw.add(v.weight()));
    List<Double> weights = CompetencyWeights.normalize(raw);
    List<Competency> competencies = new ArrayList<>(values.size());
    for (int i = 0; i < values.size(); i++) {
      MergedItem value = values.get(i);
      competencies.add(
          new Competency(null, value.name(), value.category(), weights.get(i), value.rationale()));
    }
    return competencies;
  }

  static boolean isBalanced(List<Competency> competencies) {
    boolean technical = competencies.stream().anyMatch(c -> c.category().isTechnical());
    boolean nonTechnical = competencies.stream().anyMatch(c -> !c.category().isTechnical());
    return technical && nonTechnical;
  }

  private static PromptVariables variables(JobContext job) {
    JobAttributes attributes = job.attributes();
    return PromptVariables.builder()
        .put("description", job.description())
        .put("seniority", attributes.seniority().name())
        .put("expectation_bar", attributes.seniority().expectationBar())
        .put("domain", attributes.domain() == null ? "unspecified" : attributes.domain())
        .put(
            "company_size",
            attributes.companySize() == null ? "unspecified" : attributes.companySize())
        .putList("culture_tags", attributes.cultureTags())
        .build();
  }

  private static List<String> names(List<Competency> competencies) {
    return competencies.stream().map(c -> c.name() + ":" + c.category()).toList();
  }

  private record MergedItem(
      String name, CompetencyCategory category, @Nullable Double weight, String rationale) {

    MergedItem absorb(ThoughtChainResponse.Item other) {
      Double combined =
          weight == null || other.weight() == null ? null : weight + other.weight();
      String extra = other.rationale() == null ? "" : other.rationale().strip();
      String combinedRationale =
          extra.isEmpty() || rationale.contains(extra)
              ? rationale
              : (rationale + " " + extra).strip();
      return new MergedItem(name, category, combined, combinedRationale);
    }
  }
}
