package dev.candor.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Extracts a JSON object from model output and checks its required top-level fields.
 *
 * <p>Tolerates Markdown code fences and prose around the object: the text between the first
 * {@code '{'} and the last {@code '}'} is parsed.
 */
final class JsonOutputParser {

  private final ObjectMapper objectMapper;

  JsonOutputParser(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Parses the structured payload of a provider response.
   *
   * @param provider provider name for error reporting
   * @param text raw model output
   * @param requiredFields top-level fields that must be present and non-null
   * @return the parsed JSON object
   * @throws ProviderException with kind {@link ProviderErrorKind#MALFORMED_RESPONSE} on any failure
   */
  JsonNode parse(String provider, String text, Set<String> requiredFields) {
    int start = text.indexOf('{');
    int end = text.lastIndexOf('}');
    if (start < 0 || end <= start) {
      throw malformed(provider, "No JSON object in provider output", null);
    }
    JsonNode node;
    try {
      node = objectMapper.readTree(text.substring(start, end + 1));
    } catch (JsonProcessingException e) {
      throw malformed(
          provider, "Unparseable JSON in provider output: " + e.getOriginalMessage(), e);
    }
    if (node == null || !node.isObject()) {
      throw malformed(provider, "Provider output is not a JSON object", null);
    }
    List<String> missing =
        requiredFields.stream().filter(f -> !node.hasNonNull(f)).sorted().toList();
    if (!missing.isEmpty()) {
      throw malformed(provider, "Provider output is missing required fields " + missing, null);
    }
    return node;
  }

  private static ProviderException malformed(
      String provider, String message, @Nullable Throwable cause) {
    return new ProviderException(ProviderErrorKind.MALFORMED_RESPONSE, provider, message, cause);
  }
}
