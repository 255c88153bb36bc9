package dev.candor.question;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.CosineSimilarity;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Merges near-duplicate questions using in-process embeddings. The earlier question is kept and
 * absorbs the competency ids of every later question whose cosine similarity reaches the
 * threshold.
 */
@Component
public class QuestionDeduplicator {

  private static final Logger log = LoggerFactory.getLogger(QuestionDeduplicator.class);

  private final EmbeddingModel embeddingModel;
  private final QuestionProperties properties;

  public QuestionDeduplicator(EmbeddingModel embeddingModel, QuestionProperties properties) {
    this.embeddingModel = embeddingModel;
    this.properties = properties;
  }

  public List<Question> deduplicate(List<Question> questions) {
    if (questions.size() < 2) {
      return List.copyOf(questions);
    }
    List<TextSegment> segments = questions.stream().map(q -> TextSegment.from(q.text())).toList();
    List<Embedding> embeddings = embeddingModel.embedAll(segments).content();

    List<Question> kept = new ArrayList<>();
    List<Embedding> keptEmbeddings = new ArrayList<>();
    for (int i = 0; i < questions.size(); i++) {
      Question candidate = questions.get(i);
      Embedding embedding = embeddings.get(i);
      int match = -1;
      for (int k = 0; k < kept.size(); k++) {
        if (kept.get(k).id().equals(candidate.id())
            || CosineSimilarity.between(keptEmbeddings.get(k), embedding)
                >= properties.getSimilarityThreshold()) {
          match = k;
          break;
        }
      }
      if (match < 0) {
        kept.add(candidate);
        keptEmbeddings.add(embedding);
      } else {
        log.debug(
            "Merging near-duplicate question {} into {}", candidate.id(), kept.get(match).id());
        kept.set(match, kept.get(match).withAdditionalCompetencies(candidate.competencyIds()));
      }
    }
    return List.copyOf(kept);
  }
}
