package dev.candor.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** {@link EvaluationStore} over the {@code evaluation_records} JSONB table. */
@Service
public class JpaEvaluationStore implements EvaluationStore {

  private static final Logger log = LoggerFactory.getLogger(JpaEvaluationStore.class);

  private final EvaluationRecordRepository repository;
  private final ObjectMapper objectMapper;

  public JpaEvaluationStore(EvaluationRecordRepository repository, ObjectMapper objectMapper) {
    this.repository = repository;
    this.objectMapper = objectMapper;
  }

  @Override
  @Transactional
  public void save(RecordKind kind, String id, Object value) {
    String payload;
    try {
      payload = objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new StoreException("Cannot serialize " + kind + " " + id, e);
    }
    EvaluationRecord record =
        repository
            .findByKindAndRecordId(kind, id)
            .map(
                existing -> {
                  existing.setPayload(payload);
                  return existing;
                })
            .orElseGet(() -> new EvaluationRecord(kind, id, payload));
    repository.save(record);
    log.debug("Stored {} {}", kind, id);
  }

  @Override
  @Transactional(readOnly = true)
  public <T> Optional<T> find(RecordKind kind, String id, Class<T> type) {
    Optional<EvaluationRecord> record = repository.findByKindAndRecordId(kind, id);
    if (record.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(record.get().getPayload(), type));
    } catch (JsonProcessingException e) {
      throw new StoreException("Cannot read stored " + kind + " " + id, e);
    }
  }

  @Override
  @Transactional
  public boolean delete(RecordKind kind, String id) {
    return repository.deleteByKindAndRecordId(kind, id) > 0;
  }
}
