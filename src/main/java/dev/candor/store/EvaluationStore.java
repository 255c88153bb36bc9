package dev.candor.store;

import java.util.Optional;

/**
 * Durable storage for generated and evaluated artifacts, addressed by kind and id. Values are
 * stored as JSON documents; saving an existing key replaces it.
 */
public interface EvaluationStore {

  void save(RecordKind kind, String id, Object value);

  <T> Optional<T> find(RecordKind kind, String id, Class<T> type);

  /** @return true if a record was removed */
  boolean delete(RecordKind kind, String id);
}
