package dev.candor.store;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

/** Spring Data repository for {@link EvaluationRecord} entities. */
public interface EvaluationRecordRepository extends JpaRepository<EvaluationRecord, UUID> {

  Optional<EvaluationRecord> findByKindAndRecordId(RecordKind kind, String recordId);

  @Modifying
  @Transactional
  @Query("DELETE FROM EvaluationRecord r WHERE r.kind = :kind AND r.recordId = :recordId")
  int deleteByKindAndRecordId(@Param("kind") RecordKind kind, @Param("recordId") String recordId);
}
