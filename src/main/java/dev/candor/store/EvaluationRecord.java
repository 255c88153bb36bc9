package dev.candor.store;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * One stored artifact as a JSONB document. The unique constraint on {@code (kind, record_id)}
 * keeps one document per artifact.
 *
 * <p>Maps to the {@code evaluation_records} table managed by Flyway migrations.
 */
@Entity
@Table(
    name = "evaluation_records",
    uniqueConstraints = @UniqueConstraint(columnNames = {"kind", "record_id"}))
public class EvaluationRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private RecordKind kind;

  @Column(name = "record_id", nullable = false)
  private String recordId;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(nullable = false, columnDefinition = "JSONB")
  private String payload;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected EvaluationRecord() {
    // JPA requires no-arg constructor
  }

  public EvaluationRecord(RecordKind kind, String recordId, String payload) {
    this.kind = kind;
    this.recordId = recordId;
    this.payload = payload;
  }

  @PrePersist
  protected void onCreate() {
    Instant now = Instant.now();
    this.createdAt = now;
    this.updatedAt = now;
  }

  @PreUpdate
  protected void onUpdate() {
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public RecordKind getKind() {
    return kind;
  }

  public String getRecordId() {
    return recordId;
  }

  public String getPayload() {
    return payload;
  }

  public void setPayload(String payload) {
    this.payload = payload;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
