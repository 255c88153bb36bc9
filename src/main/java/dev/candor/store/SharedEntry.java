package dev.candor.store;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

/**
 * One key of the shared key-value store. A null expiry means the entry never expires.
 *
 * <p>Maps to the {@code shared_entries} table managed by Flyway migrations.
 */
@Entity
@Table(name = "shared_entries")
public class SharedEntry {

  @Id
  @Column(name = "entry_key", nullable = false)
  private String key;

  @Column(name = "entry_value", nullable = false, columnDefinition = "TEXT")
  private String value;

  @Column(name = "expires_at")
  private Instant expiresAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected SharedEntry() {
    // JPA requires no-arg constructor
  }

  public SharedEntry(String key, String value, Instant expiresAt, Instant updatedAt) {
    this.key = key;
    this.value = value;
    this.expiresAt = expiresAt;
    this.updatedAt = updatedAt;
  }

  public boolean isExpired(Instant now) {
    return expiresAt != null && !now.isBefore(expiresAt);
  }

  public String getKey() {
    return key;
  }

  public String getValue() {
    return value;
  }

  public void setValue(String value) {
    this.value = value;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }

  public void setExpiresAt(Instant expiresAt) {
    this.expiresAt = expiresAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void setUpdatedAt(Instant updatedAt) {
    this.updatedAt = updatedAt;
  }
}
