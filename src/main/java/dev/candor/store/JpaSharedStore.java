package dev.candor.store;

import dev.candor.cache.SharedStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** {@link SharedStore} over the {@code shared_entries} table. Expired rows read as absent. */
@Service
public class JpaSharedStore implements SharedStore {

  private final SharedEntryRepository repository;
  private final Clock clock;

  public JpaSharedStore(SharedEntryRepository repository, Clock clock) {
    this.repository = repository;
    this.clock = clock;
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<String> get(String key) {
    Instant now = clock.instant();
    return repository.findById(key).filter(e -> !e.isExpired(now)).map(SharedEntry::getValue);
  }

  @Override
  @Transactional
  public void set(String key, String value, @Nullable Duration ttl) {
    Instant now = clock.instant();
    Instant expiresAt = ttl == null ? null : now.plus(ttl);
    SharedEntry entry =
        repository
            .findById(key)
            .map(
                existing -> {
                  existing.setValue(value);
                  existing.setExpiresAt(expiresAt);
                  existing.setUpdatedAt(now);
                  return existing;
                })
            .orElseGet(() -> new SharedEntry(key, value, expiresAt, now));
    repository.save(entry);
  }

  @Override
  @Transactional
  public boolean expire(String key, Duration ttl) {
    Instant now = clock.instant();
    Optional<SharedEntry> entry = repository.findById(key);
    entry.ifPresent(
        e -> {
          e.setExpiresAt(now.plus(ttl));
          e.setUpdatedAt(now);
          repository.save(e);
        });
    return entry.isPresent();
  }

  @Override
  @Transactional
  public int purgeExpired() {
    return repository.deleteExpired(clock.instant());
  }
}
