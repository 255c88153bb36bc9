package dev.candor.store;

import java.time.Instant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

/** Spring Data repository for {@link SharedEntry} entities. */
public interface SharedEntryRepository extends JpaRepository<SharedEntry, String> {

  /**
   * Deletes every entry whose expiry is at or before {@code now}.
   *
   * @return number of deleted entries
   */
  @Modifying
  @Transactional
  @Query("DELETE FROM SharedEntry e WHERE e.expiresAt IS NOT NULL AND e.expiresAt <= :now")
  int deleteExpired(@Param("now") Instant now);
}
