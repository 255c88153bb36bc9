package dev.candor;

import dev.candor.store.EvaluationRecord;
import dev.candor.store.EvaluationRecordRepository;
import dev.candor.store.RecordKind;
import dev.candor.store.SharedEntry;
import dev.candor.store.SharedEntryRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Compensates for ddl-auto=validate by verifying each JPA entity
 * can be persisted and read back against the Flyway schema.
 */
@Transactional
class JpaSchemaDriftIT extends BaseIntegrationTest {

    @Autowired
    private EvaluationRecordRepository evaluationRecordRepository;

    @Autowired
    private SharedEntryRepository sharedEntryRepository;

    @Test
    void evaluationRecordRoundtripsAgainstFlywaySchema() {
        EvaluationRecord record = new EvaluationRecord(
                RecordKind.ANSWER, "a-drift", "{\"text\": \"idempotency keys\"}");

        EvaluationRecord saved = evaluationRecordRepository.saveAndFlush(record);
        EvaluationRecord found = evaluationRecordRepository
                .findByKindAndRecordId(RecordKind.ANSWER, "a-drift")
                .orElseThrow();

        assertThat(found.getId()).isEqualTo(saved.getId());
        assertThat(found.getPayload()).contains("idempotency keys");
        assertThat(found.getCreatedAt()).isNotNull();
        assertThat(found.getUpdatedAt()).isNotNull();
    }

    @Test
    void sharedEntryRoundtripsAgainstFlywaySchema() {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MICROS);
        sharedEntryRepository.saveAndFlush(
                new SharedEntry("pool:payments:java", "{\"count\":1}", now.plusSeconds(60), now));

        SharedEntry found = sharedEntryRepository.findById("pool:payments:java").orElseThrow();

        assertThat(found.getValue()).isEqualTo("{\"count\":1}");
        assertThat(found.getExpiresAt()).isEqualTo(now.plusSeconds(60));
    }

    @Test
    void deleteExpiredRemovesOnlyExpiredEntries() {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MICROS);
        sharedEntryRepository.saveAndFlush(new SharedEntry("old", "v", now.minusSeconds(1), now));
        sharedEntryRepository.saveAndFlush(new SharedEntry("live", "v", now.plusSeconds(60), now));
        sharedEntryRepository.saveAndFlush(new SharedEntry("forever", "v", null, now));

        int deleted = sharedEntryRepository.deleteExpired(now);

        assertThat(deleted).isEqualTo(1);
        assertThat(sharedEntryRepository.findById("old")).isEmpty();
        assertThat(sharedEntryRepository.findById("live")).isPresent();
        assertThat(sharedEntryRepository.findById("forever")).isPresent();
    }
}
