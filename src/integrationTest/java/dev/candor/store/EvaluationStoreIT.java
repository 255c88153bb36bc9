package dev.candor.store;

import dev.candor.BaseIntegrationTest;
import dev.candor.cache.SharedStore;
import dev.candor.evaluation.Answer;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class EvaluationStoreIT extends BaseIntegrationTest {

    private static final Instant SUBMITTED_AT = Instant.parse("2025-01-01T00:00:00Z");

    @Autowired
    private EvaluationStore store;

    @Autowired
    private SharedStore sharedStore;

    @Test
    void artifactsRoundtripThroughJsonb() {
        Answer answer = new Answer(
                "a-it-1", "q-1", "cand-1", "Use idempotency keys.", SUBMITTED_AT);

        store.save(RecordKind.ANSWER, answer.id(), answer);

        assertThat(store.find(RecordKind.ANSWER, answer.id(), Answer.class)).contains(answer);
    }

    @Test
    void savingAgainReplacesTheDocument() {
        Answer first = new Answer("a-it-2", "q-1", "c", "first", SUBMITTED_AT);
        Answer second = new Answer("a-it-2", "q-1", "c", "second", SUBMITTED_AT);

        store.save(RecordKind.ANSWER, "a-it-2", first);
        store.save(RecordKind.ANSWER, "a-it-2", second);

        assertThat(store.find(RecordKind.ANSWER, "a-it-2", Answer.class))
                .get()
                .extracting(Answer::text)
                .isEqualTo("second");
        assertThat(store.delete(RecordKind.ANSWER, "a-it-2")).isTrue();
        assertThat(store.find(RecordKind.ANSWER, "a-it-2", Answer.class)).isEmpty();
    }

    @Test
    void sharedStoreHonorsExpiry() {
        sharedStore.set("it:forever", "kept", null);
        sharedStore.set("it:expired", "gone", Duration.ofMillis(1));

        await(Duration.ofMillis(50));

        assertThat(sharedStore.get("it:forever")).contains("kept");
        assertThat(sharedStore.get("it:expired")).isEmpty();
        assertThat(sharedStore.purgeExpired()).isGreaterThanOrEqualTo(1);
    }

    private static void await(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
