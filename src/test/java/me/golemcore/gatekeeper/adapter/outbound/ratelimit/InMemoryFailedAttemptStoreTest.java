package me.golemcore.gatekeeper.adapter.outbound.ratelimit;

import me.golemcore.gatekeeper.domain.model.FailedAttemptRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryFailedAttemptStoreTest {

    private static final Instant T0 = Instant.ofEpochSecond(1_700_000_000L);

    private InMemoryFailedAttemptStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryFailedAttemptStore();
    }

    private static FailedAttemptRecord record(int count, Instant windowStart, Instant lastFailure) {
        return FailedAttemptRecord.builder()
                .count(count)
                .windowStart(windowStart)
                .cumulativeFailures(count)
                .lastFailure(lastFailure)
                .build();
    }

    @Test
    void shouldCreateAndUpdateRecord() {
        store.update("actor", current -> record(1, T0, T0));
        FailedAttemptRecord updated = store.update("actor",
                current -> current.toBuilder().count(current.getCount() + 1).build());

        assertEquals(2, updated.getCount());
        assertEquals(2, store.get("actor").orElseThrow().getCount());
    }

    @Test
    void shouldRemoveRecordWhenUpdateReturnsNull() {
        store.update("actor", current -> record(1, T0, T0));

        store.update("actor", current -> null);

        assertFalse(store.get("actor").isPresent());
    }

    @Test
    void shouldRemoveRecord() {
        store.update("actor", current -> record(1, T0, T0));

        store.remove("actor");

        assertFalse(store.get("actor").isPresent());
        assertEquals(0, store.size());
    }

    @Test
    void shouldEvictByLatestActivity() {
        store.update("stale", current -> record(1, T0, T0));
        store.update("recent-failure", current -> record(1, T0, T0.plusSeconds(500)));
        store.update("recent-window", current -> record(0, T0.plusSeconds(500), T0));

        int evicted = store.evictOlderThan(T0.plusSeconds(100));

        assertEquals(1, evicted);
        assertFalse(store.get("stale").isPresent());
        assertTrue(store.get("recent-failure").isPresent());
        assertTrue(store.get("recent-window").isPresent());
    }
}
