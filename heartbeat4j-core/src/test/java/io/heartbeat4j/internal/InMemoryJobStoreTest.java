package io.heartbeat4j.internal;

import io.heartbeat4j.core.PersistResult;
import io.heartbeat4j.core.ScheduledJob;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryJobStoreTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);

    @Test
    void upsertShouldKeepOriginalCreatedAt() {
        InMemoryJobStore store = new InMemoryJobStore(clock);
        Instant first = Instant.parse("2025-12-01T00:00:00Z");

        PersistResult created = store.upsert(new ScheduledJob("briefing", "30 6 * * *", "morning_briefing", "v1", first));
        PersistResult updated = store.upsert(new ScheduledJob("briefing", "0 7 * * *", "morning_briefing", "v2",
                Instant.parse("2026-01-01T00:00:00Z")));

        assertTrue(created.created());
        assertTrue(updated.updated());
        ScheduledJob row = store.findByName("briefing").orElseThrow();
        assertEquals("0 7 * * *", row.cronSpec());
        assertEquals("v2", row.description());
        assertEquals(first, row.createdAt());
    }

    @Test
    void upsertShouldStampMissingCreatedAt() {
        InMemoryJobStore store = new InMemoryJobStore(clock);
        store.upsert(new ScheduledJob("cleanup", "0 3 * * *", "memory_cleanup", null, null));

        assertEquals(clock.instant(), store.findByName("cleanup").orElseThrow().createdAt());
    }

    @Test
    void findAllShouldOrderByCreatedAtThenName() {
        InMemoryJobStore store = new InMemoryJobStore(clock);
        Instant t0 = Instant.parse("2025-01-01T00:00:00Z");
        store.upsert(new ScheduledJob("c", "* * * * *", "x", null, t0.plusSeconds(10)));
        store.upsert(new ScheduledJob("b", "* * * * *", "x", null, t0));
        store.upsert(new ScheduledJob("a", "* * * * *", "x", null, t0));

        List<String> names = store.findAll().stream().map(ScheduledJob::name).toList();

        assertEquals(List.of("a", "b", "c"), names);
    }

    @Test
    void deleteByNameShouldReportCount() {
        InMemoryJobStore store = new InMemoryJobStore(clock);
        store.upsert(new ScheduledJob("a", "* * * * *", "x", null, null));

        assertEquals(1, store.deleteByName("a"));
        assertEquals(0, store.deleteByName("a"));
        assertFalse(store.findByName("a").isPresent());
    }
}
