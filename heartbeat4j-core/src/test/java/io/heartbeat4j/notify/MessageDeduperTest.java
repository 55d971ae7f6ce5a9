package io.heartbeat4j.notify;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessageDeduperTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T12:00:00Z"));
    private final MessageDeduper deduper = new MessageDeduper(Duration.ofMinutes(30), clock);

    @Test
    void sameMessageShouldBeSuppressedWithinCooldown() {
        assertTrue(deduper.tryAccept("disk usage 91%"));

        clock.advance(Duration.ofMinutes(29));
        assertFalse(deduper.tryAccept("disk usage 91%"));
        assertTrue(deduper.tryAccept("disk usage 92%"));
    }

    @Test
    void sameMessageShouldPassOnceCooldownElapsed() {
        assertTrue(deduper.tryAccept("disk usage 91%"));

        clock.advance(Duration.ofMinutes(30));
        assertTrue(deduper.tryAccept("disk usage 91%"));
    }

    @Test
    void suppressedMessageShouldNotExtendWindow() {
        assertTrue(deduper.tryAccept("ping"));
        clock.advance(Duration.ofMinutes(20));
        assertFalse(deduper.tryAccept("ping"));

        clock.advance(Duration.ofMinutes(10));
        assertTrue(deduper.tryAccept("ping"));
    }

    @Test
    void expiredEntriesShouldBePurged() {
        deduper.tryAccept("a");
        deduper.tryAccept("b");
        clock.advance(Duration.ofMinutes(31));

        deduper.tryAccept("c");

        assertEquals(1, deduper.size());
    }

    @Test
    void hashShouldBeMd5Hex() {
        assertEquals("5d41402abc4b2a76b9719d911017c592", MessageDeduper.hashOf("hello"));
    }
}
