package com.ai.autoreply.component;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EventDeduplicatorTest {

    private final AtomicReference<Instant> now = new AtomicReference<>(Instant.parse("2024-05-10T12:00:00Z"));
    private EventDeduplicator deduplicator;

    @BeforeEach
    void setUp() {
        Clock clock = mock(Clock.class);
        when(clock.instant()).thenAnswer(invocation -> now.get());
        deduplicator = new EventDeduplicator(clock, Duration.ofSeconds(60));
    }

    @Test
    void repeatedIdWithinTtlIsDuplicate() {
        assertThat(deduplicator.markIfNew("ABC123")).isTrue();
        now.set(now.get().plusSeconds(30));
        assertThat(deduplicator.markIfNew("ABC123")).isFalse();
        assertThat(deduplicator.markIfNew("DEF456")).isTrue();
    }

    @Test
    void eventsWithoutIdAreAlwaysNew() {
        assertThat(deduplicator.markIfNew(null)).isTrue();
        assertThat(deduplicator.markIfNew(null)).isTrue();
        assertThat(deduplicator.markIfNew("  ")).isTrue();
        assertThat(deduplicator.size()).isZero();
    }

    @Test
    void idIsNewAgainOnceTtlElapsed() {
        deduplicator.markIfNew("ABC123");
        now.set(now.get().plusSeconds(61));
        assertThat(deduplicator.markIfNew("ABC123")).isTrue();
        assertThat(deduplicator.markIfNew("ABC123")).isFalse();
    }

    @Test
    void sweepEvictsOnlyExpiredEntries() {
        deduplicator.markIfNew("old");
        now.set(now.get().plusSeconds(40));
        deduplicator.markIfNew("recent");
        now.set(now.get().plusSeconds(25));

        deduplicator.evictExpired();

        assertThat(deduplicator.size()).isEqualTo(1);
        assertThat(deduplicator.markIfNew("recent")).isFalse();
        assertThat(deduplicator.markIfNew("old")).isTrue();
    }
}
