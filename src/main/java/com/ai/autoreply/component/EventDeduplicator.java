package com.ai.autoreply.component;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local guard against the gateway redelivering the same event.
 * Ids are forgotten after the TTL; a restart forgets everything.
 */
@Component
public class EventDeduplicator {

    private static final Logger log = LoggerFactory.getLogger(EventDeduplicator.class);

    private final Map<String, Instant> seen = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    public EventDeduplicator(Clock clock, @Value("${autoreply.dedup.ttl:60s}") Duration ttl) {
        this.clock = clock;
        this.ttl = ttl;
    }

    /**
     * Records the id and reports whether it is new. Events without an id are always new.
     */
    public boolean markIfNew(String eventId) {
        if (StringUtils.isBlank(eventId)) {
            return true;
        }
        Instant now = clock.instant();
        Instant previous = seen.putIfAbsent(eventId, now);
        if (previous == null) {
            return true;
        }
        if (isExpired(previous, now) && seen.replace(eventId, previous, now)) {
            return true;
        }
        log.debug("Duplicate event {} (first seen {})", eventId, previous);
        return false;
    }

    @Scheduled(fixedDelayString = "${autoreply.dedup.sweep-interval-ms:30000}")
    public void evictExpired() {
        Instant now = clock.instant();
        int before = seen.size();
        seen.entrySet().removeIf(e -> isExpired(e.getValue(), now));
        int evicted = before - seen.size();
        if (evicted > 0) {
            log.debug("Evicted {} dedup entries, {} remaining", evicted, seen.size());
        }
    }

    int size() {
        return seen.size();
    }

    private boolean isExpired(Instant recordedAt, Instant now) {
        return !recordedAt.plus(ttl).isAfter(now);
    }
}
