package com.jimin.river.fetch;

import com.jimin.river.config.RiverProperties;
import com.jimin.river.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ValidatorCacheTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T00:00:00Z"));
    private final ValidatorCache cache = new ValidatorCache(clock, RiverProperties.defaults());

    @Test
    void expiresAfterTtl() {
        cache.put(1L, new Validators("Sun, 01 Mar 2026 00:00:00 GMT", "\"v1\""));

        clock.advance(Duration.ofHours(23));
        assertEquals(Optional.of(new Validators("Sun, 01 Mar 2026 00:00:00 GMT", "\"v1\"")), cache.get(1L));

        clock.advance(Duration.ofHours(2));
        assertTrue(cache.get(1L).isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    void emptyValuesNeverEraseStoredOnes() {
        cache.put(1L, new Validators("Sun, 01 Mar 2026 00:00:00 GMT", "\"v1\""));
        cache.put(1L, new Validators(null, "\"v2\""));
        cache.put(1L, Validators.NONE);

        assertEquals(new Validators("Sun, 01 Mar 2026 00:00:00 GMT", "\"v2\""), cache.get(1L).orElseThrow());
    }

    @Test
    void putRefreshesTimestamp() {
        cache.put(1L, new Validators(null, "\"v1\""));
        clock.advance(Duration.ofHours(20));
        cache.put(1L, new Validators(null, "\"v1\""));
        clock.advance(Duration.ofHours(20));

        assertTrue(cache.get(1L).isPresent());
    }

    @Test
    void blankStringsAreTreatedAsMissing() {
        assertTrue(new Validators("", "  ").isEmpty());
        assertEquals(new Validators("a", "b"), new Validators("a", "").orElse(new Validators(null, "b")));
    }
}
