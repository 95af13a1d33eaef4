package com.jimin.river.fetch;

import com.jimin.river.config.RiverProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 피드별 최근 검증자 캐시 (프로세스 메모리)
 *
 * TTL이 지난 값은 없는 것으로 취급하고, 그때는 DB에 저장된 검증자를 사용한다.
 * 빈 검증자로 기존 값을 지우지 않는다.
 */
@Component
public class ValidatorCache {

    private final Map<Long, CachedValidators> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    public ValidatorCache(Clock clock, RiverProperties properties) {
        this.clock = clock;
        this.ttl = properties.fetch().validatorCacheTtl();
    }

    public Optional<Validators> get(Long feedId) {
        CachedValidators cached = entries.get(feedId);
        if (cached == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(cached.storedAt().plus(ttl))) {
            entries.remove(feedId, cached);
            return Optional.empty();
        }
        return Optional.of(cached.validators());
    }

    /**
     * 필드별로 새 값이 없으면 기존 값을 유지하고 저장 시각을 갱신한다.
     */
    public void put(Long feedId, Validators validators) {
        if (feedId == null || validators == null) {
            return;
        }
        Instant now = clock.instant();
        entries.compute(feedId, (id, previous) -> {
            Validators merged = previous == null ? validators : validators.orElse(previous.validators());
            if (merged.isEmpty()) {
                return previous;
            }
            return new CachedValidators(merged, now);
        });
    }

    public void evict(Long feedId) {
        entries.remove(feedId);
    }

    public int size() {
        return entries.size();
    }

    private record CachedValidators(Validators validators, Instant storedAt) {
    }
}
