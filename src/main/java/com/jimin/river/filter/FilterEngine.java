package com.jimin.river.filter;

import com.jimin.river.config.RiverProperties;
import com.jimin.river.dto.EntryCandidate;
import com.jimin.river.exception.FilterEvaluationException;
import com.jimin.river.store.FeedStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * FilterEngine - 수집 항목 keep/discard 판정
 *
 * 동작 방식:
 * 1. 활성 필터 그룹을 TTL 캐시에서 읽음 (만료 시 FeedStore에서 한 번만 다시 조회)
 * 2. 피드 카테고리에 해당하는 그룹만 남김
 * 3. keep 그룹이 하나라도 있으면 화이트리스트 모드
 *    - keep 그룹 중 하나라도 매치되면 유지, 아니면 제외 (discard 그룹은 무시)
 * 4. 없으면 블랙리스트 모드
 *    - discard 그룹 중 하나라도 매치되면 제외, 기본은 유지
 *
 * 그룹 안의 규칙 오류는 해당 그룹만 "매치 안 됨"으로 처리한다.
 * 화이트리스트 모드에서 매치된 그룹 없이 오류가 난 그룹이 있으면 FilterEvaluationException을 던지고,
 * 호출자는 항목을 유지한다.
 */
@Slf4j
@Component
public class FilterEngine {

    private final FeedStore feedStore;
    private final PatternMatcher patternMatcher;
    private final Clock clock;
    private final Duration cacheTtl;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicInteger refreshCount = new AtomicInteger();

    // lock으로 보호
    private List<FilterGroupSnapshot> cachedGroups = List.of();
    private Instant cachedAt;

    public FilterEngine(FeedStore feedStore, PatternMatcher patternMatcher, Clock clock,
                        RiverProperties properties) {
        this.feedStore = feedStore;
        this.patternMatcher = patternMatcher;
        this.clock = clock;
        this.cacheTtl = properties.filter().cacheTtl();
    }

    /**
     * @param entry        평가할 항목
     * @param feedCategory 항목이 속한 피드의 카테고리 (없으면 null)
     * @param feedTags     항목이 속한 피드의 태그
     * @throws FilterEvaluationException 필터 설정 조회 실패, 또는 화이트리스트 판정 불가
     */
    public FilterDecision filterEntry(EntryCandidate entry, String feedCategory, List<String> feedTags) {
        List<FilterGroupSnapshot> relevant = activeGroups().stream()
                .filter(group -> group.appliesTo(feedCategory))
                .collect(Collectors.toList());

        if (relevant.isEmpty()) {
            return FilterDecision.KEEP;
        }

        FilterTarget target = new FilterTarget(entry.title(), entry.content(), feedCategory, feedTags);

        boolean whitelistMode = relevant.stream().anyMatch(FilterGroupSnapshot::isKeep);
        if (whitelistMode) {
            return applyWhitelist(relevant, target, entry);
        }
        return applyBlacklist(relevant, target, entry);
    }

    /**
     * 필터 1개를 샘플 문자열에 적용 (text를 모든 대상 필드로 사용)
     */
    public boolean testFilter(FilterDefinition filter, String text) {
        return matchesTarget(filter, FilterTarget.uniform(text));
    }

    /**
     * 그룹 1개를 샘플 문자열에 적용 (text를 모든 대상 필드로 사용)
     */
    public boolean testFilterGroup(FilterGroupSnapshot group, String text) {
        return evaluateGroup(group, FilterTarget.uniform(text));
    }

    /**
     * 다음 호출 때 필터 설정을 다시 읽도록 캐시 무효화
     */
    public void invalidateCache() {
        lock.writeLock().lock();
        try {
            cachedAt = null;
            cachedGroups = List.of();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 그룹 캐시 + 정규식 캐시 모두 비움
     */
    public void clearCache() {
        invalidateCache();
        patternMatcher.clearCache();
    }

    int refreshCount() {
        return refreshCount.get();
    }

    List<FilterGroupSnapshot> activeGroups() {
        lock.readLock().lock();
        try {
            if (isFresh()) {
                return cachedGroups;
            }
        } finally {
            lock.readLock().unlock();
        }

        lock.writeLock().lock();
        try {
            // 먼저 write lock을 잡은 스레드가 이미 갱신했으면 그대로 사용
            if (isFresh()) {
                return cachedGroups;
            }
            List<FilterGroupSnapshot> loaded;
            try {
                loaded = List.copyOf(feedStore.getActiveFilterGroups());
            } catch (RuntimeException e) {
                throw new FilterEvaluationException("필터 설정을 불러오지 못했습니다", e);
            }
            cachedGroups = loaded;
            cachedAt = clock.instant();
            refreshCount.incrementAndGet();
            log.debug("필터 그룹 캐시 갱신: {}개", loaded.size());
            return loaded;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private boolean isFresh() {
        return cachedAt != null && clock.instant().isBefore(cachedAt.plus(cacheTtl));
    }

    private FilterDecision applyWhitelist(List<FilterGroupSnapshot> groups, FilterTarget target,
                                          EntryCandidate entry) {
        FilterEvaluationException firstError = null;
        for (FilterGroupSnapshot group : groups) {
            if (!group.isKeep()) {
                continue;
            }
            try {
                if (evaluateGroup(group, target)) {
                    return FilterDecision.KEEP;
                }
            } catch (FilterEvaluationException e) {
                log.warn("필터 그룹 평가 오류 - group: {}, entry: {}, 원인: {}", group.name(), entry.url(), e.getMessage());
                if (firstError == null) {
                    firstError = e;
                }
            }
        }
        if (firstError != null) {
            throw new FilterEvaluationException(
                    "keep 그룹 평가 오류로 판정할 수 없습니다: " + firstError.getMessage(), firstError);
        }
        return FilterDecision.DISCARD;
    }

    private FilterDecision applyBlacklist(List<FilterGroupSnapshot> groups, FilterTarget target,
                                          EntryCandidate entry) {
        for (FilterGroupSnapshot group : groups) {
            if (!group.isDiscard()) {
                continue;
            }
            try {
                if (evaluateGroup(group, target)) {
                    log.debug("discard 그룹 매치 - group: {}, entry: {}", group.name(), entry.url());
                    return FilterDecision.DISCARD;
                }
            } catch (FilterEvaluationException e) {
                log.warn("필터 그룹 평가 오류 - group: {}, entry: {}, 원인: {}", group.name(), entry.url(), e.getMessage());
            }
        }
        return FilterDecision.KEEP;
    }

    /**
     * position 0 규칙이 시작값, 이후 규칙은 왼쪽부터 AND/OR로 접는다 (short-circuit).
     */
    private boolean evaluateGroup(FilterGroupSnapshot group, FilterTarget target) {
        List<FilterRuleSnapshot> rules = group.rules();
        if (rules.isEmpty()) {
            return false;
        }

        boolean result = ruleMatches(rules.get(0), target);
        for (int i = 1; i < rules.size(); i++) {
            FilterRuleSnapshot rule = rules.get(i);
            if (RuleOperator.parseOrAnd(rule.operator()) == RuleOperator.OR) {
                result = result || ruleMatches(rule, target);
            } else {
                result = result && ruleMatches(rule, target);
            }
        }
        return result;
    }

    private boolean ruleMatches(FilterRuleSnapshot rule, FilterTarget target) {
        // 참조하던 필터가 삭제된 규칙
        if (rule.filter() == null) {
            return false;
        }
        return matchesTarget(rule.filter(), target);
    }

    private boolean matchesTarget(FilterDefinition filter, FilterTarget target) {
        TargetType type = TargetType.fromWireName(filter.targetType())
                .orElseThrow(() -> new FilterEvaluationException(
                        "알 수 없는 대상 타입: " + filter.targetType()));

        switch (type) {
            case TITLE:
                return patternMatcher.matches(filter, target.title());
            case CONTENT:
                return patternMatcher.matches(filter, target.content());
            case FEED_CATEGORY:
                return patternMatcher.matches(filter, target.category());
            case FEED_TAGS:
                for (String tag : target.tags()) {
                    if (patternMatcher.matches(filter, tag)) {
                        return true;
                    }
                }
                return false;
            default:
                throw new FilterEvaluationException("알 수 없는 대상 타입: " + filter.targetType());
        }
    }

    private record FilterTarget(String title, String content, String category, List<String> tags) {

        FilterTarget {
            tags = tags == null ? List.of() : tags;
        }

        static FilterTarget uniform(String text) {
            return new FilterTarget(text, text, text, text == null ? List.of() : List.of(text));
        }
    }
}
