package com.jimin.river.store;

import com.jimin.river.dto.EntryCandidate;
import com.jimin.river.entity.EntryFilter;
import com.jimin.river.entity.Feed;
import com.jimin.river.entity.FeedEntry;
import com.jimin.river.entity.FilterGroup;
import com.jimin.river.filter.FilterGroupSnapshot;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 수집 파이프라인이 사용하는 저장소
 *
 * 운영: JpaFeedStore (MySQL), 단위 테스트: 메모리 구현
 * 구현체는 여러 수집 스레드에서 동시에 호출된다.
 */
public interface FeedStore {

    // ===== 수집 파이프라인 =====

    List<Feed> listFeeds();

    /**
     * 이미 저장된 항목 중 가장 최신 publishedAt
     */
    Optional<LocalDateTime> getEntryWatermark(Long feedId);

    /**
     * url 기준 upsert. 충돌 시 incoming publishedAt이 더 최신일 때만 갱신한다.
     */
    UpsertCounts upsertEntries(Long feedId, List<EntryCandidate> entries);

    /**
     * publishedAt 최신순으로 keep개만 남기고 삭제
     *
     * @return 삭제된 항목 수
     */
    int trimEntries(Long feedId, int keep);

    void updateFeedMeta(FeedMetaUpdate update);

    /**
     * status=ERROR, errorCount+1, lastError 기록
     */
    void recordFeedError(Long feedId, String message);

    /**
     * 활성 그룹 (priority, name 순) + 규칙에 연결된 필터
     */
    List<FilterGroupSnapshot> getActiveFilterGroups();

    Optional<String> getSetting(String key);

    // ===== 구독 / 설정 관리 =====

    Optional<Feed> findFeed(Long feedId);

    Optional<Feed> findFeedByUrl(String url);

    Feed createFeed(String url, String title, String category, List<String> tags);

    /**
     * 피드와 그 항목 전체 삭제
     *
     * @return 피드가 존재했으면 true
     */
    boolean deleteFeed(Long feedId);

    long countEntries(Long feedId);

    List<FeedEntry> listEntries(Long feedId);

    void putSetting(String key, String value, String type);

    EntryFilter saveFilter(EntryFilter filter);

    Optional<EntryFilter> findFilter(Long filterId);

    /**
     * 필터와 그 필터를 참조하는 규칙 삭제
     */
    boolean deleteFilter(Long filterId);

    FilterGroup saveGroup(FilterGroup group);

    Optional<FilterGroup> findGroup(Long groupId);

    boolean deleteGroup(Long groupId);

    /**
     * 그룹의 규칙 전체 교체
     */
    FilterGroup replaceGroupRules(Long groupId, List<RuleSpec> rules);

    record RuleSpec(Long filterId, String operator, int position) {
    }
}
