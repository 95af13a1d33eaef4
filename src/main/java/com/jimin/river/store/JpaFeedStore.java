package com.jimin.river.store;

import com.jimin.river.dto.EntryCandidate;
import com.jimin.river.entity.AppSetting;
import com.jimin.river.entity.EntryFilter;
import com.jimin.river.entity.Feed;
import com.jimin.river.entity.FeedEntry;
import com.jimin.river.entity.FeedStatus;
import com.jimin.river.entity.FilterGroup;
import com.jimin.river.entity.FilterGroupRule;
import com.jimin.river.exception.FeedNotFoundException;
import com.jimin.river.exception.FilterConfigNotFoundException;
import com.jimin.river.fetch.Validators;
import com.jimin.river.filter.FilterDefinition;
import com.jimin.river.filter.FilterGroupSnapshot;
import com.jimin.river.repository.AppSettingRepository;
import com.jimin.river.repository.EntryFilterRepository;
import com.jimin.river.repository.FeedEntryRepository;
import com.jimin.river.repository.FeedRepository;
import com.jimin.river.repository.FilterGroupRepository;
import com.jimin.river.repository.FilterGroupRuleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * FeedStore의 Spring Data JPA 구현
 *
 * 메서드 하나가 트랜잭션 하나.
 * EntryPersistenceService가 바깥 트랜잭션을 열면 그 트랜잭션에 참여한다 (피드 단위 롤백).
 */
@Slf4j
@Repository
@RequiredArgsConstructor
@Transactional
public class JpaFeedStore implements FeedStore {

    static final int MAX_ERROR_LENGTH = 1000;
    static final int MAX_TITLE_LENGTH = 1000;
    static final int MAX_URL_LENGTH = 700;
    static final int MAX_GUID_LENGTH = 1000;
    static final int MAX_FAVICON_URL_LENGTH = 500;

    private final FeedRepository feedRepository;
    private final FeedEntryRepository entryRepository;
    private final EntryFilterRepository filterRepository;
    private final FilterGroupRepository groupRepository;
    private final FilterGroupRuleRepository ruleRepository;
    private final AppSettingRepository settingRepository;

    @Override
    @Transactional(readOnly = true)
    public List<Feed> listFeeds() {
        return feedRepository.findAllByOrderByIdAsc();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<LocalDateTime> getEntryWatermark(Long feedId) {
        return Optional.ofNullable(entryRepository.findLatestPublishedAt(feedId));
    }

    @Override
    public UpsertCounts upsertEntries(Long feedId, List<EntryCandidate> entries) {
        Feed feed = feedRepository.findById(feedId)
                .orElseThrow(() -> new FeedNotFoundException(feedId));

        int inserted = 0;
        int updated = 0;
        int skipped = 0;
        for (EntryCandidate candidate : entries) {
            if (candidate.url() == null || candidate.url().isBlank()) {
                skipped++;
                continue;
            }
            // url은 unique 키라 자를 수 없음 → 컬럼보다 길면 건너뜀
            if (candidate.url().length() > MAX_URL_LENGTH) {
                log.warn("URL이 {}자를 넘어 항목을 건너뜁니다. 피드 ID: {}, URL: {}...",
                        MAX_URL_LENGTH, feedId, candidate.url().substring(0, 100));
                skipped++;
                continue;
            }

            Optional<FeedEntry> existing = entryRepository.findByUrl(candidate.url());
            if (existing.isEmpty()) {
                FeedEntry entry = new FeedEntry();
                entry.setFeed(feed);
                entry.setUrl(candidate.url());
                apply(entry, candidate);
                entryRepository.save(entry);
                inserted++;
                continue;
            }

            // 같은 url: incoming이 더 최신일 때만 갱신
            FeedEntry entry = existing.get();
            if (candidate.publishedAt() != null && candidate.publishedAt().isAfter(entry.getPublishedAt())) {
                apply(entry, candidate);
                updated++;
            } else {
                skipped++;
            }
        }
        return new UpsertCounts(inserted, updated, skipped);
    }

    @Override
    public int trimEntries(Long feedId, int keep) {
        List<Long> ids = entryRepository.findIdsByFeedIdNewestFirst(feedId);
        if (ids.size() <= keep) {
            return 0;
        }
        List<Long> expired = new ArrayList<>(ids.subList(Math.max(keep, 0), ids.size()));
        entryRepository.deleteAllByIdInBatch(expired);
        return expired.size();
    }

    @Override
    public void updateFeedMeta(FeedMetaUpdate update) {
        Feed feed = feedRepository.findById(update.feedId())
                .orElseThrow(() -> new FeedNotFoundException(update.feedId()));

        if (update.title() != null && !update.title().isBlank() && !feed.isTitleManuallyEdited()) {
            feed.setTitle(update.title());
        }
        Validators validators = update.validators();
        if (validators.lastModified() != null) {
            feed.setLastModified(validators.lastModified());
        }
        if (validators.etag() != null) {
            feed.setEtag(validators.etag());
        }
        feed.setLastFetched(update.fetchedAt());
        feed.setStatus(FeedStatus.ACTIVE);
        feed.setErrorCount(0);
        feed.setLastError(null);
    }

    @Override
    public void recordFeedError(Long feedId, String message) {
        int updated = feedRepository.recordError(feedId, FeedStatus.ERROR, truncate(message));
        if (updated == 0) {
            log.warn("오류를 기록할 피드가 없습니다. ID: {}", feedId);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<FilterGroupSnapshot> getActiveFilterGroups() {
        List<FilterGroup> groups = groupRepository.findByActiveTrueOrderByPriorityAscNameAsc();

        Set<Long> filterIds = new HashSet<>();
        for (FilterGroup group : groups) {
            for (FilterGroupRule rule : group.getRules()) {
                filterIds.add(rule.getFilterId());
            }
        }
        Map<Long, FilterDefinition> filters = filterRepository.findAllById(filterIds).stream()
                .map(FilterDefinition::from)
                .collect(Collectors.toMap(FilterDefinition::id, Function.identity()));

        List<FilterGroupSnapshot> snapshots = new ArrayList<>(groups.size());
        for (FilterGroup group : groups) {
            snapshots.add(FilterGroupSnapshot.from(group, filters));
        }
        return snapshots;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<String> getSetting(String key) {
        return settingRepository.findById(key).map(AppSetting::getValue);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Feed> findFeed(Long feedId) {
        return feedRepository.findById(feedId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Feed> findFeedByUrl(String url) {
        return feedRepository.findByUrl(url);
    }

    @Override
    public Feed createFeed(String url, String title, String category, List<String> tags) {
        Feed feed = new Feed(url, title);
        feed.setCategory(category);
        if (tags != null) {
            feed.setTags(new ArrayList<>(tags));
        }
        return feedRepository.save(feed);
    }

    @Override
    public boolean deleteFeed(Long feedId) {
        if (!feedRepository.existsById(feedId)) {
            return false;
        }
        int entries = entryRepository.deleteAllByFeedId(feedId);
        feedRepository.deleteById(feedId);
        log.debug("피드 삭제: ID {} (항목 {}건)", feedId, entries);
        return true;
    }

    @Override
    @Transactional(readOnly = true)
    public long countEntries(Long feedId) {
        return entryRepository.countByFeedId(feedId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<FeedEntry> listEntries(Long feedId) {
        return entryRepository.findByFeedIdOrderByPublishedAtDesc(feedId);
    }

    @Override
    public void putSetting(String key, String value, String type) {
        AppSetting setting = settingRepository.findById(key)
                .orElseGet(() -> new AppSetting(key, null, null, null));
        setting.setValue(value);
        setting.setType(type);
        settingRepository.save(setting);
    }

    @Override
    public EntryFilter saveFilter(EntryFilter filter) {
        return filterRepository.save(filter);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<EntryFilter> findFilter(Long filterId) {
        return filterRepository.findById(filterId);
    }

    @Override
    public boolean deleteFilter(Long filterId) {
        if (!filterRepository.existsById(filterId)) {
            return false;
        }
        ruleRepository.deleteAllByFilterId(filterId);
        filterRepository.deleteById(filterId);
        return true;
    }

    @Override
    public FilterGroup saveGroup(FilterGroup group) {
        return groupRepository.save(group);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<FilterGroup> findGroup(Long groupId) {
        return groupRepository.findWithRulesById(groupId);
    }

    @Override
    public boolean deleteGroup(Long groupId) {
        Optional<FilterGroup> group = groupRepository.findById(groupId);
        if (group.isEmpty()) {
            return false;
        }
        // rules는 cascade + orphanRemoval로 함께 삭제
        groupRepository.delete(group.get());
        return true;
    }

    @Override
    public FilterGroup replaceGroupRules(Long groupId, List<RuleSpec> rules) {
        FilterGroup group = groupRepository.findWithRulesById(groupId)
                .orElseThrow(() -> new FilterConfigNotFoundException("필터 그룹", groupId));

        group.getRules().clear();
        rules.stream()
                .sorted(Comparator.comparingInt(RuleSpec::position))
                .forEach(rule -> group.addRule(rule.filterId(), rule.operator(), rule.position()));
        return groupRepository.save(group);
    }

    // 긴 필드는 컬럼 길이에 맞춰 자른다
    private static void apply(FeedEntry entry, EntryCandidate candidate) {
        entry.setTitle(candidate.title() == null ? "" : truncate(candidate.title(), MAX_TITLE_LENGTH));
        entry.setContent(candidate.content());
        entry.setGuid(truncate(candidate.guid(), MAX_GUID_LENGTH));
        entry.setPublishedAt(candidate.publishedAt());
        entry.setFaviconUrl(truncate(candidate.faviconUrl(), MAX_FAVICON_URL_LENGTH));
    }

    private static String truncate(String message) {
        return truncate(message, MAX_ERROR_LENGTH);
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
