package com.jimin.river.service;

import com.jimin.river.config.RiverProperties;
import com.jimin.river.config.RuntimeSettings;
import com.jimin.river.dto.EntryCandidate;
import com.jimin.river.dto.FetchResult;
import com.jimin.river.dto.SaveOutcome;
import com.jimin.river.entity.Feed;
import com.jimin.river.exception.FeedPersistenceException;
import com.jimin.river.exception.FilterEvaluationException;
import com.jimin.river.filter.FilterDecision;
import com.jimin.river.filter.FilterEngine;
import com.jimin.river.store.FeedMetaUpdate;
import com.jimin.river.store.FeedStore;
import com.jimin.river.store.UpsertCounts;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * EntryPersistenceService - 수집 결과 저장
 *
 * 동작 방식:
 * 1. 필터 평가 (트랜잭션 밖) → discard 항목은 저장하지 않음, 평가 오류는 유지
 * 2. 한 트랜잭션 안에서
 *    - 피드 메타데이터 갱신 (lastFetched, 검증자, 제목, 상태 ACTIVE)
 *    - 항목 upsert (url 기준, 더 최신일 때만 갱신)
 *    - max_posts 개수만 남기고 오래된 항목 삭제
 * 3. 실패 시 이 피드의 변경만 롤백 → FeedPersistenceException
 *
 * 통과한 항목이 없어도 메타데이터는 갱신한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EntryPersistenceService {

    private final FeedStore feedStore;
    private final FilterEngine filterEngine;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final RiverProperties properties;

    /**
     * @throws FeedPersistenceException 저장 트랜잭션 실패 (롤백됨)
     */
    public SaveOutcome save(FetchResult result) {
        Feed feed = result.feed();

        List<EntryCandidate> survivors = new ArrayList<>();
        for (EntryCandidate entry : result.entries()) {
            if (shouldKeep(entry, feed)) {
                survivors.add(entry);
            }
        }
        int filtered = result.entries().size() - survivors.size();
        if (filtered > 0) {
            log.info("필터로 제외: {} - {}건", feed.getUrl(), filtered);
        }

        FeedMetaUpdate meta = new FeedMetaUpdate(feed.getId(), result.feedTitle(), result.validators(),
                LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS));
        try {
            int maxPosts = maxPosts();
            SaveOutcome outcome = transactionTemplate.execute(status -> {
                feedStore.updateFeedMeta(meta);
                if (survivors.isEmpty()) {
                    return SaveOutcome.metadataOnly(filtered);
                }
                UpsertCounts counts = feedStore.upsertEntries(feed.getId(), survivors);
                int trimmed = feedStore.trimEntries(feed.getId(), maxPosts);
                return new SaveOutcome(counts.inserted(), counts.updated(), filtered, trimmed);
            });
            if (outcome.saved() > 0 || outcome.trimmed() > 0) {
                log.info("저장 완료: {} - 신규 {}건, 갱신 {}건, 정리 {}건",
                        feed.getUrl(), outcome.inserted(), outcome.updated(), outcome.trimmed());
            }
            return outcome;
        } catch (RuntimeException e) {
            throw new FeedPersistenceException("저장 실패: " + feed.getUrl() + " - " + e.getMessage(), e);
        }
    }

    /**
     * settings.max_posts, 없거나 1 미만이면 river.retention.default-max-posts
     */
    int maxPosts() {
        return RuntimeSettings.intValue(RuntimeSettings.MAX_POSTS, feedStore.getSetting(RuntimeSettings.MAX_POSTS))
                .filter(value -> value >= 1)
                .orElse(properties.retention().defaultMaxPosts());
    }

    private boolean shouldKeep(EntryCandidate entry, Feed feed) {
        try {
            FilterDecision decision = filterEngine.filterEntry(entry, feed.getCategory(), feed.getTags());
            if (decision == FilterDecision.DISCARD) {
                log.debug("필터 제외 항목: {} ({})", entry.title(), entry.url());
                return false;
            }
            return true;
        } catch (FilterEvaluationException e) {
            log.warn("필터 평가 오류로 항목 유지: {} - {}", entry.url(), e.getMessage());
            return true;
        }
    }
}
