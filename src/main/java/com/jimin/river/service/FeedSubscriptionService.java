package com.jimin.river.service;

import com.jimin.river.dto.FetchResult;
import com.jimin.river.entity.Feed;
import com.jimin.river.exception.DuplicateFeedException;
import com.jimin.river.exception.FeedNotFoundException;
import com.jimin.river.exception.FeedPersistenceException;
import com.jimin.river.exception.FeedValidationException;
import com.jimin.river.fetch.DestinationGuard;
import com.jimin.river.fetch.FeedFetcher;
import com.jimin.river.fetch.UpdateContext;
import com.jimin.river.fetch.ValidatorCache;
import com.jimin.river.store.FeedStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;

/**
 * 피드 구독 / 구독 해지
 *
 * 구독:
 * 1. URL 검사 (scheme, SSRF) + 중복 확인
 * 2. 피드 생성 후 한 번 수집해서 실제 피드인지 확인 (실패 시 생성 취소)
 * 3. 첫 수집 결과 저장 (실패해도 구독은 유지, 로그만 남김)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeedSubscriptionService {

    private final FeedStore feedStore;
    private final FeedFetcher feedFetcher;
    private final EntryPersistenceService persistenceService;
    private final DestinationGuard destinationGuard;
    private final ValidatorCache validatorCache;

    /**
     * @throws FeedValidationException 잘못된 URL 또는 차단된 목적지
     * @throws DuplicateFeedException  이미 구독 중인 URL
     * @throws com.jimin.river.exception.FeedPipelineException 첫 수집 실패
     */
    public Feed subscribe(String url, String category, List<String> tags) {
        String normalized = url == null ? "" : url.trim();
        destinationGuard.check(toUri(normalized));

        if (feedStore.findFeedByUrl(normalized).isPresent()) {
            throw new DuplicateFeedException(normalized);
        }

        Feed feed = feedStore.createFeed(normalized, normalized, category, tags);
        FetchResult result = feedFetcher.fetch(feed, UpdateContext.create());
        if (result.failed()) {
            feedStore.deleteFeed(feed.getId());
            validatorCache.evict(feed.getId());
            log.warn("피드 구독 실패: {} - {}", normalized, result.error().getMessage());
            throw result.error();
        }

        try {
            persistenceService.save(result);
        } catch (FeedPersistenceException e) {
            log.error("구독 직후 첫 저장 실패 (다음 주기에 다시 수집): {} - {}", normalized, e.getMessage());
        }

        Feed subscribed = feedStore.findFeed(feed.getId()).orElse(feed);
        log.info("피드 구독: {} ({})", subscribed.getTitle(), normalized);
        return subscribed;
    }

    /**
     * 피드와 그 항목 전체 삭제
     */
    public void unsubscribe(Long feedId) {
        if (!feedStore.deleteFeed(feedId)) {
            throw new FeedNotFoundException(feedId);
        }
        validatorCache.evict(feedId);
        log.info("피드 구독 해지: ID {}", feedId);
    }

    private static URI toUri(String url) {
        if (url.isEmpty()) {
            throw new FeedValidationException("피드 URL이 비어 있습니다");
        }
        try {
            return new URI(url);
        } catch (URISyntaxException e) {
            throw new FeedValidationException("잘못된 피드 URL입니다: " + url, e);
        }
    }
}
