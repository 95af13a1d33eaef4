package com.jimin.river.service;

import com.jimin.river.config.RuntimeSettings;
import com.jimin.river.dto.FetchResult;
import com.jimin.river.dto.SaveOutcome;
import com.jimin.river.dto.UpdateSummary;
import com.jimin.river.entity.Feed;
import com.jimin.river.entity.FeedStatus;
import com.jimin.river.exception.FeedFetchException;
import com.jimin.river.exception.FeedPersistenceException;
import com.jimin.river.fetch.FeedFetcher;
import com.jimin.river.fetch.UpdateContext;
import com.jimin.river.fetch.Validators;
import com.jimin.river.store.FeedStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * FeedUpdateService - 전체 피드 수집 주기 1회 실행
 *
 * 동작 방식:
 * 1. 피드 목록 조회 (DISABLED 제외)
 * 2. 배정 스레드가 Semaphore 슬롯을 얻을 때마다 피드 1개를 수집 스레드 풀에 제출
 * 3. 수집 결과는 큐로 전달되고, 호출 스레드가 먼저 끝난 순서대로 저장
 * 4. 모든 수집 작업이 끝나면 종료 표시를 큐에 넣어 소비 루프를 끝냄
 *
 * 피드 하나의 실패는 기록(status=ERROR)만 하고 주기를 중단하지 않는다.
 * 취소되면 더 이상 배정하지 않고, 이후 도착한 결과는 저장하지 않는다.
 */
@Slf4j
@Service
public class FeedUpdateService {

    static final int MIN_CONCURRENCY = 1;
    static final int MAX_CONCURRENCY = 128;

    private static final long ACQUIRE_POLL_MILLIS = 100;

    // 소비 루프 종료 표시 (참조 비교)
    private static final FetchResult END_OF_RESULTS =
            new FetchResult(null, null, null, List.of(), Validators.NONE, false, null);

    private final FeedStore feedStore;
    private final FeedFetcher feedFetcher;
    private final EntryPersistenceService persistenceService;
    private final Executor executor;

    public FeedUpdateService(FeedStore feedStore, FeedFetcher feedFetcher,
                             EntryPersistenceService persistenceService,
                             @Qualifier("feedFetchExecutor") Executor executor) {
        this.feedStore = feedStore;
        this.feedFetcher = feedFetcher;
        this.persistenceService = persistenceService;
        this.executor = executor;
    }

    public UpdateSummary updateFeeds(UpdateContext context) {
        List<Feed> feeds = feedStore.listFeeds().stream()
                .filter(feed -> feed.getStatus() != FeedStatus.DISABLED)
                .collect(Collectors.toList());
        int concurrency = concurrencyLimit();
        log.info("피드 업데이트 시작: {}개 피드, 동시 수집 {}개", feeds.size(), concurrency);

        if (feeds.isEmpty()) {
            return new UpdateSummary(0, 0, 0, 0, 0, 0, 0, context.isCancelled());
        }

        Semaphore slots = new Semaphore(concurrency);
        // 피드마다 결과는 최대 1개 + 종료 표시 → 생산자는 막히지 않는다
        BlockingQueue<FetchResult> results = new ArrayBlockingQueue<>(feeds.size() + 1);
        AtomicInteger dispatched = new AtomicInteger();

        // 배정은 별도 스레드, 저장은 이 스레드에서 하나씩 → DB 쓰기는 직렬
        CompletableFuture.runAsync(() -> dispatch(feeds, slots, results, dispatched, context), executor);

        int succeeded = 0;
        int notModified = 0;
        int failed = 0;
        int saved = 0;
        int filtered = 0;

        while (true) {
            FetchResult result;
            try {
                result = results.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                context.cancel();
                log.warn("피드 업데이트 대기 중 인터럽트 - 주기를 취소합니다");
                break;
            }
            if (result == END_OF_RESULTS) {
                break;
            }
            // 취소 뒤에는 큐만 비우고 종료 표시까지 기다린다
            if (context.isCancelled()) {
                log.debug("취소 이후 도착한 결과는 저장하지 않음: {}", result.feed().getUrl());
                continue;
            }

            // 수집 실패는 저장 없이 오류만 기록
            if (result.failed()) {
                failed++;
                recordFailure(result);
                continue;
            }

            try {
                SaveOutcome outcome = persistenceService.save(result);
                succeeded++;
                if (result.notModified()) {
                    notModified++;
                }
                saved += outcome.saved();
                filtered += outcome.filtered();
            } catch (FeedPersistenceException e) {
                // 이 피드만 롤백, 다음 결과는 계속 처리
                failed++;
                log.error("피드 저장 실패 (롤백됨): {} - {}", result.feed().getUrl(), e.getMessage());
            }
        }

        UpdateSummary summary = new UpdateSummary(feeds.size(), dispatched.get(), succeeded, notModified,
                failed, saved, filtered, context.isCancelled());
        log.info("피드 업데이트 완료: 성공 {} (변경 없음 {}), 실패 {}, 저장 {}건, 필터 제외 {}건{}",
                succeeded, notModified, failed, saved, filtered, summary.cancelled() ? " [취소됨]" : "");
        return summary;
    }

    /**
     * settings.feed_concurrency를 [1, 128]로 제한, 없거나 잘못된 값이면 CPU 기준 기본값
     */
    public int concurrencyLimit() {
        return RuntimeSettings.intValue(RuntimeSettings.FEED_CONCURRENCY,
                        feedStore.getSetting(RuntimeSettings.FEED_CONCURRENCY))
                .map(value -> clamp(value, MIN_CONCURRENCY, MAX_CONCURRENCY))
                .orElseGet(() -> defaultConcurrency(Runtime.getRuntime().availableProcessors()));
    }

    /**
     * CPU 코어 수 × 4, [4, 32]
     */
    static int defaultConcurrency(int cpus) {
        return clamp(cpus * 4, 4, 32);
    }

    private void dispatch(List<Feed> feeds, Semaphore slots, BlockingQueue<FetchResult> results,
                          AtomicInteger dispatched, UpdateContext context) {
        List<CompletableFuture<Void>> tasks = new ArrayList<>();
        try {
            for (Feed feed : feeds) {
                if (!acquire(slots, context)) {
                    log.info("피드 업데이트 취소 - 남은 {}개 피드는 수집하지 않음", feeds.size() - dispatched.get());
                    break;
                }
                dispatched.incrementAndGet();
                // 슬롯은 fetchOne의 finally에서 반납
                try {
                    tasks.add(CompletableFuture.runAsync(() -> fetchOne(feed, slots, results, context), executor));
                } catch (RejectedExecutionException e) {
                    slots.release();
                    results.add(FetchResult.failed(feed, new FeedFetchException("수집 작업을 시작할 수 없습니다", e)));
                }
            }
        } finally {
            // 시작된 수집이 모두 끝난 뒤에만 종료 표시
            CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0]))
                    .whenComplete((ignored, error) -> results.add(END_OF_RESULTS));
        }
    }

    private void fetchOne(Feed feed, Semaphore slots, BlockingQueue<FetchResult> results, UpdateContext context) {
        try {
            results.add(feedFetcher.fetch(feed, context));
        } catch (RuntimeException e) {
            log.error("피드 수집 중 예상하지 못한 오류: {}", feed.getUrl(), e);
            results.add(FetchResult.failed(feed, new FeedFetchException("예상하지 못한 오류: " + e.getMessage(), e)));
        } finally {
            slots.release();
        }
    }

    // 짧게 나눠 기다려야 취소를 바로 확인할 수 있다
    private boolean acquire(Semaphore slots, UpdateContext context) {
        while (!context.isCancelled()) {
            try {
                if (slots.tryAcquire(ACQUIRE_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                    // 기다리는 사이 취소됨
                    if (context.isCancelled()) {
                        slots.release();
                        return false;
                    }
                    return true;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return false;
    }

    private void recordFailure(FetchResult result) {
        Feed feed = result.feed();
        log.warn("피드 수집 실패: {} [{}] - {}", feed.getUrl(), result.error().kind(), result.error().getMessage());
        try {
            feedStore.recordFeedError(feed.getId(), result.error().getMessage());
        } catch (RuntimeException e) {
            log.error("피드 오류 기록 실패: {}", feed.getUrl(), e);
        }
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
