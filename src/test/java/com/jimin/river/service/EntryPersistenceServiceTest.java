package com.jimin.river.service;

import com.jimin.river.config.RiverProperties;
import com.jimin.river.config.RuntimeSettings;
import com.jimin.river.dto.EntryCandidate;
import com.jimin.river.dto.FetchResult;
import com.jimin.river.dto.SaveOutcome;
import com.jimin.river.entity.Feed;
import com.jimin.river.entity.FeedEntry;
import com.jimin.river.entity.FeedStatus;
import com.jimin.river.exception.FeedPersistenceException;
import com.jimin.river.fetch.Validators;
import com.jimin.river.filter.FilterAction;
import com.jimin.river.filter.FilterEngine;
import com.jimin.river.filter.PatternMatcher;
import com.jimin.river.store.UpsertCounts;
import com.jimin.river.support.InMemoryFeedStore;
import com.jimin.river.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

import static com.jimin.river.support.FilterFixtures.first;
import static com.jimin.river.support.FilterFixtures.group;
import static com.jimin.river.support.FilterFixtures.or;
import static com.jimin.river.support.FilterFixtures.titleKeyword;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class EntryPersistenceServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 15, 12, 0);

    private InMemoryFeedStore store;
    private PlatformTransactionManager transactionManager;
    private EntryPersistenceService service;
    private Feed feed;

    @BeforeEach
    void setUp() {
        store = new InMemoryFeedStore();
        transactionManager = mock(PlatformTransactionManager.class);
        service = serviceOver(store);
        feed = store.addFeed("https://blog.example.com/rss");
        feed.setStatus(FeedStatus.ERROR);
        feed.setErrorCount(3);
        feed.setLastError("HTTP 500");
    }

    @Test
    void savesSurvivorsAndRefreshesFeedMetadata() {
        SaveOutcome outcome = service.save(fetched(
                entry("Learning Go Programming", "https://blog.example.com/go", 10),
                entry("Rust Guide", "https://blog.example.com/rust", 11)));

        assertEquals(2, outcome.inserted());
        assertEquals(0, outcome.filtered());
        assertEquals(2, store.countEntries(feed.getId()));
        assertEquals("Example Engineering", feed.getTitle());
        assertEquals("\"v2\"", feed.getEtag());
        assertEquals(NOW, feed.getLastFetched());
        assertEquals(FeedStatus.ACTIVE, feed.getStatus());
        assertEquals(0, feed.getErrorCount());
        assertNull(feed.getLastError());
    }

    @Test
    void whitelistDropsEntriesThatNoKeepGroupMatches() {
        store.setFilterGroups(List.of(group("langs", FilterAction.KEEP,
                first(titleKeyword("Go")), or(titleKeyword("Rust")))));

        SaveOutcome outcome = service.save(fetched(
                entry("Learning Go Programming", "https://blog.example.com/go", 10),
                entry("Rust Guide", "https://blog.example.com/rust", 11),
                entry("Python Tutorial", "https://blog.example.com/python", 9)));

        assertEquals(2, outcome.inserted());
        assertEquals(1, outcome.filtered());
        assertEquals(List.of("https://blog.example.com/go", "https://blog.example.com/rust"),
                store.listEntries(feed.getId()).stream().map(FeedEntry::getUrl).sorted().collect(Collectors.toList()));
    }

    @Test
    void allEntriesDiscardedStillUpdatesMetadata() {
        store.setFilterGroups(List.of(group("no ads", FilterAction.DISCARD, first(titleKeyword("Sponsored")))));

        SaveOutcome outcome = service.save(fetched(
                entry("Sponsored: buy now", "https://blog.example.com/ad1", 10),
                entry("Sponsored again", "https://blog.example.com/ad2", 11)));

        assertEquals(SaveOutcome.metadataOnly(2), outcome);
        assertEquals(0, store.countEntries(feed.getId()));
        assertEquals(NOW, feed.getLastFetched());
        assertEquals(FeedStatus.ACTIVE, feed.getStatus());
    }

    @Test
    void filterEvaluationFailureKeepsEntries() {
        store.failFilterGroupReads(new IllegalStateException("db down"));

        SaveOutcome outcome = service.save(fetched(
                entry("Sponsored: buy now", "https://blog.example.com/ad1", 10)));

        assertEquals(1, outcome.inserted());
        assertEquals(0, outcome.filtered());
    }

    @Test
    void notModifiedOnlyTouchesMetadata() {
        feed.setEtag("\"old\"");

        SaveOutcome outcome = service.save(FetchResult.notModified(feed, new Validators(null, "\"v3\"")));

        assertEquals(0, outcome.saved());
        assertEquals("\"v3\"", feed.getEtag());
        assertEquals(NOW, feed.getLastFetched());
        assertEquals("https://blog.example.com/rss", feed.getTitle());
    }

    @Test
    void trimsToMaxPosts() {
        store.putSetting(RuntimeSettings.MAX_POSTS, "2", RuntimeSettings.TYPE_INT);

        SaveOutcome outcome = service.save(fetched(
                entry("one", "https://blog.example.com/1", 1),
                entry("two", "https://blog.example.com/2", 2),
                entry("three", "https://blog.example.com/3", 3)));

        assertEquals(3, outcome.inserted());
        assertEquals(1, outcome.trimmed());
        assertEquals(List.of("https://blog.example.com/2", "https://blog.example.com/3"),
                store.listEntries(feed.getId()).stream().map(FeedEntry::getUrl).sorted().collect(Collectors.toList()));
    }

    @Test
    void invalidMaxPostsFallsBackToDefault() {
        store.putSetting(RuntimeSettings.MAX_POSTS, "0", RuntimeSettings.TYPE_INT);
        assertEquals(100, service.maxPosts());

        store.putSetting(RuntimeSettings.MAX_POSTS, "many", RuntimeSettings.TYPE_INT);
        assertEquals(100, service.maxPosts());

        store.putSetting(RuntimeSettings.MAX_POSTS, "25", RuntimeSettings.TYPE_INT);
        assertEquals(25, service.maxPosts());
    }

    @Test
    void storeFailureRollsBackAndIsWrapped() {
        InMemoryFeedStore failing = new InMemoryFeedStore() {
            @Override
            public synchronized UpsertCounts upsertEntries(Long feedId, List<EntryCandidate> entries) {
                throw new IllegalStateException("value too long");
            }
        };
        Feed target = failing.addFeed("https://broken.example.com/rss");

        FeedPersistenceException error = assertThrows(FeedPersistenceException.class,
                () -> serviceOver(failing).save(FetchResult.fetched(target, "t", null,
                        List.of(entry("x", "https://broken.example.com/x", 1)), Validators.NONE)));

        assertEquals(IllegalStateException.class, error.getCause().getClass());
        verify(transactionManager).rollback(any());
    }

    private EntryPersistenceService serviceOver(InMemoryFeedStore target) {
        MutableClock clock = new MutableClock(Instant.parse("2026-03-15T12:00:00.750Z"));
        FilterEngine engine = new FilterEngine(target, new PatternMatcher(), clock, RiverProperties.defaults());
        return new EntryPersistenceService(target, engine, new TransactionTemplate(transactionManager),
                clock, RiverProperties.defaults());
    }

    private FetchResult fetched(EntryCandidate... entries) {
        return FetchResult.fetched(feed, "Example Engineering", "https://blog.example.com/",
                List.of(entries), new Validators("Sun, 15 Mar 2026 11:00:00 GMT", "\"v2\""));
    }

    private static EntryCandidate entry(String title, String url, int day) {
        return new EntryCandidate(title, url, null, null, LocalDateTime.of(2026, 3, day, 9, 0),
                "/static/favicons/default.ico");
    }
}
