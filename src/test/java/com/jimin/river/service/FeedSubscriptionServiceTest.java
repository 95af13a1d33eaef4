package com.jimin.river.service;

import com.jimin.river.config.RiverProperties;
import com.jimin.river.dto.FetchResult;
import com.jimin.river.dto.SaveOutcome;
import com.jimin.river.entity.Feed;
import com.jimin.river.exception.DuplicateFeedException;
import com.jimin.river.exception.FeedFetchException;
import com.jimin.river.exception.FeedNotFoundException;
import com.jimin.river.exception.FeedParseException;
import com.jimin.river.exception.FeedPersistenceException;
import com.jimin.river.exception.FeedValidationException;
import com.jimin.river.fetch.DestinationGuard;
import com.jimin.river.fetch.FeedFetcher;
import com.jimin.river.fetch.ValidatorCache;
import com.jimin.river.fetch.Validators;
import com.jimin.river.support.InMemoryFeedStore;
import com.jimin.river.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.InetAddress;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FeedSubscriptionServiceTest {

    @Mock
    private FeedFetcher feedFetcher;

    @Mock
    private EntryPersistenceService persistenceService;

    private InMemoryFeedStore store;
    private ValidatorCache validatorCache;
    private FeedSubscriptionService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryFeedStore();
        validatorCache = new ValidatorCache(new MutableClock(Instant.parse("2026-03-15T12:00:00Z")),
                RiverProperties.defaults());
        DestinationGuard guard = new DestinationGuard(host -> new InetAddress[]{
                InetAddress.getByAddress(host, new byte[]{93, (byte) 184, (byte) 216, 34})});
        service = new FeedSubscriptionService(store, feedFetcher, persistenceService, guard, validatorCache);
    }

    @Test
    void subscribeFetchesOnceAndSaves() {
        when(feedFetcher.fetch(any(), any())).thenAnswer(invocation -> {
            Feed feed = invocation.getArgument(0);
            feed.setTitle("Example Engineering");
            return FetchResult.fetched(feed, "Example Engineering", null, List.of(), Validators.NONE);
        });
        when(persistenceService.save(any())).thenReturn(SaveOutcome.metadataOnly(0));

        Feed feed = service.subscribe("  https://blog.example.com/rss  ", "tech", List.of("go"));

        assertEquals("https://blog.example.com/rss", feed.getUrl());
        assertEquals("tech", feed.getCategory());
        assertEquals(List.of("go"), feed.getTags());
        assertEquals("Example Engineering", feed.getTitle());
        assertTrue(store.findFeedByUrl("https://blog.example.com/rss").isPresent());
        verify(persistenceService).save(any());
    }

    @Test
    void duplicateUrlIsRejectedBeforeFetching() {
        store.addFeed("https://blog.example.com/rss");

        assertThrows(DuplicateFeedException.class,
                () -> service.subscribe("https://blog.example.com/rss", null, List.of()));
        verifyNoInteractions(feedFetcher);
    }

    @Test
    void failedFirstFetchRemovesTheFeed() {
        FeedParseException parseError = new FeedParseException("피드 형식이 아닙니다");
        when(feedFetcher.fetch(any(), any())).thenAnswer(invocation ->
                FetchResult.failed(invocation.getArgument(0), parseError));

        FeedParseException thrown = assertThrows(FeedParseException.class,
                () -> service.subscribe("https://blog.example.com/index.html", null, List.of()));

        assertSame(parseError, thrown);
        assertTrue(store.listFeeds().isEmpty());
        verify(persistenceService, never()).save(any());
    }

    @Test
    void initialSaveFailureKeepsTheSubscription() {
        when(feedFetcher.fetch(any(), any())).thenAnswer(invocation ->
                FetchResult.fetched(invocation.getArgument(0), "t", null, List.of(), Validators.NONE));
        when(persistenceService.save(any()))
                .thenThrow(new FeedPersistenceException("저장 실패", new IllegalStateException("locked")));

        Feed feed = service.subscribe("https://blog.example.com/rss", null, null);

        assertTrue(store.findFeed(feed.getId()).isPresent());
    }

    @Test
    void privateDestinationsAreRejected() {
        assertThrows(FeedValidationException.class,
                () -> service.subscribe("http://192.168.0.10/feed", null, List.of()));
        assertThrows(FeedValidationException.class,
                () -> service.subscribe("file:///etc/passwd", null, List.of()));
        assertThrows(FeedValidationException.class, () -> service.subscribe("   ", null, List.of()));
        verifyNoInteractions(feedFetcher);
    }

    @Test
    void unsubscribeRemovesFeedAndCachedValidators() {
        Feed feed = store.addFeed("https://blog.example.com/rss");
        validatorCache.put(feed.getId(), new Validators(null, "\"v1\""));

        service.unsubscribe(feed.getId());

        assertTrue(store.findFeed(feed.getId()).isEmpty());
        assertTrue(validatorCache.get(feed.getId()).isEmpty());
    }

    @Test
    void unsubscribeUnknownFeedFails() {
        assertThrows(FeedNotFoundException.class, () -> service.unsubscribe(404L));
    }

    @Test
    void fetchErrorIsRethrownUnchanged() {
        when(feedFetcher.fetch(any(), any())).thenAnswer(invocation ->
                FetchResult.failed(invocation.getArgument(0), new FeedFetchException("HTTP 404 응답", 404)));

        FeedFetchException thrown = assertThrows(FeedFetchException.class,
                () -> service.subscribe("https://blog.example.com/missing", null, List.of()));

        assertEquals(404, thrown.getStatusCode().getAsInt());
    }
}
