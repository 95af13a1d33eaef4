package com.jimin.river.scheduler;

import com.jimin.river.config.RiverProperties;
import com.jimin.river.config.RuntimeSettings;
import com.jimin.river.fetch.UpdateContext;
import com.jimin.river.service.FeedUpdateService;
import com.jimin.river.support.InMemoryFeedStore;
import com.jimin.river.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.support.SimpleTriggerContext;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FeedUpdateJobTest {

    private static final Instant NOW = Instant.parse("2026-03-15T12:00:00Z");

    @Mock
    private FeedUpdateService updateService;

    private InMemoryFeedStore store;
    private FeedUpdateJob job;

    @BeforeEach
    void setUp() {
        store = new InMemoryFeedStore();
        job = new FeedUpdateJob(updateService, store, new MutableClock(NOW), RiverProperties.defaults());
    }

    @Test
    void firstCycleRunsImmediately() {
        assertEquals(NOW, job.nextExecution(new SimpleTriggerContext()));
    }

    @Test
    void nextCycleStartsIntervalAfterPreviousCompletion() {
        Instant finished = NOW.plusSeconds(42);
        store.putSetting(RuntimeSettings.UPDATE_INTERVAL, "300", RuntimeSettings.TYPE_INT);

        assertEquals(finished.plusSeconds(300),
                job.nextExecution(new SimpleTriggerContext(NOW, NOW, finished)));
    }

    @Test
    void intervalIsReadEachTimeWithDefaultAndFloor() {
        assertEquals(Duration.ofSeconds(900), job.updateInterval());

        store.putSetting(RuntimeSettings.UPDATE_INTERVAL, "5", RuntimeSettings.TYPE_INT);
        assertEquals(Duration.ofSeconds(60), job.updateInterval());

        store.putSetting(RuntimeSettings.UPDATE_INTERVAL, "soon", RuntimeSettings.TYPE_INT);
        assertEquals(Duration.ofSeconds(900), job.updateInterval());

        store.putSetting(RuntimeSettings.UPDATE_INTERVAL, "1800", RuntimeSettings.TYPE_INT);
        assertEquals(Duration.ofSeconds(1800), job.updateInterval());
    }

    @Test
    void failedCycleDoesNotStopTheSchedule() {
        when(updateService.updateFeeds(any())).thenThrow(new IllegalStateException("db down"));

        assertDoesNotThrow(job::runCycle);
        verify(updateService).updateFeeds(any());
    }

    @Test
    void shutdownCancelsRunningCycle() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        AtomicReference<UpdateContext> context = new AtomicReference<>();
        when(updateService.updateFeeds(any())).thenAnswer(invocation -> {
            UpdateContext running = invocation.getArgument(0);
            context.set(running);
            started.countDown();
            while (!running.isCancelled()) {
                Thread.sleep(10);
            }
            return null;
        });

        CompletableFuture<Void> cycle = CompletableFuture.runAsync(job::runCycle);
        assertTrue(started.await(5, TimeUnit.SECONDS));
        job.cancelRunningCycle();
        cycle.get(5, TimeUnit.SECONDS);

        assertTrue(context.get().isCancelled());
    }
}
