package com.jimin.river.fetch;

import com.jimin.river.exception.FeedFetchException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UpdateContextTest {

    @Test
    void cancelAbortsPendingAwait() {
        UpdateContext context = UpdateContext.create();
        CompletableFuture<String> never = new CompletableFuture<>();
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            scheduler.schedule(context::cancel, 100, TimeUnit.MILLISECONDS);

            assertThrows(FeedFetchException.class, () -> context.await(never));
            assertTrue(never.isCancelled());
            assertEquals(0, context.inFlightCount());
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    void awaitAfterCancelFailsImmediately() {
        UpdateContext context = UpdateContext.create();
        context.cancel();

        assertThrows(FeedFetchException.class, () -> context.await(new CompletableFuture<>()));
    }

    @Test
    void translatesIoFailures() {
        UpdateContext context = UpdateContext.create();

        FeedFetchException timeout = assertThrows(FeedFetchException.class,
                () -> context.await(CompletableFuture.failedFuture(new HttpTimeoutException("request timed out"))));
        assertTrue(timeout.getMessage().contains("시간 초과"));

        FeedFetchException overall = assertThrows(FeedFetchException.class,
                () -> context.await(new CompletableFuture<String>().orTimeout(50, TimeUnit.MILLISECONDS)));
        assertTrue(overall.getMessage().contains("시간 초과"));

        assertThrows(FeedFetchException.class,
                () -> context.await(CompletableFuture.failedFuture(new IOException("connection reset"))));
        assertEquals("ok", context.await(CompletableFuture.completedFuture("ok")));
    }
}
