package com.jimin.river.fetch;

import com.jimin.river.exception.FeedFetchException;
import com.jimin.river.exception.FeedPipelineException;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 수집 주기 1회의 취소 신호
 *
 * cancel() 이후:
 * - 스케줄러는 더 이상 피드를 배정하지 않음
 * - 진행 중인 HTTP 요청(await로 등록된 future)은 취소됨
 */
public class UpdateContext {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Set<CompletableFuture<?>> inFlight = ConcurrentHashMap.newKeySet();

    public static UpdateContext create() {
        return new UpdateContext();
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            inFlight.forEach(future -> future.cancel(true));
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * future 완료를 기다린다. 기다리는 동안 cancel()되면 future도 취소된다.
     *
     * @throws FeedFetchException 취소, 인터럽트, 타임아웃, I/O 오류
     */
    public <T> T await(CompletableFuture<T> future) {
        inFlight.add(future);
        try {
            // add 직전에 cancel()된 경우
            if (cancelled.get()) {
                future.cancel(true);
            }
            return future.get();
        } catch (CancellationException e) {
            throw new FeedFetchException("수집이 취소되었습니다", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FeedFetchException("수집이 중단되었습니다", e);
        } catch (ExecutionException e) {
            throw translate(e.getCause());
        } finally {
            inFlight.remove(future);
        }
    }

    int inFlightCount() {
        return inFlight.size();
    }

    private static FeedPipelineException translate(Throwable cause) {
        if (cause instanceof FeedPipelineException) {
            return (FeedPipelineException) cause;
        }
        if (cause instanceof HttpTimeoutException || cause instanceof TimeoutException) {
            String detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            return new FeedFetchException("요청 시간 초과: " + detail, cause);
        }
        if (cause instanceof IOException) {
            return new FeedFetchException("요청 실패: " + cause.getMessage(), cause);
        }
        return new FeedFetchException("요청 실패: " + cause, cause);
    }
}
