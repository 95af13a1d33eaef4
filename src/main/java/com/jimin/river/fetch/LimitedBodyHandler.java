package com.jimin.river.fetch;

import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Flow;

/**
 * 2xx 응답 본문을 최대 크기까지만 메모리로 받는 BodyHandler (요청 1개당 1개)
 *
 * 본문까지 비동기로 받으므로 sendAsync future가 본문 수신 완료 시점에 끝난다.
 * → orTimeout / UpdateContext.cancel()이 느린 본문에도 적용된다.
 * 2xx가 아닌 응답(리다이렉트, 304, 오류)의 본문은 버린다.
 */
class LimitedBodyHandler implements HttpResponse.BodyHandler<byte[]> {

    private static final byte[] EMPTY = new byte[0];

    private final int limit;
    private volatile LimitedSubscriber subscriber;

    LimitedBodyHandler(long maxBytes) {
        this.limit = (int) Math.min(maxBytes, Integer.MAX_VALUE - 8);
    }

    @Override
    public HttpResponse.BodySubscriber<byte[]> apply(HttpResponse.ResponseInfo responseInfo) {
        int status = responseInfo.statusCode();
        if (status < 200 || status >= 300) {
            return HttpResponse.BodySubscribers.replacing(EMPTY);
        }
        LimitedSubscriber created = new LimitedSubscriber(limit);
        subscriber = created;
        return created;
    }

    /**
     * 본문이 제한에 걸려 잘렸는지
     */
    boolean truncated() {
        LimitedSubscriber current = subscriber;
        return current != null && current.truncated;
    }

    int limit() {
        return limit;
    }

    /**
     * 타임아웃/취소 후 남은 본문 수신 중단 (연결을 닫는다)
     */
    void abort() {
        LimitedSubscriber current = subscriber;
        if (current != null) {
            current.abort();
        }
    }

    private static final class LimitedSubscriber implements HttpResponse.BodySubscriber<byte[]> {

        private final int limit;
        private final CompletableFuture<byte[]> body = new CompletableFuture<>();
        private byte[] buffer = new byte[8192];
        private int size;
        private volatile Flow.Subscription subscription;
        private volatile boolean truncated;

        LimitedSubscriber(int limit) {
            this.limit = limit;
        }

        @Override
        public CompletionStage<byte[]> getBody() {
            return body;
        }

        @Override
        public void onSubscribe(Flow.Subscription subscription) {
            this.subscription = subscription;
            subscription.request(1);
        }

        @Override
        public void onNext(List<ByteBuffer> items) {
            if (body.isDone()) {
                return;
            }
            for (ByteBuffer item : items) {
                int take = Math.min(item.remaining(), limit - size);
                ensureCapacity(size + take);
                item.get(buffer, size, take);
                size += take;
                if (size >= limit) {
                    // 제한 도달: 나머지는 받지 않고 잘린 본문으로 완료
                    truncated = true;
                    subscription.cancel();
                    body.complete(Arrays.copyOf(buffer, size));
                    return;
                }
            }
            subscription.request(1);
        }

        @Override
        public void onError(Throwable throwable) {
            body.completeExceptionally(throwable);
        }

        @Override
        public void onComplete() {
            body.complete(Arrays.copyOf(buffer, size));
        }

        void abort() {
            Flow.Subscription current = subscription;
            if (current != null) {
                current.cancel();
            }
            body.cancel(false);
        }

        private void ensureCapacity(int required) {
            if (required > buffer.length) {
                buffer = Arrays.copyOf(buffer, Math.min(limit, Math.max(required, buffer.length * 2)));
            }
        }
    }
}
