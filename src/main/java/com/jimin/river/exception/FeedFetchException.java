package com.jimin.river.exception;

import java.util.OptionalInt;

/**
 * 타임아웃, 연결 실패, 4xx/5xx 응답 등 일시적인 수집 오류
 *
 * 429도 일반 오류와 동일하게 취급한다 (백오프 신호 없음).
 */
public class FeedFetchException extends FeedPipelineException {

    private final Integer statusCode;

    public FeedFetchException(String message) {
        super(message);
        this.statusCode = null;
    }

    public FeedFetchException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public FeedFetchException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = null;
    }

    public OptionalInt getStatusCode() {
        return statusCode == null ? OptionalInt.empty() : OptionalInt.of(statusCode);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.FETCH;
    }
}
