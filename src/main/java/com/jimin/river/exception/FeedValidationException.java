package com.jimin.river.exception;

/**
 * 잘못된 URL, 허용되지 않는 scheme, 사설/예약 주소로 향하는 요청
 *
 * 해당 피드의 이번 수집만 실패시키고 다음 주기 전에는 재시도하지 않는다.
 */
public class FeedValidationException extends FeedPipelineException {

    public FeedValidationException(String message) {
        super(message);
    }

    public FeedValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.VALIDATION;
    }
}
