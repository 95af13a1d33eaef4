package com.jimin.river.exception;

/**
 * FeedPipelineException - 피드 수집 파이프라인 오류의 공통 상위 타입
 *
 * 호출자는 메시지 문자열이 아니라 kind()로 분기한다.
 * 어떤 하위 타입도 프로세스 전체를 중단시키지 않는다 (피드 단위로 격리).
 */
public abstract class FeedPipelineException extends RuntimeException {

    protected FeedPipelineException(String message) {
        super(message);
    }

    protected FeedPipelineException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract FailureKind kind();
}
