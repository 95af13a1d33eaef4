package com.jimin.river.exception;

/**
 * 필터 평가 오류 (잘못된 정규식, 알 수 없는 패턴/대상 타입, 필터 설정 조회 실패)
 *
 * 호출자는 이 예외를 받으면 항목을 유지(keep)해야 한다.
 */
public class FilterEvaluationException extends FeedPipelineException {

    public FilterEvaluationException(String message) {
        super(message);
    }

    public FilterEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.FILTER;
    }
}
