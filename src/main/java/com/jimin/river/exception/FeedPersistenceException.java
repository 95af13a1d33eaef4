package com.jimin.river.exception;

/**
 * 저장 트랜잭션 실패 - 해당 피드의 트랜잭션만 롤백된다
 */
public class FeedPersistenceException extends FeedPipelineException {

    public FeedPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.PERSISTENCE;
    }
}
