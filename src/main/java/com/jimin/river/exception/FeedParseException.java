package com.jimin.river.exception;

/**
 * 피드 본문이 RSS/Atom 형식이 아니거나 깨진 경우
 */
public class FeedParseException extends FeedPipelineException {

    public FeedParseException(String message) {
        super(message);
    }

    public FeedParseException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.PARSE;
    }
}
