package com.jimin.river.exception;

/**
 * FeedNotFoundException - 피드를 찾을 수 없을 때 발생하는 예외
 */
public class FeedNotFoundException extends RuntimeException {

    private final Long feedId;

    public FeedNotFoundException(Long feedId) {
        super("피드를 찾을 수 없습니다. ID: " + feedId);
        this.feedId = feedId;
    }

    public Long getFeedId() {
        return feedId;
    }
}
