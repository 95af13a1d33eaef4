package com.jimin.river.fetch;

import com.jimin.river.dto.FetchResult;
import com.jimin.river.entity.Feed;

/**
 * 피드 1개 수집
 *
 * 파이프라인 오류는 예외 대신 FetchResult.failed로 돌려준다.
 */
public interface FeedFetcher {

    FetchResult fetch(Feed feed, UpdateContext context);
}
