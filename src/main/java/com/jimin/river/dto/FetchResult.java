package com.jimin.river.dto;

import com.jimin.river.entity.Feed;
import com.jimin.river.exception.FeedPipelineException;
import com.jimin.river.fetch.Validators;

import java.util.List;

/**
 * 피드 1개의 수집 결과
 *
 * 성공(fetched), 변경 없음(notModified, 304), 실패(failed) 중 하나.
 * entries는 워터마크보다 새로운 항목만, publishedAt 최신순.
 */
public record FetchResult(
        Feed feed,
        String feedTitle,
        String siteLink,
        List<EntryCandidate> entries,
        Validators validators,
        boolean notModified,
        FeedPipelineException error
) {
    public static FetchResult fetched(Feed feed, String feedTitle, String siteLink,
                                      List<EntryCandidate> entries, Validators validators) {
        return new FetchResult(feed, feedTitle, siteLink, List.copyOf(entries), validators, false, null);
    }

    public static FetchResult notModified(Feed feed, Validators validators) {
        return new FetchResult(feed, null, null, List.of(), validators, true, null);
    }

    public static FetchResult failed(Feed feed, FeedPipelineException error) {
        return new FetchResult(feed, null, null, List.of(), Validators.NONE, false, error);
    }

    public boolean failed() {
        return error != null;
    }
}
