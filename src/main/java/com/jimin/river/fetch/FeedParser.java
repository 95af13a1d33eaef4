package com.jimin.river.fetch;

import com.jimin.river.exception.FeedParseException;

import java.io.InputStream;

/**
 * RSS / Atom 본문 파서
 */
public interface FeedParser {

    /**
     * @throws FeedParseException 피드 형식이 아니거나 깨진 본문
     */
    ParsedFeed parse(InputStream body);
}
