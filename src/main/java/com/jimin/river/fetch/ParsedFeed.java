package com.jimin.river.fetch;

import java.time.Instant;
import java.util.List;

/**
 * 파서 출력 (형식 무관)
 *
 * @param link 피드가 가리키는 사이트 주소 (파비콘 조회용)
 */
public record ParsedFeed(String title, String link, List<Item> items) {

    public ParsedFeed {
        items = items == null ? List.of() : List.copyOf(items);
    }

    /**
     * @param publishedAt 발행 시각, 없으면 null
     */
    public record Item(String title, String link, String guid, String content, Instant publishedAt) {
    }
}
