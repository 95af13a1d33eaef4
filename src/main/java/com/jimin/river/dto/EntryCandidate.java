package com.jimin.river.dto;

import java.time.LocalDateTime;

/**
 * 수집 후 저장 전 단계의 항목
 *
 * 필터 평가 → 통과한 항목만 FeedEntry로 upsert된다.
 */
public record EntryCandidate(
        String title,
        String url,
        String content,
        String guid,
        LocalDateTime publishedAt,
        String faviconUrl
) {
}
