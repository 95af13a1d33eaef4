package com.jimin.river.store;

import com.jimin.river.fetch.Validators;

import java.time.LocalDateTime;

/**
 * 수집 성공 후 피드 메타데이터 갱신 내용
 *
 * - title: 비어 있거나 사용자가 직접 수정한 제목이면 덮어쓰지 않음
 * - validators: 빈 값은 기존 값을 덮어쓰지 않음
 * - 상태는 ACTIVE, errorCount 0, lastError null 로 초기화
 */
public record FeedMetaUpdate(
        Long feedId,
        String title,
        Validators validators,
        LocalDateTime fetchedAt
) {
    public FeedMetaUpdate {
        validators = validators == null ? Validators.NONE : validators;
    }
}
