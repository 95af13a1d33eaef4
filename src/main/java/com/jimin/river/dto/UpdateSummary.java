package com.jimin.river.dto;

/**
 * 수집 주기 1회 요약
 *
 * @param feeds       수집 대상 피드 수 (비활성 제외)
 * @param dispatched  실제로 수집을 시작한 피드 수 (취소 시 feeds보다 작다)
 * @param succeeded   저장까지 끝난 피드 수 (304 포함)
 * @param notModified 304 응답 수
 * @param failed      수집 또는 저장에 실패한 피드 수
 * @param saved       insert + update 된 항목 수
 * @param filtered    필터로 제외된 항목 수
 * @param cancelled   주기가 취소되었는지 여부
 */
public record UpdateSummary(
        int feeds,
        int dispatched,
        int succeeded,
        int notModified,
        int failed,
        int saved,
        int filtered,
        boolean cancelled
) {
}
