package com.jimin.river.store;

/**
 * upsert 결과
 *
 * @param skipped 같은 url의 기존 항목이 더 최신이거나 같아서 건너뛴 수
 */
public record UpsertCounts(int inserted, int updated, int skipped) {
}
