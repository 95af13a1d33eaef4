package com.jimin.river.filter;

/**
 * 그룹 규칙 스냅샷
 *
 * filter가 null이면 참조 대상 필터가 삭제된 규칙 → 매치되지 않는 것으로 평가
 */
public record FilterRuleSnapshot(
        Long filterId,
        String operator,
        int position,
        FilterDefinition filter
) {
}
