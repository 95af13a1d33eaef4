package com.jimin.river.filter;

import com.jimin.river.entity.FilterGroup;
import com.jimin.river.entity.FilterGroupRule;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 활성 필터 그룹 스냅샷 (rules는 position 순)
 */
public record FilterGroupSnapshot(
        Long id,
        String name,
        String action,
        int priority,
        String applyToCategory,
        List<FilterRuleSnapshot> rules
) {
    public FilterGroupSnapshot {
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    /**
     * @param filters 규칙의 filterId → 필터 (없는 ID는 삭제된 필터로 평가)
     */
    public static FilterGroupSnapshot from(FilterGroup group, Map<Long, FilterDefinition> filters) {
        List<FilterRuleSnapshot> rules = group.getRules().stream()
                .sorted(Comparator.comparingInt(FilterGroupRule::getPosition))
                .map(rule -> new FilterRuleSnapshot(rule.getFilterId(), rule.getOperator(),
                        rule.getPosition(), filters.get(rule.getFilterId())))
                .collect(Collectors.toList());
        return new FilterGroupSnapshot(group.getId(), group.getName(), group.getAction(),
                group.getPriority(), group.getApplyToCategory(), rules);
    }

    public boolean isKeep() {
        return FilterAction.fromWireName(action).filter(FilterAction.KEEP::equals).isPresent();
    }

    public boolean isDiscard() {
        return FilterAction.fromWireName(action).filter(FilterAction.DISCARD::equals).isPresent();
    }

    /**
     * applyToCategory가 비어 있으면 모든 피드, 아니면 카테고리가 같을 때만 적용
     */
    public boolean appliesTo(String feedCategory) {
        if (applyToCategory == null || applyToCategory.isBlank()) {
            return true;
        }
        return applyToCategory.equals(feedCategory);
    }
}
