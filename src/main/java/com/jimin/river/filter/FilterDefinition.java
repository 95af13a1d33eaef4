package com.jimin.river.filter;

import com.jimin.river.entity.EntryFilter;

/**
 * 평가용 불변 필터 (EntryFilter Entity의 스냅샷)
 *
 * 캐시에 보관되어 여러 스레드가 동시에 읽으므로 JPA Entity를 직접 들고 있지 않는다.
 */
public record FilterDefinition(
        Long id,
        String name,
        String pattern,
        String patternType,
        String targetType,
        boolean caseSensitive
) {
    public static FilterDefinition from(EntryFilter filter) {
        return new FilterDefinition(
                filter.getId(),
                filter.getName(),
                filter.getPattern(),
                filter.getPatternType(),
                filter.getTargetType(),
                filter.isCaseSensitive()
        );
    }

    public static FilterDefinition keyword(String pattern, TargetType target, boolean caseSensitive) {
        return new FilterDefinition(null, pattern, pattern, PatternType.KEYWORD.wireName(),
                target.wireName(), caseSensitive);
    }

    public static FilterDefinition regex(String pattern, TargetType target, boolean caseSensitive) {
        return new FilterDefinition(null, pattern, pattern, PatternType.REGEX.wireName(),
                target.wireName(), caseSensitive);
    }
}
