package com.jimin.river.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * 필터 생성/수정 요청
 *
 * patternType: keyword | regex
 * targetType : title | content | feed_category | feed_tags
 */
public record FilterRequest(

        @NotBlank(message = "필터 이름은 필수입니다")
        @Size(max = 100, message = "필터 이름은 최대 100자입니다")
        String name,

        @NotBlank(message = "패턴은 필수입니다")
        @Size(max = 1000, message = "패턴은 최대 1000자입니다")
        String pattern,

        @NotBlank
        @Pattern(regexp = "keyword|regex", message = "patternType은 keyword 또는 regex 입니다")
        String patternType,

        @NotBlank
        @Pattern(regexp = "title|content|feed_category|feed_tags",
                message = "targetType은 title, content, feed_category, feed_tags 중 하나입니다")
        String targetType,

        boolean caseSensitive
) {
}
