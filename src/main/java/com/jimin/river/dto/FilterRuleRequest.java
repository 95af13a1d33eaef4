package com.jimin.river.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

/**
 * 그룹 규칙 한 줄 (position 0의 operator는 무시됨)
 */
public record FilterRuleRequest(

        @NotNull
        Long filterId,

        @NotNull
        @Pattern(regexp = "AND|OR", message = "operator는 AND 또는 OR 입니다")
        String operator,

        @Min(0)
        int position
) {
}
