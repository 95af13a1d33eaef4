package com.jimin.river.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * 필터 그룹 생성/수정 요청
 *
 * applyToCategory가 비어 있으면 모든 피드에 적용
 */
public record FilterGroupRequest(

        @NotBlank(message = "그룹 이름은 필수입니다")
        @Size(max = 100)
        String name,

        @NotBlank
        @Pattern(regexp = "keep|discard", message = "action은 keep 또는 discard 입니다")
        String action,

        boolean active,

        int priority,

        @Size(max = 100)
        String applyToCategory
) {
}
