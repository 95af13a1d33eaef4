package com.jimin.river.config;

import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * settings 테이블 키 + 정수 값 해석
 *
 * 숫자가 아닌 값은 없는 것으로 취급한다 (호출자가 기본값 사용).
 */
@Slf4j
public final class RuntimeSettings {

    public static final String MAX_POSTS = "max_posts";
    public static final String FEED_CONCURRENCY = "feed_concurrency";
    public static final String UPDATE_INTERVAL = "update_interval";

    public static final String TYPE_INT = "int";

    private RuntimeSettings() {
    }

    public static Optional<Integer> intValue(String key, Optional<String> raw) {
        if (raw.isEmpty() || raw.get().isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Integer.parseInt(raw.get().trim()));
        } catch (NumberFormatException e) {
            log.warn("잘못된 설정값 무시: {}={}", key, raw.get());
            return Optional.empty();
        }
    }
}
