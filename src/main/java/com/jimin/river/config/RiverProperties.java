package com.jimin.river.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * river.* 설정 (application.yml)
 *
 * settings 테이블의 max_posts / feed_concurrency / update_interval 값이 있으면 그쪽이 우선이고,
 * 여기 값은 기본값으로만 쓰인다.
 */
@Validated
@ConfigurationProperties(prefix = "river")
public record RiverProperties(
        @Valid @DefaultValue Fetch fetch,
        @Valid @DefaultValue Filter filter,
        @Valid @DefaultValue Retention retention,
        @Valid @DefaultValue Scheduler scheduler
) {

    public static RiverProperties defaults() {
        return new RiverProperties(
                new Fetch("NewsRiver/1.0", Duration.ofSeconds(30), Duration.ofSeconds(10),
                        5L * 1024 * 1024, 5, Duration.ofHours(24)),
                new Filter(Duration.ofMinutes(5)),
                new Retention(100),
                new Scheduler(true, Duration.ofSeconds(900), Duration.ofSeconds(60))
        );
    }

    public record Fetch(
            @NotBlank @DefaultValue("NewsRiver/1.0") String userAgent,
            @NotNull @DefaultValue("30s") Duration requestTimeout,
            @NotNull @DefaultValue("10s") Duration connectTimeout,
            @Min(1024) @DefaultValue("5242880") long maxBodyBytes,
            @Min(0) @DefaultValue("5") int maxRedirects,
            @NotNull @DefaultValue("24h") Duration validatorCacheTtl
    ) {
    }

    public record Filter(
            @NotNull @DefaultValue("5m") Duration cacheTtl
    ) {
    }

    public record Retention(
            @Min(1) @DefaultValue("100") int defaultMaxPosts
    ) {
    }

    public record Scheduler(
            @DefaultValue("true") boolean enabled,
            @NotNull @DefaultValue("900s") Duration defaultInterval,
            @NotNull @DefaultValue("60s") Duration minimumInterval
    ) {
    }
}
