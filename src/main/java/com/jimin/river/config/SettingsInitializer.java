package com.jimin.river.config;

import com.jimin.river.store.FeedStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 기본 설정값 초기화
 *
 * 시작할 때마다 실행되지만 이미 있는 키는 건드리지 않는다 (운영 중 변경한 값 유지).
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class SettingsInitializer {

    private final FeedStore feedStore;
    private final RiverProperties properties;

    @Bean
    public ApplicationRunner initSettings() {
        return args -> {
            int added = 0;
            for (Map.Entry<String, String> setting : defaultSettings().entrySet()) {
                if (feedStore.getSetting(setting.getKey()).isEmpty()) {
                    feedStore.putSetting(setting.getKey(), setting.getValue(), RuntimeSettings.TYPE_INT);
                    added++;
                    log.info("기본 설정 추가: {}={}", setting.getKey(), setting.getValue());
                }
            }
            if (added == 0) {
                log.info("설정 초기화 완료 (추가 없음 - 이미 존재)");
            }
        };
    }

    Map<String, String> defaultSettings() {
        Map<String, String> defaults = new LinkedHashMap<>();
        defaults.put(RuntimeSettings.MAX_POSTS, String.valueOf(properties.retention().defaultMaxPosts()));
        defaults.put(RuntimeSettings.UPDATE_INTERVAL,
                String.valueOf(properties.scheduler().defaultInterval().toSeconds()));
        return defaults;
    }
}
