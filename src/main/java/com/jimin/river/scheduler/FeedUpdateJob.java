package com.jimin.river.scheduler;

import com.jimin.river.config.RiverProperties;
import com.jimin.river.config.RuntimeSettings;
import com.jimin.river.fetch.UpdateContext;
import com.jimin.river.service.FeedUpdateService;
import com.jimin.river.store.FeedStore;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.TriggerContext;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 피드 업데이트 주기 실행
 *
 * - 시작 직후 1회, 이후 이전 주기가 끝난 시각 + update_interval 마다 실행
 * - update_interval(초)은 매번 settings에서 다시 읽음 (최소 60초)
 * - 종료 시 진행 중인 주기를 취소
 *
 * river.scheduler.enabled=false 면 등록하지 않는다 (테스트 프로필).
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "river.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class FeedUpdateJob implements SchedulingConfigurer {

    private final FeedUpdateService updateService;
    private final FeedStore feedStore;
    private final Clock clock;
    private final RiverProperties.Scheduler settings;

    private final AtomicReference<UpdateContext> running = new AtomicReference<>();

    public FeedUpdateJob(FeedUpdateService updateService, FeedStore feedStore, Clock clock,
                         RiverProperties properties) {
        this.updateService = updateService;
        this.feedStore = feedStore;
        this.clock = clock;
        this.settings = properties.scheduler();
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        registrar.addTriggerTask(this::runCycle, this::nextExecution);
    }

    public void runCycle() {
        UpdateContext context = UpdateContext.create();
        running.set(context);
        try {
            updateService.updateFeeds(context);
        } catch (RuntimeException e) {
            log.error("피드 업데이트 주기 실패", e);
        } finally {
            running.compareAndSet(context, null);
        }
    }

    Instant nextExecution(TriggerContext triggerContext) {
        Instant lastCompletion = triggerContext.lastCompletion();
        if (lastCompletion == null) {
            return clock.instant();
        }
        return lastCompletion.plus(updateInterval());
    }

    Duration updateInterval() {
        Duration interval;
        try {
            interval = RuntimeSettings.intValue(RuntimeSettings.UPDATE_INTERVAL,
                            feedStore.getSetting(RuntimeSettings.UPDATE_INTERVAL))
                    .map(seconds -> Duration.ofSeconds(seconds))
                    .orElse(settings.defaultInterval());
        } catch (RuntimeException e) {
            log.warn("update_interval 조회 실패, 기본값 사용: {}", e.getMessage());
            interval = settings.defaultInterval();
        }
        if (interval.compareTo(settings.minimumInterval()) < 0) {
            return settings.minimumInterval();
        }
        return interval;
    }

    @PreDestroy
    public void cancelRunningCycle() {
        UpdateContext context = running.get();
        if (context != null) {
            log.info("종료 중 - 진행 중인 피드 업데이트를 취소합니다");
            context.cancel();
        }
    }
}
