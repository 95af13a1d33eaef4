package com.jimin.river.config;

import com.jimin.river.fetch.HostResolver;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.net.InetAddress;
import java.net.http.HttpClient;
import java.time.Clock;

/**
 * 수집 파이프라인 공용 Bean
 */
@Configuration
public class RiverConfig {

    // 설정값 feed_concurrency의 상한과 같다. 실제 동시 실행 수는 주기마다 Semaphore가 정한다.
    static final int FETCH_POOL_SIZE = 128;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * 리다이렉트는 클라이언트가 따라가지 않는다.
     * ConditionalFetchClient가 홉마다 목적지를 검사하면서 직접 처리한다.
     */
    @Bean
    public HttpClient feedHttpClient(RiverProperties properties) {
        return HttpClient.newBuilder()
                .connectTimeout(properties.fetch().connectTimeout())
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    @Bean
    public HostResolver hostResolver() {
        return InetAddress::getAllByName;
    }

    @Bean(name = "feedFetchExecutor")
    public ThreadPoolTaskExecutor feedFetchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(FETCH_POOL_SIZE);
        executor.setMaxPoolSize(FETCH_POOL_SIZE);
        executor.setAllowCoreThreadTimeOut(true);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("feed-fetch-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
