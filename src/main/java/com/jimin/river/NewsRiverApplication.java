package com.jimin.river;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * NewsRiverApplication - RSS/Atom 피드 수집 파이프라인
 *
 * 구성:
 * - Fetch Scheduler (동시성 제한 병렬 수집)
 * - Conditional Fetch Client (ETag / Last-Modified 조건부 요청, SSRF 차단)
 * - Filter Engine (keep/discard 규칙 그룹 평가)
 * - Persistence Step (트랜잭션 upsert + 보존 개수 정리)
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class NewsRiverApplication {

	public static void main(String[] args) {
		SpringApplication.run(NewsRiverApplication.class, args);
	}

}
