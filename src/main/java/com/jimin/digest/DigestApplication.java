package com.jimin.digest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * DigestApplication - 큐레이션 다이제스트 서비스
 *
 * - 피드 카탈로그 + RSS 자동 수집
 * - 토픽 검증 / 방법론 분류 / 품질 점수
 * - 등급별 검색 스코프, 폴더, 저장 아이템
 * - Swagger UI (API 문서 자동 생성)
 */
@SpringBootApplication
@EnableScheduling  // Why: @Scheduled 활성화 (RSS 수집, 점수 재계산)
@ConfigurationPropertiesScan
public class DigestApplication {

	public static void main(String[] args) {
		SpringApplication.run(DigestApplication.class, args);
	}

}
