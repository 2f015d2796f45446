package com.jimin.digest.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jimin.digest.audit.CatalogEntry;
import com.jimin.digest.audit.CatalogReader;
import com.jimin.digest.core.taxonomy.TaxonomyValidator;
import com.jimin.digest.entity.Feed;
import com.jimin.digest.entity.SourceType;
import com.jimin.digest.repository.FeedRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.InputStream;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * 피드 카탈로그 시드
 *
 * Why: 카탈로그 초기 구성을 JSON 파일로 관리하여 GitOps 방식으로 변경 가능.
 *      배포 시마다 실행되지만 existsByUrl로 중복 삽입 방지 (멱등성 보장).
 *
 * 시드 피드는 승인 상태로 들어간다.
 * 어휘에 없는 토픽이 있는 피드는 건너뛰고 WARN (감사 CLI로 미리 잡아야 함)
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class CatalogInitializer {

    private final FeedRepository feedRepository;
    private final TaxonomyValidator taxonomyValidator;
    private final DigestProperties properties;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    @Bean
    public ApplicationRunner initFeedCatalog() {
        return args -> {
            String location = properties.getCatalog().getSeedLocation();
            if (location == null || location.isBlank()) {
                log.info("카탈로그 시드 생략 (seed-location 미설정)");
                return;
            }
            Resource resource = resourceLoader.getResource(location);
            if (!resource.exists()) {
                log.warn("카탈로그 시드 파일 없음: {}", location);
                return;
            }

            List<CatalogEntry> entries;
            try (InputStream in = resource.getInputStream()) {
                entries = new CatalogReader(objectMapper).read(in);
            }

            int added = 0;
            int skipped = 0;
            for (CatalogEntry entry : entries) {
                if (feedRepository.existsByUrl(entry.url())) {
                    continue;
                }
                Map<String, Integer> invalid = taxonomyValidator.findInvalid(entry.topics());
                if (!invalid.isEmpty()) {
                    log.warn("시드 피드 건너뜀 (잘못된 토픽 {}): {}", invalid.keySet(), entry.name());
                    skipped++;
                    continue;
                }

                feedRepository.save(toFeed(entry));
                added++;
                log.info("카탈로그 피드 추가: {} ({})", entry.name(), entry.sourceType());
            }

            if (added > 0 || skipped > 0) {
                log.info("카탈로그 시드 완료: 추가 {}, 건너뜀 {}", added, skipped);
            } else {
                log.info("카탈로그 시드 완료 (추가 없음 - 이미 존재)");
            }
        };
    }

    private Feed toFeed(CatalogEntry entry) {
        Feed feed = new Feed();
        feed.setName(entry.name());
        feed.setUrl(entry.url());
        feed.setSourceType(SourceType.fromValue(entry.sourceType()));
        feed.setDomain(entry.domain());
        feed.setCategory(entry.category() == null ? "general" : entry.category());
        feed.setDescription(entry.description());
        feed.getTopics().addAll(entry.topics());
        feed.setApproved(true);
        feed.setApprovedAt(LocalDateTime.now());
        feed.setActive(true);
        return feed;
    }
}
