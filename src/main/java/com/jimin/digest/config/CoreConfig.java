package com.jimin.digest.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jimin.digest.core.access.ScopeResolver;
import com.jimin.digest.core.access.TierGate;
import com.jimin.digest.core.ranking.RankingEngine;
import com.jimin.digest.core.scoring.EngagementAggregator;
import com.jimin.digest.core.scoring.ScoreEngine;
import com.jimin.digest.core.scoring.SubscoreCalculator;
import com.jimin.digest.core.taxonomy.MethodologyClassifier;
import com.jimin.digest.core.taxonomy.Taxonomy;
import com.jimin.digest.core.taxonomy.TaxonomyLoader;
import com.jimin.digest.core.taxonomy.TaxonomyValidator;
import com.jimin.digest.core.taxonomy.TopicTagger;
import com.jimin.digest.ingest.ItemNormalizer;
import com.jimin.digest.repository.DigestRepository;
import com.jimin.digest.repository.FolderRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.Locale;
import java.util.Map;

/**
 * 코어 컴포넌트 Bean 등록
 *
 * Why: 코어 클래스는 Spring에 의존하지 않는다 (감사 CLI가 그대로 재사용).
 *      설정값 주입과 리소스 로딩은 여기서만 한다.
 */
@Configuration
@Slf4j
public class CoreConfig {

    // 설정이 비어 있을 때의 기본 가중치
    static final Map<String, Double> DEFAULT_WEIGHTS = Map.of(
            SubscoreCalculator.CONTENT_QUALITY, 0.4,
            SubscoreCalculator.ENGAGEMENT_SIGNALS, 0.2,
            SubscoreCalculator.SOURCE_CREDIBILITY, 0.2,
            SubscoreCalculator.RECENCY, 0.1,
            SubscoreCalculator.COMMUNITY_VALIDATION, 0.1
    );

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public TierGate tierGate() {
        return TierGate.standard();
    }

    @Bean
    public ScopeResolver scopeResolver(TierGate tierGate, FolderRepository folderRepository,
                                       DigestRepository digestRepository) {
        return new ScopeResolver(tierGate, folderRepository, digestRepository);
    }

    @Bean
    public Taxonomy taxonomy(DigestProperties properties, ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        Resource resource = resourceLoader.getResource(properties.getTaxonomy().getLocation());
        try (InputStream in = resource.getInputStream()) {
            Taxonomy taxonomy = new TaxonomyLoader(objectMapper).load(in);
            log.info("Taxonomy 로드 완료: version={}, topics={}", taxonomy.version(), taxonomy.size());
            return taxonomy;
        } catch (IOException e) {
            throw new UncheckedIOException("taxonomy 로드 실패: " + resource.getDescription(), e);
        }
    }

    @Bean
    public TaxonomyValidator taxonomyValidator(Taxonomy taxonomy) {
        return new TaxonomyValidator(taxonomy);
    }

    @Bean
    public TopicTagger topicTagger(DigestProperties properties, ResourceLoader resourceLoader, Taxonomy taxonomy) {
        Resource resource = resourceLoader.getResource(properties.getTaxonomy().getPatternsLocation());
        try (InputStream in = resource.getInputStream()) {
            TopicTagger tagger = TopicTagger.load(in);
            long unknown = tagger.knownTopics().stream().filter(t -> !taxonomy.contains(t)).count();
            if (unknown > 0) {
                log.warn("토픽 패턴 중 어휘에 없는 토픽 {}개 (태깅 결과에서 제외됨)", unknown);
            }
            return tagger;
        } catch (IOException e) {
            throw new UncheckedIOException("토픽 패턴 로드 실패: " + resource.getDescription(), e);
        }
    }

    @Bean
    public MethodologyClassifier methodologyClassifier() {
        return new MethodologyClassifier();
    }

    @Bean
    public ScoreEngine scoreEngine(DigestProperties properties) {
        Map<String, Double> weights = properties.getScoring().getWeights();
        if (weights == null || weights.isEmpty()) {
            weights = DEFAULT_WEIGHTS;
        }
        ScoreEngine engine = new ScoreEngine(weights);
        log.info("점수 가중치: {}", engine.getWeights());
        return engine;
    }

    @Bean
    public EngagementAggregator engagementAggregator(DigestProperties properties) {
        DigestProperties.EngagementWeights w = properties.getScoring().getEngagementWeights();
        return new EngagementAggregator(w.getUpvotes(), w.getViews(), w.getComments());
    }

    @Bean
    public SubscoreCalculator subscoreCalculator(Clock clock) {
        return new SubscoreCalculator(clock);
    }

    @Bean
    public RankingEngine rankingEngine(EngagementAggregator engagementAggregator, DigestProperties properties) {
        return new RankingEngine(engagementAggregator, Locale.forLanguageTag(properties.getRanking().getLocale()));
    }

    @Bean
    public ItemNormalizer itemNormalizer(Clock clock) {
        return new ItemNormalizer(clock);
    }
}
