package com.jimin.digest.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * digest.* 설정 바인딩 (application.properties)
 *
 * 가중치 합 검증은 ScoreEngine 생성 시점에 한다 (합이 1이 아니면 기동 실패).
 */
@ConfigurationProperties(prefix = "digest")
@Validated
@Getter
@Setter
public class DigestProperties {

    @Valid
    private Taxonomy taxonomy = new Taxonomy();

    @Valid
    private Scoring scoring = new Scoring();

    @Valid
    private Ingest ingest = new Ingest();

    @Valid
    private Ranking ranking = new Ranking();

    @Valid
    private Catalog catalog = new Catalog();

    @Valid
    private Cache cache = new Cache();

    @Getter
    @Setter
    public static class Taxonomy {

        @NotBlank
        private String location = "classpath:taxonomy/topics.json";

        @NotBlank
        private String patternsLocation = "classpath:taxonomy/topic-patterns.txt";
    }

    @Getter
    @Setter
    public static class Scoring {

        /** 서브점수 이름 → 가중치 (합 1.0) */
        private Map<String, Double> weights = new LinkedHashMap<>();

        @Valid
        private EngagementWeights engagementWeights = new EngagementWeights();
    }

    @Getter
    @Setter
    public static class EngagementWeights {

        @PositiveOrZero
        private double upvotes = 1.0;

        @PositiveOrZero
        private double views = 1.0;

        @PositiveOrZero
        private double comments = 1.0;
    }

    @Getter
    @Setter
    public static class Ingest {

        /** 어휘에 없는 선언 토픽 처리 방식 */
        @NotNull
        private UnknownTopicPolicy unknownTopicPolicy = UnknownTopicPolicy.REJECT;

        @Min(0)
        private int maxTopics = 5;
    }

    public enum UnknownTopicPolicy { REJECT, STRIP }

    @Getter
    @Setter
    public static class Ranking {

        @NotBlank
        private String locale = "en";
    }

    @Getter
    @Setter
    public static class Catalog {

        /** 비어 있으면 시드 생략 */
        private String seedLocation = "classpath:seeds/feed-catalog.json";
    }

    @Getter
    @Setter
    public static class Cache {

        @Valid
        private CacheSpec itemFolders = new CacheSpec();
    }

    @Getter
    @Setter
    public static class CacheSpec {

        @NotNull
        private Duration ttl = Duration.ofMinutes(10);

        @Min(1)
        private long maxSize = 10_000;
    }
}
