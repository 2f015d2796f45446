package com.jimin.digest.core.scoring;

import com.jimin.digest.entity.Engagement;
import com.jimin.digest.entity.SourceType;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 아이템 메타데이터에서 기본 서브점수(0~1) 도출
 *
 *  - contentQuality      : 출처별 기본값 (AI 분석 점수가 오면 명시 서브점수로 덮어씀)
 *  - engagementSignals   : 출처별 로그 정규화
 *  - sourceCredibility   : 저널 등급 / 출처 기본값
 *  - recency             : 발행 후 경과일 단계 감쇠
 *  - communityValidation : 평가 데이터 없음 → 중립 0.5
 *
 * 명시 서브점수(수집 시 전달 또는 API 갱신)가 항상 도출값보다 우선한다.
 */
public class SubscoreCalculator {

    public static final String CONTENT_QUALITY = "contentQuality";
    public static final String ENGAGEMENT_SIGNALS = "engagementSignals";
    public static final String SOURCE_CREDIBILITY = "sourceCredibility";
    public static final String RECENCY = "recency";
    public static final String COMMUNITY_VALIDATION = "communityValidation";

    private static final List<String> HIGH_IMPACT_JOURNALS = List.of(
            "nature", "science", "cell", "lancet", "nejm", "jama", "bmj",
            "pnas", "immunity", "neuron", "annual review");

    private static final List<String> MID_TIER_JOURNALS = List.of(
            "plos", "frontiers", "nutrients", "journal of", "european",
            "american journal", "clinical", "metabolism", "diabetes");

    private final Clock clock;

    public SubscoreCalculator(Clock clock) {
        this.clock = clock;
    }

    public Map<String, Double> derive(SourceType sourceType,
                                      LocalDateTime publishedAt,
                                      Engagement engagement,
                                      String journalName,
                                      Map<String, Double> explicit) {
        Map<String, Double> subscores = new LinkedHashMap<>();
        subscores.put(CONTENT_QUALITY, contentBaseline(sourceType));
        subscores.put(ENGAGEMENT_SIGNALS, engagementSignals(sourceType, engagement));
        subscores.put(SOURCE_CREDIBILITY, credibility(sourceType, journalName));
        subscores.put(RECENCY, recency(publishedAt));
        subscores.put(COMMUNITY_VALIDATION, 0.5);
        if (explicit != null) {
            subscores.putAll(explicit);
        }
        return subscores;
    }

    double contentBaseline(SourceType sourceType) {
        if (sourceType == null) {
            return 0.5;
        }
        return switch (sourceType) {
            case JOURNAL -> 0.625;
            case SUBSTACK -> 0.55;
            case YOUTUBE -> 0.5;
            case REDDIT -> 0.45;
            case PODCAST -> 0.5;
        };
    }

    double engagementSignals(SourceType sourceType, Engagement engagement) {
        long upvotes = engagement == null ? 0 : engagement.getUpvotes();
        long views = engagement == null ? 0 : engagement.getViews();
        long comments = engagement == null ? 0 : engagement.getComments();

        if (sourceType == null) {
            return 0.3;
        }
        double normalized = switch (sourceType) {
            case REDDIT -> {
                double upvoteScore = Math.min(Math.log10(upvotes + 1) / 2, 1);
                double commentRatio = upvotes > 0 ? Math.min((double) comments / upvotes, 0.5) : 0;
                yield upvoteScore + commentRatio;
            }
            case YOUTUBE -> {
                double viewScore = Math.min(Math.log10(views + 1) / 4, 0.7);
                double likeRatio = views > 0 ? Math.min((double) upvotes / views * 10, 0.3) : 0;
                yield viewScore + likeRatio;
            }
            case SUBSTACK -> Math.min(Math.log10(upvotes + 1) / 2, 0.8) + Math.min(comments / 20.0, 0.2);
            case JOURNAL, PODCAST -> 0.3;
        };
        return Math.min(normalized, 1.0);
    }

    double credibility(SourceType sourceType, String journalName) {
        if (sourceType == null) {
            return 0.5;
        }
        return switch (sourceType) {
            case JOURNAL -> switch (journalTier(journalName)) {
                case "high" -> 1.0;
                case "mid" -> 0.75;
                default -> 0.6;
            };
            case YOUTUBE -> 0.25;
            case REDDIT, SUBSTACK, PODCAST -> 0.5;
        };
    }

    String journalTier(String journalName) {
        if (journalName == null || journalName.isBlank()) {
            return "low";
        }
        String name = journalName.toLowerCase(Locale.ROOT);
        if (HIGH_IMPACT_JOURNALS.stream().anyMatch(name::contains)) {
            return "high";
        }
        if (MID_TIER_JOURNALS.stream().anyMatch(name::contains)) {
            return "mid";
        }
        return "low";
    }

    double recency(LocalDateTime publishedAt) {
        if (publishedAt == null) {
            return 0.0;
        }
        double days = Duration.between(publishedAt, LocalDateTime.now(clock)).toMinutes() / (60.0 * 24.0);
        if (days < 7) return 1.0;
        if (days < 30) return 0.9;
        if (days < 90) return 0.7;
        if (days < 180) return 0.5;
        if (days < 365) return 0.3;
        // 1년 이후 5년에 걸쳐 0.1 → 0 선형 감쇠
        return Math.max(0.0, 0.1 * (1 - (days - 365) / 1825));
    }
}
