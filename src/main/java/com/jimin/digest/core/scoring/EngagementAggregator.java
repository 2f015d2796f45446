package com.jimin.digest.core.scoring;

import com.jimin.digest.entity.Engagement;

import java.util.Map;

/**
 * 참여 카운터(upvotes, views, comments)를 하나의 비교 가능한 크기로 합침
 *
 * 기본 정책: 가중치 1.0 → 단순 합. 정렬 키 전용 (화면에는 개별 카운터 표시).
 * 없는 필드는 0, 결과는 음수가 되지 않는다.
 */
public class EngagementAggregator {

    public static final String UPVOTES = "upvotes";
    public static final String VIEWS = "views";
    public static final String COMMENTS = "comments";

    private final double upvotesWeight;
    private final double viewsWeight;
    private final double commentsWeight;

    public EngagementAggregator(double upvotesWeight, double viewsWeight, double commentsWeight) {
        if (upvotesWeight < 0 || viewsWeight < 0 || commentsWeight < 0) {
            throw new IllegalArgumentException("참여 가중치는 음수일 수 없습니다");
        }
        this.upvotesWeight = upvotesWeight;
        this.viewsWeight = viewsWeight;
        this.commentsWeight = commentsWeight;
    }

    public static EngagementAggregator unweighted() {
        return new EngagementAggregator(1.0, 1.0, 1.0);
    }

    public double aggregate(Map<String, Long> counters) {
        if (counters == null) {
            return 0.0;
        }
        return combine(counters.get(UPVOTES), counters.get(VIEWS), counters.get(COMMENTS));
    }

    public double aggregate(Engagement engagement) {
        if (engagement == null) {
            return 0.0;
        }
        return combine(engagement.getUpvotes(), engagement.getViews(), engagement.getComments());
    }

    private double combine(Long upvotes, Long views, Long comments) {
        double magnitude = upvotesWeight * positive(upvotes)
                + viewsWeight * positive(views)
                + commentsWeight * positive(comments);
        return Math.max(0.0, magnitude);
    }

    private long positive(Long value) {
        return value == null ? 0L : Math.max(0L, value);
    }
}
