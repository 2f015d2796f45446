package com.jimin.digest.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 참여 카운터 (증가만 가능)
 *
 * 화면에는 개별 값 그대로 표시, 정렬에는 EngagementAggregator 합계 사용
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Engagement {

    @Column(nullable = false)
    private long upvotes;

    @Column(nullable = false)
    private long views;

    @Column(nullable = false)
    private long comments;

    /**
     * @throws ArithmeticException 카운터가 long 범위를 넘으면 (음수로 넘어가지 않게)
     */
    public Engagement plus(long upvotesDelta, long viewsDelta, long commentsDelta) {
        return new Engagement(
                Math.addExact(upvotes, upvotesDelta),
                Math.addExact(views, viewsDelta),
                Math.addExact(comments, commentsDelta));
    }
}
