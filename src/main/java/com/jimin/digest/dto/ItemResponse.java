package com.jimin.digest.dto;

import com.jimin.digest.entity.Item;
import com.jimin.digest.entity.Methodology;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 아이템 응답 DTO
 *
 * subscores: 이름순 정렬 (점수 계산 순서와 동일)
 */
public record ItemResponse(
        String id,
        String sourceType,
        Long feedId,
        String title,
        String url,
        String doi,
        String journalName,
        String authorOrChannel,
        String excerpt,
        LocalDateTime publishedAt,
        List<String> topics,
        Methodology methodology,
        boolean preprint,
        EngagementView engagement,
        Map<String, Double> subscores,
        double totalScore,
        boolean archived
) {

    public record EngagementView(long upvotes, long views, long comments) {
    }

    public static ItemResponse from(Item item) {
        return new ItemResponse(
                item.getId(),
                item.getSourceType().value(),
                item.getFeed() == null ? null : item.getFeed().getId(),
                item.getTitle(),
                item.getUrl(),
                item.getDoi(),
                item.getJournalName(),
                item.getAuthorOrChannel(),
                item.getExcerpt(),
                item.getPublishedAt(),
                List.copyOf(item.getTopics()),
                item.getMethodology(),
                item.isPreprint(),
                new EngagementView(
                        item.getEngagement().getUpvotes(),
                        item.getEngagement().getViews(),
                        item.getEngagement().getComments()),
                new TreeMap<>(item.getSubscores()),
                item.getTotalScore(),
                item.isArchived()
        );
    }
}
