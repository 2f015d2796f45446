package com.jimin.digest.dto;

import com.jimin.digest.entity.Feed;

import java.time.LocalDateTime;
import java.util.List;

public record FeedResponse(
        Long id,
        String name,
        String url,
        String sourceType,
        String domain,
        String category,
        String description,
        List<String> topics,
        boolean approved,
        boolean active,
        LocalDateTime lastFetchedAt
) {
    public static FeedResponse from(Feed feed) {
        return new FeedResponse(
                feed.getId(),
                feed.getName(),
                feed.getUrl(),
                feed.getSourceType().value(),
                feed.getDomain(),
                feed.getCategory(),
                feed.getDescription(),
                List.copyOf(feed.getTopics()),
                feed.isApproved(),
                feed.isActive(),
                feed.getLastFetchedAt()
        );
    }
}
