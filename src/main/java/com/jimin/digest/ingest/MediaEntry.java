package com.jimin.digest.ingest;

import com.jimin.digest.entity.SourceType;

import java.time.LocalDateTime;

/**
 * 영상/오디오 (YouTube, Podcast)
 *
 * @param likes 좋아요 수 → upvotes로 정규화
 */
public record MediaEntry(SourceType sourceType,
                         String title,
                         String url,
                         String channel,
                         LocalDateTime publishedAt,
                         String description,
                         long views,
                         long likes,
                         long comments) implements RawItem {
}
