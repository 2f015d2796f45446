package com.jimin.digest.ingest;

import java.time.LocalDateTime;

/**
 * 일반 RSS/Atom 항목 (Substack, 블로그 등)
 * 출처 종류는 카탈로그 피드의 sourceType을 따른다.
 * RSS category는 자유 라벨이라 받지 않는다 (토픽은 피드 토픽 + 자동 태깅).
 */
public record FeedEntry(String title,
                        String url,
                        String author,
                        LocalDateTime publishedAt,
                        String summary) implements RawItem {
}
