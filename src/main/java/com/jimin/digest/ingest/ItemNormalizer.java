package com.jimin.digest.ingest;

import com.jimin.digest.entity.Engagement;
import com.jimin.digest.entity.Feed;
import com.jimin.digest.entity.SourceType;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * 출처별 RawItem → NormalizedItem 변환
 *
 * 제목/URL이 비어 있으면 IllegalArgumentException (수집 단계에서 거부 처리)
 * 발행일이 없으면 수집 시각 사용
 */
public class ItemNormalizer {

    private static final int EXCERPT_MAX = 2000;

    private final Clock clock;

    public ItemNormalizer(Clock clock) {
        this.clock = clock;
    }

    public NormalizedItem normalize(Feed feed, RawItem raw) {
        if (raw == null) {
            throw new IllegalArgumentException("원본 아이템이 없습니다");
        }
        String title = required(raw.title(), "title");
        String url = required(raw.url(), "url");

        if (raw instanceof JournalArticle article) {
            return new NormalizedItem(SourceType.JOURNAL, title, url,
                    article.doi(), article.journalName(),
                    article.authors() == null || article.authors().isEmpty() ? null : String.join(", ", article.authors()),
                    publishedOrNow(article.publishedAt()),
                    excerpt(article.abstractText()),
                    listOrEmpty(article.topics()),
                    listOrEmpty(article.publicationTypes()),
                    article.preprint(),
                    new Engagement(),
                    article.subscores() == null ? Map.of() : Map.copyOf(article.subscores()));
        }
        if (raw instanceof CommunityPost post) {
            return new NormalizedItem(SourceType.REDDIT, title, url, null, null,
                    post.author(),
                    publishedOrNow(post.postedAt()),
                    excerpt(post.body()),
                    listOrEmpty(post.topics()),
                    List.of(), false,
                    new Engagement(Math.max(0, post.upvotes()), 0, Math.max(0, post.comments())),
                    Map.of());
        }
        if (raw instanceof MediaEntry media) {
            SourceType type = media.sourceType() == null ? SourceType.YOUTUBE : media.sourceType();
            return new NormalizedItem(type, title, url, null, null,
                    media.channel(),
                    publishedOrNow(media.publishedAt()),
                    excerpt(media.description()),
                    List.of(), List.of(), false,
                    new Engagement(Math.max(0, media.likes()), Math.max(0, media.views()), Math.max(0, media.comments())),
                    Map.of());
        }
        if (raw instanceof FeedEntry entry) {
            SourceType type = feed == null ? SourceType.SUBSTACK : feed.getSourceType();
            return new NormalizedItem(type, title, url, null, null,
                    entry.author(),
                    publishedOrNow(entry.publishedAt()),
                    excerpt(entry.summary()),
                    List.of(), List.of(), false,
                    new Engagement(),
                    Map.of());
        }
        throw new IllegalArgumentException("지원하지 않는 원본 타입: " + raw.getClass().getSimpleName());
    }

    private String required(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " 는 필수입니다");
        }
        return value.trim();
    }

    private LocalDateTime publishedOrNow(LocalDateTime publishedAt) {
        return publishedAt == null ? LocalDateTime.now(clock) : publishedAt;
    }

    // Why: RSS description에 HTML 태그 포함
    private String excerpt(String text) {
        if (text == null) return null;
        String clean = text.replaceAll("<[^>]*>", "").trim();
        return clean.length() > EXCERPT_MAX ? clean.substring(0, EXCERPT_MAX) : clean;
    }

    private List<String> listOrEmpty(List<String> values) {
        return values == null ? List.of() : values.stream().filter(v -> v != null).map(String::trim).toList();
    }
}
