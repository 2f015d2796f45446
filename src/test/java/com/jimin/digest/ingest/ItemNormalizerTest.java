package com.jimin.digest.ingest;

import com.jimin.digest.entity.Feed;
import com.jimin.digest.entity.SourceType;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ItemNormalizerTest {

    private final Clock clock = Clock.fixed(Instant.parse("2025-03-01T00:00:00Z"), ZoneOffset.UTC);
    private final ItemNormalizer normalizer = new ItemNormalizer(clock);

    @Test
    void journalArticle() {
        JournalArticle article = new JournalArticle(" Intermittent fasting trial ", "https://doi.org/10.1000/xyz",
                "10.1000/xyz", "Cell Metabolism", List.of("Kim", "Lee"), LocalDateTime.of(2025, 2, 1, 9, 0),
                "<p>A randomized trial</p>", List.of("Randomized Controlled Trial"), false,
                List.of("fasting"), Map.of("contentQuality", 0.9));

        NormalizedItem item = normalizer.normalize(null, article);

        assertThat(item.sourceType()).isEqualTo(SourceType.JOURNAL);
        assertThat(item.title()).isEqualTo("Intermittent fasting trial");
        assertThat(item.authorOrChannel()).isEqualTo("Kim, Lee");
        assertThat(item.excerpt()).isEqualTo("A randomized trial");
        assertThat(item.declaredTopics()).containsExactly("fasting");
        assertThat(item.subscores()).containsEntry("contentQuality", 0.9);
    }

    @Test
    void communityPostCarriesEngagement() {
        CommunityPost post = new CommunityPost("Keto week 3", "https://reddit.com/r/keto/1", "keto", "user1",
                null, "going well", 120, 14, null);

        NormalizedItem item = normalizer.normalize(null, post);

        assertThat(item.sourceType()).isEqualTo(SourceType.REDDIT);
        assertThat(item.engagement().getUpvotes()).isEqualTo(120);
        assertThat(item.engagement().getComments()).isEqualTo(14);
        assertThat(item.publishedAt()).isEqualTo(LocalDateTime.of(2025, 3, 1, 0, 0));
    }

    @Test
    void mediaLikesBecomeUpvotes() {
        MediaEntry video = new MediaEntry(SourceType.YOUTUBE, "Sauna science", "https://youtu.be/x", "Channel",
                LocalDateTime.of(2025, 1, 1, 0, 0), null, 10_000, 500, 40);

        NormalizedItem item = normalizer.normalize(null, video);

        assertThat(item.engagement().getViews()).isEqualTo(10_000);
        assertThat(item.engagement().getUpvotes()).isEqualTo(500);
    }

    @Test
    void feedEntryTakesSourceTypeFromFeed() {
        Feed feed = new Feed();
        feed.setSourceType(SourceType.PODCAST);

        NormalizedItem item = normalizer.normalize(feed,
                new FeedEntry("Episode 12", "https://pod.example/12", "Host", null, "Sleep and recovery"));

        assertThat(item.sourceType()).isEqualTo(SourceType.PODCAST);
        assertThat(item.taggingText()).contains("Episode 12").contains("Sleep and recovery");
    }

    @Test
    void titleAndUrlAreRequired() {
        assertThatThrownBy(() -> normalizer.normalize(null,
                new FeedEntry(" ", "https://x.example", null, null, null)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> normalizer.normalize(null,
                new FeedEntry("title", null, null, null, null)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
