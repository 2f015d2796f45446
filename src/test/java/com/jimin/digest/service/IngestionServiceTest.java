package com.jimin.digest.service;

import com.jimin.digest.config.DigestProperties;
import com.jimin.digest.core.scoring.ScoreEngine;
import com.jimin.digest.core.scoring.SubscoreCalculator;
import com.jimin.digest.core.taxonomy.MethodologyClassifier;
import com.jimin.digest.core.taxonomy.Taxonomy;
import com.jimin.digest.core.taxonomy.TaxonomyValidator;
import com.jimin.digest.core.taxonomy.TopicTagger;
import com.jimin.digest.entity.Feed;
import com.jimin.digest.entity.Item;
import com.jimin.digest.entity.Methodology;
import com.jimin.digest.entity.SourceType;
import com.jimin.digest.ingest.FeedEntry;
import com.jimin.digest.ingest.IngestionResult;
import com.jimin.digest.ingest.IngestionResult.RejectionReason;
import com.jimin.digest.ingest.ItemNormalizer;
import com.jimin.digest.ingest.JournalArticle;
import com.jimin.digest.repository.ItemRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IngestionServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-01T00:00:00Z"), ZoneOffset.UTC);

    private ItemRepository itemRepository;
    private DigestProperties properties;
    private IngestionService service;

    @BeforeEach
    void setUp() {
        itemRepository = mock(ItemRepository.class);
        when(itemRepository.saveAndFlush(any(Item.class))).thenAnswer(inv -> inv.getArgument(0));
        properties = new DigestProperties();

        TaxonomyValidator validator = new TaxonomyValidator(
                new Taxonomy("t1", Set.of("fasting", "metabolic", "sleep")));
        TopicTagger tagger = new TopicTagger(Map.of(
                "sleep", List.of(Pattern.compile("\\bsleep\\b", Pattern.CASE_INSENSITIVE)),
                "crypto", List.of(Pattern.compile("bitcoin", Pattern.CASE_INSENSITIVE))));
        ItemScoringService scoring = new ItemScoringService(itemRepository,
                new SubscoreCalculator(CLOCK),
                new ScoreEngine(Map.of("contentQuality", 0.5, "recency", 0.5)));

        service = new IngestionService(itemRepository, new ItemNormalizer(CLOCK), validator, tagger,
                new MethodologyClassifier(), scoring, properties, CLOCK);
    }

    @Test
    void unapprovedFeedIsRejected() {
        Feed feed = feed(List.of("fasting"));
        feed.setApproved(false);

        IngestionResult result = service.ingest(feed, entry("Fasting news"));

        assertThat(result.reason()).isEqualTo(RejectionReason.FEED_NOT_APPROVED);
        verify(itemRepository, never()).saveAndFlush(any());
    }

    @Test
    void acceptedItemIsTaggedClassifiedAndScored() {
        JournalArticle article = new JournalArticle("Sleep restriction and insulin", "https://doi.org/10.1000/abc",
                "10.1000/abc", "Obscure Journal", List.of("Park"), LocalDateTime.of(2025, 5, 30, 0, 0),
                "A randomized crossover trial on sleep and bitcoin miners", List.of(), false,
                List.of("metabolic"), Map.of());

        IngestionResult result = service.ingest(feed(List.of("fasting")), article);

        assertThat(result.isAccepted()).isTrue();
        ArgumentCaptor<Item> saved = ArgumentCaptor.forClass(Item.class);
        verify(itemRepository).saveAndFlush(saved.capture());
        Item item = saved.getValue();
        assertThat(item.getTopics()).containsExactly("fasting", "metabolic", "sleep");
        assertThat(item.getMethodology()).isEqualTo(Methodology.RCT);
        assertThat(item.getHashDedupe()).hasSize(64);
        // contentQuality 0.625 * 0.5 + recency 1.0 * 0.5
        assertThat(item.getTotalScore()).isEqualTo(0.8125);
        assertThat(result.item().id()).isEqualTo(item.getId());
    }

    @Test
    void duplicateHashIsRejected() {
        when(itemRepository.existsByHashDedupe(anyString())).thenReturn(true);

        IngestionResult result = service.ingest(feed(List.of()), entry("Seen before"));

        assertThat(result.reason()).isEqualTo(RejectionReason.DUPLICATE);
        verify(itemRepository, never()).saveAndFlush(any());
    }

    @Test
    void concurrentDuplicateIsRejected() {
        when(itemRepository.saveAndFlush(any(Item.class))).thenThrow(new DataIntegrityViolationException("hash_dedupe"));

        IngestionResult result = service.ingest(feed(List.of()), entry("Race"));

        assertThat(result.isAccepted()).isFalse();
        assertThat(result.reason()).isEqualTo(RejectionReason.DUPLICATE);
    }

    @Test
    void unknownTopicsRejectByDefault() {
        IngestionResult result = service.ingest(feed(List.of("fasting", "astrology", "astrology")), entry("Stars"));

        assertThat(result.reason()).isEqualTo(RejectionReason.INVALID_TOPICS);
        assertThat(result.invalidTopics()).containsEntry("astrology", 2);
        verify(itemRepository, never()).saveAndFlush(any());
    }

    @Test
    void unknownTopicsStrippedWhenConfigured() {
        properties.getIngest().setUnknownTopicPolicy(DigestProperties.UnknownTopicPolicy.STRIP);

        IngestionResult result = service.ingest(feed(List.of("fasting", "astrology")), entry("Stars"));

        assertThat(result.isAccepted()).isTrue();
        assertThat(result.item().topics()).containsExactly("fasting");
    }

    @Test
    void blankTitleIsInvalidItem() {
        IngestionResult result = service.ingest(feed(List.of()), entry(" "));

        assertThat(result.reason()).isEqualTo(RejectionReason.INVALID_ITEM);
    }

    private Feed feed(List<String> topics) {
        Feed feed = new Feed();
        feed.setName("Test feed");
        feed.setUrl("https://feed.example/rss");
        feed.setSourceType(SourceType.SUBSTACK);
        feed.setCategory("health");
        feed.setApproved(true);
        feed.getTopics().addAll(topics);
        return feed;
    }

    private FeedEntry entry(String title) {
        return new FeedEntry(title, "https://feed.example/p/" + title.trim().toLowerCase(), "Author",
                LocalDateTime.of(2025, 5, 1, 0, 0), "summary");
    }
}
