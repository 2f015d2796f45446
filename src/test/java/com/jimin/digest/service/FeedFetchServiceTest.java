package com.jimin.digest.service;

import com.jimin.digest.entity.Feed;
import com.jimin.digest.entity.SourceType;
import com.jimin.digest.ingest.FeedEntry;
import com.jimin.digest.ingest.IngestionResult;
import com.jimin.digest.ingest.IngestionResult.RejectionReason;
import com.jimin.digest.repository.FeedRepository;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.SyndFeedInput;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.StringReader;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FeedFetchServiceTest {

    private static final String RSS = """
            <?xml version="1.0" encoding="UTF-8"?>
            <rss version="2.0">
              <channel>
                <title>Metabolic Notes</title>
                <link>https://notes.example</link>
                <description>test</description>
                <item>
                  <title>Ketones and cognition</title>
                  <link>https://notes.example/p/ketones</link>
                  <description>&lt;p&gt;A short review&lt;/p&gt;</description>
                  <pubDate>Mon, 05 May 2025 08:00:00 GMT</pubDate>
                  <category>Brain</category>
                </item>
                <item>
                  <title>Ketones and cognition</title>
                  <link>https://notes.example/p/ketones?utm_source=rss</link>
                </item>
              </channel>
            </rss>
            """;

    private FeedRepository feedRepository;
    private IngestionService ingestionService;
    private FeedFetchService service;

    @BeforeEach
    void setUp() {
        feedRepository = mock(FeedRepository.class);
        ingestionService = mock(IngestionService.class);
        service = new FeedFetchService(feedRepository, ingestionService);
    }

    @Test
    void everyEntryGoesThroughIngestion() throws Exception {
        Feed feed = feed("https://notes.example/rss");
        when(ingestionService.ingest(eq(feed), any(FeedEntry.class)))
                .thenReturn(IngestionResult.accepted(null))
                .thenReturn(IngestionResult.rejected(RejectionReason.DUPLICATE, "dup"));

        int accepted = service.ingestEntries(feed, parse());

        assertThat(accepted).isEqualTo(1);
        ArgumentCaptor<FeedEntry> entries = ArgumentCaptor.forClass(FeedEntry.class);
        verify(ingestionService, times(2)).ingest(eq(feed), entries.capture());
        FeedEntry first = entries.getAllValues().get(0);
        assertThat(first.title()).isEqualTo("Ketones and cognition");
        assertThat(first.url()).isEqualTo("https://notes.example/p/ketones");
        assertThat(first.summary()).contains("A short review");
        assertThat(first.publishedAt()).isNotNull();
        assertThat(entries.getAllValues().get(1).publishedAt()).isNull();
    }

    @Test
    void unreachableFeedIsSkipped() {
        Feed broken = feed("not a url");

        assertThat(service.fetchFeed(broken)).isZero();
        verify(ingestionService, never()).ingest(any(), any());
        verify(feedRepository, never()).save(any());
    }

    @Test
    void fetchAllContinuesPastFailures() {
        when(feedRepository.findByApprovedTrueAndActiveTrue())
                .thenReturn(List.of(feed("not a url"), feed("also not a url")));

        assertThat(service.fetchAllFeeds()).isZero();
    }

    private SyndFeed parse() throws Exception {
        return new SyndFeedInput().build(new StringReader(RSS));
    }

    private Feed feed(String url) {
        Feed feed = new Feed();
        feed.setName("Metabolic Notes");
        feed.setUrl(url);
        feed.setSourceType(SourceType.SUBSTACK);
        feed.setApproved(true);
        return feed;
    }
}
