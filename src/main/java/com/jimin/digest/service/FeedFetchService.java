package com.jimin.digest.service;

import com.jimin.digest.entity.Feed;
import com.jimin.digest.ingest.FeedEntry;
import com.jimin.digest.ingest.IngestionResult;
import com.jimin.digest.repository.FeedRepository;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.SyndFeedInput;
import com.rometools.rome.io.XmlReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.net.URI;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Date;
import java.util.List;

/**
 * RSS 피드 수집 어댑터
 *
 * 동작 방식:
 * 1. 승인 + 활성 피드 목록 조회
 * 2. Rome으로 RSS/Atom 파싱
 * 3. 각 항목을 FeedEntry로 만들어 IngestionService에 전달
 *    (중복/토픽 검증/점수 계산은 수집 쪽 책임)
 * 4. 한 피드 실패가 다른 피드 수집을 막지 않음
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FeedFetchService {

    private final FeedRepository feedRepository;
    private final IngestionService ingestionService;

    /**
     * @return 신규 저장된 아이템 수
     */
    @Scheduled(cron = "${digest.fetch.cron:0 0 * * * *}")
    public int fetchAllFeeds() {
        List<Feed> feeds = feedRepository.findByApprovedTrueAndActiveTrue();
        log.info("피드 수집 시작: {} 개 피드", feeds.size());

        int totalNew = 0;
        for (Feed feed : feeds) {
            totalNew += fetchFeed(feed);
        }

        log.info("피드 수집 완료: 총 {} 건 신규 저장", totalNew);
        return totalNew;
    }

    public int fetchFeed(Feed feed) {
        try (InputStream in = URI.create(feed.getUrl()).toURL().openStream()) {
            log.info("수집 중: {} ({})", feed.getName(), feed.getUrl());
            int newCount = ingestEntries(feed, new SyndFeedInput().build(new XmlReader(in)));

            feed.setLastFetchedAt(LocalDateTime.now());
            feedRepository.save(feed);

            log.info("  → {} 에서 {} 건 신규 저장", feed.getName(), newCount);
            return newCount;
        } catch (Exception e) {
            log.error("수집 실패: {} - {}", feed.getName(), e.getMessage());
            return 0;
        }
    }

    /**
     * 파싱된 피드의 항목을 수집 파이프라인으로 전달
     */
    int ingestEntries(Feed feed, SyndFeed syndFeed) {
        int newCount = 0;
        for (SyndEntry entry : syndFeed.getEntries()) {
            IngestionResult result = ingestionService.ingest(feed, toFeedEntry(entry));
            if (result.isAccepted()) {
                newCount++;
            }
        }
        return newCount;
    }

    FeedEntry toFeedEntry(SyndEntry entry) {
        return new FeedEntry(
                entry.getTitle(),
                entry.getLink(),
                entry.getAuthor(),
                toLocalDateTime(entry.getPublishedDate() != null ? entry.getPublishedDate() : entry.getUpdatedDate()),
                entry.getDescription() != null ? entry.getDescription().getValue() : null);
    }

    /**
     * java.util.Date → LocalDateTime 변환 (없으면 null → 수집 시각으로 대체됨)
     */
    private LocalDateTime toLocalDateTime(Date date) {
        if (date == null) return null;
        return date.toInstant().atZone(ZoneId.systemDefault()).toLocalDateTime();
    }
}
