package com.jimin.digest.service;

import com.jimin.digest.config.DigestProperties;
import com.jimin.digest.core.taxonomy.MethodologyClassifier;
import com.jimin.digest.core.taxonomy.TaxonomyValidator;
import com.jimin.digest.core.taxonomy.TopicTagger;
import com.jimin.digest.dto.ItemResponse;
import com.jimin.digest.entity.Feed;
import com.jimin.digest.entity.Item;
import com.jimin.digest.ingest.DedupeHasher;
import com.jimin.digest.ingest.IngestionResult;
import com.jimin.digest.ingest.IngestionResult.RejectionReason;
import com.jimin.digest.ingest.ItemNormalizer;
import com.jimin.digest.ingest.NormalizedItem;
import com.jimin.digest.ingest.RawItem;
import com.jimin.digest.repository.ItemRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * 아이템 수집 Service
 *
 * 순서:
 *  1. 피드 승인 확인 (미승인 피드 → FEED_NOT_APPROVED)
 *  2. 정규화 (제목/URL 없음 → INVALID_ITEM)
 *  3. 중복 해시 확인 (→ DUPLICATE)
 *  4. 토픽 = 피드 토픽 + 선언 토픽 검증 (정책: REJECT / STRIP) + 자동 태깅
 *  5. 방법론 분류, 점수 계산 후 저장
 *
 * 토픽 검증과 분류를 통과한 아이템만 저장된다.
 * Why: 트랜잭션 없이 저장 한 번으로 끝냄. 해시 유니크 제약 위반(동시 수집)을 DUPLICATE로 처리하기 위함.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionService {

    private final ItemRepository itemRepository;
    private final ItemNormalizer itemNormalizer;
    private final TaxonomyValidator taxonomyValidator;
    private final TopicTagger topicTagger;
    private final MethodologyClassifier methodologyClassifier;
    private final ItemScoringService scoringService;
    private final DigestProperties properties;
    private final Clock clock;

    public IngestionResult ingest(Feed feed, RawItem raw) {
        if (feed == null || !feed.isApproved()) {
            String name = feed == null ? "(none)" : feed.getName();
            log.warn("미승인 피드 항목 거부: {}", name);
            return IngestionResult.rejected(RejectionReason.FEED_NOT_APPROVED, "승인되지 않은 피드: " + name);
        }

        NormalizedItem normalized;
        try {
            normalized = itemNormalizer.normalize(feed, raw);
        } catch (IllegalArgumentException e) {
            log.warn("정규화 실패 ({}): {}", feed.getName(), e.getMessage());
            return IngestionResult.rejected(RejectionReason.INVALID_ITEM, e.getMessage());
        }

        String hash = DedupeHasher.hash(normalized.url(), normalized.title());
        if (itemRepository.existsByHashDedupe(hash)) {
            log.debug("중복 항목 건너뜀: {}", normalized.url());
            return IngestionResult.rejected(RejectionReason.DUPLICATE, "이미 수집된 항목: " + normalized.url());
        }

        List<String> declared = new ArrayList<>(feed.getTopics());
        declared.addAll(normalized.declaredTopics());
        Map<String, Integer> invalid = taxonomyValidator.findInvalid(declared);
        if (!invalid.isEmpty()) {
            if (properties.getIngest().getUnknownTopicPolicy() == DigestProperties.UnknownTopicPolicy.REJECT) {
                log.warn("어휘에 없는 토픽으로 거부: {} {}", normalized.url(), invalid.keySet());
                return IngestionResult.invalidTopics(
                        "taxonomy " + taxonomyValidator.getTaxonomy().version() + " 에 없는 토픽", invalid);
            }
            log.warn("어휘에 없는 토픽 제거: {} {}", normalized.url(), invalid.keySet());
            declared = taxonomyValidator.strip(declared);
        }

        Item item = toItem(feed, normalized, hash, topics(declared, normalized));
        scoringService.applyScore(item);

        try {
            itemRepository.saveAndFlush(item);
        } catch (DataIntegrityViolationException e) {
            log.debug("동시 수집 중복: {}", normalized.url());
            return IngestionResult.rejected(RejectionReason.DUPLICATE, "이미 수집된 항목: " + normalized.url());
        }

        log.info("수집: [{}] {} (score={})", item.getSourceType().value(), item.getTitle(), item.getTotalScore());
        return IngestionResult.accepted(ItemResponse.from(item));
    }

    /**
     * 검증된 선언 토픽 + 자동 태깅 결과 (최대 maxTopics개, 어휘에 있는 것만)
     */
    private List<String> topics(List<String> declared, NormalizedItem normalized) {
        Set<String> topics = new LinkedHashSet<>(declared);
        topicTagger.tag(normalized.taggingText(), properties.getIngest().getMaxTopics()).stream()
                .filter(taxonomyValidator::isValid)
                .forEach(topics::add);
        return List.copyOf(topics);
    }

    private Item toItem(Feed feed, NormalizedItem normalized, String hash, List<String> topics) {
        Item item = new Item();
        item.setId(UUID.randomUUID().toString());
        item.setFeed(feed.getId() == null ? null : feed);
        item.setSourceType(normalized.sourceType());
        item.setTitle(normalized.title());
        item.setUrl(normalized.url());
        item.setDoi(normalized.doi() != null ? normalized.doi() : DedupeHasher.extractDoi(normalized.url()));
        item.setJournalName(normalized.journalName());
        item.setAuthorOrChannel(normalized.authorOrChannel());
        item.setExcerpt(normalized.excerpt());
        item.setPublishedAt(normalized.publishedAt());
        item.setIngestedAt(LocalDateTime.now(clock));
        item.getTopics().addAll(topics);
        item.setMethodology(methodologyClassifier.classify(normalized.classificationSignals()));
        item.setPreprint(normalized.preprint());
        item.setEngagement(normalized.engagement());
        item.getSubscoreInputs().putAll(normalized.subscores());
        item.setHashDedupe(hash);
        return item;
    }
}
