package com.jimin.digest.service;

import com.jimin.digest.audit.CatalogAuditReport;
import com.jimin.digest.audit.CatalogAuditor;
import com.jimin.digest.audit.CatalogEntry;
import com.jimin.digest.core.taxonomy.TaxonomyValidator;
import com.jimin.digest.dto.FeedResponse;
import com.jimin.digest.dto.FeedSubmitRequest;
import com.jimin.digest.entity.Feed;
import com.jimin.digest.entity.SourceType;
import com.jimin.digest.exception.FeedNotFoundException;
import com.jimin.digest.repository.FeedRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 피드 카탈로그 Service
 *
 * - 카탈로그 노출: 승인된 피드만
 * - 제출: 토픽 검증 통과 시 미승인 상태로 저장
 * - 승인: 이후 수집 대상이 됨
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class CatalogService {

    private final FeedRepository feedRepository;
    private final TaxonomyValidator taxonomyValidator;

    public List<FeedResponse> listApproved() {
        return feedRepository.findByApprovedTrueOrderByNameAsc().stream()
                .map(FeedResponse::from)
                .toList();
    }

    /**
     * @throws com.jimin.digest.exception.InvalidTopicException 어휘에 없는 토픽 (전체 목록 포함)
     */
    @Transactional
    public FeedResponse submit(FeedSubmitRequest request, String submittedBy) {
        List<String> topics = taxonomyValidator.validate(request.topics());
        if (feedRepository.existsByUrl(request.url().trim())) {
            throw new IllegalArgumentException("이미 등록된 피드 URL입니다: " + request.url());
        }

        Feed feed = new Feed();
        feed.setName(request.name().trim());
        feed.setUrl(request.url().trim());
        feed.setSourceType(SourceType.fromValue(request.sourceType()));
        feed.setDomain(request.domain());
        feed.setCategory(request.category());
        feed.setDescription(request.description());
        feed.getTopics().addAll(topics);
        feed.setApproved(false);
        feed.setSubmittedBy(submittedBy);

        Feed saved = feedRepository.save(feed);
        log.info("피드 제출: {} ({}) by {}", saved.getName(), saved.getUrl(), submittedBy);
        return FeedResponse.from(saved);
    }

    @Transactional
    public FeedResponse approve(Long feedId) {
        Feed feed = feedRepository.findById(feedId)
                .orElseThrow(() -> new FeedNotFoundException(feedId));
        if (!feed.isApproved()) {
            feed.setApproved(true);
            feed.setApprovedAt(LocalDateTime.now());
            log.info("피드 승인: {}", feed.getName());
        }
        return FeedResponse.from(feed);
    }

    /**
     * 저장된 전체 카탈로그(미승인 포함) 토픽 감사
     */
    public CatalogAuditReport audit() {
        List<CatalogEntry> entries = feedRepository.findAll().stream()
                .map(feed -> new CatalogEntry(feed.getName(), feed.getUrl(), feed.getSourceType().value(),
                        feed.getDomain(), feed.getCategory(), feed.getDescription(), feed.getTopics()))
                .toList();
        CatalogAuditReport report = new CatalogAuditor(taxonomyValidator).audit(entries);
        if (!report.isClean()) {
            log.warn("카탈로그 감사: 잘못된 토픽 {}종 ({} 건)", report.uniqueInvalidTopics(), report.totalInvalidAssignments());
        }
        return report;
    }
}
