package com.jimin.digest.service;

import com.jimin.digest.core.ranking.RankingEngine;
import com.jimin.digest.core.ranking.SortOption;
import com.jimin.digest.dto.DigestResponse;
import com.jimin.digest.entity.Digest;
import com.jimin.digest.entity.Item;
import com.jimin.digest.exception.DigestNotFoundException;
import com.jimin.digest.repository.DigestRepository;
import com.jimin.digest.repository.ItemRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 다이제스트 발행/조회 Service
 *
 * 발행: 기간 내 발행된 아이템을 quality-desc 순으로 묶어 고정 저장
 * (이후 점수가 바뀌어도 다이제스트 구성은 그대로, 조회 시 정렬만 다시 함)
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class DigestService {

    private final DigestRepository digestRepository;
    private final ItemRepository itemRepository;
    private final RankingEngine rankingEngine;

    public List<DigestResponse> listDigests() {
        return digestRepository.findAllByOrderByGeneratedAtDesc().stream()
                .map(DigestResponse::from)
                .toList();
    }

    public DigestResponse getDigest(String slug) {
        return digestRepository.findBySlug(slug)
                .map(DigestResponse::from)
                .orElseThrow(() -> new DigestNotFoundException("slug=" + slug));
    }

    @Transactional
    public DigestResponse publish(String slug, LocalDateTime windowStart, LocalDateTime windowEnd) {
        if (!windowStart.isBefore(windowEnd)) {
            throw new IllegalArgumentException("windowStart는 windowEnd보다 앞이어야 합니다");
        }
        if (digestRepository.existsBySlug(slug)) {
            throw new IllegalArgumentException("이미 존재하는 다이제스트입니다: " + slug);
        }

        List<Item> items = rankingEngine.sort(
                itemRepository.findByPublishedAtBetween(windowStart, windowEnd), SortOption.QUALITY_DESC);

        Digest digest = new Digest();
        digest.setSlug(slug);
        digest.setWindowStart(windowStart);
        digest.setWindowEnd(windowEnd);
        digest.getItems().addAll(items);

        Digest saved = digestRepository.save(digest);
        log.info("다이제스트 발행: {} ({} ~ {}), {} 건", slug, windowStart, windowEnd, items.size());
        return DigestResponse.from(saved);
    }
}
