package com.jimin.digest.service;

import com.jimin.digest.core.scoring.ScoreBreakdown;
import com.jimin.digest.core.scoring.ScoreEngine;
import com.jimin.digest.core.scoring.SubscoreCalculator;
import com.jimin.digest.dto.EngagementDeltaRequest;
import com.jimin.digest.dto.ItemResponse;
import com.jimin.digest.entity.Item;
import com.jimin.digest.exception.ArchivedItemException;
import com.jimin.digest.exception.InvalidEngagementException;
import com.jimin.digest.exception.ItemNotFoundException;
import com.jimin.digest.repository.ItemRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;

/**
 * 아이템 점수 갱신 Service
 *
 * 점수는 항상 서브점수에서 처음부터 다시 계산한다 (기존 totalScore를 보정하지 않음).
 * 참여/서브점수 변경은 행 잠금(findForUpdate) 후 같은 트랜잭션에서 재계산
 * → 동시 갱신이 서로의 결과를 덮어쓰지 않음
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class ItemScoringService {

    private final ItemRepository itemRepository;
    private final SubscoreCalculator subscoreCalculator;
    private final ScoreEngine scoreEngine;

    /**
     * 엔티티의 subscores / totalScore 갱신 (저장은 호출자 트랜잭션)
     */
    public ScoreBreakdown applyScore(Item item) {
        Map<String, Double> derived = subscoreCalculator.derive(
                item.getSourceType(),
                item.getPublishedAt(),
                item.getEngagement(),
                item.getJournalName(),
                item.getSubscoreInputs());
        ScoreBreakdown breakdown = scoreEngine.computeScore(derived);

        item.getSubscores().clear();
        item.getSubscores().putAll(breakdown.subscores());
        item.setTotalScore(breakdown.totalScore());
        return breakdown;
    }

    /**
     * 참여 카운터 증가 + 점수 재계산
     * archived 아이템도 카운터는 계속 받는다.
     */
    @Transactional
    public ItemResponse recordEngagement(String itemId, EngagementDeltaRequest delta) {
        if (delta.upvotes() < 0 || delta.views() < 0 || delta.comments() < 0) {
            throw new InvalidEngagementException("참여 카운터는 감소할 수 없습니다");
        }

        Item item = itemRepository.findForUpdate(itemId)
                .orElseThrow(() -> new ItemNotFoundException(itemId));
        try {
            item.setEngagement(item.getEngagement().plus(delta.upvotes(), delta.views(), delta.comments()));
        } catch (ArithmeticException e) {
            throw new InvalidEngagementException("참여 카운터 범위를 초과했습니다: " + itemId);
        }
        applyScore(item);

        log.debug("참여 갱신: {} → total={}", itemId, item.getTotalScore());
        return ItemResponse.from(item);
    }

    /**
     * 명시 서브점수 입력 교체 + 점수 재계산
     */
    @Transactional
    public ItemResponse replaceSubscoreInputs(String itemId, Map<String, Double> inputs) {
        Item item = itemRepository.findForUpdate(itemId)
                .orElseThrow(() -> new ItemNotFoundException(itemId));
        if (item.isArchived()) {
            throw new ArchivedItemException(itemId);
        }

        item.getSubscoreInputs().clear();
        item.getSubscoreInputs().putAll(inputs);
        ScoreBreakdown breakdown = applyScore(item);

        log.info("서브점수 갱신: {} → total={}", itemId, breakdown.totalScore());
        return ItemResponse.from(item);
    }

    /**
     * 최신성 서브점수 감쇠 반영 (매일 새벽)
     * archived 아이템은 점수를 고정한다.
     *
     * @return 재계산된 아이템 수
     */
    @Scheduled(cron = "${digest.scoring.rescore-cron:0 30 3 * * *}")
    @Transactional
    public int rescoreAll() {
        List<Item> items = itemRepository.findByArchivedFalse();
        items.forEach(this::applyScore);
        log.info("점수 재계산 완료: {} 건", items.size());
        return items.size();
    }
}
