package com.jimin.digest.core.ranking;

import com.jimin.digest.core.scoring.EngagementAggregator;
import com.jimin.digest.entity.Item;

import java.text.Collator;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * RankingEngine - 정렬 옵션별 결정적 정렬
 *
 * List.sort (TimSort)는 안정 정렬 → 키가 같으면 입력 순서 유지.
 * 동점일 때 보조 키를 쓰지 않는다 (출력이 입력 순서에만 의존).
 * 입력 리스트는 변경하지 않고 새 리스트를 돌려준다.
 */
public class RankingEngine {

    private final EngagementAggregator engagementAggregator;
    private final Locale locale;

    public RankingEngine(EngagementAggregator engagementAggregator, Locale locale) {
        this.engagementAggregator = engagementAggregator;
        this.locale = locale;
    }

    public List<Item> sort(List<Item> items, SortOption option) {
        List<Item> sorted = new ArrayList<>(items);
        sorted.sort(comparator(option));
        return sorted;
    }

    Comparator<Item> comparator(SortOption option) {
        return switch (option) {
            case QUALITY_DESC -> quality().reversed();
            case QUALITY_ASC -> quality();
            case RECENCY_DESC -> recency().reversed();
            case RECENCY_ASC -> recency();
            case ENGAGEMENT_DESC -> engagement().reversed();
            case TITLE_ASC -> title();
            case TITLE_DESC -> title().reversed();
        };
    }

    private Comparator<Item> quality() {
        return Comparator.comparingDouble(Item::getTotalScore);
    }

    private Comparator<Item> recency() {
        return Comparator.comparing(Item::getPublishedAt, Comparator.nullsFirst(Comparator.naturalOrder()));
    }

    private Comparator<Item> engagement() {
        return Comparator.comparingDouble(item -> engagementAggregator.aggregate(item.getEngagement()));
    }

    private Comparator<Item> title() {
        // Collator는 스레드 안전하지 않음 → 정렬 호출마다 새로 생성
        Collator collator = Collator.getInstance(locale);
        return Comparator.comparing(item -> item.getTitle() == null ? "" : item.getTitle(), collator);
    }
}
