package com.jimin.digest.service;

import com.jimin.digest.core.access.SearchScope;
import com.jimin.digest.core.ranking.SortOption;
import com.jimin.digest.dto.DigestResponse;
import com.jimin.digest.dto.ItemResponse;
import com.jimin.digest.entity.Item;
import com.jimin.digest.entity.SourceType;
import com.jimin.digest.exception.DigestNotFoundException;
import com.jimin.digest.repository.DigestRepository;
import com.jimin.digest.repository.ItemRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
class DigestServiceTest {

    private static final LocalDateTime WEEK_START = LocalDateTime.of(2025, 5, 5, 0, 0);
    private static final LocalDateTime WEEK_END = LocalDateTime.of(2025, 5, 12, 0, 0);

    @Autowired
    private DigestService digestService;

    @Autowired
    private ItemQueryService itemQueryService;

    @Autowired
    private DigestRepository digestRepository;

    @Autowired
    private ItemRepository itemRepository;

    @AfterEach
    void tearDown() {
        digestRepository.deleteAll();
        itemRepository.deleteAll();
    }

    @Test
    void publishCollectsWindowAndFreezesMembership() {
        Item low = itemRepository.save(item("Low", WEEK_START.plusDays(1), 0.3));
        Item high = itemRepository.save(item("High", WEEK_START.plusDays(2), 0.9));
        itemRepository.save(item("Outside", WEEK_END.plusDays(1), 1.0));

        DigestResponse digest = digestService.publish("2025-w19", WEEK_START, WEEK_END);
        itemRepository.save(item("Late arrival", WEEK_START.plusDays(3), 0.95));

        assertThat(digest.itemCount()).isEqualTo(2);
        assertThat(itemQueryService.search(SearchScope.currentDigest(digest.id()), SortOption.QUALITY_DESC, null))
                .extracting(ItemResponse::id)
                .containsExactly(high.getId(), low.getId());
    }

    @Test
    void searchWithoutScopeUsesLatestDigest() {
        Item older = itemRepository.save(item("Older", WEEK_START.minusDays(3), 0.5));
        Item newer = itemRepository.save(item("Newer", WEEK_START.plusDays(1), 0.5));
        DigestResponse previous = digestService.publish("2025-w18", WEEK_START.minusDays(7), WEEK_START.minusDays(1));
        digestService.publish("2025-w19", WEEK_START, WEEK_END);

        assertThat(itemQueryService.search(null, SortOption.TITLE_ASC, null))
                .extracting(ItemResponse::id)
                .containsExactly(newer.getId());
        assertThat(itemQueryService.search(SearchScope.currentDigest(previous.id()), SortOption.TITLE_ASC, null))
                .extracting(ItemResponse::id)
                .containsExactly(older.getId());
        assertThat(digestService.listDigests())
                .extracting(DigestResponse::slug)
                .containsExactlyInAnyOrder("2025-w19", "2025-w18");
    }

    @Test
    void searchWithoutAnyDigestIsNotFound() {
        assertThatThrownBy(() -> itemQueryService.search(null, SortOption.QUALITY_DESC, null))
                .isInstanceOf(DigestNotFoundException.class);
    }

    @Test
    void invalidWindowOrDuplicateSlugRejected() {
        assertThatThrownBy(() -> digestService.publish("bad", WEEK_END, WEEK_START))
                .isInstanceOf(IllegalArgumentException.class);

        digestService.publish("2025-w19", WEEK_START, WEEK_END);
        assertThatThrownBy(() -> digestService.publish("2025-w19", WEEK_START, WEEK_END))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> digestService.getDigest("missing"))
                .isInstanceOf(DigestNotFoundException.class);
    }

    private Item item(String title, LocalDateTime publishedAt, double score) {
        Item item = new Item();
        item.setId(UUID.randomUUID().toString());
        item.setSourceType(SourceType.SUBSTACK);
        item.setTitle(title);
        item.setUrl("https://news.example/" + item.getId());
        item.setPublishedAt(publishedAt);
        item.setIngestedAt(publishedAt);
        item.setTotalScore(score);
        item.setHashDedupe(item.getId().replace("-", ""));
        return item;
    }
}
