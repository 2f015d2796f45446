package com.jimin.digest.service;

import com.jimin.digest.core.access.QuerySpec;
import com.jimin.digest.core.access.ScopeResolver;
import com.jimin.digest.core.access.SearchScope;
import com.jimin.digest.core.access.Tier;
import com.jimin.digest.core.ranking.RankingEngine;
import com.jimin.digest.core.ranking.SortOption;
import com.jimin.digest.dto.ItemResponse;
import com.jimin.digest.entity.Item;
import com.jimin.digest.exception.DigestNotFoundException;
import com.jimin.digest.exception.ItemNotFoundException;
import com.jimin.digest.repository.DigestRepository;
import com.jimin.digest.repository.ItemRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 아이템 조회 Service
 *
 * 흐름: 스코프 해석(등급/소유 검증) → 대상 아이템 로드 → 정렬
 * 스코프 미지정이면 가장 최근 다이제스트의 current_digest
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ItemQueryService {

    private final ItemRepository itemRepository;
    private final DigestRepository digestRepository;
    private final ScopeResolver scopeResolver;
    private final RankingEngine rankingEngine;
    private final UserTierService userTierService;

    public List<ItemResponse> search(SearchScope scope, SortOption sort, String userId) {
        Tier tier = userTierService.tierOf(userId);
        SearchScope effective = scope != null ? scope : latestDigestScope();
        QuerySpec spec = scopeResolver.resolve(effective, tier, userId);

        List<Item> items = switch (spec.type()) {
            case CURRENT_DIGEST -> itemRepository.findByDigestId(spec.digestId());
            case ALL_DIGESTS -> itemRepository.findAllInDigests();
            case SAVED_ITEMS -> itemRepository.findSavedByUser(spec.userId());
            case FOLDER -> itemRepository.findByFolderId(spec.folderId());
        };

        return rankingEngine.sort(items, sort == null ? SortOption.QUALITY_DESC : sort)
                .stream()
                .map(ItemResponse::from)
                .toList();
    }

    public ItemResponse getItem(String itemId) {
        return itemRepository.findById(itemId)
                .map(ItemResponse::from)
                .orElseThrow(() -> new ItemNotFoundException(itemId));
    }

    private SearchScope latestDigestScope() {
        return digestRepository.findFirstByOrderByGeneratedAtDescIdDesc()
                .map(digest -> SearchScope.currentDigest(digest.getId()))
                .orElseThrow(() -> new DigestNotFoundException("latest"));
    }
}
