package com.jimin.digest.controller;

import com.jimin.digest.core.access.ScopeType;
import com.jimin.digest.core.access.SearchScope;
import com.jimin.digest.core.ranking.SortOption;
import com.jimin.digest.dto.EngagementDeltaRequest;
import com.jimin.digest.dto.FolderResponse;
import com.jimin.digest.dto.ItemResponse;
import com.jimin.digest.dto.SubscoreUpdateRequest;
import com.jimin.digest.service.FolderMembershipService;
import com.jimin.digest.service.ItemQueryService;
import com.jimin.digest.service.ItemScoringService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Tag(name = "Items", description = "아이템 검색 / 점수 API")
@RestController
@RequestMapping("/api/items")
@RequiredArgsConstructor
public class ItemController {

    private final ItemQueryService itemQueryService;
    private final ItemScoringService itemScoringService;
    private final FolderMembershipService membershipService;

    /**
     * scope 생략 시 최신 다이제스트 (digestId만 주면 해당 다이제스트)
     * 예: GET /api/items?scope=folder&folderId=3&sort=recency-desc
     */
    @Operation(summary = "스코프 검색 + 정렬 (current_digest / all_digests / saved_items / folder)")
    @GetMapping
    public ResponseEntity<List<ItemResponse>> search(
            @RequestParam(required = false) String scope,
            @RequestParam(required = false) Long digestId,
            @RequestParam(required = false) Long folderId,
            @RequestParam(required = false, defaultValue = "quality-desc") String sort,
            @RequestHeader(value = ApiHeaders.USER_ID, required = false) String userId) {
        SearchScope searchScope;
        if (scope != null) {
            searchScope = new SearchScope(ScopeType.fromValue(scope), digestId, folderId);
        } else {
            searchScope = digestId != null ? SearchScope.currentDigest(digestId) : null;
        }
        return ResponseEntity.ok(itemQueryService.search(searchScope, SortOption.fromValue(sort), userId));
    }

    @Operation(summary = "아이템 상세 (서브점수 포함)")
    @GetMapping("/{id}")
    public ResponseEntity<ItemResponse> getItem(@PathVariable String id) {
        return ResponseEntity.ok(itemQueryService.getItem(id));
    }

    @Operation(summary = "아이템이 들어 있는 내 폴더 목록")
    @GetMapping("/{id}/folders")
    public ResponseEntity<List<FolderResponse>> getItemFolders(
            @PathVariable String id,
            @RequestHeader(ApiHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(membershipService.foldersOf(userId, id));
    }

    @Operation(summary = "참여 카운터 증가 (점수 재계산)")
    @PostMapping("/{id}/engagement")
    public ResponseEntity<ItemResponse> recordEngagement(
            @PathVariable String id,
            @Valid @RequestBody EngagementDeltaRequest request) {
        return ResponseEntity.ok(itemScoringService.recordEngagement(id, request));
    }

    @Operation(summary = "명시 서브점수 교체 (점수 재계산, archived 불가)")
    @PutMapping("/{id}/subscores")
    public ResponseEntity<ItemResponse> replaceSubscores(
            @PathVariable String id,
            @Valid @RequestBody SubscoreUpdateRequest request) {
        return ResponseEntity.ok(itemScoringService.replaceSubscoreInputs(id, request.subscores()));
    }
}
