package com.jimin.digest.controller;

import com.jimin.digest.core.ranking.SortOption;
import com.jimin.digest.dto.FolderRequest;
import com.jimin.digest.dto.FolderResponse;
import com.jimin.digest.dto.ItemResponse;
import com.jimin.digest.service.FolderMembershipService;
import com.jimin.digest.service.FolderService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@Tag(name = "Folders", description = "폴더 (pro) API")
@RestController
@RequestMapping("/api/folders")
@RequiredArgsConstructor
public class FolderController {

    private final FolderService folderService;
    private final FolderMembershipService membershipService;

    @Operation(summary = "내 폴더 목록")
    @GetMapping
    public ResponseEntity<List<FolderResponse>> listFolders(@RequestHeader(ApiHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(folderService.listFolders(userId));
    }

    @Operation(summary = "폴더 생성 (pro)")
    @PostMapping
    public ResponseEntity<FolderResponse> createFolder(
            @RequestHeader(ApiHeaders.USER_ID) String userId,
            @Valid @RequestBody FolderRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(folderService.createFolder(userId, request));
    }

    @Operation(summary = "폴더 이름/설명/색상 수정")
    @PatchMapping("/{id}")
    public ResponseEntity<FolderResponse> updateFolder(
            @RequestHeader(ApiHeaders.USER_ID) String userId,
            @PathVariable Long id,
            @Valid @RequestBody FolderRequest request) {
        return ResponseEntity.ok(folderService.updateFolder(userId, id, request));
    }

    @Operation(summary = "폴더 삭제 (멤버십 함께 제거, 아이템은 유지)")
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteFolder(
            @RequestHeader(ApiHeaders.USER_ID) String userId,
            @PathVariable Long id) {
        folderService.deleteFolder(userId, id);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "폴더 안 아이템 (pro + 소유자)")
    @GetMapping("/{id}/items")
    public ResponseEntity<List<ItemResponse>> folderItems(
            @RequestHeader(ApiHeaders.USER_ID) String userId,
            @PathVariable Long id,
            @RequestParam(required = false, defaultValue = "quality-desc") String sort) {
        return ResponseEntity.ok(folderService.folderItems(userId, id, SortOption.fromValue(sort)));
    }

    @Operation(summary = "폴더에 아이템 추가 (멱등)")
    @PostMapping("/{id}/items/{itemId}")
    public ResponseEntity<Map<String, Boolean>> addItem(
            @RequestHeader(ApiHeaders.USER_ID) String userId,
            @PathVariable Long id,
            @PathVariable String itemId) {
        boolean added = membershipService.add(userId, id, itemId);
        return ResponseEntity.ok(Map.of("added", added));
    }

    @Operation(summary = "폴더에서 아이템 제거 (멱등)")
    @DeleteMapping("/{id}/items/{itemId}")
    public ResponseEntity<Map<String, Boolean>> removeItem(
            @RequestHeader(ApiHeaders.USER_ID) String userId,
            @PathVariable Long id,
            @PathVariable String itemId) {
        boolean removed = membershipService.remove(userId, id, itemId);
        return ResponseEntity.ok(Map.of("removed", removed));
    }
}
