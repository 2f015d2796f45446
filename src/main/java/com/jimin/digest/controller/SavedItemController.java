package com.jimin.digest.controller;

import com.jimin.digest.dto.ItemResponse;
import com.jimin.digest.service.SavedItemService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@Tag(name = "Saved Items", description = "저장(북마크) API")
@RestController
@RequestMapping("/api/saved-items")
@RequiredArgsConstructor
public class SavedItemController {

    private final SavedItemService savedItemService;

    @Operation(summary = "저장 목록 (최근 저장순)")
    @GetMapping
    public ResponseEntity<List<ItemResponse>> listSaved(@RequestHeader(ApiHeaders.USER_ID) String userId) {
        return ResponseEntity.ok(savedItemService.listSaved(userId));
    }

    @Operation(summary = "아이템 저장 (멱등)")
    @PostMapping("/{itemId}")
    public ResponseEntity<Map<String, Boolean>> save(
            @RequestHeader(ApiHeaders.USER_ID) String userId,
            @PathVariable String itemId) {
        return ResponseEntity.ok(Map.of("saved", savedItemService.save(userId, itemId)));
    }

    @Operation(summary = "저장 해제 (멱등)")
    @DeleteMapping("/{itemId}")
    public ResponseEntity<Map<String, Boolean>> unsave(
            @RequestHeader(ApiHeaders.USER_ID) String userId,
            @PathVariable String itemId) {
        return ResponseEntity.ok(Map.of("removed", savedItemService.unsave(userId, itemId)));
    }

    @Operation(summary = "저장 여부")
    @GetMapping("/{itemId}/status")
    public ResponseEntity<Map<String, Boolean>> status(
            @RequestHeader(ApiHeaders.USER_ID) String userId,
            @PathVariable String itemId) {
        return ResponseEntity.ok(Map.of("saved", savedItemService.isSaved(userId, itemId)));
    }
}
