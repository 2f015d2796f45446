package com.jimin.digest.controller;

import com.jimin.digest.audit.CatalogAuditReport;
import com.jimin.digest.dto.FeedResponse;
import com.jimin.digest.dto.FeedSubmitRequest;
import com.jimin.digest.service.CatalogService;
import com.jimin.digest.service.FeedFetchService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@Tag(name = "Catalog", description = "피드 카탈로그 API")
@RestController
@RequestMapping("/api/catalog")
@RequiredArgsConstructor
public class CatalogController {

    private final CatalogService catalogService;
    private final FeedFetchService fetchService;

    @Operation(summary = "승인된 피드 목록")
    @GetMapping
    public ResponseEntity<List<FeedResponse>> listApproved() {
        return ResponseEntity.ok(catalogService.listApproved());
    }

    @Operation(summary = "피드 제출 (토픽 검증, 승인 대기)")
    @PostMapping
    public ResponseEntity<FeedResponse> submit(
            @RequestHeader(value = ApiHeaders.USER_ID, required = false) String userId,
            @Valid @RequestBody FeedSubmitRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(catalogService.submit(request, userId));
    }

    @Operation(summary = "피드 승인")
    @PatchMapping("/{id}/approve")
    public ResponseEntity<FeedResponse> approve(@PathVariable Long id) {
        return ResponseEntity.ok(catalogService.approve(id));
    }

    @Operation(summary = "카탈로그 토픽 감사")
    @GetMapping("/audit")
    public ResponseEntity<CatalogAuditReport> audit() {
        return ResponseEntity.ok(catalogService.audit());
    }

    @Operation(summary = "수동 피드 수집 트리거")
    @PostMapping("/fetch")
    public ResponseEntity<Map<String, Integer>> triggerFetch() {
        return ResponseEntity.ok(Map.of("ingested", fetchService.fetchAllFeeds()));
    }
}
