package com.jimin.digest.controller;

import com.jimin.digest.dto.DigestResponse;
import com.jimin.digest.dto.PublishDigestRequest;
import com.jimin.digest.service.DigestService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Tag(name = "Digests", description = "다이제스트 발행/조회 API")
@RestController
@RequestMapping("/api/digests")
@RequiredArgsConstructor
public class DigestController {

    private final DigestService digestService;

    @Operation(summary = "다이제스트 목록 (최신순)")
    @GetMapping
    public ResponseEntity<List<DigestResponse>> listDigests() {
        return ResponseEntity.ok(digestService.listDigests());
    }

    @Operation(summary = "slug로 다이제스트 조회")
    @GetMapping("/{slug}")
    public ResponseEntity<DigestResponse> getDigest(@PathVariable String slug) {
        return ResponseEntity.ok(digestService.getDigest(slug));
    }

    @Operation(summary = "기간 내 아이템으로 다이제스트 발행")
    @PostMapping
    public ResponseEntity<DigestResponse> publish(@Valid @RequestBody PublishDigestRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(digestService.publish(request.slug(), request.windowStart(), request.windowEnd()));
    }
}
