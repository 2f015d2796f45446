package com.jimin.digest.controller;

import com.jimin.digest.dto.TierInfoResponse;
import com.jimin.digest.service.UserTierService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Tier", description = "구독 등급 API")
@RestController
@RequestMapping("/api/me")
@RequiredArgsConstructor
public class TierController {

    private final UserTierService userTierService;

    @Operation(summary = "내 등급 + 스코프별 사용 가능 여부")
    @GetMapping("/tier")
    public ResponseEntity<TierInfoResponse> myTier(
            @RequestHeader(value = ApiHeaders.USER_ID, required = false) String userId) {
        return ResponseEntity.ok(userTierService.describe(userId));
    }
}
