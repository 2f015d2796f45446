package com.jimin.digest.dto;

import com.jimin.digest.entity.Digest;

import java.time.LocalDateTime;

public record DigestResponse(
        Long id,
        String slug,
        LocalDateTime windowStart,
        LocalDateTime windowEnd,
        LocalDateTime generatedAt,
        int itemCount
) {
    public static DigestResponse from(Digest digest) {
        return new DigestResponse(
                digest.getId(),
                digest.getSlug(),
                digest.getWindowStart(),
                digest.getWindowEnd(),
                digest.getGeneratedAt(),
                digest.getItems().size()
        );
    }
}
