package com.jimin.digest.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

import java.time.LocalDateTime;

public record PublishDigestRequest(

        @NotBlank(message = "slug는 필수입니다")
        @Pattern(regexp = "^[a-z0-9][a-z0-9-]{0,49}$", message = "slug는 소문자/숫자/하이픈 50자 이내입니다")
        String slug,

        @NotNull(message = "windowStart는 필수입니다")
        LocalDateTime windowStart,

        @NotNull(message = "windowEnd는 필수입니다")
        LocalDateTime windowEnd
) {
}
