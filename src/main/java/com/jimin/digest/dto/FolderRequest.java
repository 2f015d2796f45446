package com.jimin.digest.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * 폴더 생성/수정 요청 DTO
 *
 * 생성 시 name 필수 (Service에서 확인), 수정 시 null 필드는 유지
 */
public record FolderRequest(

        @Size(min = 1, max = 100, message = "폴더 이름은 1~100자입니다")
        String name,

        @Size(max = 500, message = "설명은 최대 500자입니다")
        String description,

        @Pattern(regexp = "^#[0-9a-fA-F]{6}$", message = "색상은 #RRGGBB 형식입니다")
        String color
) {
}
