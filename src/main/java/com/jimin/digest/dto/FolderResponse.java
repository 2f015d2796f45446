package com.jimin.digest.dto;

import com.jimin.digest.entity.Folder;

import java.time.LocalDateTime;

public record FolderResponse(
        Long id,
        String userId,
        String name,
        String description,
        String color,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static FolderResponse from(Folder folder) {
        return new FolderResponse(
                folder.getId(),
                folder.getUserId(),
                folder.getName(),
                folder.getDescription(),
                folder.getColor(),
                folder.getCreatedAt(),
                folder.getUpdatedAt()
        );
    }
}
