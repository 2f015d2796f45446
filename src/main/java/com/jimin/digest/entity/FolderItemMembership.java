package com.jimin.digest.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * FolderItemMembership Entity - 폴더 ↔ 아이템 다대다 연결
 *
 * DB 테이블: item_folders
 * (folder_id, item_id) UNIQUE → 멤버십은 집합 (중복 없음)
 * 폴더 삭제 시 함께 삭제, 아이템 삭제 시에는 지연 정리 허용 (FK 없음)
 */
@Entity
@Table(name = "item_folders",
        uniqueConstraints = @UniqueConstraint(name = "item_folders_folder_item_uk", columnNames = {"folder_id", "item_id"}),
        indexes = @Index(name = "item_folders_item_id_idx", columnList = "item_id"))
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FolderItemMembership {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "folder_id", nullable = false)
    private Long folderId;

    @Column(name = "item_id", nullable = false, length = 36)
    private String itemId;

    @Column(name = "added_at", nullable = false, updatable = false)
    private LocalDateTime addedAt;

    public FolderItemMembership(Long folderId, String itemId) {
        this.folderId = folderId;
        this.itemId = itemId;
    }

    @PrePersist
    protected void onCreate() {
        addedAt = LocalDateTime.now();
    }
}
