package com.jimin.digest.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * SavedItem Entity - 북마크
 *
 * DB 테이블: saved_items
 * saved_items 스코프의 조회 대상
 */
@Entity
@Table(name = "saved_items",
        uniqueConstraints = @UniqueConstraint(name = "saved_items_user_item_uk", columnNames = {"user_id", "item_id"}))
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SavedItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, length = 255)
    private String userId;

    @Column(name = "item_id", nullable = false, length = 36)
    private String itemId;

    @Column(name = "saved_at", nullable = false, updatable = false)
    private LocalDateTime savedAt;

    public SavedItem(String userId, String itemId) {
        this.userId = userId;
        this.itemId = itemId;
    }

    @PrePersist
    protected void onCreate() {
        savedAt = LocalDateTime.now();
    }
}
