package com.jimin.digest.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Feed Entity - 피드 카탈로그 항목
 *
 * DB 테이블: feed_catalog
 * 역할: "어떤 소스를 수집해도 되는가?" (승인된 피드 = 수집 허가)
 * 아이템을 소유하지 않는다.
 */
@Entity
@Table(name = "feed_catalog")
@Getter
@Setter
@NoArgsConstructor
public class Feed {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(nullable = false, length = 500, unique = true)
    private String url;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_type", nullable = false, length = 20)
    private SourceType sourceType;

    // health, technology 등 대분류
    @Column(length = 50)
    private String domain;

    @Column(nullable = false, length = 100)
    private String category;

    @Column(columnDefinition = "TEXT")
    private String description;

    // 모든 토픽은 Taxonomy 검증을 통과해야 저장된다
    @ElementCollection
    @CollectionTable(name = "feed_topics", joinColumns = @JoinColumn(name = "feed_id"))
    @OrderColumn(name = "position")
    @Column(name = "topic", nullable = false, length = 64)
    private List<String> topics = new ArrayList<>();

    // false면 카탈로그에 노출되지 않고 수집도 하지 않음
    @Column(name = "is_approved", nullable = false)
    private boolean approved;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "submitted_by", length = 255)
    private String submittedBy;

    @Column(name = "approved_at")
    private LocalDateTime approvedAt;

    @Column(name = "last_fetched_at")
    private LocalDateTime lastFetchedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
