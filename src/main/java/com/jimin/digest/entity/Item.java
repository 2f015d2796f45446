package com.jimin.digest.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Item Entity - 큐레이션된 개별 콘텐츠
 *
 * DB 테이블: items
 * 생명주기:
 *  - 수집 시 생성 (토픽 검증 + 방법론 분류 완료 상태로만 저장)
 *  - 참여/서브점수 입력이 바뀔 때마다 점수 재계산
 *  - 삭제하지 않음 (과거 다이제스트 보존)
 *  - archived=true 이면 참여 카운터 외 변경 불가
 */
@Entity
@Table(name = "items", indexes = {
        @Index(name = "items_source_type_idx", columnList = "source_type"),
        @Index(name = "items_published_at_idx", columnList = "published_at")
})
@Getter
@Setter
@NoArgsConstructor
public class Item {

    @Id
    @Column(length = 36)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_type", nullable = false, length = 20)
    private SourceType sourceType;

    // 수집 출처 피드 (수동 수집이면 null)
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "feed_id")
    private Feed feed;

    @Column(nullable = false, length = 500)
    private String title;

    @Column(nullable = false, length = 1000)
    private String url;

    @Column(length = 255)
    private String doi;

    @Column(name = "journal_name", length = 255)
    private String journalName;

    @Column(name = "author_or_channel", length = 255)
    private String authorOrChannel;

    @Column(columnDefinition = "TEXT")
    private String excerpt;

    @Column(name = "published_at", nullable = false, updatable = false)
    private LocalDateTime publishedAt;

    @Column(name = "ingested_at", nullable = false, updatable = false)
    private LocalDateTime ingestedAt;

    // 표시 순서 유지 (정렬에는 영향 없음)
    @ElementCollection
    @CollectionTable(name = "item_topics", joinColumns = @JoinColumn(name = "item_id"))
    @OrderColumn(name = "position")
    @Column(name = "topic", nullable = false, length = 64)
    private List<String> topics = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Methodology methodology = Methodology.NA;

    @Column(nullable = false)
    private boolean preprint;

    @Embedded
    private Engagement engagement = new Engagement();

    // 명시 서브점수 입력 (AI 분석, 관리자 입력 등). 도출 서브점수보다 우선.
    @ElementCollection
    @CollectionTable(name = "item_subscore_inputs", joinColumns = @JoinColumn(name = "item_id"))
    @MapKeyColumn(name = "name", length = 64)
    @Column(name = "score_value", nullable = false)
    private Map<String, Double> subscoreInputs = new HashMap<>();

    // 계산 결과 (ItemScoringService만 갱신)
    @ElementCollection
    @CollectionTable(name = "item_subscores", joinColumns = @JoinColumn(name = "item_id"))
    @MapKeyColumn(name = "name", length = 64)
    @Column(name = "score_value", nullable = false)
    private Map<String, Double> subscores = new HashMap<>();

    @Column(name = "total_score", nullable = false)
    private double totalScore;

    // URL/DOI + 제목 기반 중복 방지 해시
    @Column(name = "hash_dedupe", nullable = false, length = 64, unique = true)
    private String hashDedupe;

    @Column(nullable = false)
    private boolean archived;

    @Version
    private Long version;
}
