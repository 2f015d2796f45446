package com.jimin.digest.repository;

import com.jimin.digest.entity.Feed;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface FeedRepository extends JpaRepository<Feed, Long> {

    // Why: 승인된 피드만 카탈로그 노출
    List<Feed> findByApprovedTrueOrderByNameAsc();

    // Why: 승인 + 활성 피드만 수집 대상. 수집은 트랜잭션 밖에서 피드 토픽을 읽는다.
    @EntityGraph(attributePaths = "topics")
    List<Feed> findByApprovedTrueAndActiveTrue();

    boolean existsByUrl(String url);
}
