package com.jimin.digest.repository;

import com.jimin.digest.entity.Digest;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface DigestRepository extends JpaRepository<Digest, Long> {

    Optional<Digest> findBySlug(String slug);

    boolean existsBySlug(String slug);

    // Why: 스코프 미지정 요청은 가장 최근 다이제스트를 대상으로 함
    Optional<Digest> findFirstByOrderByGeneratedAtDescIdDesc();

    List<Digest> findAllByOrderByGeneratedAtDesc();
}
