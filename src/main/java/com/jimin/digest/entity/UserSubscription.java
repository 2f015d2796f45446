package com.jimin.digest.entity;

import com.jimin.digest.core.access.Tier;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * UserSubscription Entity - 사용자 구독 등급
 *
 * DB 테이블: user_subscriptions
 * 결제 연동(외부)이 갱신하고, 이 서비스는 읽기만 한다.
 * testAccount=true 이면 등급과 관계없이 pro 취급
 */
@Entity
@Table(name = "user_subscriptions")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserSubscription {

    @Id
    @Column(name = "user_id", length = 255)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Tier tier = Tier.FREE;

    @Column(name = "test_account", nullable = false)
    private boolean testAccount;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public UserSubscription(String userId, Tier tier) {
        this.userId = userId;
        this.tier = tier;
    }
}
