package com.jimin.digest.repository;

import com.jimin.digest.entity.UserSubscription;
import org.springframework.data.jpa.repository.JpaRepository;

public interface UserSubscriptionRepository extends JpaRepository<UserSubscription, String> {
}
