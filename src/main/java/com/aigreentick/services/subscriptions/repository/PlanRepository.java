package com.aigreentick.services.subscriptions.repository;

import com.aigreentick.services.subscriptions.constants.SubscriptionCategory;
import com.aigreentick.services.subscriptions.entity.Plan;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PlanRepository extends JpaRepository<Plan, Long> {

    List<Plan> findByCategoryOrderByAmountAsc(SubscriptionCategory category);

    Optional<Plan> findByCategoryAndName(SubscriptionCategory category, String name);
}
