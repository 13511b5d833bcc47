package com.aigreentick.services.subscriptions.repository;

import com.aigreentick.services.subscriptions.entity.Subscription;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Spring Data access to subscriptions.
 *
 * Only JpaSubscriptionStore uses this directly. Everything else goes
 * through SubscriptionStore so the guarded-write rule cannot be bypassed.
 */
@Repository
public interface SubscriptionRepository extends JpaRepository<Subscription, Long>,
        JpaSpecificationExecutor<Subscription> {

    Optional<Subscription> findByCheckoutRequestId(String checkoutRequestId);
}
