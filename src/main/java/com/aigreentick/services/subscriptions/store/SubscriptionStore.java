package com.aigreentick.services.subscriptions.store;

import com.aigreentick.services.subscriptions.constants.SubscriptionStatus;
import com.aigreentick.services.subscriptions.entity.Subscription;

import java.util.List;
import java.util.Optional;

/**
 * Persistence capability used by the payment orchestration core.
 *
 * All status changes go through updateIfStateMatches(): a write whose
 * expected state no longer matches the stored one is dropped and reported
 * as false, never as an error. Concurrent writers (webhook, status poll,
 * expiry sweep) rely on this instead of locks.
 */
public interface SubscriptionStore {

    Subscription create(Subscription subscription);

    Optional<Subscription> findById(Long id);

    List<Subscription> find(SubscriptionCriteria criteria);

    default Optional<Subscription> findByCheckoutRequestId(String checkoutRequestId) {
        return find(SubscriptionCriteria.builder()
                .checkoutRequestId(checkoutRequestId)
                .limit(1)
                .build())
                .stream()
                .findFirst();
    }

    /**
     * Apply the non-null fields of the patch only if the record is still in expectedState.
     *
     * @return true if exactly this call changed the record
     */
    boolean updateIfStateMatches(Long id, SubscriptionStatus expectedState, SubscriptionPatch patch);
}
