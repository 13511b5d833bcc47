package com.aigreentick.services.subscriptions.service;

import com.aigreentick.services.subscriptions.constants.SubscriptionStatus;
import com.aigreentick.services.subscriptions.dto.response.PushResult;
import com.aigreentick.services.subscriptions.entity.Plan;
import com.aigreentick.services.subscriptions.entity.Subscription;
import com.aigreentick.services.subscriptions.exception.InvalidRequestException;
import com.aigreentick.services.subscriptions.store.SubscriptionCriteria;
import com.aigreentick.services.subscriptions.store.SubscriptionPatch;
import com.aigreentick.services.subscriptions.store.SubscriptionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * The only code that changes a subscription's status.
 *
 * Every transition is a guarded write keyed on the status the caller last
 * saw. If another path (webhook, status query, sweep, admin) moved the
 * record first, the write matches nothing and the transition returns
 * false. Losing that race is normal and never an error.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubscriptionStateMachine {

    private final SubscriptionStore subscriptionStore;
    private final Clock clock;

    // ════════════════════════════════════════════════════════════
    // CREATE
    // ════════════════════════════════════════════════════════════

    public Subscription createPending(String ownerId, Plan plan) {
        Duration duration = plan.getDuration();
        if (duration == null) {
            throw InvalidRequestException.planWithoutDuration(plan.getName());
        }
        LocalDateTime now = LocalDateTime.now(clock);

        Subscription created = subscriptionStore.create(Subscription.builder()
                .ownerId(ownerId)
                .category(plan.getCategory())
                .planName(plan.getName())
                .amount(plan.getAmount())
                .status(SubscriptionStatus.PENDING)
                .endDate(now.plus(duration))
                .createdAt(now)
                .updatedAt(now)
                .build());

        log.info("Subscription {} created PENDING: owner={}, plan={}/{}, endDate={}",
                created.getId(), ownerId, plan.getCategory().getValue(), plan.getName(), created.getEndDate());
        return created;
    }

    /**
     * Stores the gateway correlation ids on a still-pending record.
     * Must complete before the subscribe flow returns.
     */
    public boolean attachCheckout(Long subscriptionId, PushResult pushResult) {
        boolean written = subscriptionStore.updateIfStateMatches(subscriptionId, SubscriptionStatus.PENDING,
                SubscriptionPatch.builder()
                        .checkoutRequestId(pushResult.getCheckoutRequestId())
                        .merchantRequestId(pushResult.getMerchantRequestId())
                        .updatedAt(LocalDateTime.now(clock))
                        .build());
        if (written) {
            log.info("Subscription {} linked to checkoutRequestId={}",
                    subscriptionId, pushResult.getCheckoutRequestId());
        } else {
            log.warn("Subscription {} no longer PENDING, checkoutRequestId={} not attached",
                    subscriptionId, pushResult.getCheckoutRequestId());
        }
        return written;
    }

    // ════════════════════════════════════════════════════════════
    // TERMINAL OUTCOMES (webhook and status query share these)
    // ════════════════════════════════════════════════════════════

    public boolean activate(Subscription subscription, PaymentConfirmation confirmation) {
        LocalDateTime now = LocalDateTime.now(clock);
        SubscriptionPatch.SubscriptionPatchBuilder patch = SubscriptionPatch.builder()
                .status(SubscriptionStatus.ACTIVE)
                .receiptNumber(confirmation.getReceiptNumber())
                .paidAmount(confirmation.getPaidAmount())
                .payerPhone(confirmation.getPayerPhone())
                .updatedAt(now);
        if (subscription.getStartDate() == null) {
            patch.startDate(now);
        }
        return transition(subscription, SubscriptionStatus.ACTIVE, patch.build());
    }

    public boolean fail(Subscription subscription, String reason) {
        return transition(subscription, SubscriptionStatus.FAILED, SubscriptionPatch.builder()
                .status(SubscriptionStatus.FAILED)
                .failureReason(reason)
                .updatedAt(LocalDateTime.now(clock))
                .build());
    }

    /**
     * Administrative cancellation from PENDING or ACTIVE.
     *
     * @throws InvalidRequestException if the record is already terminal
     */
    public boolean cancel(Subscription subscription) {
        if (!subscription.getStatus().canTransitionTo(SubscriptionStatus.CANCELLED)) {
            throw new InvalidRequestException("Subscription " + subscription.getId()
                    + " is " + subscription.getStatus().getValue() + " and cannot be cancelled");
        }
        return transition(subscription, SubscriptionStatus.CANCELLED, SubscriptionPatch.builder()
                .status(SubscriptionStatus.CANCELLED)
                .updatedAt(LocalDateTime.now(clock))
                .build());
    }

    // ════════════════════════════════════════════════════════════
    // EXPIRY
    // ════════════════════════════════════════════════════════════

    /**
     * Moves every ACTIVE record whose endDate has been reached to EXPIRED.
     * Safe to run concurrently with itself: a record moved by one run fails
     * the guard in the other.
     *
     * @return number of records this run expired
     */
    public int sweepExpired() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<Subscription> due = subscriptionStore.find(SubscriptionCriteria.builder()
                .status(SubscriptionStatus.ACTIVE)
                .endDateAtOrBefore(now)
                .build());

        int expired = 0;
        for (Subscription subscription : due) {
            boolean written = subscriptionStore.updateIfStateMatches(subscription.getId(), SubscriptionStatus.ACTIVE,
                    SubscriptionPatch.builder()
                            .status(SubscriptionStatus.EXPIRED)
                            .updatedAt(now)
                            .build());
            if (written) {
                expired++;
                log.info("Subscription {} → EXPIRED (endDate={})", subscription.getId(), subscription.getEndDate());
            }
        }
        return expired;
    }

    // ════════════════════════════════════════════════════════════
    // PRIVATE
    // ════════════════════════════════════════════════════════════

    private boolean transition(Subscription subscription, SubscriptionStatus target, SubscriptionPatch patch) {
        SubscriptionStatus from = subscription.getStatus();
        if (!from.canTransitionTo(target)) {
            log.info("Subscription {} is {}, ignoring transition to {}",
                    subscription.getId(), from.getValue(), target.getValue());
            return false;
        }

        boolean written = subscriptionStore.updateIfStateMatches(subscription.getId(), from, patch);
        if (written) {
            log.info("Subscription {} {} → {}", subscription.getId(), from, target);
        } else {
            log.warn("Subscription {} transition {} → {} dropped: status changed concurrently",
                    subscription.getId(), from, target);
        }
        return written;
    }
}
