package com.aigreentick.services.subscriptions.scheduler;

import com.aigreentick.services.subscriptions.constants.SubscriptionStatus;
import com.aigreentick.services.subscriptions.dto.response.GatewayStatus;
import com.aigreentick.services.subscriptions.entity.Subscription;
import com.aigreentick.services.subscriptions.service.StkStatusPoller;
import com.aigreentick.services.subscriptions.service.SubscriptionStateMachine;
import com.aigreentick.services.subscriptions.store.SubscriptionCriteria;
import com.aigreentick.services.subscriptions.store.SubscriptionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * ══════════════════════════════════════════════════════════════════
 * Subscription Maintenance Scheduler
 * ══════════════════════════════════════════════════════════════════
 *
 *   1. Expiry sweep: ACTIVE records past their endDate → EXPIRED
 *
 *   2. Stale pending poll: the fallback for lost webhooks. PENDING
 *      records with a checkoutRequestId, older than min-age (the webhook
 *      normally lands well within it) and younger than max-age, get one
 *      status query each per run.
 *
 * SCHEDULE
 * ─────────
 *   Expiry sweep:        subscriptions.expiry-sweep.cron      (default every 5 min)
 *   Stale pending poll:  subscriptions.pending-poll.interval  (default 5 min)
 *
 * Both are safe to overlap with webhooks and with other instances:
 * every transition is a guarded write.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SubscriptionMaintenanceScheduler {

    private final SubscriptionStateMachine stateMachine;
    private final StkStatusPoller statusPoller;
    private final SubscriptionStore subscriptionStore;
    private final Clock clock;

    @Value("${subscriptions.pending-poll.min-age:PT2M}")
    private Duration pendingMinAge;

    @Value("${subscriptions.pending-poll.max-age:PT1H}")
    private Duration pendingMaxAge;

    @Value("${subscriptions.pending-poll.batch-size:50}")
    private int pendingBatchSize;

    // ════════════════════════════════════════════════════════════
    // 1. Expiry sweep
    // ════════════════════════════════════════════════════════════

    @Scheduled(cron = "${subscriptions.expiry-sweep.cron:0 */5 * * * *}")
    public void runExpirySweep() {
        try {
            int expired = stateMachine.sweepExpired();
            if (expired > 0) {
                log.info("Expiry sweep: {} subscription(s) expired", expired);
            } else {
                log.debug("Expiry sweep: nothing to expire");
            }
        } catch (Exception ex) {
            log.error("Expiry sweep failed: {}", ex.getMessage(), ex);
        }
    }

    // ════════════════════════════════════════════════════════════
    // 2. Stale pending poll
    // ════════════════════════════════════════════════════════════

    @Scheduled(fixedDelayString = "${subscriptions.pending-poll.interval:PT5M}",
            initialDelayString = "${subscriptions.pending-poll.initial-delay:PT1M}")
    public void pollStalePending() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<Subscription> stale = subscriptionStore.find(SubscriptionCriteria.builder()
                .status(SubscriptionStatus.PENDING)
                .hasCheckoutRequestId(true)
                .createdBefore(now.minus(pendingMinAge))
                .createdAfter(now.minus(pendingMaxAge))
                .limit(pendingBatchSize)
                .build());

        if (stale.isEmpty()) {
            log.debug("Pending poll: no stale pending subscriptions");
            return;
        }

        log.info("Pending poll: querying {} stale pending subscription(s)", stale.size());
        int settled = 0;
        for (Subscription subscription : stale) {
            try {
                GatewayStatus status = statusPoller.query(subscription.getCheckoutRequestId());
                if (status.isSettled()) {
                    settled++;
                }
            } catch (Exception ex) {
                log.warn("Pending poll: query failed for subscription {} (checkoutRequestId={}): {}",
                        subscription.getId(), subscription.getCheckoutRequestId(), ex.getMessage());
            }
        }
        log.info("Pending poll complete: {}/{} settled", settled, stale.size());
    }
}
