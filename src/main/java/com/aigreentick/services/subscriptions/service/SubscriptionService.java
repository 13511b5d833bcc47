package com.aigreentick.services.subscriptions.service;

import com.aigreentick.services.subscriptions.constants.SubscriptionCategory;
import com.aigreentick.services.subscriptions.constants.SubscriptionStatus;
import com.aigreentick.services.subscriptions.dto.request.PushPaymentCommand;
import com.aigreentick.services.subscriptions.dto.request.SubscribeRequest;
import com.aigreentick.services.subscriptions.dto.response.PushResult;
import com.aigreentick.services.subscriptions.dto.response.SubscribeResponse;
import com.aigreentick.services.subscriptions.dto.response.SubscriptionResponse;
import com.aigreentick.services.subscriptions.entity.Plan;
import com.aigreentick.services.subscriptions.entity.Subscription;
import com.aigreentick.services.subscriptions.exception.DuplicateSubscriptionException;
import com.aigreentick.services.subscriptions.exception.InvalidRequestException;
import com.aigreentick.services.subscriptions.exception.SubscriptionNotFoundException;
import com.aigreentick.services.subscriptions.exception.SubscriptionServiceException;
import com.aigreentick.services.subscriptions.mapper.SubscriptionMapper;
import com.aigreentick.services.subscriptions.store.SubscriptionCriteria;
import com.aigreentick.services.subscriptions.store.SubscriptionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Caller-facing subscription flows. Owner ids come from the upstream
 * gateway and are trusted as given.
 *
 * Not @Transactional: push and status query are network calls, and each
 * state change commits on its own in the store.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubscriptionService {

    static final String PUSH_FAILED_REASON = "Payment request could not be sent. Please try again.";

    private final PlanService planService;
    private final SubscriptionStore subscriptionStore;
    private final SubscriptionStateMachine stateMachine;
    private final StkPushInitiator pushInitiator;
    private final StkStatusPoller statusPoller;
    private final PhoneNumberNormalizer phoneNumberNormalizer;
    private final Clock clock;

    // ========================
    // SUBSCRIBE
    // ========================

    /**
     * Create a PENDING subscription and prompt the payer's phone.
     *
     * The correlation ids are stored before this returns. If the push
     * fails, the record can never be reconciled and is marked FAILED.
     */
    public SubscribeResponse subscribe(String ownerId, SubscribeRequest request) {
        requireOwner(ownerId);
        Plan plan = planService.resolve(request.getCategory(), request.getPlan());
        phoneNumberNormalizer.normalize(request.getPhone());
        ensureNoRunningSubscription(ownerId, plan.getCategory());

        Subscription subscription = stateMachine.createPending(ownerId, plan);

        PushResult pushResult;
        try {
            pushResult = pushInitiator.initiate(PushPaymentCommand.builder()
                    .phone(request.getPhone())
                    .amount(plan.getAmount())
                    .accountReference(subscription.accountReference())
                    .build());
        } catch (SubscriptionServiceException ex) {
            log.error("STK push failed for subscription {}: {}", subscription.getId(), ex.getMessage());
            stateMachine.fail(subscription, ex.getMessage());
            throw ex;
        } catch (RuntimeException ex) {
            log.error("STK push failed unexpectedly for subscription {}", subscription.getId(), ex);
            stateMachine.fail(subscription, PUSH_FAILED_REASON);
            throw ex;
        }

        if (!stateMachine.attachCheckout(subscription.getId(), pushResult)) {
            // Settled elsewhere (e.g. cancelled) while the push was in flight.
            return SubscriptionMapper.toSubscribeResponse(reload(subscription.getId()), null);
        }
        return SubscriptionMapper.toSubscribeResponse(reload(subscription.getId()), pushResult);
    }

    // ========================
    // READ
    // ========================

    public List<SubscriptionResponse> listForOwner(String ownerId) {
        requireOwner(ownerId);
        return subscriptionStore.find(SubscriptionCriteria.builder().ownerId(ownerId).build())
                .stream()
                .map(SubscriptionMapper::toSubscriptionResponse)
                .collect(Collectors.toList());
    }

    public SubscriptionResponse getForOwner(String ownerId, Long id) {
        return SubscriptionMapper.toSubscriptionResponse(findOwned(ownerId, id));
    }

    /**
     * Synchronous freshness check: queries the gateway for a PENDING record
     * that has a correlation id, then returns the re-read record.
     */
    public SubscriptionResponse refresh(String ownerId, Long id) {
        Subscription subscription = findOwned(ownerId, id);
        if (subscription.isPending() && subscription.hasCheckoutRequest()) {
            statusPoller.query(subscription.getCheckoutRequestId());
            subscription = reload(id);
        }
        return SubscriptionMapper.toSubscriptionResponse(subscription);
    }

    // ========================
    // CANCEL
    // ========================

    public SubscriptionResponse cancel(String ownerId, Long id) {
        Subscription subscription = findOwned(ownerId, id);
        if (!stateMachine.cancel(subscription)) {
            log.warn("Cancel of subscription {} lost a race, returning current state", id);
        }
        return SubscriptionMapper.toSubscriptionResponse(reload(id));
    }

    // ========================
    // PRIVATE HELPERS
    // ========================

    private void ensureNoRunningSubscription(String ownerId, SubscriptionCategory category) {
        boolean running = !subscriptionStore.find(SubscriptionCriteria.builder()
                .ownerId(ownerId)
                .category(category)
                .status(SubscriptionStatus.ACTIVE)
                .endDateAfter(LocalDateTime.now(clock))
                .limit(1)
                .build()).isEmpty();
        if (running) {
            throw DuplicateSubscriptionException.activeInCategory(category.getValue());
        }
    }

    private Subscription findOwned(String ownerId, Long id) {
        requireOwner(ownerId);
        return subscriptionStore.findById(id)
                .filter(s -> ownerId.equals(s.getOwnerId()))
                .orElseThrow(() -> SubscriptionNotFoundException.withId(id));
    }

    private Subscription reload(Long id) {
        return subscriptionStore.findById(id)
                .orElseThrow(() -> SubscriptionNotFoundException.withId(id));
    }

    private void requireOwner(String ownerId) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new InvalidRequestException("Missing caller identity");
        }
    }
}
