package com.aigreentick.services.subscriptions.service;

import com.aigreentick.services.subscriptions.constants.SubscriptionConstants;
import com.aigreentick.services.subscriptions.dto.response.CallbackAck;
import com.aigreentick.services.subscriptions.entity.Subscription;
import com.aigreentick.services.subscriptions.store.SubscriptionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Applies one outcome webhook to its subscription.
 *
 * Daraja delivers at least once, so the same outcome may arrive repeatedly
 * and after a status query already settled the record. Only a PENDING record
 * is ever changed; every other case logs and acknowledges. The gateway is
 * always told "Accepted": a failure here is ours to investigate, and a
 * rejection would only make Daraja redeliver.
 *
 * Success requires MpesaReceiptNumber, Amount and AccountReference. A
 * success missing any of them leaves the record PENDING for the status
 * poll to settle.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CallbackReconciler {

    private final SubscriptionStore subscriptionStore;
    private final SubscriptionStateMachine stateMachine;

    public CallbackAck reconcile(OutcomeNotification notification) {
        try {
            apply(notification);
        } catch (RuntimeException ex) {
            log.error("Failed to reconcile outcome for checkoutRequestId={}: {}",
                    notification.getCheckoutRequestId(), ex.getMessage(), ex);
        }
        return CallbackAck.accepted();
    }

    private void apply(OutcomeNotification notification) {
        String checkoutRequestId = notification.getCheckoutRequestId();
        if (checkoutRequestId == null || checkoutRequestId.isBlank()) {
            log.warn("Outcome notification without CheckoutRequestID ignored");
            return;
        }

        Optional<Subscription> found = lookup(checkoutRequestId);
        if (found.isEmpty()) {
            log.warn("No subscription for checkoutRequestId={}, notification ignored", checkoutRequestId);
            return;
        }
        Subscription subscription = found.get();

        if (!subscription.isPending()) {
            log.info("Subscription {} already {}, duplicate notification ignored (resultCode={})",
                    subscription.getId(), subscription.getStatus().getValue(), notification.getResultCode());
            return;
        }

        if (notification.getResultCode() == null) {
            log.warn("Notification for subscription {} has no ResultCode, ignored", subscription.getId());
            return;
        }

        if (notification.isSuccess()) {
            activate(subscription, notification);
        } else {
            log.info("Payment failed for subscription {}: resultCode={}, desc={}",
                    subscription.getId(), notification.getResultCode(), notification.getResultDesc());
            stateMachine.fail(subscription, notification.getResultDesc());
        }
    }

    /**
     * By correlation id first; failing that, the correlation id read as the
     * subscription's own id (payloads that echo the account reference there).
     */
    private Optional<Subscription> lookup(String checkoutRequestId) {
        Optional<Subscription> byCheckout = subscriptionStore.findByCheckoutRequestId(checkoutRequestId);
        if (byCheckout.isPresent()) {
            return byCheckout;
        }
        Long asId = parseId(checkoutRequestId);
        if (asId == null) {
            return Optional.empty();
        }
        Optional<Subscription> byId = subscriptionStore.findById(asId);
        byId.ifPresent(s -> log.warn("Subscription {} matched by id fallback, not by checkoutRequestId", s.getId()));
        return byId;
    }

    private void activate(Subscription subscription, OutcomeNotification notification) {
        String receipt = notification.metadataText(SubscriptionConstants.ITEM_RECEIPT_NUMBER);
        String amountText = notification.metadataText(SubscriptionConstants.ITEM_AMOUNT);
        String accountReference = notification.metadataText(SubscriptionConstants.ITEM_ACCOUNT_REFERENCE);

        if (receipt == null || amountText == null || accountReference == null) {
            log.warn("Success notification for subscription {} lacks metadata "
                            + "(receipt={}, amount={}, accountReference={}); left PENDING",
                    subscription.getId(), receipt != null, amountText != null, accountReference != null);
            return;
        }

        BigDecimal paidAmount;
        try {
            paidAmount = new BigDecimal(amountText);
        } catch (NumberFormatException ex) {
            log.warn("Success notification for subscription {} has non-numeric Amount '{}'; left PENDING",
                    subscription.getId(), amountText);
            return;
        }

        if (!accountReference.equals(subscription.accountReference())) {
            log.warn("Subscription {} notification carries AccountReference={}",
                    subscription.getId(), accountReference);
        }
        if (paidAmount.compareTo(subscription.getAmount()) != 0) {
            log.warn("Subscription {} paid {} against a price of {}",
                    subscription.getId(), paidAmount, subscription.getAmount());
        }

        boolean activated = stateMachine.activate(subscription, PaymentConfirmation.builder()
                .receiptNumber(receipt)
                .paidAmount(paidAmount)
                .payerPhone(notification.metadataText(SubscriptionConstants.ITEM_PHONE_NUMBER))
                .build());
        if (activated) {
            log.info("Payment confirmed for subscription {}: receipt={}, amount={}",
                    subscription.getId(), receipt, paidAmount);
        }
    }

    private Long parseId(String value) {
        try {
            return Long.valueOf(value.trim());
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
