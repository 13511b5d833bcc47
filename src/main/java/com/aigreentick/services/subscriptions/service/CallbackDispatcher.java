package com.aigreentick.services.subscriptions.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Hands webhook deliveries to the callback pool so the controller can
 * acknowledge Daraja immediately.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CallbackDispatcher {

    private final CallbackReconciler callbackReconciler;

    @Async("callbackTaskExecutor")
    public void dispatch(OutcomeNotification notification) {
        log.debug("Reconciling checkoutRequestId={} on [{}]",
                notification.getCheckoutRequestId(), Thread.currentThread().getName());
        callbackReconciler.reconcile(notification);
    }
}
