package com.aigreentick.services.subscriptions.service;

import com.aigreentick.services.subscriptions.client.AccessToken;
import com.aigreentick.services.subscriptions.client.GatewayMessageResolver;
import com.aigreentick.services.subscriptions.client.MpesaApiClient;
import com.aigreentick.services.subscriptions.client.MpesaTokenCache;
import com.aigreentick.services.subscriptions.client.StkRequestSigner;
import com.aigreentick.services.subscriptions.config.MpesaApiConfig;
import com.aigreentick.services.subscriptions.constants.SubscriptionConstants;
import com.aigreentick.services.subscriptions.dto.request.StkQueryPayload;
import com.aigreentick.services.subscriptions.dto.response.GatewayStatus;
import com.aigreentick.services.subscriptions.dto.response.StkQueryResponse;
import com.aigreentick.services.subscriptions.entity.Subscription;
import com.aigreentick.services.subscriptions.exception.MpesaAuthException;
import com.aigreentick.services.subscriptions.exception.SubscriptionNotFoundException;
import com.aigreentick.services.subscriptions.store.SubscriptionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Asks the gateway for the outcome of one push, for when the webhook has
 * not arrived (or never will).
 *
 *   ResultCode 0                  → SUCCESS, activate
 *   any other ResultCode          → FAILED, fail
 *   errorCode 500.001.1001        → PROCESSING, no change
 *   anything else                 → UNKNOWN, no change
 *
 * Transitions go through SubscriptionStateMachine exactly as the webhook's
 * do, so whichever path sees the outcome first wins and the other is a no-op.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StkStatusPoller {

    static final String SUCCESS_MESSAGE = "Payment received. Your subscription is active.";
    static final String PROCESSING_MESSAGE = "Waiting for you to confirm the payment on your phone.";

    private final SubscriptionStore subscriptionStore;
    private final SubscriptionStateMachine stateMachine;
    private final MpesaTokenCache tokenCache;
    private final StkRequestSigner requestSigner;
    private final MpesaApiClient mpesaApiClient;
    private final GatewayMessageResolver messageResolver;
    private final MpesaApiConfig mpesaApiConfig;

    /**
     * @throws SubscriptionNotFoundException for an unknown checkoutRequestId, before any network call
     */
    public GatewayStatus query(String checkoutRequestId) {
        Subscription subscription = subscriptionStore.findByCheckoutRequestId(checkoutRequestId)
                .orElseThrow(() -> SubscriptionNotFoundException.withCheckoutRequestId(checkoutRequestId));

        AccessToken token = tokenCache.getToken();
        StkRequestSigner.Signature signature = requestSigner.sign();
        StkQueryPayload payload = StkQueryPayload.builder()
                .businessShortCode(mpesaApiConfig.getShortcode())
                .password(signature.getPassword())
                .timestamp(signature.getTimestamp())
                .checkoutRequestId(checkoutRequestId)
                .build();

        StkQueryResponse response;
        try {
            response = mpesaApiClient.queryStkStatus(payload, token);
        } catch (MpesaAuthException ex) {
            tokenCache.invalidate(token);
            throw ex;
        }

        GatewayStatus status = classify(checkoutRequestId, response);
        log.info("STK status for subscription {}: {} (resultCode={}, desc={})",
                subscription.getId(), status.getOutcome(), status.getResultCode(), status.getResultDesc());

        switch (status.getOutcome()) {
            case SUCCESS -> stateMachine.activate(subscription, PaymentConfirmation.none());
            case FAILED -> stateMachine.fail(subscription, status.getResultDesc());
            default -> { }
        }
        return status;
    }

    private GatewayStatus classify(String checkoutRequestId, StkQueryResponse response) {
        if (!response.hasResult()) {
            boolean processing = SubscriptionConstants.ERROR_CODE_STILL_PROCESSING.equals(response.getErrorCode());
            return GatewayStatus.builder()
                    .outcome(processing ? GatewayStatus.Outcome.PROCESSING : GatewayStatus.Outcome.UNKNOWN)
                    .checkoutRequestId(checkoutRequestId)
                    .resultCode(response.getErrorCode())
                    .resultDesc(response.getErrorMessage())
                    .userMessage(processing
                            ? PROCESSING_MESSAGE
                            : messageResolver.resolve(response.getErrorCode(), response.getErrorMessage()))
                    .build();
        }

        int resultCode;
        try {
            resultCode = Integer.parseInt(response.getResultCode().trim());
        } catch (NumberFormatException ex) {
            log.warn("Unparseable ResultCode '{}' for checkoutRequestId={}", response.getResultCode(), checkoutRequestId);
            return GatewayStatus.builder()
                    .outcome(GatewayStatus.Outcome.UNKNOWN)
                    .checkoutRequestId(checkoutRequestId)
                    .resultCode(response.getResultCode())
                    .resultDesc(response.getResultDesc())
                    .userMessage(messageResolver.resolve(null, response.getResultDesc()))
                    .build();
        }

        boolean success = resultCode == SubscriptionConstants.RESULT_CODE_SUCCESS;
        return GatewayStatus.builder()
                .outcome(success ? GatewayStatus.Outcome.SUCCESS : GatewayStatus.Outcome.FAILED)
                .checkoutRequestId(checkoutRequestId)
                .resultCode(String.valueOf(resultCode))
                .resultDesc(response.getResultDesc())
                .userMessage(success
                        ? SUCCESS_MESSAGE
                        : messageResolver.resolve(String.valueOf(resultCode), response.getResultDesc()))
                .build();
    }
}
