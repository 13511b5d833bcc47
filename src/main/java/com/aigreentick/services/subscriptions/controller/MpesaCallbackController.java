package com.aigreentick.services.subscriptions.controller;

import com.aigreentick.services.subscriptions.constants.SubscriptionConstants;
import com.aigreentick.services.subscriptions.dto.request.StkCallbackRequest;
import com.aigreentick.services.subscriptions.dto.response.CallbackAck;
import com.aigreentick.services.subscriptions.mapper.SubscriptionMapper;
import com.aigreentick.services.subscriptions.service.CallbackDispatcher;
import com.aigreentick.services.subscriptions.service.OutcomeNotification;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Daraja STK outcome webhook.
 *
 * Flow: raw body parsed here → 200 {"ResultCode":0,"ResultDesc":"Accepted"}
 *       → CallbackDispatcher (async) → CallbackReconciler
 *
 * Every delivery is acknowledged, including malformed ones. Daraja has no
 * request signature to verify.
 */
@RestController
@RequestMapping(SubscriptionConstants.API_V1 + "/subscriptions/mpesa")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "M-Pesa Webhook", description = "STK push outcome notifications from Safaricom")
public class MpesaCallbackController {

    private final CallbackDispatcher callbackDispatcher;
    private final ObjectMapper objectMapper;

    @PostMapping("/callback")
    @Operation(summary = "Receive STK push outcome (always acknowledged)")
    public ResponseEntity<CallbackAck> handleCallback(@RequestBody(required = false) String rawBody) {
        OutcomeNotification notification = parse(rawBody);
        if (notification == null) {
            log.warn("M-Pesa callback without Body.stkCallback acknowledged and ignored");
        } else {
            log.info("M-Pesa callback received: checkoutRequestId={}, resultCode={}",
                    notification.getCheckoutRequestId(), notification.getResultCode());
            callbackDispatcher.dispatch(notification);
        }
        return ResponseEntity.ok(CallbackAck.accepted());
    }

    private OutcomeNotification parse(String rawBody) {
        if (rawBody == null || rawBody.isBlank()) {
            return null;
        }
        try {
            return SubscriptionMapper.toOutcomeNotification(
                    objectMapper.readValue(rawBody, StkCallbackRequest.class));
        } catch (JsonProcessingException ex) {
            log.error("Unparseable M-Pesa callback: {}", ex.getOriginalMessage());
            return null;
        }
    }
}
