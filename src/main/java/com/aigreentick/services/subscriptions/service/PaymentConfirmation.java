package com.aigreentick.services.subscriptions.service;

import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * Payment details recorded on activation. A status query carries none of
 * them, so that path activates with an empty confirmation.
 */
@Getter
@Builder
public class PaymentConfirmation {

    private final String receiptNumber;
    private final BigDecimal paidAmount;
    private final String payerPhone;

    public static PaymentConfirmation none() {
        return PaymentConfirmation.builder().build();
    }
}
