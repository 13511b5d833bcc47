package com.aigreentick.services.subscriptions.dto.request;

import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * What the caller asks StkPushInitiator to charge.
 * The phone is raw user input; normalization happens inside the initiator.
 */
@Getter
@Builder
public class PushPaymentCommand {

    private final String phone;
    private final BigDecimal amount;
    private final String accountReference;

    /** Optional; defaults to mpesa.transaction-description */
    private final String description;
}
