package com.aigreentick.services.subscriptions.store;

import com.aigreentick.services.subscriptions.constants.SubscriptionStatus;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Partial update for a guarded write. Null fields are left untouched.
 */
@Getter
@Builder
public class SubscriptionPatch {

    private final SubscriptionStatus status;
    private final LocalDateTime startDate;
    private final String checkoutRequestId;
    private final String merchantRequestId;
    private final String receiptNumber;
    private final BigDecimal paidAmount;
    private final String payerPhone;
    private final String failureReason;
    private final LocalDateTime updatedAt;
}
