package com.aigreentick.services.subscriptions.store;

import com.aigreentick.services.subscriptions.constants.SubscriptionCategory;
import com.aigreentick.services.subscriptions.constants.SubscriptionStatus;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;

/**
 * Selection filter for SubscriptionStore.find(). Null fields do not filter.
 * Results are ordered newest first.
 */
@Getter
@Builder
public class SubscriptionCriteria {

    private final String ownerId;
    private final SubscriptionCategory category;
    private final SubscriptionStatus status;
    private final String checkoutRequestId;

    /** endDate <= this */
    private final LocalDateTime endDateAtOrBefore;

    /** endDate > this */
    private final LocalDateTime endDateAfter;

    /** createdAt < this */
    private final LocalDateTime createdBefore;

    /** createdAt > this */
    private final LocalDateTime createdAfter;

    /** true: only records with a correlation id */
    private final Boolean hasCheckoutRequestId;

    /** 0 or null means unlimited */
    private final Integer limit;

    public boolean isLimited() {
        return limit != null && limit > 0;
    }
}
