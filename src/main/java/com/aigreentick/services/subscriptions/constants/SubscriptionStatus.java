package com.aigreentick.services.subscriptions.constants;

import java.util.EnumSet;
import java.util.Set;

/**
 * Subscription lifecycle.
 *
 *   PENDING ──► ACTIVE ──► EXPIRED
 *      │          │
 *      │          └──────► CANCELLED
 *      ├──────► FAILED
 *      └──────► CANCELLED
 *
 * FAILED, EXPIRED and CANCELLED are terminal.
 */
public enum SubscriptionStatus {
    PENDING("pending"),
    ACTIVE("active"),
    FAILED("failed"),
    EXPIRED("expired"),
    CANCELLED("cancelled");

    private final String value;

    SubscriptionStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public Set<SubscriptionStatus> allowedTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(ACTIVE, FAILED, CANCELLED);
            case ACTIVE -> EnumSet.of(EXPIRED, CANCELLED);
            case FAILED, EXPIRED, CANCELLED -> EnumSet.noneOf(SubscriptionStatus.class);
        };
    }

    public boolean canTransitionTo(SubscriptionStatus target) {
        return allowedTargets().contains(target);
    }
}
