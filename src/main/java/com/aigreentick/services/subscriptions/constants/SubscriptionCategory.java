package com.aigreentick.services.subscriptions.constants;

/**
 * Subscription categories offered in the plan catalogue
 */
public enum SubscriptionCategory {
    GAMING("gaming"),
    GYM("gym"),
    MOVIES("movies"),
    SPORTS("sports");

    private final String value;

    SubscriptionCategory(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static SubscriptionCategory fromValue(String value) {
        for (SubscriptionCategory category : SubscriptionCategory.values()) {
            if (category.value.equalsIgnoreCase(value)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Invalid subscription category: " + value);
    }
}
