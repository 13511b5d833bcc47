package com.aigreentick.services.subscriptions.exception;

/**
 * Thrown when the owner already holds a running subscription in a category
 */
public class DuplicateSubscriptionException extends SubscriptionServiceException {

    public DuplicateSubscriptionException(String message) {
        super(message, "DUPLICATE_SUBSCRIPTION");
    }

    public static DuplicateSubscriptionException activeInCategory(String category) {
        return new DuplicateSubscriptionException(
                "You already have an active " + category + " subscription");
    }
}
