package com.aigreentick.services.subscriptions.exception;

/**
 * Thrown when a subscription or correlation id is unknown
 */
public class SubscriptionNotFoundException extends SubscriptionServiceException {

    public SubscriptionNotFoundException(String message) {
        super(message, "SUBSCRIPTION_NOT_FOUND");
    }

    public static SubscriptionNotFoundException withId(Long id) {
        return new SubscriptionNotFoundException("Subscription not found with ID: " + id);
    }

    public static SubscriptionNotFoundException withCheckoutRequestId(String checkoutRequestId) {
        return new SubscriptionNotFoundException(
                "Subscription not found for checkout request: " + checkoutRequestId);
    }
}
