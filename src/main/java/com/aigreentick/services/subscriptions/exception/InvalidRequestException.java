package com.aigreentick.services.subscriptions.exception;

/**
 * Thrown for requests the caller can fix: bad phone, amount, reference or plan
 */
public class InvalidRequestException extends SubscriptionServiceException {

    public InvalidRequestException(String message) {
        super(message, "INVALID_REQUEST");
    }

    protected InvalidRequestException(String message, String errorCode) {
        super(message, errorCode);
    }

    public static InvalidRequestException invalidAmount(Object amount) {
        return new InvalidRequestException("Amount must be a positive whole number, got: " + amount);
    }

    public static InvalidRequestException invalidCategory(String category) {
        return new InvalidRequestException("Unknown subscription category: " + category);
    }

    public static InvalidRequestException planWithoutDuration(String planName) {
        return new InvalidRequestException("Plan " + planName + " has no duration configured");
    }
}
