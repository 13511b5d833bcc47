package com.aigreentick.services.subscriptions.exception;

import lombok.Getter;

/**
 * Base exception for all subscription service exceptions
 */
@Getter
public class SubscriptionServiceException extends RuntimeException {

    private final String errorCode;

    public SubscriptionServiceException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public SubscriptionServiceException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
