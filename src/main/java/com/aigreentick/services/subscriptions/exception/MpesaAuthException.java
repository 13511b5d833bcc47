package com.aigreentick.services.subscriptions.exception;

/**
 * Thrown when no gateway access token can be obtained: bad credentials,
 * a rejected token, or token refresh retries exhausted.
 */
public class MpesaAuthException extends SubscriptionServiceException {

    public MpesaAuthException(String message) {
        super(message, "MPESA_AUTH_ERROR");
    }

    public MpesaAuthException(String message, Throwable cause) {
        super(message, "MPESA_AUTH_ERROR", cause);
    }

    public static MpesaAuthException unauthorized() {
        return new MpesaAuthException("M-Pesa API authentication failed. Access token may be expired.");
    }
}
