package com.aigreentick.services.subscriptions.exception;

import lombok.Getter;

/**
 * Thrown when the gateway could not be reached or did not answer in time.
 * Transient: the caller may safely ask the user to retry.
 */
@Getter
public class MpesaNetworkException extends SubscriptionServiceException {

    private final boolean timedOut;

    public MpesaNetworkException(String message, boolean timedOut, Throwable cause) {
        super(message, "MPESA_NETWORK_ERROR", cause);
        this.timedOut = timedOut;
    }

    public static MpesaNetworkException unavailable() {
        return new MpesaNetworkException(
                "M-Pesa is temporarily unavailable. Please try again later.", false, null);
    }
}
