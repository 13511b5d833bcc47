package com.aigreentick.services.subscriptions.exception;

import lombok.Getter;

/**
 * Thrown when the gateway answers but rejects the request or reports failure.
 *
 * getMessage() is the user-facing sentence; the raw gateway code and text
 * are kept separately for logs.
 */
@Getter
public class MpesaGatewayException extends SubscriptionServiceException {

    private final String gatewayCode;
    private final String gatewayDescription;
    private final int httpStatus;

    public MpesaGatewayException(String userMessage, String gatewayCode,
                                 String gatewayDescription, int httpStatus) {
        super(userMessage, "MPESA_GATEWAY_ERROR");
        this.gatewayCode = gatewayCode;
        this.gatewayDescription = gatewayDescription;
        this.httpStatus = httpStatus;
    }

    public boolean isClientError() {
        return httpStatus >= 400 && httpStatus < 500;
    }
}
