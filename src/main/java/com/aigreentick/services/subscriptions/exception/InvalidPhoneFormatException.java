package com.aigreentick.services.subscriptions.exception;

import lombok.Getter;

/**
 * Thrown when a phone number matches none of the accepted input shapes.
 * Keeps the caller's original input for diagnostics.
 */
@Getter
public class InvalidPhoneFormatException extends InvalidRequestException {

    private final String originalInput;

    public InvalidPhoneFormatException(String originalInput) {
        super("Invalid phone number format: " + originalInput, "INVALID_PHONE_FORMAT");
        this.originalInput = originalInput;
    }
}
