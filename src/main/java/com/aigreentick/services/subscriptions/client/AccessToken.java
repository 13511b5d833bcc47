package com.aigreentick.services.subscriptions.client;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;

/**
 * Daraja OAuth bearer token. Lives only in MpesaTokenCache; never persisted.
 */
@Getter
@AllArgsConstructor
public final class AccessToken {

    private final String value;
    private final Instant issuedAt;
    private final Instant expiresAt;

    /**
     * @return true if the token is still valid at now + safetyMargin
     */
    public boolean isUsableAt(Instant now, Duration safetyMargin) {
        return now.plus(safetyMargin).isBefore(expiresAt);
    }

    @Override
    public String toString() {
        return "AccessToken[issuedAt=" + issuedAt + ", expiresAt=" + expiresAt + "]";
    }
}
