package com.aigreentick.services.subscriptions.service;

import lombok.Builder;
import lombok.Getter;

import java.util.Collections;
import java.util.Map;

/**
 * One delivery of the gateway's outcome webhook, flattened.
 * Metadata items are keyed by their Name; values are left as the gateway sent them.
 */
@Getter
@Builder
public class OutcomeNotification {

    private final String checkoutRequestId;
    private final String merchantRequestId;
    private final Integer resultCode;
    private final String resultDesc;

    @Builder.Default
    private final Map<String, Object> metadata = Collections.emptyMap();

    public boolean isSuccess() {
        return resultCode != null && resultCode == 0;
    }

    /** @return the item as text, or null when absent or blank */
    public String metadataText(String name) {
        Object value = metadata.get(name);
        if (value == null) return null;
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? null : text;
    }
}
