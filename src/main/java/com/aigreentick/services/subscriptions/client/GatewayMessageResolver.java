package com.aigreentick.services.subscriptions.client;

import com.aigreentick.services.subscriptions.config.MpesaApiConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Turns gateway result/error codes into sentences users can act on.
 * The table is mpesa.result-messages; unknown codes fall back to the
 * gateway's own description.
 */
@Component
@RequiredArgsConstructor
public class GatewayMessageResolver {

    static final String GENERIC_FAILURE = "Payment could not be completed. Please try again.";

    private final MpesaApiConfig mpesaApiConfig;

    public String resolve(String code, String gatewayDescription) {
        if (code != null) {
            String configured = mpesaApiConfig.getResultMessages().get(code.trim());
            if (configured != null && !configured.isBlank()) {
                return configured;
            }
        }
        if (gatewayDescription != null && !gatewayDescription.isBlank()) {
            return gatewayDescription;
        }
        return GENERIC_FAILURE;
    }
}
