package com.aigreentick.services.subscriptions.config;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Set;

/**
 * Fail-fast validation for required M-Pesa configuration.
 * If any required value is missing or still a placeholder, the application
 * context fails to load with an actionable message.
 *
 * Required env vars:
 *   - MPESA_CONSUMER_KEY    → mpesa.consumer-key
 *   - MPESA_CONSUMER_SECRET → mpesa.consumer-secret
 *   - MPESA_SHORTCODE       → mpesa.shortcode
 *   - MPESA_PASSKEY         → mpesa.passkey
 *   - MPESA_CALLBACK_URL    → mpesa.callback-url
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class MpesaConfigValidator {

    static final Duration MIN_TOKEN_SAFETY_MARGIN = Duration.ofSeconds(30);

    private static final Set<String> PLACEHOLDER_VALUES = Set.of(
            "",
            "null",
            "undefined",
            "changeme",
            "your-consumer-key",
            "your-consumer-secret",
            "your-passkey"
    );

    private final MpesaApiConfig mpesaApiConfig;

    @PostConstruct
    public void validateMpesaConfig() {
        log.info("Validating M-Pesa configuration...");

        validateRequired("MPESA_CONSUMER_KEY", "mpesa.consumer-key", mpesaApiConfig.getConsumerKey());
        validateRequired("MPESA_CONSUMER_SECRET", "mpesa.consumer-secret", mpesaApiConfig.getConsumerSecret());
        validateRequired("MPESA_SHORTCODE", "mpesa.shortcode", mpesaApiConfig.getShortcode());
        validateRequired("MPESA_PASSKEY", "mpesa.passkey", mpesaApiConfig.getPasskey());
        validateRequired("MPESA_CALLBACK_URL", "mpesa.callback-url", mpesaApiConfig.getCallbackUrl());

        if (mpesaApiConfig.getTokenSafetyMargin() == null
                || mpesaApiConfig.getTokenSafetyMargin().compareTo(MIN_TOKEN_SAFETY_MARGIN) < 0) {
            throw new IllegalStateException("mpesa.token-safety-margin must be at least "
                    + MIN_TOKEN_SAFETY_MARGIN.toSeconds() + "s, got " + mpesaApiConfig.getTokenSafetyMargin());
        }
        if (mpesaApiConfig.getTokenMaxRetries() < 0) {
            throw new IllegalStateException("mpesa.token-max-retries must not be negative");
        }

        if (mpesaApiConfig.getBaseUrl() == null || !mpesaApiConfig.getBaseUrl().startsWith("https://")) {
            log.warn("mpesa.base-url may be incorrectly configured: {}", mpesaApiConfig.getBaseUrl());
        }
        if (mpesaApiConfig.getResultMessages().isEmpty()) {
            log.warn("mpesa.result-messages is empty. Users will see raw gateway descriptions.");
        }

        log.info("M-Pesa configuration validated successfully. Shortcode: {}, base URL: {}",
                mpesaApiConfig.getShortcode(), mpesaApiConfig.getBaseUrl());
    }

    private void validateRequired(String envVar, String configKey, String value) {
        if (isNullOrPlaceholder(value)) {
            String message = String.format(
                    "%n%n" +
                            "╔══════════════════════════════════════════════════════════════╗%n" +
                            "║  STARTUP FAILED: Missing Required Configuration              ║%n" +
                            "╠══════════════════════════════════════════════════════════════╣%n" +
                            "║  Config key : %-48s ║%n" +
                            "║  Env var    : %-48s ║%n" +
                            "╚══════════════════════════════════════════════════════════════╝%n",
                    configKey, envVar
            );
            throw new IllegalStateException(message);
        }
    }

    private boolean isNullOrPlaceholder(String value) {
        if (value == null) return true;
        return PLACEHOLDER_VALUES.contains(value.trim().toLowerCase())
                || value.trim().startsWith("${");
    }
}
