package com.aigreentick.services.subscriptions.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed config properties for the Safaricom Daraja (M-Pesa) API.
 *
 * Bound from application.yml under prefix "mpesa":
 * ┌─────────────────────────────────────────────────────────────────┐
 * │  mpesa:                                                         │
 * │    consumer-key:     ${MPESA_CONSUMER_KEY}                      │
 * │    consumer-secret:  ${MPESA_CONSUMER_SECRET}                   │
 * │    shortcode:        ${MPESA_SHORTCODE}                         │
 * │    passkey:          ${MPESA_PASSKEY}                           │
 * │    base-url:         https://sandbox.safaricom.co.ke            │
 * │    callback-url:     ${MPESA_CALLBACK_URL}                      │
 * └─────────────────────────────────────────────────────────────────┘
 *
 * Secrets come from environment variables only.
 * See MpesaConfigValidator for fail-fast startup validation.
 */
@Configuration
@ConfigurationProperties(prefix = "mpesa")
@Data
public class MpesaApiConfig {

    /** Daraja app consumer key, used for the client-credentials token exchange */
    private String consumerKey;

    /** Daraja app consumer secret. Treat as a password, never log it */
    private String consumerSecret;

    /** Paybill / till shortcode (BusinessShortCode and PartyB) */
    private String shortcode;

    /** Lipa na M-Pesa Online passkey, part of the request password */
    private String passkey;

    /** Base URL for Daraja (override in tests) */
    private String baseUrl = "https://sandbox.safaricom.co.ke";

    /** Public URL the gateway POSTs the payment outcome to */
    private String callbackUrl;

    private String transactionType = "CustomerPayBillOnline";

    /** Short text shown on the user's phone, cut to 13 chars */
    private String transactionDescription = "Subscription";

    /** Zone of the yyyyMMddHHmmss signing timestamp */
    private String timezone = "Africa/Nairobi";

    /** Country calling code prefixed to local numbers */
    private String countryCode = "254";

    /** A cached token is refreshed once it is this close to expiry (min 30s) */
    private Duration tokenSafetyMargin = Duration.ofSeconds(30);

    /** Retries after the first failed token exchange */
    private int tokenMaxRetries = 3;

    private Duration tokenRetryDelay = Duration.ofSeconds(2);

    private Duration tokenTimeout = Duration.ofSeconds(10);

    /** Timeout for STK push and status query calls */
    private Duration requestTimeout = Duration.ofSeconds(30);

    /**
     * Gateway result code → user-facing message.
     * Unknown codes fall back to the gateway's own description.
     */
    private Map<String, String> resultMessages = new LinkedHashMap<>();
}
