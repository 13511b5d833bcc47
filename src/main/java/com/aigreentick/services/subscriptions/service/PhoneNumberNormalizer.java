package com.aigreentick.services.subscriptions.service;

import com.aigreentick.services.subscriptions.config.MpesaApiConfig;
import com.aigreentick.services.subscriptions.exception.InvalidPhoneFormatException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Converts user-typed phone numbers to the canonical MSISDN the gateway
 * expects: country code + 9 digits, no '+', e.g. 254712345678.
 *
 * After stripping every non-digit, accepted shapes are:
 *   0XXXXXXXXX     → country code replaces the 0
 *   7XXXXXXXX      → country code prepended
 *   254XXXXXXXXX   → unchanged (also covers +254...)
 */
@Component
@RequiredArgsConstructor
public class PhoneNumberNormalizer {

    private static final int SUBSCRIBER_DIGITS = 9;

    private final MpesaApiConfig mpesaApiConfig;

    public String normalize(String input) {
        if (input == null || input.isBlank()) {
            throw new InvalidPhoneFormatException(input);
        }
        String digits = input.replaceAll("\\D", "");
        String countryCode = mpesaApiConfig.getCountryCode();

        if (digits.length() == SUBSCRIBER_DIGITS + 1 && digits.startsWith("0")) {
            return countryCode + digits.substring(1);
        }
        if (digits.length() == SUBSCRIBER_DIGITS && digits.startsWith("7")) {
            return countryCode + digits;
        }
        if (digits.length() == countryCode.length() + SUBSCRIBER_DIGITS && digits.startsWith(countryCode)) {
            return digits;
        }
        throw new InvalidPhoneFormatException(input);
    }
}
