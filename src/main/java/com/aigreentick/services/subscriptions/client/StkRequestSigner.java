package com.aigreentick.services.subscriptions.client;

import com.aigreentick.services.subscriptions.config.MpesaApiConfig;
import com.aigreentick.services.subscriptions.constants.SubscriptionConstants;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Base64;

/**
 * Lipa na M-Pesa Online request signing.
 *
 *   Timestamp = yyyyMMddHHmmss in the configured zone (Africa/Nairobi)
 *   Password  = base64(shortcode + passkey + Timestamp)
 *
 * Push and status query are signed the same way.
 */
@Component
@RequiredArgsConstructor
public class StkRequestSigner {

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern(SubscriptionConstants.SIGNING_TIMESTAMP_PATTERN);

    private final MpesaApiConfig mpesaApiConfig;
    private final Clock clock;

    public Signature sign() {
        String timestamp = TIMESTAMP_FORMAT.format(
                clock.instant().atZone(ZoneId.of(mpesaApiConfig.getTimezone())));
        return new Signature(timestamp, password(timestamp));
    }

    String password(String timestamp) {
        String raw = mpesaApiConfig.getShortcode() + mpesaApiConfig.getPasskey() + timestamp;
        return Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    @Getter
    @AllArgsConstructor
    public static final class Signature {
        private final String timestamp;
        private final String password;
    }
}
