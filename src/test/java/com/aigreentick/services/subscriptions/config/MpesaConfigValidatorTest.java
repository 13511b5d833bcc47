package com.aigreentick.services.subscriptions.config;

import com.aigreentick.services.subscriptions.support.TestFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

@DisplayName("MpesaConfigValidator")
class MpesaConfigValidatorTest {

    @Test
    void acceptsCompleteConfig() {
        MpesaConfigValidator validator = new MpesaConfigValidator(TestFixtures.mpesaConfig());

        assertThatCode(validator::validateMpesaConfig).doesNotThrowAnyException();
    }

    @Test
    void rejectsUnresolvedPlaceholder() {
        MpesaApiConfig config = TestFixtures.mpesaConfig();
        config.setPasskey("${MPESA_PASSKEY}");

        assertThatThrownBy(() -> new MpesaConfigValidator(config).validateMpesaConfig())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("MPESA_PASSKEY");
    }

    @Test
    void rejectsMissingCallbackUrl() {
        MpesaApiConfig config = TestFixtures.mpesaConfig();
        config.setCallbackUrl(null);

        assertThatThrownBy(() -> new MpesaConfigValidator(config).validateMpesaConfig())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("mpesa.callback-url");
    }

    @Test
    void rejectsShortSafetyMargin() {
        MpesaApiConfig config = TestFixtures.mpesaConfig();
        config.setTokenSafetyMargin(Duration.ofSeconds(5));

        assertThatThrownBy(() -> new MpesaConfigValidator(config).validateMpesaConfig())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("token-safety-margin");
    }
}
