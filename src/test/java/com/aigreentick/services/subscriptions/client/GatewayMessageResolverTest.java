package com.aigreentick.services.subscriptions.client;

import com.aigreentick.services.subscriptions.support.TestFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("GatewayMessageResolver")
class GatewayMessageResolverTest {

    private final GatewayMessageResolver resolver = new GatewayMessageResolver(TestFixtures.mpesaConfig());

    @Test
    void knownCodeUsesConfiguredMessage() {
        assertThat(resolver.resolve("1032", "Request cancelled by user"))
                .isEqualTo("Payment was cancelled by user");
    }

    @Test
    void unknownCodeFallsBackToGatewayText() {
        assertThat(resolver.resolve("9999", "Something odd happened"))
                .isEqualTo("Something odd happened");
    }

    @Test
    void nothingKnownGivesGenericMessage() {
        assertThat(resolver.resolve(null, " ")).isEqualTo(GatewayMessageResolver.GENERIC_FAILURE);
    }
}
