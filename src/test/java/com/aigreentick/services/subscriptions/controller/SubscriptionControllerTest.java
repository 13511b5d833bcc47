package com.aigreentick.services.subscriptions.controller;

import com.aigreentick.services.subscriptions.dto.request.SubscribeRequest;
import com.aigreentick.services.subscriptions.dto.response.SubscribeResponse;
import com.aigreentick.services.subscriptions.dto.response.SubscriptionResponse;
import com.aigreentick.services.subscriptions.exception.DuplicateSubscriptionException;
import com.aigreentick.services.subscriptions.exception.InvalidPhoneFormatException;
import com.aigreentick.services.subscriptions.exception.MpesaAuthException;
import com.aigreentick.services.subscriptions.exception.MpesaGatewayException;
import com.aigreentick.services.subscriptions.exception.MpesaNetworkException;
import com.aigreentick.services.subscriptions.exception.PlanNotFoundException;
import com.aigreentick.services.subscriptions.exception.SubscriptionNotFoundException;
import com.aigreentick.services.subscriptions.service.PlanService;
import com.aigreentick.services.subscriptions.service.SubscriptionService;
import com.aigreentick.services.subscriptions.support.TestFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import java.math.BigDecimal;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SubscriptionController.class)
@DisplayName("SubscriptionController")
class SubscriptionControllerTest {

    private static final String BASE = "/api/v1/subscriptions";
    private static final String SUBSCRIBE_BODY =
            "{\"category\":\"gaming\",\"plan\":\"Hourly Pass\",\"phone\":\"0712345678\"}";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SubscriptionService subscriptionService;

    @MockBean
    private PlanService planService;

    private ResultActions subscribe(String body) throws Exception {
        return mockMvc.perform(post(BASE + "/subscribe")
                .header("X-User-Id", TestFixtures.OWNER)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body));
    }

    private static SubscriptionResponse pendingResponse() {
        return SubscriptionResponse.builder()
                .id(7L)
                .ownerId(TestFixtures.OWNER)
                .category("gaming")
                .planName("Hourly Pass")
                .amount(new BigDecimal("100"))
                .status("pending")
                .build();
    }

    @Test
    @DisplayName("GET /plans lists the catalogue")
    void listsPlans() throws Exception {
        when(planService.listAll()).thenReturn(List.of(TestFixtures.hourlyGamingPlan()));

        mockMvc.perform(get(BASE + "/plans"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data[0].category").value("gaming"))
                .andExpect(jsonPath("$.data[0].name").value("Hourly Pass"))
                .andExpect(jsonPath("$.data[0].durationHours").value(1));
    }

    @Test
    @DisplayName("GET /plans answers 404 when the catalogue is empty")
    void emptyPlans() throws Exception {
        when(planService.listAll()).thenThrow(new PlanNotFoundException("No plans found"));

        mockMvc.perform(get(BASE + "/plans"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("PLAN_NOT_FOUND"));
    }

    @Test
    @DisplayName("POST /subscribe answers 201 with the correlation id")
    void subscribes() throws Exception {
        when(subscriptionService.subscribe(eq(TestFixtures.OWNER), any(SubscribeRequest.class)))
                .thenReturn(SubscribeResponse.builder()
                        .subscription(pendingResponse())
                        .checkoutRequestId("ws_CO_1")
                        .customerMessage("Success. Request accepted for processing")
                        .build());

        subscribe(SUBSCRIBE_BODY)
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("STK Push initiated. Enter M-Pesa PIN to complete."))
                .andExpect(jsonPath("$.data.checkoutRequestId").value("ws_CO_1"))
                .andExpect(jsonPath("$.data.subscription.status").value("pending"));
    }

    @Test
    @DisplayName("POST /subscribe without the caller header is a 400")
    void missingOwnerHeader() throws Exception {
        mockMvc.perform(post(BASE + "/subscribe")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(SUBSCRIBE_BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("MISSING_HEADER"));

        verifyNoInteractions(subscriptionService);
    }

    @Test
    @DisplayName("POST /subscribe with missing fields reports each one")
    void validationErrors() throws Exception {
        subscribe("{\"category\":\"gaming\"}")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.data.plan").value("Plan is required"))
                .andExpect(jsonPath("$.data.phone").value("Phone number is required"));
    }

    @Test
    @DisplayName("a bad phone number is a 400")
    void badPhone() throws Exception {
        when(subscriptionService.subscribe(any(), any())).thenThrow(new InvalidPhoneFormatException("12345"));

        subscribe(SUBSCRIBE_BODY)
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_PHONE_FORMAT"));
    }

    @Test
    @DisplayName("a running subscription in the category is a 409")
    void duplicate() throws Exception {
        when(subscriptionService.subscribe(any(), any()))
                .thenThrow(DuplicateSubscriptionException.activeInCategory("gaming"));

        subscribe(SUBSCRIBE_BODY)
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("You already have an active gaming subscription"));
    }

    @Test
    @DisplayName("a gateway rejection is a 502 with the user-facing message")
    void gatewayRejection() throws Exception {
        when(subscriptionService.subscribe(any(), any())).thenThrow(new MpesaGatewayException(
                "Insufficient balance in your M-Pesa account", "1", "The balance is insufficient", 200));

        subscribe(SUBSCRIBE_BODY)
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.message").value("Insufficient balance in your M-Pesa account"));
    }

    @Test
    @DisplayName("token and network failures are 503")
    void unavailable() throws Exception {
        when(subscriptionService.subscribe(any(), any()))
                .thenThrow(new MpesaAuthException("Could not obtain M-Pesa access token after 4 attempts"))
                .thenThrow(MpesaNetworkException.unavailable());

        subscribe(SUBSCRIBE_BODY)
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error.code").value("MPESA_AUTH_ERROR"));
        subscribe(SUBSCRIBE_BODY)
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error.code").value("MPESA_NETWORK_ERROR"));
    }

    @Test
    @DisplayName("GET /{id} of an unknown or foreign subscription is a 404")
    void notFound() throws Exception {
        when(subscriptionService.getForOwner(TestFixtures.OWNER, 99L))
                .thenThrow(SubscriptionNotFoundException.withId(99L));

        mockMvc.perform(get(BASE + "/99").header("X-User-Id", TestFixtures.OWNER))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("SUBSCRIPTION_NOT_FOUND"));
    }

    @Test
    @DisplayName("GET /{id} with a non-numeric id is a 400")
    void badId() throws Exception {
        mockMvc.perform(get(BASE + "/abc").header("X-User-Id", TestFixtures.OWNER))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_PARAMETER_TYPE"));
    }

    @Test
    @DisplayName("POST /{id}/refresh and PATCH /{id}/cancel return the current record")
    void refreshAndCancel() throws Exception {
        when(subscriptionService.refresh(TestFixtures.OWNER, 7L)).thenReturn(pendingResponse());
        SubscriptionResponse cancelled = pendingResponse();
        cancelled.setStatus("cancelled");
        when(subscriptionService.cancel(TestFixtures.OWNER, 7L)).thenReturn(cancelled);

        mockMvc.perform(post(BASE + "/7/refresh").header("X-User-Id", TestFixtures.OWNER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("pending"));
        mockMvc.perform(patch(BASE + "/7/cancel").header("X-User-Id", TestFixtures.OWNER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("cancelled"));
    }
}
