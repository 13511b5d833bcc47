package com.aigreentick.services.subscriptions.client;

import com.aigreentick.services.subscriptions.config.MpesaApiConfig;
import com.aigreentick.services.subscriptions.constants.SubscriptionConstants;
import com.aigreentick.services.subscriptions.dto.request.StkPushPayload;
import com.aigreentick.services.subscriptions.dto.request.StkQueryPayload;
import com.aigreentick.services.subscriptions.dto.response.DarajaErrorResponse;
import com.aigreentick.services.subscriptions.dto.response.StkPushResponse;
import com.aigreentick.services.subscriptions.dto.response.StkQueryResponse;
import com.aigreentick.services.subscriptions.dto.response.TokenResponse;
import com.aigreentick.services.subscriptions.exception.MpesaAuthException;
import com.aigreentick.services.subscriptions.exception.MpesaGatewayException;
import com.aigreentick.services.subscriptions.exception.MpesaNetworkException;
import com.aigreentick.services.subscriptions.exception.SubscriptionServiceException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import io.netty.handler.timeout.ReadTimeoutException;
import io.netty.handler.timeout.WriteTimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.codec.CodecException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.concurrent.TimeoutException;

/**
 * HTTP client for the Safaricom Daraja API (Lipa na M-Pesa Online).
 *
 * Three calls:
 *   GET  /oauth/v1/generate?grant_type=client_credentials  (Basic auth)
 *   POST /mpesa/stkpush/v1/processrequest                    (Bearer)
 *   POST /mpesa/stkpushquery/v1/query                        (Bearer)
 *
 * Error mapping, shared by all three:
 *   401                 → MpesaAuthException (caller drops its cached token)
 *   other 4xx / 5xx     → MpesaGatewayException with Daraja's errorCode/errorMessage
 *   no response         → MpesaNetworkException
 *   timeout             → MpesaNetworkException with timedOut = true
 *   undecodable 2xx     → MpesaGatewayException (502)
 *
 * Resilience: push and query run behind RateLimiter → CircuitBreaker, with
 * no @Retry. A replayed push prompts the user's phone a second time.
 * Token exchange has its own bounded retry in MpesaTokenCache.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MpesaApiClient {

    static final String TOKEN_PATH = "/oauth/v1/generate";
    static final String STK_PUSH_PATH = "/mpesa/stkpush/v1/processrequest";
    static final String STK_QUERY_PATH = "/mpesa/stkpushquery/v1/query";

    private static final String CB_NAME = "mpesaApi";

    @Qualifier("mpesaWebClient")
    private final WebClient webClient;
    private final MpesaApiConfig mpesaApiConfig;
    private final GatewayMessageResolver messageResolver;
    private final ObjectMapper objectMapper;

    // ======================================================
    // OAUTH
    // ======================================================

    /**
     * Client-credentials exchange. Not retried here; see MpesaTokenCache.
     */
    public TokenResponse fetchAccessToken() {
        log.debug("Requesting M-Pesa access token");
        String credentials = Base64.getEncoder().encodeToString(
                (mpesaApiConfig.getConsumerKey() + ":" + mpesaApiConfig.getConsumerSecret())
                        .getBytes(StandardCharsets.UTF_8));

        Mono<TokenResponse> call = webClient.get()
                .uri(uri -> uri.path(TOKEN_PATH)
                        .queryParam("grant_type", "client_credentials")
                        .build())
                .header(HttpHeaders.AUTHORIZATION, "Basic " + credentials)
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toException)
                .bodyToMono(TokenResponse.class);

        return execute("token exchange", call, mpesaApiConfig.getTokenTimeout());
    }

    // ======================================================
    // STK PUSH
    // ======================================================

    @CircuitBreaker(name = CB_NAME, fallbackMethod = "pushUnavailable")
    @RateLimiter(name = CB_NAME)
    public StkPushResponse submitStkPush(StkPushPayload payload, AccessToken token) {
        log.info("Submitting STK push: accountReference={}, amount={}",
                payload.getAccountReference(), payload.getAmount());

        Mono<StkPushResponse> call = webClient.post()
                .uri(STK_PUSH_PATH)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token.getValue())
                .bodyValue(payload)
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toException)
                .bodyToMono(StkPushResponse.class);

        return execute("STK push", call, mpesaApiConfig.getRequestTimeout());
    }

    // ======================================================
    // STK STATUS QUERY
    // ======================================================

    /**
     * While the user has not answered the prompt, Daraja replies 500 with
     * errorCode 500.001.1001. That answer is returned as a response carrying
     * only errorCode/errorMessage instead of being thrown.
     */
    @CircuitBreaker(name = CB_NAME, fallbackMethod = "queryUnavailable")
    @RateLimiter(name = CB_NAME)
    public StkQueryResponse queryStkStatus(StkQueryPayload payload, AccessToken token) {
        log.debug("Querying STK status: checkoutRequestId={}", payload.getCheckoutRequestId());

        Mono<StkQueryResponse> call = webClient.post()
                .uri(STK_QUERY_PATH)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token.getValue())
                .bodyValue(payload)
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toException)
                .bodyToMono(StkQueryResponse.class);

        try {
            return execute("STK query", call, mpesaApiConfig.getRequestTimeout());
        } catch (MpesaGatewayException ex) {
            if (SubscriptionConstants.ERROR_CODE_STILL_PROCESSING.equals(ex.getGatewayCode())) {
                return StkQueryResponse.builder()
                        .checkoutRequestId(payload.getCheckoutRequestId())
                        .errorCode(ex.getGatewayCode())
                        .errorMessage(ex.getGatewayDescription())
                        .build();
            }
            throw ex;
        }
    }

    // ======================================================
    // FALLBACKS (circuit open / rate limited)
    // ======================================================

    private StkPushResponse pushUnavailable(StkPushPayload payload, AccessToken token,
                                            CallNotPermittedException ex) {
        log.error("Circuit OPEN for M-Pesa API, STK push blocked: accountReference={}",
                payload.getAccountReference());
        throw MpesaNetworkException.unavailable();
    }

    private StkPushResponse pushUnavailable(StkPushPayload payload, AccessToken token,
                                            RequestNotPermitted ex) {
        log.warn("M-Pesa rate limit reached, STK push rejected: accountReference={}",
                payload.getAccountReference());
        throw MpesaNetworkException.unavailable();
    }

    private StkQueryResponse queryUnavailable(StkQueryPayload payload, AccessToken token,
                                              CallNotPermittedException ex) {
        log.error("Circuit OPEN for M-Pesa API, STK query blocked: checkoutRequestId={}",
                payload.getCheckoutRequestId());
        throw MpesaNetworkException.unavailable();
    }

    private StkQueryResponse queryUnavailable(StkQueryPayload payload, AccessToken token,
                                              RequestNotPermitted ex) {
        log.warn("M-Pesa rate limit reached, STK query rejected: checkoutRequestId={}",
                payload.getCheckoutRequestId());
        throw MpesaNetworkException.unavailable();
    }

    // ======================================================
    // PRIVATE HELPERS
    // ======================================================

    private <T> T execute(String operation, Mono<T> call, Duration timeout) {
        try {
            T body = call.timeout(timeout).block();
            if (body == null) {
                throw new MpesaGatewayException(messageResolver.resolve(null, null),
                        null, "Empty response body for " + operation, 502);
            }
            return body;
        } catch (SubscriptionServiceException ex) {
            throw ex;
        } catch (WebClientRequestException ex) {
            boolean timedOut = isTimeout(ex.getCause());
            log.error("M-Pesa {} failed without a response: {}", operation, ex.getMessage());
            throw new MpesaNetworkException(timedOut
                    ? "M-Pesa did not respond in time. Please try again."
                    : "Could not reach M-Pesa. Please try again.", timedOut, ex);
        } catch (WebClientException ex) {
            log.error("M-Pesa {} returned an unreadable response: {}", operation, ex.getMessage());
            throw new MpesaGatewayException(messageResolver.resolve(null, null),
                    null, ex.getMessage(), 502);
        } catch (CodecException ex) {
            log.error("M-Pesa {} returned a body that could not be decoded: {}", operation, ex.getMessage());
            throw new MpesaGatewayException(messageResolver.resolve(null, null),
                    null, ex.getMessage(), 502);
        } catch (RuntimeException ex) {
            Throwable cause = Exceptions.unwrap(ex);
            if (isTimeout(cause)) {
                log.error("M-Pesa {} timed out after {}", operation, timeout);
                throw new MpesaNetworkException("M-Pesa did not respond in time. Please try again.", true, ex);
            }
            throw ex;
        }
    }

    private Mono<? extends Throwable> toException(ClientResponse response) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> mapErrorResponse(status, body));
    }

    private RuntimeException mapErrorResponse(int status, String body) {
        if (status == 401) {
            log.warn("M-Pesa rejected the access token (401)");
            return MpesaAuthException.unauthorized();
        }
        DarajaErrorResponse error = parseError(body);
        String code = error != null ? error.getErrorCode() : null;
        String description = error != null && error.getErrorMessage() != null
                ? error.getErrorMessage()
                : "HTTP " + status;
        if (!SubscriptionConstants.ERROR_CODE_STILL_PROCESSING.equals(code)) {
            log.warn("M-Pesa error response: status={}, errorCode={}, errorMessage={}", status, code, description);
        }
        return new MpesaGatewayException(messageResolver.resolve(code, description), code, description, status);
    }

    private DarajaErrorResponse parseError(String body) {
        if (body == null || body.isBlank()) return null;
        try {
            return objectMapper.readValue(body, DarajaErrorResponse.class);
        } catch (JsonProcessingException ex) {
            log.debug("M-Pesa error body is not JSON: {}", body);
            return null;
        }
    }

    private boolean isTimeout(Throwable cause) {
        return cause instanceof TimeoutException
                || cause instanceof ReadTimeoutException
                || cause instanceof WriteTimeoutException;
    }
}
