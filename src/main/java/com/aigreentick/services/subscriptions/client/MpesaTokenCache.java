package com.aigreentick.services.subscriptions.client;

import com.aigreentick.services.subscriptions.config.MpesaApiConfig;
import com.aigreentick.services.subscriptions.dto.response.TokenResponse;
import com.aigreentick.services.subscriptions.exception.MpesaAuthException;
import com.aigreentick.services.subscriptions.exception.MpesaGatewayException;
import com.aigreentick.services.subscriptions.exception.MpesaNetworkException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Owner of the one Daraja access token shared by every outgoing call.
 *
 * Starts empty. getToken() returns the cached token while
 * now + safetyMargin is before its expiry; otherwise it refreshes.
 *
 * SINGLE-FLIGHT REFRESH
 * ─────────────────────
 * Daraja throttles bursts of token requests, so at most one exchange runs
 * per expiry cycle. The first caller that finds the cache stale publishes a
 * CompletableFuture under the monitor and performs the exchange; everyone
 * arriving meanwhile waits on that same future and sees the same token, or
 * the same MpesaAuthException.
 *
 * RETRY
 * ─────
 * Up to token-max-retries extra attempts, token-retry-delay apart.
 * Not retried: timeouts and 4xx answers (bad credentials do not heal).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MpesaTokenCache {

    private final MpesaApiClient mpesaApiClient;
    private final MpesaApiConfig mpesaApiConfig;
    private final Clock clock;

    private final Object monitor = new Object();

    // guarded by monitor
    private AccessToken current;
    private CompletableFuture<AccessToken> inFlight;

    /**
     * @return a token valid for at least the configured safety margin
     * @throws MpesaAuthException when no token could be obtained
     */
    public AccessToken getToken() {
        CompletableFuture<AccessToken> refresh;
        boolean leader = false;

        synchronized (monitor) {
            if (current != null && current.isUsableAt(clock.instant(), mpesaApiConfig.getTokenSafetyMargin())) {
                return current;
            }
            if (inFlight == null) {
                inFlight = new CompletableFuture<>();
                leader = true;
            }
            refresh = inFlight;
        }

        if (leader) {
            return refresh(refresh);
        }
        return await(refresh);
    }

    /**
     * Drops the cached token if it is still the given one. Called when the
     * gateway answers 401 to a request made with it.
     */
    public void invalidate(AccessToken rejected) {
        synchronized (monitor) {
            if (current != null && rejected != null && current.getValue().equals(rejected.getValue())) {
                log.warn("Invalidating rejected M-Pesa access token (expiresAt={})", current.getExpiresAt());
                current = null;
            }
        }
    }

    // ════════════════════════════════════════════════════════════
    // PRIVATE
    // ════════════════════════════════════════════════════════════

    private AccessToken refresh(CompletableFuture<AccessToken> refresh) {
        AccessToken token;
        try {
            token = exchangeWithRetry();
        } catch (RuntimeException ex) {
            synchronized (monitor) {
                inFlight = null;
            }
            refresh.completeExceptionally(ex);
            throw ex;
        }

        synchronized (monitor) {
            current = token;
            inFlight = null;
        }
        refresh.complete(token);
        return token;
    }

    private AccessToken await(CompletableFuture<AccessToken> refresh) {
        try {
            return refresh.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new MpesaAuthException("Interrupted while waiting for M-Pesa access token", ex);
        } catch (ExecutionException | CompletionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof MpesaAuthException) {
                throw (MpesaAuthException) cause;
            }
            throw new MpesaAuthException("M-Pesa access token refresh failed", cause);
        }
    }

    private AccessToken exchangeWithRetry() {
        int maxAttempts = mpesaApiConfig.getTokenMaxRetries() + 1;
        RuntimeException lastFailure = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                AccessToken token = exchange();
                if (attempt > 1) {
                    log.info("M-Pesa token exchange succeeded after {} attempts", attempt);
                }
                return token;
            } catch (MpesaAuthException ex) {
                log.error("M-Pesa rejected the API credentials: {}", ex.getMessage());
                throw ex;
            } catch (MpesaNetworkException ex) {
                if (ex.isTimedOut()) {
                    log.error("M-Pesa token exchange timed out, not retrying");
                    throw new MpesaAuthException("M-Pesa token exchange timed out", ex);
                }
                lastFailure = ex;
            } catch (MpesaGatewayException ex) {
                if (ex.isClientError()) {
                    log.error("M-Pesa token exchange rejected ({}): {}", ex.getHttpStatus(), ex.getGatewayDescription());
                    throw new MpesaAuthException("M-Pesa rejected the token request", ex);
                }
                lastFailure = ex;
            } catch (RuntimeException ex) {
                log.error("Unexpected failure during M-Pesa token exchange", ex);
                lastFailure = ex;
            }

            if (attempt < maxAttempts) {
                log.warn("M-Pesa token exchange failed (attempt {}/{}): {}. Retrying...",
                        attempt, maxAttempts, lastFailure.getMessage());
                sleep(mpesaApiConfig.getTokenRetryDelay());
            }
        }

        log.error("M-Pesa token exchange exhausted all {} attempts", maxAttempts);
        throw new MpesaAuthException(
                "Could not obtain M-Pesa access token after " + maxAttempts + " attempts", lastFailure);
    }

    private AccessToken exchange() {
        TokenResponse response = mpesaApiClient.fetchAccessToken();
        if (response.getAccessToken() == null || response.getAccessToken().isBlank()) {
            throw new MpesaGatewayException("Malformed token response", null, "access_token missing", 502);
        }
        long lifetimeSeconds = parseLifetime(response.getExpiresIn());

        Instant issuedAt = clock.instant();
        Instant expiresAt = issuedAt.plusSeconds(lifetimeSeconds);
        log.info("Obtained M-Pesa access token, valid until {}", expiresAt);
        return new AccessToken(response.getAccessToken(), issuedAt, expiresAt);
    }

    private long parseLifetime(String expiresIn) {
        if (expiresIn != null) {
            try {
                long seconds = Long.parseLong(expiresIn.trim());
                if (seconds > 0) {
                    return seconds;
                }
            } catch (NumberFormatException ex) {
                log.debug("Unparseable expires_in: {}", expiresIn);
            }
        }
        throw new MpesaGatewayException("Malformed token response", null,
                "expires_in invalid: " + expiresIn, 502);
    }

    private void sleep(Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new MpesaAuthException("Interrupted during M-Pesa token retry backoff", ie);
        }
    }
}
