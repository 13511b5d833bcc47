package com.aigreentick.services.subscriptions.client;

import com.aigreentick.services.subscriptions.dto.response.TokenResponse;
import com.aigreentick.services.subscriptions.exception.MpesaAuthException;
import com.aigreentick.services.subscriptions.exception.MpesaGatewayException;
import com.aigreentick.services.subscriptions.exception.MpesaNetworkException;
import com.aigreentick.services.subscriptions.support.MutableClock;
import com.aigreentick.services.subscriptions.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("MpesaTokenCache")
class MpesaTokenCacheTest {

    @Mock
    private MpesaApiClient mpesaApiClient;

    private MutableClock clock;
    private MpesaTokenCache tokenCache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(TestFixtures.NOW);
        tokenCache = new MpesaTokenCache(mpesaApiClient, TestFixtures.mpesaConfig(), clock);
    }

    private static TokenResponse token(String value) {
        return new TokenResponse(value, "3599");
    }

    @Nested
    @DisplayName("caching")
    class Caching {

        @Test
        @DisplayName("reuses the token while more than the safety margin remains")
        void reusesFreshToken() {
            when(mpesaApiClient.fetchAccessToken()).thenReturn(token("first"), token("second"));

            AccessToken first = tokenCache.getToken();
            clock.advance(Duration.ofSeconds(3599 - 31));
            AccessToken again = tokenCache.getToken();

            assertThat(again.getValue()).isEqualTo("first");
            assertThat(first.getExpiresAt()).isEqualTo(TestFixtures.NOW.plusSeconds(3599));
            verify(mpesaApiClient, times(1)).fetchAccessToken();
        }

        @Test
        @DisplayName("refreshes once less than the safety margin remains")
        void refreshesNearExpiry() {
            when(mpesaApiClient.fetchAccessToken()).thenReturn(token("first"), token("second"));

            tokenCache.getToken();
            clock.advance(Duration.ofSeconds(3599 - 29));

            assertThat(tokenCache.getToken().getValue()).isEqualTo("second");
            verify(mpesaApiClient, times(2)).fetchAccessToken();
        }

        @Test
        @DisplayName("invalidate drops the matching token only")
        void invalidateMatchingOnly() {
            when(mpesaApiClient.fetchAccessToken()).thenReturn(token("first"), token("second"));

            AccessToken first = tokenCache.getToken();
            tokenCache.invalidate(new AccessToken("someone-else", clock.instant(), clock.instant()));
            assertThat(tokenCache.getToken().getValue()).isEqualTo("first");

            tokenCache.invalidate(first);
            assertThat(tokenCache.getToken().getValue()).isEqualTo("second");
        }

        @Test
        @DisplayName("toString never reveals the token value")
        void toStringMasksValue() {
            when(mpesaApiClient.fetchAccessToken()).thenReturn(token("super-secret"));

            assertThat(tokenCache.getToken().toString()).doesNotContain("super-secret");
        }
    }

    @Nested
    @DisplayName("single flight")
    class SingleFlight {

        @Test
        @DisplayName("concurrent callers on an empty cache cause exactly one exchange")
        void oneExchangeForConcurrentCallers() throws Exception {
            CountDownLatch exchangeStarted = new CountDownLatch(1);
            CountDownLatch releaseExchange = new CountDownLatch(1);
            when(mpesaApiClient.fetchAccessToken()).thenAnswer(invocation -> {
                exchangeStarted.countDown();
                releaseExchange.await(5, TimeUnit.SECONDS);
                return token("shared");
            });

            int callers = 8;
            ExecutorService pool = Executors.newFixedThreadPool(callers);
            try {
                List<Future<AccessToken>> results = new ArrayList<>();
                for (int i = 0; i < callers; i++) {
                    results.add(pool.submit(tokenCache::getToken));
                }
                assertThat(exchangeStarted.await(5, TimeUnit.SECONDS)).isTrue();
                Thread.sleep(100);
                releaseExchange.countDown();

                for (Future<AccessToken> result : results) {
                    assertThat(result.get(5, TimeUnit.SECONDS).getValue()).isEqualTo("shared");
                }
            } finally {
                pool.shutdownNow();
            }
            verify(mpesaApiClient, times(1)).fetchAccessToken();
        }

        @Test
        @DisplayName("a failed refresh does not block the next one")
        void failureClearsInFlight() {
            when(mpesaApiClient.fetchAccessToken())
                    .thenThrow(new MpesaGatewayException("bad", "400.008.01", "Invalid credentials", 400))
                    .thenReturn(token("recovered"));

            assertThatThrownBy(tokenCache::getToken).isInstanceOf(MpesaAuthException.class);
            assertThat(tokenCache.getToken().getValue()).isEqualTo("recovered");
        }

        @Test
        @DisplayName("an unexpected exchange error reaches the leader and every waiter as the same auth failure")
        void unexpectedErrorSharedByWaiters() throws Exception {
            CountDownLatch exchangeStarted = new CountDownLatch(1);
            CountDownLatch releaseExchange = new CountDownLatch(1);
            when(mpesaApiClient.fetchAccessToken()).thenAnswer(invocation -> {
                exchangeStarted.countDown();
                releaseExchange.await(5, TimeUnit.SECONDS);
                throw new IllegalStateException("JSON decoding error");
            });

            int callers = 4;
            ExecutorService pool = Executors.newFixedThreadPool(callers);
            try {
                List<Future<AccessToken>> results = new ArrayList<>();
                for (int i = 0; i < callers; i++) {
                    results.add(pool.submit(tokenCache::getToken));
                }
                assertThat(exchangeStarted.await(5, TimeUnit.SECONDS)).isTrue();
                Thread.sleep(100);
                releaseExchange.countDown();

                for (Future<AccessToken> result : results) {
                    assertThatThrownBy(() -> result.get(5, TimeUnit.SECONDS))
                            .isInstanceOf(ExecutionException.class)
                            .cause()
                            .isInstanceOf(MpesaAuthException.class)
                            .hasMessageContaining("after 4 attempts");
                }
            } finally {
                pool.shutdownNow();
            }
            verify(mpesaApiClient, times(4)).fetchAccessToken();
        }
    }

    @Nested
    @DisplayName("retry")
    class Retry {

        @Test
        @DisplayName("retries server errors and gives up after the configured attempts")
        void exhaustsRetries() {
            when(mpesaApiClient.fetchAccessToken())
                    .thenThrow(new MpesaGatewayException("down", null, "HTTP 503", 503));

            assertThatThrownBy(tokenCache::getToken)
                    .isInstanceOf(MpesaAuthException.class)
                    .hasMessageContaining("after 4 attempts")
                    .hasCauseInstanceOf(MpesaGatewayException.class);
            verify(mpesaApiClient, times(4)).fetchAccessToken();
        }

        @Test
        @DisplayName("a connection failure followed by success yields the token")
        void recoversAfterNetworkFailure() {
            when(mpesaApiClient.fetchAccessToken())
                    .thenThrow(new MpesaNetworkException("refused", false, null))
                    .thenReturn(token("late"));

            assertThat(tokenCache.getToken().getValue()).isEqualTo("late");
            verify(mpesaApiClient, times(2)).fetchAccessToken();
        }

        @Test
        @DisplayName("a 4xx answer is not retried")
        void clientErrorNotRetried() {
            when(mpesaApiClient.fetchAccessToken())
                    .thenThrow(new MpesaGatewayException("bad", "400.008.01", "Invalid grant type", 400));

            assertThatThrownBy(tokenCache::getToken).isInstanceOf(MpesaAuthException.class);
            verify(mpesaApiClient, times(1)).fetchAccessToken();
        }

        @Test
        @DisplayName("a timeout is not retried")
        void timeoutNotRetried() {
            when(mpesaApiClient.fetchAccessToken())
                    .thenThrow(new MpesaNetworkException("slow", true, null));

            assertThatThrownBy(tokenCache::getToken)
                    .isInstanceOf(MpesaAuthException.class)
                    .hasMessageContaining("timed out");
            verify(mpesaApiClient, times(1)).fetchAccessToken();
        }

        @Test
        @DisplayName("a rejected credential pair is not retried")
        void unauthorizedNotRetried() {
            when(mpesaApiClient.fetchAccessToken()).thenThrow(MpesaAuthException.unauthorized());

            assertThatThrownBy(tokenCache::getToken).isInstanceOf(MpesaAuthException.class);
            verify(mpesaApiClient, times(1)).fetchAccessToken();
        }

        @Test
        @DisplayName("a response without a usable lifetime counts as a failed attempt")
        void malformedLifetime() {
            when(mpesaApiClient.fetchAccessToken())
                    .thenReturn(new TokenResponse("abc", "soon"))
                    .thenReturn(token("good"));

            assertThat(tokenCache.getToken().getValue()).isEqualTo("good");
        }

        @Test
        @DisplayName("an unexpected error is retried like a transient failure")
        void unexpectedErrorRetried() {
            when(mpesaApiClient.fetchAccessToken())
                    .thenThrow(new IllegalStateException("JSON decoding error"));

            assertThatThrownBy(tokenCache::getToken)
                    .isInstanceOf(MpesaAuthException.class)
                    .hasMessageContaining("after 4 attempts")
                    .hasCauseInstanceOf(IllegalStateException.class);
            verify(mpesaApiClient, times(4)).fetchAccessToken();
        }
    }
}
