package com.aigreentick.services.subscriptions.service;

import com.aigreentick.services.subscriptions.client.AccessToken;
import com.aigreentick.services.subscriptions.client.GatewayMessageResolver;
import com.aigreentick.services.subscriptions.client.MpesaApiClient;
import com.aigreentick.services.subscriptions.client.MpesaTokenCache;
import com.aigreentick.services.subscriptions.client.StkRequestSigner;
import com.aigreentick.services.subscriptions.config.MpesaApiConfig;
import com.aigreentick.services.subscriptions.constants.SubscriptionConstants;
import com.aigreentick.services.subscriptions.dto.request.PushPaymentCommand;
import com.aigreentick.services.subscriptions.dto.request.StkPushPayload;
import com.aigreentick.services.subscriptions.dto.response.PushResult;
import com.aigreentick.services.subscriptions.dto.response.StkPushResponse;
import com.aigreentick.services.subscriptions.exception.InvalidRequestException;
import com.aigreentick.services.subscriptions.exception.MpesaAuthException;
import com.aigreentick.services.subscriptions.exception.MpesaGatewayException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Builds, signs and submits one STK push.
 *
 * Failure mapping:
 *   bad phone / amount / reference → InvalidRequestException (before any network call)
 *   no token                       → MpesaAuthException
 *   ResponseCode != "0"            → MpesaGatewayException with a user-facing message
 *   no response                    → MpesaNetworkException
 *
 * The push is never retried. The caller persists the returned
 * checkoutRequestId before anything else can reconcile against it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StkPushInitiator {

    private final PhoneNumberNormalizer phoneNumberNormalizer;
    private final MpesaTokenCache tokenCache;
    private final StkRequestSigner requestSigner;
    private final MpesaApiClient mpesaApiClient;
    private final GatewayMessageResolver messageResolver;
    private final MpesaApiConfig mpesaApiConfig;

    public PushResult initiate(PushPaymentCommand command) {
        String phone = phoneNumberNormalizer.normalize(command.getPhone());
        long amount = wholeAmount(command.getAmount());
        String accountReference = validReference(command.getAccountReference());
        String description = truncate(command.getDescription() != null
                        ? command.getDescription()
                        : mpesaApiConfig.getTransactionDescription(),
                SubscriptionConstants.MAX_TRANSACTION_DESC_LENGTH);

        AccessToken token = tokenCache.getToken();
        StkRequestSigner.Signature signature = requestSigner.sign();

        StkPushPayload payload = StkPushPayload.builder()
                .businessShortCode(mpesaApiConfig.getShortcode())
                .password(signature.getPassword())
                .timestamp(signature.getTimestamp())
                .transactionType(mpesaApiConfig.getTransactionType())
                .amount(amount)
                .partyA(phone)
                .partyB(mpesaApiConfig.getShortcode())
                .phoneNumber(phone)
                .callBackUrl(mpesaApiConfig.getCallbackUrl())
                .accountReference(accountReference)
                .transactionDesc(description)
                .build();

        StkPushResponse response;
        try {
            response = mpesaApiClient.submitStkPush(payload, token);
        } catch (MpesaAuthException ex) {
            tokenCache.invalidate(token);
            throw ex;
        }

        if (!SubscriptionConstants.RESPONSE_CODE_ACCEPTED.equals(response.getResponseCode())) {
            log.warn("STK push not accepted: accountReference={}, responseCode={}, description={}",
                    accountReference, response.getResponseCode(), response.getResponseDescription());
            throw new MpesaGatewayException(
                    messageResolver.resolve(response.getResponseCode(), response.getResponseDescription()),
                    response.getResponseCode(), response.getResponseDescription(), 200);
        }
        if (response.getCheckoutRequestId() == null || response.getCheckoutRequestId().isBlank()) {
            log.error("STK push accepted without CheckoutRequestID: accountReference={}", accountReference);
            throw new MpesaGatewayException(messageResolver.resolve(null, null),
                    response.getResponseCode(), "CheckoutRequestID missing", 200);
        }

        log.info("STK push accepted: accountReference={}, checkoutRequestId={}",
                accountReference, response.getCheckoutRequestId());

        return PushResult.builder()
                .merchantRequestId(response.getMerchantRequestId())
                .checkoutRequestId(response.getCheckoutRequestId())
                .responseDescription(response.getResponseDescription())
                .customerMessage(response.getCustomerMessage())
                .raw(response)
                .build();
    }

    /** Daraja takes whole shillings only. */
    private long wholeAmount(BigDecimal amount) {
        if (amount == null) {
            throw InvalidRequestException.invalidAmount(null);
        }
        BigDecimal rounded = amount.setScale(0, RoundingMode.HALF_UP);
        if (rounded.signum() <= 0) {
            throw InvalidRequestException.invalidAmount(amount);
        }
        return rounded.longValueExact();
    }

    private String validReference(String accountReference) {
        if (accountReference == null || accountReference.isBlank()
                || accountReference.length() > SubscriptionConstants.MAX_ACCOUNT_REFERENCE_LENGTH) {
            throw new InvalidRequestException("Account reference must be 1-"
                    + SubscriptionConstants.MAX_ACCOUNT_REFERENCE_LENGTH + " characters, got: " + accountReference);
        }
        return accountReference;
    }

    private String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }
}
