package com.aigreentick.services.subscriptions.constants;

/**
 * Application-wide constants for the subscription service
 */
public final class SubscriptionConstants {

    private SubscriptionConstants() {
        throw new IllegalStateException("Constants class cannot be instantiated");
    }

    // API Versioning
    public static final String API_V1 = "/api/v1";

    // Caller identity, set by the upstream API gateway after authentication
    public static final String OWNER_HEADER = "X-User-Id";

    // Daraja request limits
    public static final int MAX_ACCOUNT_REFERENCE_LENGTH = 12;
    public static final int MAX_TRANSACTION_DESC_LENGTH = 13;
    public static final String SIGNING_TIMESTAMP_PATTERN = "yyyyMMddHHmmss";

    // Daraja response codes
    public static final String RESPONSE_CODE_ACCEPTED = "0";
    public static final int RESULT_CODE_SUCCESS = 0;
    public static final String ERROR_CODE_STILL_PROCESSING = "500.001.1001";

    // STK callback metadata item names
    public static final String ITEM_RECEIPT_NUMBER = "MpesaReceiptNumber";
    public static final String ITEM_AMOUNT = "Amount";
    public static final String ITEM_ACCOUNT_REFERENCE = "AccountReference";
    public static final String ITEM_PHONE_NUMBER = "PhoneNumber";
    public static final String ITEM_TRANSACTION_DATE = "TransactionDate";

    // Success Messages
    public static final String SUCCESS_PUSH_INITIATED = "STK Push initiated. Enter M-Pesa PIN to complete.";
    public static final String SUCCESS_CALLBACK_ACCEPTED = "Accepted";

    // Error Messages
    public static final String ERROR_PAYMENT_INITIATION_FAILED = "Payment initiation failed";
}
