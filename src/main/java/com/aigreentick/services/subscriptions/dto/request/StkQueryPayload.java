package com.aigreentick.services.subscriptions.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

/**
 * Wire body of POST /mpesa/stkpushquery/v1/query
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StkQueryPayload {

    @JsonProperty("BusinessShortCode")
    private String businessShortCode;

    @JsonProperty("Password")
    private String password;

    @JsonProperty("Timestamp")
    private String timestamp;

    @JsonProperty("CheckoutRequestID")
    private String checkoutRequestId;
}
