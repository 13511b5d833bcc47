package com.aigreentick.services.subscriptions.dto.response;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Synchronous answer to an STK push submission. ResponseCode "0" means the
 * gateway accepted the request and will prompt the phone; it says nothing
 * about whether the user pays.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StkPushResponse {

    @JsonProperty("MerchantRequestID")
    private String merchantRequestId;

    @JsonProperty("CheckoutRequestID")
    private String checkoutRequestId;

    @JsonProperty("ResponseCode")
    private String responseCode;

    @JsonProperty("ResponseDescription")
    private String responseDescription;

    @JsonProperty("CustomerMessage")
    private String customerMessage;

    /** Fields the gateway adds that we do not model */
    @Builder.Default
    private Map<String, Object> extras = new LinkedHashMap<>();

    @JsonAnySetter
    public void putExtra(String name, Object value) {
        extras.put(name, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getExtras() {
        return extras;
    }
}
