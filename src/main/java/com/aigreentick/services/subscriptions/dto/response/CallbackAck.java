package com.aigreentick.services.subscriptions.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.aigreentick.services.subscriptions.constants.SubscriptionConstants;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Acknowledgement returned to the gateway for every webhook delivery.
 * Anything but ResultCode 0 would make Daraja redeliver.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class CallbackAck {

    @JsonProperty("ResultCode")
    private int resultCode;

    @JsonProperty("ResultDesc")
    private String resultDesc;

    public static CallbackAck accepted() {
        return new CallbackAck(0, SubscriptionConstants.SUCCESS_CALLBACK_ACCEPTED);
    }
}
