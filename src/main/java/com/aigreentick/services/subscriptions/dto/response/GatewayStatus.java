package com.aigreentick.services.subscriptions.dto.response;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

/**
 * What a status query learned about one push.
 */
@Getter
@Builder
@Schema(description = "Gateway-reported state of an STK push")
public class GatewayStatus {

    public enum Outcome {
        /** ResultCode 0 */
        SUCCESS,
        /** Definite non-zero ResultCode */
        FAILED,
        /** User has not answered the prompt yet */
        PROCESSING,
        /** Answer we could not classify */
        UNKNOWN
    }

    private final Outcome outcome;
    private final String checkoutRequestId;
    private final String resultCode;
    private final String resultDesc;
    private final String userMessage;

    public boolean isSettled() {
        return outcome == Outcome.SUCCESS || outcome == Outcome.FAILED;
    }
}
