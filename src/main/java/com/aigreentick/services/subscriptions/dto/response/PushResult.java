package com.aigreentick.services.subscriptions.dto.response;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

/**
 * Outcome of an accepted STK push. checkoutRequestId is the only link to
 * the later webhook or status query, so callers persist it before returning.
 */
@Getter
@Builder
@Schema(description = "Gateway acceptance of an STK push")
public class PushResult {

    @Schema(example = "29115-34620561-1")
    private final String merchantRequestId;

    @Schema(example = "ws_CO_191220191020363925")
    private final String checkoutRequestId;

    @Schema(example = "Success. Request accepted for processing")
    private final String responseDescription;

    @Schema(example = "Success. Request accepted for processing")
    private final String customerMessage;

    @JsonIgnore
    private final StkPushResponse raw;
}
