package com.aigreentick.services.subscriptions.dto.response;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "Pending subscription plus the accepted push")
public class SubscribeResponse {

    private SubscriptionResponse subscription;

    @Schema(example = "ws_CO_191220191020363925")
    private String checkoutRequestId;

    @Schema(description = "Text to show while the user enters their PIN")
    private String customerMessage;
}
