package com.aigreentick.services.subscriptions.dto.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.*;

/**
 * Request DTO for buying a subscription.
 * The owner comes from the X-User-Id header, not the body.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "Request to subscribe to a plan and pay with M-Pesa")
public class SubscribeRequest {

    @NotBlank(message = "Category is required")
    @Schema(description = "Plan category", example = "gaming")
    private String category;

    @NotBlank(message = "Plan is required")
    @Schema(description = "Plan name within the category", example = "Daily Pass")
    private String plan;

    @NotBlank(message = "Phone number is required")
    @Schema(description = "M-Pesa phone number, local or international", example = "0712345678")
    private String phone;
}
