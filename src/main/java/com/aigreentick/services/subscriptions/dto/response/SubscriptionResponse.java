package com.aigreentick.services.subscriptions.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Subscription details")
public class SubscriptionResponse {

    private Long id;
    private String ownerId;

    @Schema(example = "gaming")
    private String category;

    @Schema(example = "Daily Pass")
    private String planName;

    private BigDecimal amount;

    @Schema(example = "active", allowableValues = {"pending", "active", "failed", "expired", "cancelled"})
    private String status;

    private LocalDateTime startDate;
    private LocalDateTime endDate;

    @Schema(example = "ws_CO_191220191020363925")
    private String checkoutRequestId;

    @Schema(example = "NLJ7RT61SV")
    private String receiptNumber;

    private BigDecimal paidAmount;
    private String payerPhone;
    private String failureReason;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
