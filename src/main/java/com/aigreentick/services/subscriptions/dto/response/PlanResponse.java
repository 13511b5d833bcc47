package com.aigreentick.services.subscriptions.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.*;

import java.math.BigDecimal;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "A purchasable plan")
public class PlanResponse {

    @Schema(example = "gaming")
    private String category;

    @Schema(example = "Daily Pass")
    private String name;

    @Schema(example = "50.00")
    private BigDecimal amount;

    @Schema(example = "24")
    private Integer durationHours;

    private Integer durationDays;

    @Schema(example = "24 hours of unlimited gaming")
    private String description;
}
