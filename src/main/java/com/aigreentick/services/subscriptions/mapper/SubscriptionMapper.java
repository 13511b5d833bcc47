package com.aigreentick.services.subscriptions.mapper;

import com.aigreentick.services.subscriptions.dto.request.StkCallbackRequest;
import com.aigreentick.services.subscriptions.dto.response.PlanResponse;
import com.aigreentick.services.subscriptions.dto.response.PushResult;
import com.aigreentick.services.subscriptions.dto.response.SubscribeResponse;
import com.aigreentick.services.subscriptions.dto.response.SubscriptionResponse;
import com.aigreentick.services.subscriptions.entity.Plan;
import com.aigreentick.services.subscriptions.entity.Subscription;
import com.aigreentick.services.subscriptions.service.OutcomeNotification;
import lombok.experimental.UtilityClass;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mapper utility between subscription entities, API DTOs and gateway payloads
 */
@UtilityClass
public class SubscriptionMapper {

    public SubscriptionResponse toSubscriptionResponse(Subscription entity) {
        if (entity == null) return null;

        return SubscriptionResponse.builder()
                .id(entity.getId())
                .ownerId(entity.getOwnerId())
                .category(entity.getCategory() != null ? entity.getCategory().getValue() : null)
                .planName(entity.getPlanName())
                .amount(entity.getAmount())
                .status(entity.getStatus() != null ? entity.getStatus().getValue() : null)
                .startDate(entity.getStartDate())
                .endDate(entity.getEndDate())
                .checkoutRequestId(entity.getCheckoutRequestId())
                .receiptNumber(entity.getReceiptNumber())
                .paidAmount(entity.getPaidAmount())
                .payerPhone(entity.getPayerPhone())
                .failureReason(entity.getFailureReason())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }

    public PlanResponse toPlanResponse(Plan entity) {
        if (entity == null) return null;

        return PlanResponse.builder()
                .category(entity.getCategory().getValue())
                .name(entity.getName())
                .amount(entity.getAmount())
                .durationHours(entity.getDurationHours())
                .durationDays(entity.getDurationDays())
                .description(entity.getDescription())
                .build();
    }

    public SubscribeResponse toSubscribeResponse(Subscription entity, PushResult pushResult) {
        SubscribeResponse.SubscribeResponseBuilder builder = SubscribeResponse.builder()
                .subscription(toSubscriptionResponse(entity));
        if (pushResult != null) {
            builder.checkoutRequestId(pushResult.getCheckoutRequestId())
                    .customerMessage(pushResult.getCustomerMessage());
        }
        return builder.build();
    }

    /**
     * Flatten a webhook body. Returns null when Body.stkCallback is absent.
     */
    public OutcomeNotification toOutcomeNotification(StkCallbackRequest request) {
        if (request == null || request.getBody() == null || request.getBody().getStkCallback() == null) {
            return null;
        }
        StkCallbackRequest.StkCallback callback = request.getBody().getStkCallback();

        Map<String, Object> metadata = new LinkedHashMap<>();
        if (callback.getCallbackMetadata() != null && callback.getCallbackMetadata().getItems() != null) {
            for (StkCallbackRequest.Item item : callback.getCallbackMetadata().getItems()) {
                if (item != null && item.getName() != null && item.getValue() != null) {
                    metadata.put(item.getName(), item.getValue());
                }
            }
        }

        return OutcomeNotification.builder()
                .checkoutRequestId(callback.getCheckoutRequestId())
                .merchantRequestId(callback.getMerchantRequestId())
                .resultCode(callback.getResultCode())
                .resultDesc(callback.getResultDesc())
                .metadata(metadata)
                .build();
    }
}
