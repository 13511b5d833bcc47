package com.aigreentick.services.subscriptions.controller;

import com.aigreentick.services.subscriptions.constants.SubscriptionConstants;
import com.aigreentick.services.subscriptions.dto.request.SubscribeRequest;
import com.aigreentick.services.subscriptions.dto.response.ApiResponse;
import com.aigreentick.services.subscriptions.dto.response.PlanResponse;
import com.aigreentick.services.subscriptions.dto.response.SubscribeResponse;
import com.aigreentick.services.subscriptions.dto.response.SubscriptionResponse;
import com.aigreentick.services.subscriptions.mapper.SubscriptionMapper;
import com.aigreentick.services.subscriptions.service.PlanService;
import com.aigreentick.services.subscriptions.service.SubscriptionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST Controller for plans and subscriptions.
 * The caller is identified by the X-User-Id header set by the API gateway.
 */
@RestController
@RequestMapping(SubscriptionConstants.API_V1 + "/subscriptions")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Subscriptions", description = "Plan catalogue and M-Pesa paid subscriptions")
public class SubscriptionController {

    private final SubscriptionService subscriptionService;
    private final PlanService planService;

    // ========================
    // PLANS (public)
    // ========================

    @GetMapping("/plans")
    @Operation(summary = "List all plans")
    public ResponseEntity<ApiResponse<List<PlanResponse>>> getPlans() {
        log.debug("GET /subscriptions/plans");
        List<PlanResponse> plans = planService.listAll().stream()
                .map(SubscriptionMapper::toPlanResponse)
                .collect(Collectors.toList());
        return ResponseEntity.ok(ApiResponse.success(plans, "Plans fetched successfully"));
    }

    @GetMapping("/plans/{category}")
    @Operation(summary = "List plans of one category")
    public ResponseEntity<ApiResponse<List<PlanResponse>>> getPlansByCategory(
            @Parameter(description = "gaming, gym, movies or sports") @PathVariable String category
    ) {
        log.debug("GET /subscriptions/plans/{}", category);
        List<PlanResponse> plans = planService.listByCategory(category).stream()
                .map(SubscriptionMapper::toPlanResponse)
                .collect(Collectors.toList());
        return ResponseEntity.ok(ApiResponse.success(plans, "Plans fetched successfully"));
    }

    // ========================
    // SUBSCRIPTIONS
    // ========================

    @PostMapping("/subscribe")
    @Operation(summary = "Subscribe and pay", description = "Creates a pending subscription and sends an STK push to the phone")
    public ResponseEntity<ApiResponse<SubscribeResponse>> subscribe(
            @RequestHeader(SubscriptionConstants.OWNER_HEADER) String ownerId,
            @Valid @RequestBody SubscribeRequest request
    ) {
        log.info("POST /subscriptions/subscribe - owner={}, plan={}/{}",
                ownerId, request.getCategory(), request.getPlan());
        SubscribeResponse response = subscriptionService.subscribe(ownerId, request);
        return ResponseEntity
                .status(HttpStatus.CREATED)
                .body(ApiResponse.success(response, SubscriptionConstants.SUCCESS_PUSH_INITIATED));
    }

    @GetMapping
    @Operation(summary = "List the caller's subscriptions, newest first")
    public ResponseEntity<ApiResponse<List<SubscriptionResponse>>> getMySubscriptions(
            @RequestHeader(SubscriptionConstants.OWNER_HEADER) String ownerId
    ) {
        log.debug("GET /subscriptions - owner={}", ownerId);
        return ResponseEntity.ok(ApiResponse.success(
                subscriptionService.listForOwner(ownerId), "Subscriptions fetched successfully"));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get one of the caller's subscriptions")
    public ResponseEntity<ApiResponse<SubscriptionResponse>> getSubscription(
            @RequestHeader(SubscriptionConstants.OWNER_HEADER) String ownerId,
            @PathVariable Long id
    ) {
        log.debug("GET /subscriptions/{} - owner={}", id, ownerId);
        return ResponseEntity.ok(ApiResponse.success(
                subscriptionService.getForOwner(ownerId, id), "Subscription fetched successfully"));
    }

    @PostMapping("/{id}/refresh")
    @Operation(summary = "Check payment status now", description = "Queries M-Pesa for a pending subscription")
    public ResponseEntity<ApiResponse<SubscriptionResponse>> refresh(
            @RequestHeader(SubscriptionConstants.OWNER_HEADER) String ownerId,
            @PathVariable Long id
    ) {
        log.info("POST /subscriptions/{}/refresh - owner={}", id, ownerId);
        return ResponseEntity.ok(ApiResponse.success(
                subscriptionService.refresh(ownerId, id), "Subscription status refreshed"));
    }

    @PatchMapping("/{id}/cancel")
    @Operation(summary = "Cancel a pending or active subscription")
    public ResponseEntity<ApiResponse<SubscriptionResponse>> cancel(
            @RequestHeader(SubscriptionConstants.OWNER_HEADER) String ownerId,
            @PathVariable Long id
    ) {
        log.info("PATCH /subscriptions/{}/cancel - owner={}", id, ownerId);
        return ResponseEntity.ok(ApiResponse.success(
                subscriptionService.cancel(ownerId, id), "Subscription cancelled"));
    }
}
