package com.aigreentick.services.subscriptions.entity;

import com.aigreentick.services.subscriptions.constants.SubscriptionCategory;
import com.aigreentick.services.subscriptions.constants.SubscriptionStatus;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A time-boxed subscription paid through STK push.
 *
 * Status changes never go through save(): every transition is a guarded
 * write in SubscriptionStore.updateIfStateMatches(), keyed on the current
 * status. save() is only used for the initial PENDING insert.
 *
 * checkoutRequestId is the gateway correlation key. It is set once the push
 * is accepted and is unique across all rows.
 */
@Entity
@Table(
        name = "subscriptions",
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_subscription_checkout", columnNames = "checkout_request_id")
        },
        indexes = {
                @Index(name = "idx_subscription_owner_category", columnList = "owner_id, category"),
                @Index(name = "idx_subscription_status_end", columnList = "status, end_date"),
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Subscription {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "owner_id", nullable = false, length = 100)
    private String ownerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", nullable = false, length = 20)
    private SubscriptionCategory category;

    @Column(name = "plan_name", nullable = false, length = 100)
    private String planName;

    @Column(name = "amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private SubscriptionStatus status = SubscriptionStatus.PENDING;

    /** Set on activation only */
    @Column(name = "start_date")
    private LocalDateTime startDate;

    /** Computed from the plan duration at creation */
    @Column(name = "end_date", nullable = false)
    private LocalDateTime endDate;

    @Column(name = "checkout_request_id", length = 100)
    private String checkoutRequestId;

    @Column(name = "merchant_request_id", length = 100)
    private String merchantRequestId;

    @Column(name = "receipt_number", length = 50)
    private String receiptNumber;

    @Column(name = "paid_amount", precision = 12, scale = 2)
    private BigDecimal paidAmount;

    @Column(name = "payer_phone", length = 20)
    private String payerPhone;

    @Column(name = "failure_reason", columnDefinition = "TEXT")
    private String failureReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public boolean isPending() {
        return SubscriptionStatus.PENDING.equals(this.status);
    }

    public boolean hasCheckoutRequest() {
        return checkoutRequestId != null && !checkoutRequestId.isBlank();
    }

    /** The account reference sent to the gateway and echoed back in callbacks. */
    public String accountReference() {
        return String.valueOf(id);
    }
}
