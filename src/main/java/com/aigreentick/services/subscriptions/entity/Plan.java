package com.aigreentick.services.subscriptions.entity;

import com.aigreentick.services.subscriptions.constants.SubscriptionCategory;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * A purchasable plan. Duration is either hours or days; hours win when both are set.
 */
@Entity
@Table(name = "plans",
        uniqueConstraints = @UniqueConstraint(name = "uq_plan_category_name",
                columnNames = {"category", "name"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Plan {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", nullable = false, length = 20)
    private SubscriptionCategory category;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(name = "duration_hours")
    private Integer durationHours;

    @Column(name = "duration_days")
    private Integer durationDays;

    @Column(name = "description", nullable = false)
    private String description;

    /**
     * @return the plan's duration, or null when none is configured
     */
    public Duration getDuration() {
        if (durationHours != null && durationHours > 0) {
            return Duration.ofHours(durationHours);
        }
        if (durationDays != null && durationDays > 0) {
            return Duration.ofDays(durationDays);
        }
        return null;
    }
}
