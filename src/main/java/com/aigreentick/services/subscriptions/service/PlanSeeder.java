package com.aigreentick.services.subscriptions.service;

import com.aigreentick.services.subscriptions.constants.SubscriptionCategory;
import com.aigreentick.services.subscriptions.entity.Plan;
import com.aigreentick.services.subscriptions.repository.PlanRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

/**
 * Loads the default catalogue into an empty plans table on startup.
 * Enabled with subscriptions.seed-plans=true; never touches existing rows.
 */
@Component
@ConditionalOnProperty(name = "subscriptions.seed-plans", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class PlanSeeder implements ApplicationRunner {

    private final PlanRepository planRepository;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        if (planRepository.count() > 0) {
            log.info("Plan catalogue already present, skipping seed");
            return;
        }
        List<Plan> saved = planRepository.saveAll(defaultCatalogue());
        log.info("Seeded {} plans", saved.size());
    }

    static List<Plan> defaultCatalogue() {
        return List.of(
                hours(SubscriptionCategory.GAMING, "Hourly Pass", 50, 1, "Play games for 1 hour"),
                days(SubscriptionCategory.GAMING, "Daily Pass", 300, 1, "Unlimited gaming for 24 hours"),
                days(SubscriptionCategory.GAMING, "Weekly Pass", 1500, 7, "Unlimited gaming for 1 week"),
                days(SubscriptionCategory.GAMING, "Monthly Pass", 5000, 30, "Unlimited gaming for 1 month"),

                days(SubscriptionCategory.GYM, "Daily Workout", 200, 1, "Access to gym for 1 day"),
                days(SubscriptionCategory.GYM, "Weekly Membership", 1000, 7, "Full gym access for 1 week"),
                days(SubscriptionCategory.GYM, "Monthly Membership", 3500, 30, "Full gym access for 1 month"),
                days(SubscriptionCategory.GYM, "Annual Membership", 30000, 365, "Full gym access for 1 year"),

                days(SubscriptionCategory.MOVIES, "Basic", 100, 1, "Access to standard movies for 1 day"),
                days(SubscriptionCategory.MOVIES, "Premium", 300, 7, "Access to all movies for 1 week"),

                hours(SubscriptionCategory.SPORTS, "Daily Pass", 50, 24, "Access to sports facilities for 24 hours"),
                days(SubscriptionCategory.SPORTS, "Monthly Pass", 1000, 30, "Access to sports facilities for 1 month")
        );
    }

    private static Plan hours(SubscriptionCategory category, String name, int amount, int hours, String description) {
        return Plan.builder()
                .category(category)
                .name(name)
                .amount(BigDecimal.valueOf(amount))
                .durationHours(hours)
                .description(description)
                .build();
    }

    private static Plan days(SubscriptionCategory category, String name, int amount, int days, String description) {
        return Plan.builder()
                .category(category)
                .name(name)
                .amount(BigDecimal.valueOf(amount))
                .durationDays(days)
                .description(description)
                .build();
    }
}
