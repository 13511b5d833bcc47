package com.aigreentick.services.subscriptions.exception;

/**
 * Thrown when a plan or plan category has no entries
 */
public class PlanNotFoundException extends SubscriptionServiceException {

    public PlanNotFoundException(String message) {
        super(message, "PLAN_NOT_FOUND");
    }

    public static PlanNotFoundException forPlan(String category, String planName) {
        return new PlanNotFoundException("Invalid category or plan: " + category + " / " + planName);
    }

    public static PlanNotFoundException noneInCategory(String category) {
        return new PlanNotFoundException("No " + category + " plans found");
    }
}
