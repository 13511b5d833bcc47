package com.aigreentick.services.subscriptions.service;

import com.aigreentick.services.subscriptions.constants.SubscriptionCategory;
import com.aigreentick.services.subscriptions.entity.Plan;
import com.aigreentick.services.subscriptions.exception.InvalidRequestException;
import com.aigreentick.services.subscriptions.exception.PlanNotFoundException;
import com.aigreentick.services.subscriptions.repository.PlanRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class PlanService {

    private final PlanRepository planRepository;

    public List<Plan> listAll() {
        List<Plan> plans = planRepository.findAll(Sort.by("category", "amount"));
        if (plans.isEmpty()) {
            throw new PlanNotFoundException("No plans found");
        }
        return plans;
    }

    public List<Plan> listByCategory(String category) {
        SubscriptionCategory parsed = parseCategory(category);
        List<Plan> plans = planRepository.findByCategoryOrderByAmountAsc(parsed);
        if (plans.isEmpty()) {
            throw PlanNotFoundException.noneInCategory(parsed.getValue());
        }
        return plans;
    }

    public Plan resolve(String category, String planName) {
        SubscriptionCategory parsed = parseCategory(category);
        return planRepository.findByCategoryAndName(parsed, planName)
                .orElseThrow(() -> PlanNotFoundException.forPlan(parsed.getValue(), planName));
    }

    public SubscriptionCategory parseCategory(String category) {
        try {
            return SubscriptionCategory.fromValue(category);
        } catch (IllegalArgumentException ex) {
            throw InvalidRequestException.invalidCategory(category);
        }
    }
}
