package com.aigreentick.services.subscriptions.store;

import com.aigreentick.services.subscriptions.constants.SubscriptionStatus;
import com.aigreentick.services.subscriptions.entity.Subscription;
import com.aigreentick.services.subscriptions.repository.SubscriptionRepository;
import jakarta.persistence.EntityManager;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaUpdate;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JPA-backed SubscriptionStore.
 *
 * Guarded writes are a single statement:
 *   UPDATE subscriptions SET ... WHERE id = :id AND status = :expected
 * Exactly one concurrent caller sees updated=1; the rest see 0.
 * The persistence context is flushed before and cleared after, so later
 * reads in the same transaction see the new row instead of a stale copy.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaSubscriptionStore implements SubscriptionStore {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt");

    private final SubscriptionRepository subscriptionRepository;
    private final EntityManager entityManager;

    @Override
    @Transactional
    public Subscription create(Subscription subscription) {
        return subscriptionRepository.save(subscription);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Subscription> findById(Long id) {
        return subscriptionRepository.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Subscription> findByCheckoutRequestId(String checkoutRequestId) {
        return subscriptionRepository.findByCheckoutRequestId(checkoutRequestId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Subscription> find(SubscriptionCriteria criteria) {
        Specification<Subscription> spec = toSpecification(criteria);
        if (criteria.isLimited()) {
            return subscriptionRepository.findAll(spec, PageRequest.of(0, criteria.getLimit(), NEWEST_FIRST))
                    .getContent();
        }
        return subscriptionRepository.findAll(spec, NEWEST_FIRST);
    }

    @Override
    @Transactional
    public boolean updateIfStateMatches(Long id, SubscriptionStatus expectedState, SubscriptionPatch patch) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaUpdate<Subscription> update = cb.createCriteriaUpdate(Subscription.class);
        Root<Subscription> root = update.from(Subscription.class);

        int assignments = 0;
        if (patch.getStatus() != null) { update.set(root.<SubscriptionStatus>get("status"), patch.getStatus()); assignments++; }
        if (patch.getStartDate() != null) { update.set(root.get("startDate"), patch.getStartDate()); assignments++; }
        if (patch.getCheckoutRequestId() != null) { update.set(root.<String>get("checkoutRequestId"), patch.getCheckoutRequestId()); assignments++; }
        if (patch.getMerchantRequestId() != null) { update.set(root.<String>get("merchantRequestId"), patch.getMerchantRequestId()); assignments++; }
        if (patch.getReceiptNumber() != null) { update.set(root.<String>get("receiptNumber"), patch.getReceiptNumber()); assignments++; }
        if (patch.getPaidAmount() != null) { update.set(root.get("paidAmount"), patch.getPaidAmount()); assignments++; }
        if (patch.getPayerPhone() != null) { update.set(root.<String>get("payerPhone"), patch.getPayerPhone()); assignments++; }
        if (patch.getFailureReason() != null) { update.set(root.<String>get("failureReason"), patch.getFailureReason()); assignments++; }
        if (patch.getUpdatedAt() != null) { update.set(root.get("updatedAt"), patch.getUpdatedAt()); assignments++; }

        if (assignments == 0) {
            log.debug("Empty patch for subscription {}, nothing to write", id);
            return false;
        }

        update.where(
                cb.equal(root.get("id"), id),
                cb.equal(root.get("status"), expectedState));

        entityManager.flush();
        int updated = entityManager.createQuery(update).executeUpdate();
        entityManager.clear();
        return updated == 1;
    }

    private Specification<Subscription> toSpecification(SubscriptionCriteria c) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (c.getOwnerId() != null) predicates.add(cb.equal(root.get("ownerId"), c.getOwnerId()));
            if (c.getCategory() != null) predicates.add(cb.equal(root.get("category"), c.getCategory()));
            if (c.getStatus() != null) predicates.add(cb.equal(root.get("status"), c.getStatus()));
            if (c.getCheckoutRequestId() != null) {
                predicates.add(cb.equal(root.get("checkoutRequestId"), c.getCheckoutRequestId()));
            }
            if (c.getEndDateAtOrBefore() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.get("endDate"), c.getEndDateAtOrBefore()));
            }
            if (c.getEndDateAfter() != null) {
                predicates.add(cb.greaterThan(root.get("endDate"), c.getEndDateAfter()));
            }
            if (c.getCreatedBefore() != null) {
                predicates.add(cb.lessThan(root.get("createdAt"), c.getCreatedBefore()));
            }
            if (c.getCreatedAfter() != null) {
                predicates.add(cb.greaterThan(root.get("createdAt"), c.getCreatedAfter()));
            }
            if (Boolean.TRUE.equals(c.getHasCheckoutRequestId())) {
                predicates.add(cb.isNotNull(root.get("checkoutRequestId")));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
