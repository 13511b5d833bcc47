package com.aigreentick.services.subscriptions.support;

import com.aigreentick.services.subscriptions.constants.SubscriptionStatus;
import com.aigreentick.services.subscriptions.entity.Subscription;
import com.aigreentick.services.subscriptions.store.SubscriptionCriteria;
import com.aigreentick.services.subscriptions.store.SubscriptionPatch;
import com.aigreentick.services.subscriptions.store.SubscriptionStore;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * SubscriptionStore fake with the same guarded-write contract as the JPA store.
 * Reads hand out copies, so a caller holding an old copy sees stale state the
 * way it would after a database read.
 */
public class InMemorySubscriptionStore implements SubscriptionStore {

    private final Map<Long, Subscription> rows = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();
    private final AtomicInteger successfulWrites = new AtomicInteger();

    @Override
    public Subscription create(Subscription subscription) {
        Subscription stored = subscription.toBuilder().id(ids.incrementAndGet()).build();
        rows.put(stored.getId(), stored);
        return copy(stored);
    }

    @Override
    public Optional<Subscription> findById(Long id) {
        return Optional.ofNullable(rows.get(id)).map(this::copy);
    }

    @Override
    public List<Subscription> find(SubscriptionCriteria c) {
        Stream<Subscription> stream = rows.values().stream()
                .filter(s -> c.getOwnerId() == null || c.getOwnerId().equals(s.getOwnerId()))
                .filter(s -> c.getCategory() == null || c.getCategory() == s.getCategory())
                .filter(s -> c.getStatus() == null || c.getStatus() == s.getStatus())
                .filter(s -> c.getCheckoutRequestId() == null || c.getCheckoutRequestId().equals(s.getCheckoutRequestId()))
                .filter(s -> c.getEndDateAtOrBefore() == null || !s.getEndDate().isAfter(c.getEndDateAtOrBefore()))
                .filter(s -> c.getEndDateAfter() == null || s.getEndDate().isAfter(c.getEndDateAfter()))
                .filter(s -> c.getCreatedBefore() == null || s.getCreatedAt().isBefore(c.getCreatedBefore()))
                .filter(s -> c.getCreatedAfter() == null || s.getCreatedAt().isAfter(c.getCreatedAfter()))
                .filter(s -> !Boolean.TRUE.equals(c.getHasCheckoutRequestId()) || s.getCheckoutRequestId() != null)
                .sorted(Comparator.comparing(Subscription::getCreatedAt).reversed())
                .map(this::copy);
        if (c.isLimited()) {
            stream = stream.limit(c.getLimit());
        }
        return stream.collect(Collectors.toList());
    }

    @Override
    public synchronized boolean updateIfStateMatches(Long id, SubscriptionStatus expectedState, SubscriptionPatch patch) {
        Subscription stored = rows.get(id);
        if (stored == null || stored.getStatus() != expectedState) {
            return false;
        }
        Subscription updated = copy(stored);
        apply(patch, updated);
        rows.put(id, updated);
        successfulWrites.incrementAndGet();
        return true;
    }

    /** Number of guarded writes that changed a record. */
    public int successfulWrites() {
        return successfulWrites.get();
    }

    private static void apply(SubscriptionPatch patch, Subscription target) {
        if (patch.getStatus() != null) target.setStatus(patch.getStatus());
        if (patch.getStartDate() != null) target.setStartDate(patch.getStartDate());
        if (patch.getCheckoutRequestId() != null) target.setCheckoutRequestId(patch.getCheckoutRequestId());
        if (patch.getMerchantRequestId() != null) target.setMerchantRequestId(patch.getMerchantRequestId());
        if (patch.getReceiptNumber() != null) target.setReceiptNumber(patch.getReceiptNumber());
        if (patch.getPaidAmount() != null) target.setPaidAmount(patch.getPaidAmount());
        if (patch.getPayerPhone() != null) target.setPayerPhone(patch.getPayerPhone());
        if (patch.getFailureReason() != null) target.setFailureReason(patch.getFailureReason());
        if (patch.getUpdatedAt() != null) target.setUpdatedAt(patch.getUpdatedAt());
    }

    private Subscription copy(Subscription s) {
        return s.toBuilder().build();
    }
}
