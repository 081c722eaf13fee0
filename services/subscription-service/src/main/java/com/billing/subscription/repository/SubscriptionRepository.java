package com.billing.subscription.repository;

import com.billing.subscription.entity.Subscription;
import com.billing.subscription.entity.SubscriptionStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SubscriptionRepository extends JpaRepository<Subscription, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Subscription s WHERE s.id = :id")
    Optional<Subscription> findByIdForUpdate(@Param("id") UUID id);

    Optional<Subscription> findFirstByUserIdAndStatusIn(UUID userId, Collection<SubscriptionStatus> statuses);

    List<Subscription> findByUserIdOrderByCreatedAtDesc(UUID userId);

    List<Subscription> findByUserIdAndStatusOrderByCreatedAtDesc(UUID userId, SubscriptionStatus status);

    @Query("""
            SELECT s.id FROM Subscription s
             WHERE s.status = :status AND s.scheduledChangeAt IS NOT NULL AND s.scheduledChangeAt <= :now
            """)
    List<UUID> findIdsWithChangeDue(@Param("status") SubscriptionStatus status, @Param("now") Instant now);
}
