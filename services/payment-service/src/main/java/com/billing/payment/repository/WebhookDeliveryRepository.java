package com.billing.payment.repository;

import com.billing.payment.entity.WebhookDelivery;
import com.billing.payment.entity.WebhookDeliveryStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface WebhookDeliveryRepository extends JpaRepository<WebhookDelivery, UUID> {

    Optional<WebhookDelivery> findFirstByPaymentIdOrderByCreatedAtDesc(UUID paymentId);

    List<WebhookDelivery> findByPaymentIdOrderByCreatedAtAsc(UUID paymentId);

    @Query(value = """
            SELECT * FROM webhook_deliveries
             WHERE status = 'PENDING' AND next_attempt_at <= :now
             ORDER BY next_attempt_at ASC
             LIMIT :limit
             FOR UPDATE SKIP LOCKED
            """, nativeQuery = true)
    List<WebhookDelivery> lockDue(@Param("now") Instant now, @Param("limit") int limit);

    @Modifying
    @Query("DELETE FROM WebhookDelivery d WHERE d.status = :status AND d.deliveredAt < :cutoff")
    int deleteByStatusAndDeliveredAtBefore(@Param("status") WebhookDeliveryStatus status,
                                           @Param("cutoff") Instant cutoff);
}
