package com.billing.subscription.repository;

import com.billing.subscription.entity.PaymentRecord;
import com.billing.subscription.entity.PaymentRecordStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface PaymentRecordRepository extends JpaRepository<PaymentRecord, UUID> {

    Optional<PaymentRecord> findByPaymentCorrelationId(String paymentCorrelationId);

    List<PaymentRecord> findBySubscriptionIdOrderByCreatedAtDesc(UUID subscriptionId);

    /**
     * Sets the payment id only while the record is unclaimed. Status columns are not written, so a
     * settlement committed in the meantime stays intact.
     */
    @Modifying
    @Query("""
            UPDATE PaymentRecord r SET r.paymentCorrelationId = :paymentId
             WHERE r.id = :id AND r.paymentCorrelationId IS NULL
            """)
    int assignCorrelationIfUnclaimed(@Param("id") UUID id, @Param("paymentId") String paymentId);

    /**
     * Pending records whose payment was never acknowledged by the payment service.
     */
    @Query("""
            SELECT r.id FROM PaymentRecord r
             WHERE r.status = :status AND r.paymentCorrelationId IS NULL
               AND r.createdAt >= :from AND r.createdAt < :to
             ORDER BY r.createdAt ASC
            """)
    List<UUID> findUnacknowledged(@Param("status") PaymentRecordStatus status,
                                  @Param("from") Instant from,
                                  @Param("to") Instant to,
                                  Pageable page);
}
