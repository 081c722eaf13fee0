package com.billing.payment.repository;

import com.billing.payment.entity.PaymentTransaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface PaymentTransactionRepository extends JpaRepository<PaymentTransaction, UUID> {

    Optional<PaymentTransaction> findFirstByExternalReferenceOrderByCreatedAtDesc(String externalReference);

    /**
     * Locks up to {@code limit} payments in {@code status} last touched before {@code before}. Rows
     * another worker holds are skipped, not waited on.
     */
    @Query(value = """
            SELECT * FROM payment_transactions
             WHERE status = :status AND updated_at <= :before
             ORDER BY updated_at ASC
             LIMIT :limit
             FOR UPDATE SKIP LOCKED
            """, nativeQuery = true)
    List<PaymentTransaction> lockDue(@Param("status") String status,
                                     @Param("before") Instant before,
                                     @Param("limit") int limit);
}
