package com.billing.payment.service;

import com.billing.common.error.ApiException;
import com.billing.payment.dto.InitiatePaymentRequest;
import com.billing.payment.dto.PaymentResponse;
import com.billing.payment.dto.WebhookResendResponse;
import com.billing.payment.entity.PaymentTransaction;
import com.billing.payment.entity.WebhookDelivery;
import com.billing.payment.repository.PaymentTransactionRepository;
import com.billing.payment.repository.WebhookDeliveryRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Service
public class PaymentService {

    private static final Logger log = LoggerFactory.getLogger(PaymentService.class);

    private final PaymentTransactionRepository paymentRepository;
    private final WebhookDeliveryRepository deliveryRepository;
    private final PaymentSettlementWorker settlementWorker;
    private final MeterRegistry meterRegistry;

    public PaymentService(PaymentTransactionRepository paymentRepository,
                          WebhookDeliveryRepository deliveryRepository,
                          PaymentSettlementWorker settlementWorker,
                          MeterRegistry meterRegistry) {
        this.paymentRepository = paymentRepository;
        this.deliveryRepository = deliveryRepository;
        this.settlementWorker = settlementWorker;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Records a PENDING payment. Settlement happens later in {@link PaymentSettlementWorker}.
     */
    @Transactional
    public PaymentResponse initiate(InitiatePaymentRequest request) {
        PaymentTransaction payment = paymentRepository.save(new PaymentTransaction(
                request.externalReference(), request.amount(), request.currency(), request.metadata()));
        meterRegistry.counter("payments_initiated_total").increment();
        log.info("Payment {} initiated for reference {}: {} {}", payment.getId(), payment.getExternalReference(),
                payment.getAmount(), payment.getCurrency());
        return PaymentResponse.from(payment);
    }

    @Transactional(readOnly = true)
    public PaymentResponse get(UUID id) {
        return PaymentResponse.from(find(id));
    }

    @Transactional(readOnly = true)
    public PaymentResponse getByReference(String externalReference) {
        return paymentRepository.findFirstByExternalReferenceOrderByCreatedAtDesc(externalReference)
                .map(PaymentResponse::from)
                .orElseThrow(() -> ApiException.notFound(PaymentErrorCodes.PAYMENT_NOT_FOUND,
                        "Payment not found for reference " + externalReference,
                        Map.of("externalReference", externalReference)));
    }

    /**
     * Puts the payment's outcome webhook back on the delivery schedule, starting from the first round.
     */
    @Transactional
    public WebhookResendResponse resendWebhook(UUID id) {
        PaymentTransaction payment = find(id);
        if (!payment.getStatus().isSettled()) {
            throw ApiException.unprocessable(PaymentErrorCodes.PAYMENT_NOT_SETTLED,
                    "Payment " + id + " has no outcome to send yet",
                    Map.of("currentStatus", payment.getStatus().name()));
        }

        Instant now = Instant.now();
        WebhookDelivery delivery = deliveryRepository.findFirstByPaymentIdOrderByCreatedAtDesc(id)
                .orElseGet(() -> deliveryRepository.save(settlementWorker.outboxRow(payment)));
        delivery.requeue(now);
        meterRegistry.counter("webhook_resends_total").increment();
        log.info("Webhook for payment {} re-queued (delivery {})", id, delivery.getId());
        return new WebhookResendResponse(id, delivery.getId(), delivery.getStatus(), now);
    }

    private PaymentTransaction find(UUID id) {
        return paymentRepository.findById(id)
                .orElseThrow(() -> ApiException.notFound(PaymentErrorCodes.PAYMENT_NOT_FOUND,
                        "Payment " + id + " not found", Map.of("paymentId", id.toString())));
    }
}
