package com.billing.payment.dispatch;

import com.billing.payment.entity.WebhookDeliveryStatus;
import com.billing.payment.repository.WebhookDeliveryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

@Component
public class WebhookOutboxCleanup {

    private static final Logger log = LoggerFactory.getLogger(WebhookOutboxCleanup.class);

    private final WebhookDeliveryRepository deliveryRepository;
    private final int retentionDays;

    public WebhookOutboxCleanup(WebhookDeliveryRepository deliveryRepository,
                                @Value("${webhook.outbox.cleanup.retention-days:7}") int retentionDays) {
        this.deliveryRepository = deliveryRepository;
        this.retentionDays = retentionDays;
    }

    @Scheduled(fixedDelayString = "${webhook.outbox.cleanup.interval-ms:3600000}",
            initialDelayString = "${webhook.outbox.cleanup.initial-delay-ms:60000}")
    @Transactional
    public void cleanupDelivered() {
        Instant cutoff = Instant.now().minus(retentionDays, ChronoUnit.DAYS);
        int deleted = deliveryRepository.deleteByStatusAndDeliveredAtBefore(WebhookDeliveryStatus.DELIVERED, cutoff);
        if (deleted > 0) {
            log.info("Cleaned up {} delivered webhooks older than {} days", deleted, retentionDays);
        }
    }
}
