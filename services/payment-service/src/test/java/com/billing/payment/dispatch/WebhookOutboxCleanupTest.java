package com.billing.payment.dispatch;

import com.billing.payment.entity.WebhookDeliveryStatus;
import com.billing.payment.repository.WebhookDeliveryRepository;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebhookOutboxCleanupTest {

    private final WebhookDeliveryRepository repository = mock(WebhookDeliveryRepository.class);

    @Test
    void deletesOnlyDeliveredRowsOlderThanRetention() {
        when(repository.deleteByStatusAndDeliveredAtBefore(eq(WebhookDeliveryStatus.DELIVERED), any(Instant.class)))
                .thenReturn(3);

        Instant before = Instant.now();
        new WebhookOutboxCleanup(repository, 7).cleanupDelivered();

        ArgumentCaptor<Instant> cutoff = ArgumentCaptor.forClass(Instant.class);
        verify(repository).deleteByStatusAndDeliveredAtBefore(eq(WebhookDeliveryStatus.DELIVERED), cutoff.capture());
        assertThat(Duration.between(cutoff.getValue(), before)).isBetween(Duration.ofDays(7).minusMinutes(1),
                Duration.ofDays(7));
    }
}
