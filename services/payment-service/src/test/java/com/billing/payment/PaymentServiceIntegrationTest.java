package com.billing.payment;

import com.billing.events.PaymentWebhookEvent;
import com.billing.events.serde.EventObjectMapper;
import com.billing.payment.dispatch.DeliveryResult;
import com.billing.payment.dispatch.WebhookDispatcher;
import com.billing.payment.dispatch.WebhookOutboxRelay;
import com.billing.payment.entity.WebhookDelivery;
import com.billing.payment.entity.WebhookDeliveryStatus;
import com.billing.payment.repository.WebhookDeliveryRepository;
import com.billing.payment.service.PaymentSettlementWorker;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "payment.simulate.force-outcome=success")
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
@ActiveProfiles("test")
class PaymentServiceIntegrationTest {

    private static final String API_KEY = "test-api-key";

    @Container
    @ServiceConnection
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:17-alpine");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private PaymentSettlementWorker settlementWorker;

    @Autowired
    private WebhookOutboxRelay relay;

    @Autowired
    private WebhookDeliveryRepository deliveryRepository;

    @MockBean
    private WebhookDispatcher dispatcher;

    @BeforeEach
    void acceptWebhooks() {
        when(dispatcher.deliver(anyString(), anyString(), anyInt())).thenReturn(new DeliveryResult.Delivered(200, 1));
    }

    private static String initiateBody(String reference, String amount) {
        return """
                {"externalReference":"%s","amount":%s,"currency":"USD","metadata":{"planName":"Pro","userId":"u-1"}}"""
                .formatted(reference, amount);
    }

    private JsonNode initiate(String reference, String amount) throws Exception {
        MvcResult result = mockMvc.perform(post("/v1/payments/initiate")
                        .header("X-API-Key", API_KEY)
                        .header("Idempotency-Key", "payment-" + UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(initiateBody(reference, amount)))
                .andExpect(status().isCreated())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private JsonNode fetch(String paymentId) throws Exception {
        MvcResult result = mockMvc.perform(get("/v1/payments/" + paymentId).header("X-API-Key", API_KEY))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private List<WebhookDelivery> deliveriesFor(String paymentId) {
        return deliveryRepository.findByPaymentIdOrderByCreatedAtAsc(UUID.fromString(paymentId));
    }

    @Test
    void rejectsCallsWithoutValidApiKey() throws Exception {
        mockMvc.perform(post("/v1/payments/initiate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(initiateBody("sub-1", "9.99")))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("API_KEY_REQUIRED"));

        mockMvc.perform(get("/v1/payments/" + UUID.randomUUID()).header("X-API-Key", "wrong"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_API_KEY"));
    }

    @Test
    void initiateCreatesPendingPayment() throws Exception {
        String reference = UUID.randomUUID().toString();

        JsonNode payment = initiate(reference, "29.99");

        assertThat(payment.get("status").asText()).isEqualTo("PENDING");
        assertThat(payment.get("externalReference").asText()).isEqualTo(reference);
        assertThat(payment.get("amount").decimalValue()).isEqualByComparingTo("29.99");
        assertThat(payment.get("metadata").get("planName").asText()).isEqualTo("Pro");
        assertThat(fetch(payment.get("id").asText()).get("status").asText()).isEqualTo("PENDING");
    }

    @Test
    void initiateWithSameKeyReturnsSamePayment() throws Exception {
        String reference = UUID.randomUUID().toString();
        String key = "payment-" + UUID.randomUUID();

        MvcResult first = mockMvc.perform(post("/v1/payments/initiate")
                        .header("X-API-Key", API_KEY)
                        .header("Idempotency-Key", key)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(initiateBody(reference, "9.99")))
                .andExpect(status().isCreated())
                .andReturn();
        MvcResult second = mockMvc.perform(post("/v1/payments/initiate")
                        .header("X-API-Key", API_KEY)
                        .header("Idempotency-Key", key)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(initiateBody(reference, "9.99")))
                .andExpect(status().isCreated())
                .andExpect(header().string("Idempotent-Replayed", "true"))
                .andReturn();

        assertThat(second.getResponse().getContentAsString()).isEqualTo(first.getResponse().getContentAsString());

        mockMvc.perform(post("/v1/payments/initiate")
                        .header("X-API-Key", API_KEY)
                        .header("Idempotency-Key", key)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(initiateBody(reference, "19.99")))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("IDEMPOTENCY_KEY_REUSED"));
    }

    @Test
    void invalidAmountIsRejected() throws Exception {
        mockMvc.perform(post("/v1/payments/initiate")
                        .header("X-API-Key", API_KEY)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(initiateBody("sub-1", "0")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.details.fields.amount").exists());
    }

    @Test
    void lookupByReferenceReturnsLatestPayment() throws Exception {
        String reference = UUID.randomUUID().toString();
        initiate(reference, "9.99");
        String latest = initiate(reference, "20.00").get("id").asText();

        mockMvc.perform(get("/v1/payments/reference/" + reference).header("X-API-Key", API_KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(latest));

        mockMvc.perform(get("/v1/payments/reference/" + UUID.randomUUID()).header("X-API-Key", API_KEY))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("PAYMENT_NOT_FOUND"));
        mockMvc.perform(get("/v1/payments/" + UUID.randomUUID()).header("X-API-Key", API_KEY))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("PAYMENT_NOT_FOUND"));
    }

    @Test
    void settlementWritesOutcomeWebhookToOutbox() throws Exception {
        String reference = UUID.randomUUID().toString();
        String paymentId = initiate(reference, "29.99").get("id").asText();

        settlementWorker.startProcessing();
        assertThat(fetch(paymentId).get("status").asText()).isEqualTo("PROCESSING");
        assertThat(deliveriesFor(paymentId)).isEmpty();

        settlementWorker.settleProcessed();
        JsonNode settled = fetch(paymentId);
        assertThat(settled.get("status").asText()).isEqualTo("SUCCESS");
        assertThat(settled.get("processedAt").isNull()).isFalse();

        List<WebhookDelivery> deliveries = deliveriesFor(paymentId);
        assertThat(deliveries).hasSize(1);
        WebhookDelivery delivery = deliveries.get(0);
        assertThat(delivery.getIdempotencyKey()).isEqualTo("webhook_" + paymentId);
        assertThat(delivery.getStatus()).isEqualTo(WebhookDeliveryStatus.PENDING);

        PaymentWebhookEvent event = EventObjectMapper.instance().readValue(delivery.getPayload(), PaymentWebhookEvent.class);
        assertThat(event.eventType()).isEqualTo("payment.completed");
        assertThat(event.status()).isEqualTo("success");
        assertThat(event.paymentId()).isEqualTo(paymentId);
        assertThat(event.externalReference()).isEqualTo(reference);
        assertThat(event.amount()).isEqualByComparingTo("29.99");
        assertThat(event.metadata()).containsEntry("planName", "Pro");
    }

    @Test
    void relaySendsStoredPayloadAndClosesRow() throws Exception {
        String paymentId = initiate(UUID.randomUUID().toString(), "9.99").get("id").asText();
        settlementWorker.startProcessing();
        settlementWorker.settleProcessed();
        WebhookDelivery pending = deliveriesFor(paymentId).get(0);

        relay.relayDue();

        verify(dispatcher).deliver(eq(pending.getPayload()), eq("webhook_" + paymentId), anyInt());
        WebhookDelivery delivered = deliveriesFor(paymentId).get(0);
        assertThat(delivered.getStatus()).isEqualTo(WebhookDeliveryStatus.DELIVERED);
        assertThat(delivered.getAttempts()).isEqualTo(1);
    }

    @Test
    void exhaustedRoundIsRescheduled() throws Exception {
        String paymentId = initiate(UUID.randomUUID().toString(), "9.99").get("id").asText();
        settlementWorker.startProcessing();
        settlementWorker.settleProcessed();
        when(dispatcher.deliver(anyString(), eq("webhook_" + paymentId), anyInt()))
                .thenReturn(new DeliveryResult.Exhausted(503, "Receiver answered 503", 3));

        relay.relayDue();

        WebhookDelivery delivery = deliveriesFor(paymentId).get(0);
        assertThat(delivery.getStatus()).isEqualTo(WebhookDeliveryStatus.PENDING);
        assertThat(delivery.getAttempts()).isEqualTo(1);
        assertThat(delivery.getNextAttemptAt()).isAfter(Instant.now().plusSeconds(20));
        assertThat(delivery.getLastStatusCode()).isEqualTo(503);
    }

    @Test
    void resendRequeuesSettledPaymentWebhook() throws Exception {
        String paymentId = initiate(UUID.randomUUID().toString(), "9.99").get("id").asText();

        mockMvc.perform(post("/v1/payments/" + paymentId + "/webhook/resend").header("X-API-Key", API_KEY))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("PAYMENT_NOT_SETTLED"));

        settlementWorker.startProcessing();
        settlementWorker.settleProcessed();
        relay.relayDue();
        assertThat(deliveriesFor(paymentId).get(0).getStatus()).isEqualTo(WebhookDeliveryStatus.DELIVERED);

        mockMvc.perform(post("/v1/payments/" + paymentId + "/webhook/resend")
                        .header("X-API-Key", API_KEY)
                        .header("Idempotency-Key", "resend-" + UUID.randomUUID()))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.paymentId").value(paymentId))
                .andExpect(jsonPath("$.status").value("PENDING"));

        List<WebhookDelivery> deliveries = deliveriesFor(paymentId);
        assertThat(deliveries).hasSize(1);
        assertThat(deliveries.get(0).getStatus()).isEqualTo(WebhookDeliveryStatus.PENDING);
        assertThat(deliveries.get(0).getAttempts()).isZero();
    }
}
