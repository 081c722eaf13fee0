package com.billing.subscription.client;

import com.billing.common.error.ApiException;
import com.billing.events.WebhookHeaders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Component
public class PaymentClient {

    private static final Logger log = LoggerFactory.getLogger(PaymentClient.class);

    public static final String PAYMENT_SERVICE_UNAVAILABLE = "PAYMENT_SERVICE_UNAVAILABLE";

    private final RestClient restClient;

    public PaymentClient(@Qualifier("paymentRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    /**
     * Asks the payment service to start a payment. The idempotency key must be stable for one
     * logical payment so that retried calls return the payment created the first time.
     */
    public PaymentResponse initiatePayment(InitiatePaymentRequest request, String idempotencyKey) {
        try {
            PaymentResponse response = restClient.post()
                    .uri("/v1/payments/initiate")
                    .header(WebhookHeaders.IDEMPOTENCY_KEY, idempotencyKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(PaymentResponse.class);
            if (response == null || response.id() == null) {
                throw ApiException.badGateway(PAYMENT_SERVICE_UNAVAILABLE, "Payment service returned an empty response");
            }
            log.info("Payment {} initiated for reference {} (key={})",
                    response.id(), request.externalReference(), idempotencyKey);
            return response;
        } catch (RestClientException e) {
            throw ApiException.badGateway(PAYMENT_SERVICE_UNAVAILABLE,
                    "Payment service call failed: " + e.getMessage());
        }
    }
}
