package com.billing.subscription.config;

import com.billing.events.signature.WebhookSignature;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

@Configuration
public class SubscriptionServiceConfig {

    @Bean
    public WebhookSignature webhookSignature(@Value("${webhook.secret}") String secret) {
        return new WebhookSignature(secret);
    }

    @Bean
    public RestClient paymentRestClient(RestClient.Builder builder,
                                        @Value("${payment-service.base-url:http://localhost:8081}") String baseUrl,
                                        @Value("${payment-service.api-key}") String apiKey,
                                        @Value("${payment-service.timeout-ms:10000}") int timeoutMs) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeoutMs);
        requestFactory.setReadTimeout(timeoutMs);
        return builder.baseUrl(baseUrl)
                .defaultHeader("X-API-Key", apiKey)
                .requestFactory(requestFactory)
                .build();
    }

    @Bean
    public ThreadPoolTaskExecutor paymentInitiationExecutor(
            @Value("${payment-initiation.pool-size:4}") int poolSize,
            @Value("${payment-initiation.queue-capacity:500}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("payment-init-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(15);
        return executor;
    }
}
