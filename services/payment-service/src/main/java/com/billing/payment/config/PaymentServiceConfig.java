package com.billing.payment.config;

import com.billing.events.signature.WebhookSignature;
import com.billing.payment.web.ApiKeyInterceptor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class PaymentServiceConfig implements WebMvcConfigurer {

    private final String apiKey;

    public PaymentServiceConfig(@Value("${payment.api-key}") String apiKey) {
        this.apiKey = apiKey;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new ApiKeyInterceptor(apiKey)).addPathPatterns("/v1/payments/**");
    }

    @Bean
    public WebhookSignature webhookSignature(@Value("${webhook.secret}") String secret) {
        return new WebhookSignature(secret);
    }

    @Bean
    public RestClient webhookRestClient(RestClient.Builder builder,
                                        @Value("${webhook.timeout-ms:10000}") int timeoutMs) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeoutMs);
        requestFactory.setReadTimeout(timeoutMs);
        return builder.requestFactory(requestFactory).build();
    }
}
