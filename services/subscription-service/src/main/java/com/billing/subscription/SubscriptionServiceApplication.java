package com.billing.subscription;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = {"com.billing.subscription", "com.billing.common"})
@EntityScan(basePackages = {"com.billing.subscription.entity", "com.billing.common.idempotency"})
@EnableJpaRepositories(basePackages = {"com.billing.subscription.repository", "com.billing.common.idempotency"})
@EnableScheduling
public class SubscriptionServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(SubscriptionServiceApplication.class, args);
    }
}
