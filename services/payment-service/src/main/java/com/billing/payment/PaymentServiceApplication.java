package com.billing.payment;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = {"com.billing.payment", "com.billing.common"})
@EntityScan(basePackages = {"com.billing.payment.entity", "com.billing.common.idempotency"})
@EnableJpaRepositories(basePackages = {"com.billing.payment.repository", "com.billing.common.idempotency"})
@EnableScheduling
public class PaymentServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(PaymentServiceApplication.class, args);
    }
}
