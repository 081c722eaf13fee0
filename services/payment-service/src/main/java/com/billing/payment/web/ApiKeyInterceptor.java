package com.billing.payment.web;

import com.billing.common.error.ApiException;
import com.billing.payment.service.PaymentErrorCodes;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.servlet.HandlerInterceptor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Service-to-service authentication for the payment API: callers present the shared key in
 * {@code X-API-Key}. Failures surface as {@link ApiException} so they render like every other error.
 */
public class ApiKeyInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(ApiKeyInterceptor.class);

    public static final String HDR_API_KEY = "X-API-Key";

    private final byte[] apiKey;

    public ApiKeyInterceptor(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("payment.api-key is not configured");
        }
        this.apiKey = apiKey.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String presented = request.getHeader(HDR_API_KEY);
        if (presented == null || presented.isBlank()) {
            log.warn("API key missing on {} {}", request.getMethod(), request.getRequestURI());
            throw ApiException.unauthorized(PaymentErrorCodes.API_KEY_REQUIRED, "API key is required");
        }
        if (!MessageDigest.isEqual(apiKey, presented.getBytes(StandardCharsets.UTF_8))) {
            log.warn("Invalid API key on {} {}", request.getMethod(), request.getRequestURI());
            throw ApiException.unauthorized(PaymentErrorCodes.INVALID_API_KEY, "Invalid API key");
        }
        return true;
    }
}
