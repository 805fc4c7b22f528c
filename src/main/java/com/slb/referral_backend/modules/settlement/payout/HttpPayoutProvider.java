package com.slb.referral_backend.modules.settlement.payout;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.util.concurrent.RateLimiter;
import com.slb.referral_backend.modules.settlement.config.PayoutProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 基于 HTTP 的打款渠道适配器。
 * <p>
 * 每次调用有超时，5xx / 429 / 网络错误按配置退避重试；重试耗尽一律视为失败，
 * 由上层把流水置为 FAILED，不会留下“不确定”状态。渠道侧按 Idempotency-Key 去重。
 */
@Component
@Slf4j
public class HttpPayoutProvider implements PayoutProvider {

    static final String IDEMPOTENCY_HEADER = "Idempotency-Key";
    private static final int ERROR_BODY_MAX = 300;

    private final PayoutProperties properties;
    private final WebClient http;
    private final RateLimiter limiter;

    public HttpPayoutProvider(WebClient.Builder builder, PayoutProperties properties) {
        this.properties = properties;
        this.http = builder
                .baseUrl(properties.getBaseUrl())
                .defaultHeader(HttpHeaders.USER_AGENT, "ReferralBackend/HttpPayoutProvider")
                .build();
        this.limiter = RateLimiter.create(Math.max(0.1d, properties.getPerHostQps()));
    }

    @Override
    public PayoutResult payout(String destinationRef, BigDecimal amount, String idempotencyKey) {
        if (!StringUtils.hasText(destinationRef)) {
            return PayoutResult.failure("MISSING_PAYOUT_DESTINATION");
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("destination", destinationRef);
        payload.put("amount", amount.toPlainString());
        payload.put("currency", properties.getCurrency());
        limiter.acquire();
        try {
            JsonNode body = http.post()
                    .uri(properties.getPayoutPath())
                    .headers(headers -> {
                        applyAuthHeaders(headers);
                        headers.set(IDEMPOTENCY_HEADER, idempotencyKey);
                        headers.setContentType(MediaType.APPLICATION_JSON);
                    })
                    .bodyValue(payload)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(timeout())
                    .retryWhen(retrySpec())
                    .block();
            String reference = body != null && body.hasNonNull("id") ? body.get("id").asText() : null;
            if (!StringUtils.hasText(reference)) {
                log.error("Payout accepted without reference: key={}", idempotencyKey);
                return PayoutResult.failure("PROVIDER_NO_REFERENCE");
            }
            log.info("Payout sent: key={}, amount={}, reference={}", idempotencyKey, amount, reference);
            return PayoutResult.success(reference);
        } catch (WebClientResponseException ex) {
            logRequestError("payout", ex);
            return PayoutResult.failure("HTTP_" + ex.getStatusCode().value() + ": " + trimBody(ex.getResponseBodyAsString()));
        } catch (Exception ex) {
            logRequestError("payout", ex);
            return PayoutResult.failure(trimBody(rootMessage(ex)));
        }
    }

    @Override
    public PayoutReadiness canReceivePayouts(String destinationRef) {
        if (!StringUtils.hasText(destinationRef)) {
            return PayoutReadiness.notReady("MISSING_PAYOUT_DESTINATION");
        }
        limiter.acquire();
        try {
            JsonNode body = http.get()
                    .uri(properties.getReadinessPath(), Map.of("ref", destinationRef))
                    .headers(this::applyAuthHeaders)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(timeout())
                    .retryWhen(retrySpec())
                    .block();
            if (body != null && body.path("ready").asBoolean(false)) {
                return PayoutReadiness.ok();
            }
            String reason = body != null && body.hasNonNull("reason") ? body.get("reason").asText() : "NOT_READY";
            return PayoutReadiness.notReady(reason);
        } catch (WebClientResponseException ex) {
            logRequestError("readiness", ex);
            return PayoutReadiness.notReady("HTTP_" + ex.getStatusCode().value());
        } catch (Exception ex) {
            logRequestError("readiness", ex);
            return PayoutReadiness.notReady(trimBody(rootMessage(ex)));
        }
    }

    private Duration timeout() {
        return Duration.ofMillis(Math.max(100L, properties.getTimeoutMs()));
    }

    private Retry retrySpec() {
        return Retry.backoff(Math.max(0, properties.getMaxRetries()), Duration.ofMillis(Math.max(1L, properties.getRetryBackoffMs())))
                .maxBackoff(Duration.ofSeconds(3))
                .filter(this::isRetryable)
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    private void applyAuthHeaders(HttpHeaders headers) {
        if (StringUtils.hasText(properties.getApiKey())) {
            headers.setBearerAuth(properties.getApiKey());
        }
    }

    private boolean isRetryable(Throwable err) {
        if (err instanceof WebClientResponseException wcre) {
            int status = wcre.getStatusCode().value();
            return status >= 500 || status == 429;
        }
        return true;
    }

    private void logRequestError(String operation, Throwable err) {
        if (err instanceof WebClientResponseException wcre) {
            log.warn("Payout provider {} failed: status={}, body={}", operation, wcre.getStatusCode().value(),
                    trimBody(wcre.getResponseBodyAsString()));
        } else {
            log.warn("Payout provider {} failed: {}", operation, rootMessage(err));
        }
    }

    private static String rootMessage(Throwable err) {
        Throwable root = err;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getClass().getSimpleName() + (root.getMessage() != null ? ": " + root.getMessage() : "");
    }

    private static String trimBody(String body) {
        if (body == null) {
            return null;
        }
        return body.length() <= ERROR_BODY_MAX ? body : body.substring(0, ERROR_BODY_MAX);
    }
}
