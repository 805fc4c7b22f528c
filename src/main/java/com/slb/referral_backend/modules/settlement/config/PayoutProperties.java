package com.slb.referral_backend.modules.settlement.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app.payout")
@Data
public class PayoutProperties {

    private String baseUrl = "http://localhost:9090";
    private String apiKey;
    private String payoutPath = "/v1/payouts";
    /** {ref} 会被替换为打款目标引用 */
    private String readinessPath = "/v1/accounts/{ref}/readiness";
    private String currency = "USD";
    private long timeoutMs = 5000L;
    /** 失败后的重试次数（5xx / 429 / 网络错误） */
    private int maxRetries = 1;
    private long retryBackoffMs = 200L;
    private double perHostQps = 5.0d;
}
