package com.slb.referral_backend.modules.attribution.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "app.attribution")
@Data
public class AttributionProperties {

    /**
     * 推广 token 的 HMAC 密钥（HS256，至少 32 字节），只在本服务内使用。
     */
    private String tokenSecret;

    /**
     * 推广 token 有效期，默认 30 天。
     */
    private Duration tokenTtl = Duration.ofDays(30);

    /**
     * 速率风控：统计窗口。
     */
    private Duration velocityWindow = Duration.ofHours(1);

    /**
     * 速率风控：窗口内同一来源允许的最大点击数（达到即拒绝）。
     */
    private int velocityMaxClicks = 20;

    /**
     * 未指定落地页时的默认跳转地址。
     */
    private String defaultDestination = "/";
}
