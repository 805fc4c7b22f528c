package com.slb.referral_backend.modules.attribution.entity;

import com.slb.referral_backend.modules.account.enums.ReferralSource;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 对应表：referral_attribution_audit。注册时每个被评估的候选推荐人一行。
 */
@Data
public class AttributionAudit {
    private Long id;
    private Long newAccountId;
    private Long candidateReferrerId; // 信号无法解析出账户时为空
    private ReferralSource source;
    private Boolean success;
    private String reason;
    private String clientIp;
    private LocalDateTime createTime;
}
