package com.slb.referral_backend.modules.tier.entity;

import com.slb.referral_backend.modules.tier.enums.TierAuditAction;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 对应表：commission_tier_audit
 */
@Data
public class CommissionTierAudit {
    private Long id;
    private Integer tier;
    private TierAuditAction action;
    private String operator;
    private String notes;
    private String outcome;
    private LocalDateTime createTime;
}
