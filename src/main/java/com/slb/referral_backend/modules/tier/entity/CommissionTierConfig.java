package com.slb.referral_backend.modules.tier.entity;

import com.slb.referral_backend.modules.tier.enums.TierApprovalStatus;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 对应表：commission_tier_config（tier 1..7）
 */
@Data
public class CommissionTierConfig {
    private Integer tier;
    /** 百分比，例如 10.0000 表示 10% */
    private BigDecimal ratePercent;
    private Boolean active;
    private TierApprovalStatus approvalStatus;
    private LocalDateTime activatedAt;
    private String activatedBy;
    private LocalDateTime deactivatedAt;
    private String deactivatedBy;
    private String notes;
    private LocalDateTime updateTime;

    public boolean isEffective() {
        return Boolean.TRUE.equals(active) && approvalStatus == TierApprovalStatus.APPROVED;
    }
}
