package com.slb.referral_backend.modules.settlement.entity;

import com.slb.referral_backend.modules.settlement.enums.PayoutCadence;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 对应表：payout_preferences
 */
@Data
public class PayoutPreference {
    private Long accountId;
    private PayoutCadence cadence;
    /** 为空时使用全局最低金额 */
    private BigDecimal minimumAmount;
    private Boolean optedOut;
    private LocalDateTime updateTime;
}
