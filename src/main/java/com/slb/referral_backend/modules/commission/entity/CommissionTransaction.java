package com.slb.referral_backend.modules.commission.entity;

import com.slb.referral_backend.modules.commission.enums.CommissionStatus;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 佣金流水，对应表 commission_transactions。唯一键 (booking_id, tier)。
 */
@Data
public class CommissionTransaction {
    private Long id;
    private Long beneficiaryId; // 佣金受益人
    private String bookingId; // 来源订单/付款ID
    private Long payeeAccountId; // 产生佣金的收款方
    private Long listingId;
    private Integer tier;
    private BigDecimal commissionRate; // 小数费率
    private BigDecimal baseAmount;
    private BigDecimal amount;
    /** 一级佣金是否被委托给了 listing 指定的账户 */
    private Boolean delegated;
    private CommissionStatus status;
    private LocalDateTime createTime;
    private LocalDateTime availableTime;
    private LocalDateTime paidOutTime;
    private LocalDateTime failedTime;
    private String failureReason;
    private Long payoutBatchId;
}
