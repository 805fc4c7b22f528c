package com.slb.referral_backend.modules.commission.vo;

import com.slb.referral_backend.modules.commission.entity.CommissionTransaction;
import com.slb.referral_backend.modules.commission.enums.CommissionStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@Schema(description = "佣金流水 / Commission transaction")
public class CommissionTransactionVo {
    private Long id;
    private Long beneficiaryId;
    private String bookingId;
    private Integer tier;
    @Schema(description = "小数费率 / Rate as a fraction.", example = "0.10000000")
    private BigDecimal commissionRate;
    private BigDecimal amount;
    private Boolean delegated;
    private CommissionStatus status;
    private LocalDateTime createTime;
    private LocalDateTime availableTime;
    private LocalDateTime paidOutTime;
    private String failureReason;
    private Long payoutBatchId;

    public static CommissionTransactionVo from(CommissionTransaction tx) {
        return CommissionTransactionVo.builder()
                .id(tx.getId())
                .beneficiaryId(tx.getBeneficiaryId())
                .bookingId(tx.getBookingId())
                .tier(tx.getTier())
                .commissionRate(tx.getCommissionRate())
                .amount(tx.getAmount())
                .delegated(tx.getDelegated())
                .status(tx.getStatus())
                .createTime(tx.getCreateTime())
                .availableTime(tx.getAvailableTime())
                .paidOutTime(tx.getPaidOutTime())
                .failureReason(tx.getFailureReason())
                .payoutBatchId(tx.getPayoutBatchId())
                .build();
    }
}
