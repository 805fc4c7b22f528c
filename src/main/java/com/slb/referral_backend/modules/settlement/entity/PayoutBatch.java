package com.slb.referral_backend.modules.settlement.entity;

import com.slb.referral_backend.modules.settlement.enums.PayoutBatchStatus;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 对应表：payout_batches。唯一键 (beneficiary_id, run_id) 即结算认领。
 */
@Data
public class PayoutBatch {
    private Long id;
    private String runId;
    private Long beneficiaryId;
    /** beneficiaryId:runId，透传给打款渠道 */
    private String idempotencyKey;
    private BigDecimal amount;
    private Integer transactionCount;
    private PayoutBatchStatus status;
    private String providerReference;
    private String failureReason;
    private LocalDateTime createTime;
    private LocalDateTime completeTime;

    public static String idempotencyKey(Long beneficiaryId, String runId) {
        return beneficiaryId + ":" + runId;
    }
}
