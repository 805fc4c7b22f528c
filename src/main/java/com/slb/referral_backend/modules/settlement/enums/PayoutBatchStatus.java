package com.slb.referral_backend.modules.settlement.enums;

/**
 * 打款批次状态。CLAIMED 表示流水已认领、正在打款。
 */
public enum PayoutBatchStatus {
    CLAIMED,
    PAID,
    FAILED,
    EMPTY
}
