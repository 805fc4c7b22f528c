package com.slb.referral_backend.modules.commission.enums;

/**
 * 佣金流水状态：PENDING → AVAILABLE → PAID_OUT，或 PENDING/AVAILABLE → FAILED（仅人工可重置）。
 */
public enum CommissionStatus {
    PENDING,
    AVAILABLE,
    PAID_OUT,
    FAILED
}
