package com.slb.referral_backend.modules.settlement.enums;

public enum PayoutCadence {
    WEEKLY,
    /** 每个自然月最多打款一次 */
    MONTHLY
}
