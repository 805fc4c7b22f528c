package com.slb.referral_backend.modules.attribution.enums;

/**
 * 风控拒绝原因（机器码，写入审计表）。
 */
public enum FraudReason {
    VELOCITY_EXCEEDED,
    SELF_REFERRAL,
    SHARED_CONTACT,
    REFERRAL_CYCLE
}
