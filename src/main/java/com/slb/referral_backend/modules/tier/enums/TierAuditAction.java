package com.slb.referral_backend.modules.tier.enums;

public enum TierAuditAction {
    ACTIVATE,
    ACTIVATE_REJECTED,
    DEACTIVATE
}
