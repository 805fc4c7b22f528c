package com.slb.referral_backend.modules.tier.enums;

/**
 * 佣金层级审批状态；PROHIBITED 的层级永远不能启用。
 */
public enum TierApprovalStatus {
    APPROVED,
    PENDING_REVIEW,
    REQUIRES_CLEARANCE,
    PROHIBITED
}
