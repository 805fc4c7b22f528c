package com.slb.referral_backend.modules.account.enums;

/**
 * 账户归因来源。按优先级：显式邀请码 &gt; 推广 token &gt; 手填邀请码。
 */
public enum ReferralSource {
    EXPLICIT_CODE,
    TOKEN,
    MANUAL_CODE,
    NONE
}
