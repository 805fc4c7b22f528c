package com.slb.referral_backend.modules.attribution.dto;

/**
 * 注册时待创建的账户信息（ID 由外部身份服务分配）。
 */
public record SignupDraft(Long accountId, String email, String displayName, String payoutAccountRef) {
}
