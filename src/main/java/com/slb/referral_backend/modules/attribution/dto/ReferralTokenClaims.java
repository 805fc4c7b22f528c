package com.slb.referral_backend.modules.attribution.dto;

import java.time.Instant;

/**
 * 验签通过后的推广 token 内容。
 */
public record ReferralTokenClaims(Long referrerId, String destination, Instant issuedAt, Instant expiresAt) {
}
