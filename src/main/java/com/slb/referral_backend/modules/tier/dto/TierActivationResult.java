package com.slb.referral_backend.modules.tier.dto;

public record TierActivationResult(int tier, boolean accepted, String reason) {

    public static final String UNKNOWN_TIER = "UNKNOWN_TIER";
    public static final String PROHIBITED = "TIER_PROHIBITED";
    public static final String WOULD_CREATE_GAP = "WOULD_CREATE_GAP";

    public static TierActivationResult accepted(int tier) {
        return new TierActivationResult(tier, true, null);
    }

    public static TierActivationResult rejected(int tier, String reason) {
        return new TierActivationResult(tier, false, reason);
    }
}
