package com.slb.referral_backend.modules.attribution.dto;

import com.slb.referral_backend.modules.attribution.enums.FraudReason;

public record FraudDecision(boolean allowed, FraudReason reason, String detail) {

    private static final FraudDecision ALLOW = new FraudDecision(true, null, null);

    public static FraudDecision allow() {
        return ALLOW;
    }

    public static FraudDecision deny(FraudReason reason, String detail) {
        return new FraudDecision(false, reason, detail);
    }
}
