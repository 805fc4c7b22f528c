package com.slb.referral_backend.modules.settlement.payout;

public record PayoutReadiness(boolean ready, String reason) {

    public static PayoutReadiness ok() {
        return new PayoutReadiness(true, null);
    }

    public static PayoutReadiness notReady(String reason) {
        return new PayoutReadiness(false, reason);
    }
}
