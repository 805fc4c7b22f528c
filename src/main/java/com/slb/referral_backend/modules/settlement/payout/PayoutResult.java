package com.slb.referral_backend.modules.settlement.payout;

public record PayoutResult(boolean success, String reference, String failureReason) {

    public static PayoutResult success(String reference) {
        return new PayoutResult(true, reference, null);
    }

    public static PayoutResult failure(String reason) {
        return new PayoutResult(false, null, reason);
    }
}
