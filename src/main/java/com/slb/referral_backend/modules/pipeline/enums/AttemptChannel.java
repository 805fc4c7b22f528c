package com.slb.referral_backend.modules.pipeline.enums;

public enum AttemptChannel {
    LINK,
    QR,
    MANUAL
}
