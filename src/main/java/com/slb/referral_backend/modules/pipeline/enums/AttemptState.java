package com.slb.referral_backend.modules.pipeline.enums;

/**
 * 推荐漏斗状态，只能前进：CLICKED → ATTRIBUTED → CONVERTED。
 */
public enum AttemptState {
    CLICKED,
    ATTRIBUTED,
    CONVERTED
}
