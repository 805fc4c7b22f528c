package com.slb.referral_backend.modules.pipeline.entity;

import com.slb.referral_backend.modules.account.enums.ReferralSource;
import com.slb.referral_backend.modules.pipeline.enums.AttemptChannel;
import com.slb.referral_backend.modules.pipeline.enums.AttemptState;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 对应表：referral_attempts（推荐漏斗，一次点击一行）
 */
@Data
public class ReferralAttempt {
    private Long id;
    private Long referrerId;
    private String referralCode;
    private Long targetAccountId; // 归因前为空
    private AttemptState state;
    private AttemptChannel channel;
    private String destination;
    private String clientIp;
    private String userAgent;
    private ReferralSource attributionSource;
    private String conversionBookingId;
    private LocalDateTime createTime;
    private LocalDateTime attributedTime;
    private LocalDateTime convertedTime;
}
