package com.slb.referral_backend.modules.attribution.service;

import com.slb.referral_backend.modules.account.entity.Account;
import com.slb.referral_backend.modules.attribution.dto.FraudDecision;
import com.slb.referral_backend.modules.attribution.enums.FraudReason;
import com.slb.referral_backend.modules.pipeline.mapper.ReferralAttemptMapper;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Locale;

/**
 * 推荐风控：只读判断，不写库；拒绝结果由调用方记录审计与日志。
 */
@Component
public class FraudGuard {

    private final ReferralAttemptMapper attemptMapper;

    public FraudGuard(ReferralAttemptMapper attemptMapper) {
        this.attemptMapper = attemptMapper;
    }

    /**
     * 同一来源在 [now - window, now] 内点击数达到 maxCount 即拒绝；来源为空时放行。
     */
    public FraudDecision checkVelocity(String originIp, Duration window, int maxCount, LocalDateTime now) {
        if (!StringUtils.hasText(originIp)) {
            return FraudDecision.allow();
        }
        long count = attemptMapper.countClicksFromIpSince(originIp, now.minus(window), now);
        if (count >= maxCount) {
            return FraudDecision.deny(FraudReason.VELOCITY_EXCEEDED,
                    count + " clicks from " + originIp + " within " + window);
        }
        return FraudDecision.allow();
    }

    /**
     * 候选推荐人与新账户是同一人（同 ID 或同邮箱）时拒绝。
     */
    public FraudDecision checkSelfAssociation(Account candidate, Long newAccountId, String newAccountEmail) {
        if (candidate.getId() != null && candidate.getId().equals(newAccountId)) {
            return FraudDecision.deny(FraudReason.SELF_REFERRAL, "referrer is the new account itself");
        }
        String a = normalizeContact(candidate.getEmail());
        String b = normalizeContact(newAccountEmail);
        if (a != null && a.equals(b)) {
            return FraudDecision.deny(FraudReason.SHARED_CONTACT, "referrer shares contact " + b);
        }
        return FraudDecision.allow();
    }

    private static String normalizeContact(String email) {
        if (!StringUtils.hasText(email)) {
            return null;
        }
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
