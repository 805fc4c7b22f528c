package com.slb.referral_backend.modules.pipeline.service;

import com.slb.referral_backend.modules.account.enums.ReferralSource;
import com.slb.referral_backend.modules.pipeline.entity.ReferralAttempt;
import com.slb.referral_backend.modules.pipeline.enums.AttemptChannel;
import com.slb.referral_backend.modules.pipeline.enums.AttemptState;
import com.slb.referral_backend.modules.pipeline.mapper.ReferralAttemptMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 推荐漏斗：clicked → attributed → converted。
 * 所有状态迁移都是带前置状态条件的 UPDATE，并发下不会回退。
 */
@Slf4j
@Service
public class ReferralPipelineService {

    private final ReferralAttemptMapper attemptMapper;

    public ReferralPipelineService(ReferralAttemptMapper attemptMapper) {
        this.attemptMapper = attemptMapper;
    }

    public ReferralAttempt recordClick(Long referrerId,
                                       String referralCode,
                                       AttemptChannel channel,
                                       String destination,
                                       String clientIp,
                                       String userAgent,
                                       LocalDateTime now) {
        ReferralAttempt attempt = new ReferralAttempt();
        attempt.setReferrerId(referrerId);
        attempt.setReferralCode(referralCode);
        attempt.setState(AttemptState.CLICKED);
        attempt.setChannel(channel != null ? channel : AttemptChannel.LINK);
        attempt.setDestination(destination);
        attempt.setClientIp(clientIp);
        attempt.setUserAgent(userAgent);
        attempt.setCreateTime(now);
        attemptMapper.insert(attempt);
        return attempt;
    }

    /**
     * 将推荐人最近一条未绑定的点击记录推进为 ATTRIBUTED；
     * 找不到（例如手填邀请码、从未点击过链接）时直接插入一条 ATTRIBUTED 记录。
     */
    public void markAttributed(Long referrerId, String referralCode, Long targetAccountId,
                               ReferralSource source, LocalDateTime now) {
        Optional<ReferralAttempt> latest = attemptMapper.selectLatestUnboundClick(referrerId);
        if (latest.isPresent()
                && attemptMapper.markAttributed(latest.get().getId(), targetAccountId, source, now) == 1) {
            log.debug("Attempt {} attributed to account {}", latest.get().getId(), targetAccountId);
            return;
        }
        ReferralAttempt attempt = new ReferralAttempt();
        attempt.setReferrerId(referrerId);
        attempt.setReferralCode(referralCode);
        attempt.setTargetAccountId(targetAccountId);
        attempt.setState(AttemptState.ATTRIBUTED);
        attempt.setChannel(source == ReferralSource.TOKEN ? AttemptChannel.LINK : AttemptChannel.MANUAL);
        attempt.setAttributionSource(source);
        attempt.setCreateTime(now);
        attempt.setAttributedTime(now);
        attemptMapper.insert(attempt);
    }

    /**
     * @return true 表示本次调用完成了转化（首次合格付款）
     */
    public boolean markConverted(Long targetAccountId, String bookingId, LocalDateTime now) {
        boolean converted = attemptMapper.markConverted(targetAccountId, bookingId, now) == 1;
        if (converted) {
            log.info("Referral converted: account={}, booking={}", targetAccountId, bookingId);
        }
        return converted;
    }
}
