package com.slb.referral_backend.modules.attribution.service;

import com.slb.referral_backend.modules.account.entity.Account;
import com.slb.referral_backend.modules.account.mapper.AccountMapper;
import com.slb.referral_backend.modules.account.service.ReferralCodeGenerator;
import com.slb.referral_backend.modules.attribution.config.AttributionProperties;
import com.slb.referral_backend.modules.attribution.dto.FraudDecision;
import com.slb.referral_backend.modules.attribution.dto.ReferralClickDto;
import com.slb.referral_backend.modules.attribution.vo.ReferralClickVo;
import com.slb.referral_backend.modules.attribution.vo.ReferralCodeVo;
import com.slb.referral_backend.modules.pipeline.service.ReferralPipelineService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 推广链接入口：记录点击并下发 token。被拦截的点击不落库、不发 token，但调用方仍然跳转。
 */
@Slf4j
@Service
public class ReferralLinkService {

    static final String REASON_UNKNOWN_CODE = "UNKNOWN_CODE";

    private final AccountMapper accountMapper;
    private final FraudGuard fraudGuard;
    private final AttributionTokenCodec tokenCodec;
    private final ReferralPipelineService pipelineService;
    private final AttributionProperties properties;
    private final Clock clock;

    public ReferralLinkService(AccountMapper accountMapper,
                               FraudGuard fraudGuard,
                               AttributionTokenCodec tokenCodec,
                               ReferralPipelineService pipelineService,
                               AttributionProperties properties,
                               Clock clock) {
        this.accountMapper = accountMapper;
        this.fraudGuard = fraudGuard;
        this.tokenCodec = tokenCodec;
        this.pipelineService = pipelineService;
        this.properties = properties;
        this.clock = clock;
    }

    public ReferralClickVo recordClick(ReferralClickDto dto, String clientIp, String userAgent) {
        String destination = StringUtils.hasText(dto.getDestination())
                ? dto.getDestination()
                : properties.getDefaultDestination();
        String code = ReferralCodeGenerator.normalize(dto.getCode());
        Optional<Account> referrer = code == null
                ? Optional.empty()
                : accountMapper.selectByReferralCode(code).filter(Account::isLive);
        if (referrer.isEmpty()) {
            log.debug("Click ignored, unknown referral code {}", code);
            return new ReferralClickVo(false, null, destination, REASON_UNKNOWN_CODE);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        FraudDecision velocity = fraudGuard.checkVelocity(clientIp,
                properties.getVelocityWindow(), properties.getVelocityMaxClicks(), now);
        if (!velocity.allowed()) {
            log.warn("Referral click denied: code={}, ip={}, reason={}, detail={}",
                    code, clientIp, velocity.reason(), velocity.detail());
            return new ReferralClickVo(false, null, destination, velocity.reason().name());
        }

        Long referrerId = referrer.get().getId();
        pipelineService.recordClick(referrerId, code, dto.getChannel(), destination, clientIp, userAgent, now);
        String token = tokenCodec.issue(referrerId, destination);
        return new ReferralClickVo(true, token, destination, null);
    }

    public ReferralCodeVo checkCode(String rawCode) {
        String code = ReferralCodeGenerator.normalize(rawCode);
        if (code == null) {
            return new ReferralCodeVo(rawCode, false, null);
        }
        return accountMapper.selectByReferralCode(code)
                .filter(Account::isLive)
                .map(account -> new ReferralCodeVo(code, true, account.getDisplayName()))
                .orElseGet(() -> new ReferralCodeVo(code, false, null));
    }
}
