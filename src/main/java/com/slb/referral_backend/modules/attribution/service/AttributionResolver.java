package com.slb.referral_backend.modules.attribution.service;

import com.slb.referral_backend.common.exception.BizException;
import com.slb.referral_backend.modules.account.entity.Account;
import com.slb.referral_backend.modules.account.enums.ReferralSource;
import com.slb.referral_backend.modules.account.mapper.AccountMapper;
import com.slb.referral_backend.modules.account.service.ReferralChainService;
import com.slb.referral_backend.modules.account.service.ReferralCodeGenerator;
import com.slb.referral_backend.modules.attribution.config.AttributionProperties;
import com.slb.referral_backend.modules.attribution.dto.AttributionSignals;
import com.slb.referral_backend.modules.attribution.dto.FraudDecision;
import com.slb.referral_backend.modules.attribution.dto.SignupDraft;
import com.slb.referral_backend.modules.attribution.entity.AttributionAudit;
import com.slb.referral_backend.modules.attribution.enums.FraudReason;
import com.slb.referral_backend.modules.attribution.mapper.AttributionAuditMapper;
import com.slb.referral_backend.modules.pipeline.service.ReferralPipelineService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 注册归因：按 显式邀请码 → 推广 token → 手填邀请码 的顺序取第一个有效候选人，
 * 与建号在同一事务内写入，之后不可修改。
 * <p>
 * 任何信号问题（码不存在、token 无效、自推荐、风控拦截）都只会导致“无归因”，不会让注册失败。
 */
@Slf4j
@Service
public class AttributionResolver {

    static final String REASON_OK = "OK";
    // accounts.referral_code 唯一索引名
    static final String REFERRAL_CODE_KEY = "uk_accounts_referral_code";
    static final String REASON_UNKNOWN_CODE = "UNKNOWN_CODE";
    static final String REASON_INVALID_TOKEN = "INVALID_TOKEN";
    static final String REASON_INACTIVE_REFERRER = "INACTIVE_REFERRER";

    private final AccountMapper accountMapper;
    private final AttributionAuditMapper auditMapper;
    private final AttributionTokenCodec tokenCodec;
    private final FraudGuard fraudGuard;
    private final ReferralChainService chainService;
    private final ReferralCodeGenerator codeGenerator;
    private final ReferralPipelineService pipelineService;
    private final AttributionProperties properties;
    private final Clock clock;

    /** 候选来源，顺序即优先级 */
    private final List<CandidateSource> sources;

    public AttributionResolver(AccountMapper accountMapper,
                               AttributionAuditMapper auditMapper,
                               AttributionTokenCodec tokenCodec,
                               FraudGuard fraudGuard,
                               ReferralChainService chainService,
                               ReferralCodeGenerator codeGenerator,
                               ReferralPipelineService pipelineService,
                               AttributionProperties properties,
                               Clock clock) {
        this.accountMapper = accountMapper;
        this.auditMapper = auditMapper;
        this.tokenCodec = tokenCodec;
        this.fraudGuard = fraudGuard;
        this.chainService = chainService;
        this.codeGenerator = codeGenerator;
        this.pipelineService = pipelineService;
        this.properties = properties;
        this.clock = clock;
        this.sources = List.of(
                signals -> codeCandidate(signals.explicitCode(), ReferralSource.EXPLICIT_CODE),
                this::tokenCandidate,
                signals -> codeCandidate(signals.manualCode(), ReferralSource.MANUAL_CODE)
        );
    }

    @Transactional
    public Account resolveAndBind(SignupDraft draft, AttributionSignals signals) {
        if (draft == null || draft.accountId() == null) {
            throw new BizException("accountId 不能为空");
        }
        if (accountMapper.selectById(draft.accountId()).isPresent()) {
            throw BizException.conflict("账户已存在: " + draft.accountId());
        }
        AttributionSignals effective = signals != null ? signals : AttributionSignals.none();
        LocalDateTime now = LocalDateTime.now(clock);

        Candidate winner = null;
        FraudDecision velocity = null;
        for (CandidateSource source : sources) {
            Optional<Candidate> resolved = source.resolve(effective);
            if (resolved.isEmpty()) {
                continue;
            }
            Candidate candidate = resolved.get();
            if (candidate.referrer() == null) {
                audit(draft.accountId(), null, candidate.source(), false, candidate.rejectReason(), effective.clientIp(), now);
                continue;
            }

            FraudDecision decision = fraudGuard.checkSelfAssociation(candidate.referrer(), draft.accountId(), draft.email());
            if (decision.allowed()) {
                if (velocity == null) {
                    velocity = fraudGuard.checkVelocity(effective.clientIp(),
                            properties.getVelocityWindow(), properties.getVelocityMaxClicks(), now);
                }
                decision = velocity;
            }
            if (decision.allowed() && chainService.wouldCreateCycle(candidate.referrer().getId(), draft.accountId())) {
                decision = FraudDecision.deny(FraudReason.REFERRAL_CYCLE, "referral chain would loop back");
            }

            if (!decision.allowed()) {
                log.warn("Attribution candidate denied: newAccount={}, referrer={}, source={}, reason={}, detail={}",
                        draft.accountId(), candidate.referrer().getId(), candidate.source(), decision.reason(), decision.detail());
                audit(draft.accountId(), candidate.referrer().getId(), candidate.source(), false,
                        decision.reason().name(), effective.clientIp(), now);
                continue;
            }

            audit(draft.accountId(), candidate.referrer().getId(), candidate.source(), true, REASON_OK, effective.clientIp(), now);
            winner = candidate;
            break;
        }

        Account account = new Account();
        account.setId(draft.accountId());
        account.setEmail(draft.email());
        account.setDisplayName(draft.displayName());
        account.setPayoutAccountRef(draft.payoutAccountRef());
        account.setReferralCode(codeGenerator.generateUniqueCode());
        account.setStatus(1);
        account.setCreateTime(now);
        if (winner != null) {
            account.setReferredBy(winner.referrer().getId());
            account.setReferralSource(winner.source());
            account.setReferredAt(now);
        } else {
            account.setReferralSource(ReferralSource.NONE);
        }

        insertAccount(account);

        if (winner != null) {
            pipelineService.markAttributed(winner.referrer().getId(), winner.referrer().getReferralCode(),
                    account.getId(), winner.source(), now);
            log.info("Account {} attributed to {} via {}", account.getId(), account.getReferredBy(), winner.source());
        } else {
            log.info("Account {} created without attribution", account.getId());
        }
        return account;
    }

    /**
     * 主键冲突即账户已存在；推荐码冲突（并发注册抽到同一个码）换一个码重试一次。
     */
    private void insertAccount(Account account) {
        try {
            accountMapper.insert(account);
            return;
        } catch (DuplicateKeyException e) {
            if (!isReferralCodeClash(e)) {
                throw BizException.conflict("账户已存在: " + account.getId());
            }
            String taken = account.getReferralCode();
            account.setReferralCode(codeGenerator.generateUniqueCode());
            log.warn("Referral code {} taken concurrently, retrying account {} with {}",
                    taken, account.getId(), account.getReferralCode());
        }
        try {
            accountMapper.insert(account);
        } catch (DuplicateKeyException e) {
            throw isReferralCodeClash(e)
                    ? BizException.conflict("推荐码分配冲突，请重试")
                    : BizException.conflict("账户已存在: " + account.getId());
        }
    }

    private static boolean isReferralCodeClash(DuplicateKeyException e) {
        String message = e.getMostSpecificCause().getMessage();
        return message != null && message.contains(REFERRAL_CODE_KEY);
    }

    public List<AttributionAudit> auditTrail(Long accountId) {
        return auditMapper.selectByNewAccountId(accountId);
    }

    private Optional<Candidate> codeCandidate(String rawCode, ReferralSource source) {
        String code = ReferralCodeGenerator.normalize(rawCode);
        if (code == null) {
            return Optional.empty();
        }
        Optional<Account> referrer = accountMapper.selectByReferralCode(code);
        if (referrer.isEmpty()) {
            return Optional.of(Candidate.rejected(source, REASON_UNKNOWN_CODE));
        }
        if (!referrer.get().isLive()) {
            return Optional.of(Candidate.rejected(source, REASON_INACTIVE_REFERRER));
        }
        return Optional.of(Candidate.of(source, referrer.get()));
    }

    private Optional<Candidate> tokenCandidate(AttributionSignals signals) {
        if (!StringUtils.hasText(signals.token())) {
            return Optional.empty();
        }
        return Optional.of(tokenCodec.verify(signals.token())
                .map(claims -> accountMapper.selectById(claims.referrerId())
                        .filter(Account::isLive)
                        .map(referrer -> Candidate.of(ReferralSource.TOKEN, referrer))
                        .orElseGet(() -> Candidate.rejected(ReferralSource.TOKEN, REASON_INACTIVE_REFERRER)))
                .orElseGet(() -> Candidate.rejected(ReferralSource.TOKEN, REASON_INVALID_TOKEN)));
    }

    private void audit(Long newAccountId, Long referrerId, ReferralSource source, boolean success,
                       String reason, String clientIp, LocalDateTime now) {
        AttributionAudit audit = new AttributionAudit();
        audit.setNewAccountId(newAccountId);
        audit.setCandidateReferrerId(referrerId);
        audit.setSource(source);
        audit.setSuccess(success);
        audit.setReason(reason);
        audit.setClientIp(clientIp);
        audit.setCreateTime(now);
        auditMapper.insert(audit);
    }

    @FunctionalInterface
    interface CandidateSource {
        /** 信号缺失时返回 empty；信号存在但无法解析出账户时返回 referrer 为空的候选。 */
        Optional<Candidate> resolve(AttributionSignals signals);
    }

    record Candidate(ReferralSource source, Account referrer, String rejectReason) {
        static Candidate of(ReferralSource source, Account referrer) {
            return new Candidate(source, referrer, null);
        }

        static Candidate rejected(ReferralSource source, String reason) {
            return new Candidate(source, null, reason);
        }
    }
}
