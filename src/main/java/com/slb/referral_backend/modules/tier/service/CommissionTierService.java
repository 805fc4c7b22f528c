package com.slb.referral_backend.modules.tier.service;

import com.slb.referral_backend.modules.tier.dto.ActiveTier;
import com.slb.referral_backend.modules.tier.dto.TierActivationResult;
import com.slb.referral_backend.modules.tier.entity.CommissionTierAudit;
import com.slb.referral_backend.modules.tier.entity.CommissionTierConfig;
import com.slb.referral_backend.modules.tier.enums.TierApprovalStatus;
import com.slb.referral_backend.modules.tier.enums.TierAuditAction;
import com.slb.referral_backend.modules.tier.mapper.CommissionTierAuditMapper;
import com.slb.referral_backend.modules.tier.mapper.CommissionTierConfigMapper;
import com.slb.referral_backend.modules.tier.vo.CommissionTierVo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 佣金层级配置。生效层级必须从 1 开始连续：遇到第一个未生效的层级即截断。
 */
@Slf4j
@Service
public class CommissionTierService {

    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

    private final CommissionTierConfigMapper configMapper;
    private final CommissionTierAuditMapper auditMapper;
    private final Clock clock;

    public CommissionTierService(CommissionTierConfigMapper configMapper,
                                 CommissionTierAuditMapper auditMapper,
                                 Clock clock) {
        this.configMapper = configMapper;
        this.auditMapper = auditMapper;
        this.clock = clock;
    }

    /**
     * 当前参与计算的层级：启用且已审批，按 tier 升序，遇到断档即停止。
     */
    public List<ActiveTier> getActiveTiers() {
        List<ActiveTier> result = new ArrayList<>();
        int expected = 1;
        for (CommissionTierConfig config : configMapper.selectAll()) {
            if (config.getTier() == null || config.getTier() != expected || !config.isEffective()) {
                break;
            }
            result.add(new ActiveTier(config.getTier(), toFraction(config.getRatePercent()), config.getRatePercent()));
            expected++;
        }
        return result;
    }

    public List<CommissionTierVo> listAll() {
        List<CommissionTierConfig> all = configMapper.selectAll();
        int effectiveCount = countContiguousEffective(all);
        List<CommissionTierVo> result = new ArrayList<>(all.size());
        for (CommissionTierConfig config : all) {
            result.add(CommissionTierVo.from(config, config.getTier() != null && config.getTier() <= effectiveCount));
        }
        return result;
    }

    public List<CommissionTierAudit> recentAudit(int limit) {
        return auditMapper.selectRecent(Math.max(1, Math.min(limit, 500)));
    }

    /**
     * 启用层级。未知层级、PROHIBITED、或前一层未生效（会产生断档）时拒绝，拒绝也记审计，且不修改配置。
     */
    @Transactional
    public TierActivationResult activate(int tier, String operator, String notes) {
        LocalDateTime now = LocalDateTime.now(clock);
        Optional<CommissionTierConfig> target = configMapper.selectByTierForUpdate(tier);
        TierActivationResult result;
        if (target.isEmpty()) {
            result = TierActivationResult.rejected(tier, TierActivationResult.UNKNOWN_TIER);
        } else if (target.get().getApprovalStatus() == TierApprovalStatus.PROHIBITED) {
            result = TierActivationResult.rejected(tier, TierActivationResult.PROHIBITED);
        } else if (tier > 1 && !configMapper.selectByTier(tier - 1).map(CommissionTierConfig::isEffective).orElse(false)) {
            result = TierActivationResult.rejected(tier, TierActivationResult.WOULD_CREATE_GAP);
        } else {
            configMapper.activate(tier, operator, notes, now);
            result = TierActivationResult.accepted(tier);
        }

        if (result.accepted()) {
            log.info("Commission tier {} activated by {}", tier, operator);
            audit(tier, TierAuditAction.ACTIVATE, operator, notes, "OK", now);
        } else {
            log.warn("Commission tier {} activation rejected: operator={}, reason={}", tier, operator, result.reason());
            audit(tier, TierAuditAction.ACTIVATE_REJECTED, operator, notes, result.reason(), now);
        }
        return result;
    }

    /**
     * 停用层级，总是允许；更高层级随之因断档不再生效。
     *
     * @return false 表示层级不存在
     */
    @Transactional
    public boolean deactivate(int tier, String operator, String notes) {
        LocalDateTime now = LocalDateTime.now(clock);
        boolean updated = configMapper.deactivate(tier, operator, notes, now) > 0;
        if (updated) {
            log.info("Commission tier {} deactivated by {}", tier, operator);
            audit(tier, TierAuditAction.DEACTIVATE, operator, notes, "OK", now);
        }
        return updated;
    }

    private int countContiguousEffective(List<CommissionTierConfig> all) {
        int expected = 1;
        for (CommissionTierConfig config : all) {
            if (config.getTier() == null || config.getTier() != expected || !config.isEffective()) {
                break;
            }
            expected++;
        }
        return expected - 1;
    }

    private void audit(int tier, TierAuditAction action, String operator, String notes, String outcome, LocalDateTime now) {
        CommissionTierAudit audit = new CommissionTierAudit();
        audit.setTier(tier);
        audit.setAction(action);
        audit.setOperator(operator);
        audit.setNotes(notes);
        audit.setOutcome(outcome);
        audit.setCreateTime(now);
        auditMapper.insert(audit);
    }

    static BigDecimal toFraction(BigDecimal percent) {
        if (percent == null || percent.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return percent.divide(ONE_HUNDRED, 8, RoundingMode.HALF_UP);
    }
}
