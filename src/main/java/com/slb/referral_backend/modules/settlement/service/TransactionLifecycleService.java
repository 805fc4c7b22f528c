package com.slb.referral_backend.modules.settlement.service;

import cn.hutool.core.util.StrUtil;
import com.slb.referral_backend.common.exception.BizException;
import com.slb.referral_backend.modules.account.entity.Account;
import com.slb.referral_backend.modules.account.mapper.AccountMapper;
import com.slb.referral_backend.modules.commission.entity.CommissionTransaction;
import com.slb.referral_backend.modules.commission.enums.CommissionStatus;
import com.slb.referral_backend.modules.commission.mapper.CommissionTransactionMapper;
import com.slb.referral_backend.modules.settlement.config.SettlementProperties;
import com.slb.referral_backend.modules.settlement.entity.PayoutBatch;
import com.slb.referral_backend.modules.settlement.entity.PayoutPreference;
import com.slb.referral_backend.modules.settlement.enums.PayoutCadence;
import com.slb.referral_backend.modules.settlement.mapper.PayoutBatchMapper;
import com.slb.referral_backend.modules.settlement.mapper.PayoutPreferenceMapper;
import com.slb.referral_backend.modules.settlement.payout.PayoutProvider;
import com.slb.referral_backend.modules.settlement.payout.PayoutReadiness;
import com.slb.referral_backend.modules.settlement.payout.PayoutResult;
import com.slb.referral_backend.modules.settlement.vo.SettlementReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.temporal.IsoFields;
import java.util.List;
import java.util.Optional;

/**
 * 佣金流水生命周期：PENDING →(清算期满) AVAILABLE →(批量结算) PAID_OUT / FAILED。
 * <p>
 * 并发安全依赖数据库：逐行条件更新 + (beneficiary, run) 唯一认领。
 * 同一周期重复或并发执行，对同一受益人最多只会调用一次打款渠道。
 */
@Slf4j
@Service
public class TransactionLifecycleService {

    static final String MISSING_DESTINATION = "MISSING_PAYOUT_DESTINATION";
    // failure_reason VARCHAR(512)
    private static final int MAX_REASON_LENGTH = 500;

    private final CommissionTransactionMapper transactionMapper;
    private final PayoutBatchMapper batchMapper;
    private final PayoutPreferenceMapper preferenceMapper;
    private final AccountMapper accountMapper;
    private final SettlementTxService txService;
    private final SettlementAlertService alertService;
    private final PayoutProvider payoutProvider;
    private final SettlementProperties properties;

    public TransactionLifecycleService(CommissionTransactionMapper transactionMapper,
                                       PayoutBatchMapper batchMapper,
                                       PayoutPreferenceMapper preferenceMapper,
                                       AccountMapper accountMapper,
                                       SettlementTxService txService,
                                       SettlementAlertService alertService,
                                       PayoutProvider payoutProvider,
                                       SettlementProperties properties) {
        this.transactionMapper = transactionMapper;
        this.batchMapper = batchMapper;
        this.preferenceMapper = preferenceMapper;
        this.accountMapper = accountMapper;
        this.txService = txService;
        this.alertService = alertService;
        this.payoutProvider = payoutProvider;
        this.properties = properties;
    }

    /**
     * 把过了清算期的 PENDING 流水逐条推进为 AVAILABLE；重复执行不会影响已推进的行。
     *
     * @return 本次推进的行数
     */
    public int maturePending(LocalDateTime now) {
        LocalDateTime cutoff = now.minus(properties.getClearingInterval());
        int batchSize = Math.max(1, properties.getMatureBatchSize());
        int matured = 0;
        while (true) {
            List<Long> ids = transactionMapper.selectMaturableIds(cutoff, batchSize);
            int movedThisRound = 0;
            for (Long id : ids) {
                movedThisRound += transactionMapper.markAvailable(id, cutoff, now);
            }
            matured += movedThisRound;
            // 一轮一行都没推进说明被并发执行抢先了，交给下次调度
            if (ids.size() < batchSize || movedThisRound == 0) {
                break;
            }
        }
        if (matured > 0) {
            log.info("Matured {} commission transactions (cutoff={})", matured, cutoff);
        }
        return matured;
    }

    /**
     * 按受益人汇总 AVAILABLE 流水并打款。结算周期 = now 所在 ISO 周。
     */
    public SettlementReport runBatchSettlement(LocalDateTime now) {
        String runId = runIdOf(now);
        SettlementReport report = new SettlementReport(runId);
        List<Long> beneficiaries = transactionMapper.selectBeneficiariesWithAvailable();
        report.setBeneficiaries(beneficiaries.size());
        log.info("Settlement run {} started, {} beneficiaries with available commission", runId, beneficiaries.size());

        redriveStaleClaims(now, report);
        for (Long beneficiaryId : beneficiaries) {
            try {
                settleBeneficiary(beneficiaryId, runId, now, report);
            } catch (RuntimeException e) {
                report.setErrors(report.getErrors() + 1);
                log.error("Settlement of beneficiary {} in run {} failed unexpectedly", beneficiaryId, runId, e);
                alertService.raiseAlert(beneficiaryId, null, SettlementAlertService.SETTLEMENT_ERROR,
                        "run " + runId + ": " + e.getMessage());
            }
        }
        log.info("Settlement run {} finished: paid={}, failed={}, belowMinimum={}, optedOut={}, cadence={}, claimed={}, redriven={}, errors={}, amount={}",
                runId, report.getPaid(), report.getFailed(), report.getSkippedBelowMinimum(), report.getSkippedOptedOut(),
                report.getSkippedCadence(), report.getAlreadyClaimed(), report.getRedriven(), report.getErrors(),
                report.getPaidAmount());
        return report;
    }

    private void settleBeneficiary(Long beneficiaryId, String runId, LocalDateTime now, SettlementReport report) {
        Optional<PayoutPreference> preference = preferenceMapper.selectByAccountId(beneficiaryId);
        if (preference.map(p -> Boolean.TRUE.equals(p.getOptedOut())).orElse(false)) {
            report.setSkippedOptedOut(report.getSkippedOptedOut() + 1);
            return;
        }
        if (preference.map(PayoutPreference::getCadence).orElse(PayoutCadence.WEEKLY) == PayoutCadence.MONTHLY
                && batchMapper.countPaidSince(beneficiaryId, now.toLocalDate().withDayOfMonth(1).atStartOfDay()) > 0) {
            report.setSkippedCadence(report.getSkippedCadence() + 1);
            return;
        }

        BigDecimal minimum = minimumFor(preference.orElse(null));
        BigDecimal total = transactionMapper.sumUnclaimedAvailable(beneficiaryId);
        if (total == null || total.compareTo(minimum) < 0) {
            log.debug("Beneficiary {} below minimum payout: total={}, minimum={}", beneficiaryId, total, minimum);
            report.setSkippedBelowMinimum(report.getSkippedBelowMinimum() + 1);
            return;
        }

        Optional<PayoutBatch> claimed = txService.claim(beneficiaryId, runId, now);
        if (claimed.isEmpty()) {
            report.setAlreadyClaimed(report.getAlreadyClaimed() + 1);
            return;
        }
        PayoutBatch batch = claimed.get();
        payClaimed(batch, true, now, report);
    }

    /**
     * 重新驱动超时仍为 CLAIMED 的批次：上次执行在打款前后中断（进程崩溃、渠道异常、落库失败）。
     * 沿用批次原幂等键调用渠道，渠道侧去重，已打过的款不会再打一次。
     */
    void redriveStaleClaims(LocalDateTime now, SettlementReport report) {
        LocalDateTime before = now.minus(properties.getStaleClaimAfter());
        List<PayoutBatch> stale = batchMapper.selectStaleClaimed(before, Math.max(1, properties.getMatureBatchSize()));
        for (PayoutBatch batch : stale) {
            report.setRedriven(report.getRedriven() + 1);
            log.warn("Re-driving stale claimed batch {}: beneficiary={}, key={}, claimedAt={}",
                    batch.getId(), batch.getBeneficiaryId(), batch.getIdempotencyKey(), batch.getCreateTime());
            try {
                // 上次可能已经打款成功，不再做就绪检查，直接按原幂等键重放
                payClaimed(batch, false, now, report);
            } catch (RuntimeException e) {
                report.setErrors(report.getErrors() + 1);
                log.error("Re-drive of batch {} failed, left CLAIMED", batch.getId(), e);
                alertService.raiseAlert(batch.getBeneficiaryId(), batch.getId(), SettlementAlertService.SETTLEMENT_ERROR,
                        "key=" + batch.getIdempotencyKey() + ", re-drive failed: " + e.getMessage());
            }
        }
    }

    /**
     * 已认领批次的打款。渠道调用之前的异常把批次置为 FAILED；渠道调用及之后的异常结果未知，
     * 批次保持 CLAIMED 并告警，超过 staleClaimAfter 后由 {@link #redriveStaleClaims} 接手。
     */
    private void payClaimed(PayoutBatch batch, boolean checkReadiness, LocalDateTime now, SettlementReport report) {
        String destination = null;
        String preflightFailure;
        try {
            destination = accountMapper.selectById(batch.getBeneficiaryId())
                    .map(Account::getPayoutAccountRef)
                    .filter(StringUtils::hasText)
                    .orElse(null);
            preflightFailure = destination == null ? MISSING_DESTINATION : null;
            if (preflightFailure == null && checkReadiness) {
                PayoutReadiness readiness = payoutProvider.canReceivePayouts(destination);
                preflightFailure = readiness.ready() ? null : "NOT_READY: " + readiness.reason();
            }
        } catch (RuntimeException e) {
            log.error("Batch {} failed before payout", batch.getId(), e);
            preflightFailure = "ERROR: " + e.getMessage();
        }
        if (preflightFailure != null) {
            fail(batch, preflightFailure, now, report);
            return;
        }

        try {
            PayoutResult result = payoutProvider.payout(destination, batch.getAmount(), batch.getIdempotencyKey());
            if (result.success()) {
                txService.completePaid(batch, result.reference(), now);
                report.addPaid(batch.getAmount());
            } else {
                fail(batch, result.failureReason(), now, report);
            }
        } catch (RuntimeException e) {
            report.setErrors(report.getErrors() + 1);
            log.error("Payout outcome of batch {} unknown, left CLAIMED for re-drive: beneficiary={}, key={}, amount={}",
                    batch.getId(), batch.getBeneficiaryId(), batch.getIdempotencyKey(), batch.getAmount(), e);
            alertService.raiseAlert(batch.getBeneficiaryId(), batch.getId(), SettlementAlertService.SETTLEMENT_ERROR,
                    "key=" + batch.getIdempotencyKey() + ", amount=" + batch.getAmount() + ", outcome unknown: " + e.getMessage());
        }
    }

    private void fail(PayoutBatch batch, String reason, LocalDateTime now, SettlementReport report) {
        String effectiveReason = StringUtils.hasText(reason) ? StrUtil.maxLength(reason, MAX_REASON_LENGTH) : "UNKNOWN";
        txService.completeFailed(batch, effectiveReason, now);
        report.setFailed(report.getFailed() + 1);
        log.error("Payout failed: beneficiary={}, batch={}, amount={}, reason={}",
                batch.getBeneficiaryId(), batch.getId(), batch.getAmount(), effectiveReason);
        alertService.raiseAlert(batch.getBeneficiaryId(), batch.getId(), SettlementAlertService.PAYOUT_FAILED,
                "key=" + batch.getIdempotencyKey() + ", amount=" + batch.getAmount() + ", reason=" + effectiveReason);
    }

    private BigDecimal minimumFor(PayoutPreference preference) {
        BigDecimal global = properties.getMinimumPayout() != null ? properties.getMinimumPayout() : BigDecimal.ZERO;
        if (preference == null || preference.getMinimumAmount() == null) {
            return global;
        }
        return preference.getMinimumAmount().max(global);
    }

    /**
     * 订单取消/退款：该订单下仍在 PENDING 的流水置为 FAILED。
     */
    public int voidPendingForBooking(String bookingId, String reason, LocalDateTime now) {
        if (!StringUtils.hasText(bookingId)) {
            throw new BizException("bookingId 不能为空");
        }
        String effectiveReason = StringUtils.hasText(reason) ? "VOIDED: " + reason : "VOIDED";
        int rows = transactionMapper.voidPendingByBooking(bookingId.trim(), effectiveReason, now);
        log.info("Voided {} pending commission transactions of booking {}", rows, bookingId);
        return rows;
    }

    /**
     * 人工重置 FAILED 流水为 AVAILABLE，下一个结算周期会重新打款。
     *
     * @return false 表示流水当前不是 FAILED
     */
    public boolean resetFailed(Long transactionId, String operator) {
        CommissionTransaction tx = transactionMapper.selectById(transactionId)
                .orElseThrow(() -> BizException.notFound("佣金流水不存在: " + transactionId));
        if (tx.getStatus() != CommissionStatus.FAILED) {
            return false;
        }
        boolean reset = transactionMapper.resetFailed(transactionId) == 1;
        if (reset) {
            log.info("Commission transaction {} reset to AVAILABLE by {} (was: {})", transactionId, operator, tx.getFailureReason());
        }
        return reset;
    }

    public static String runIdOf(LocalDateTime now) {
        return String.format("%d-W%02d",
                now.get(IsoFields.WEEK_BASED_YEAR),
                now.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
    }
}
