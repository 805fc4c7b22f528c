package com.slb.referral_backend.modules.settlement.service;

import com.slb.referral_backend.modules.commission.mapper.CommissionTransactionMapper;
import com.slb.referral_backend.modules.settlement.entity.PayoutBatch;
import com.slb.referral_backend.modules.settlement.enums.PayoutBatchStatus;
import com.slb.referral_backend.modules.settlement.mapper.PayoutBatchMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 结算的各个事务步骤。单独成 bean，保证 @Transactional 经过代理生效；
 * 打款渠道调用发生在事务之外。
 */
@Slf4j
@Service
public class SettlementTxService {

    private final PayoutBatchMapper batchMapper;
    private final CommissionTransactionMapper transactionMapper;

    public SettlementTxService(PayoutBatchMapper batchMapper, CommissionTransactionMapper transactionMapper) {
        this.batchMapper = batchMapper;
        this.transactionMapper = transactionMapper;
    }

    /**
     * 认领：先插入 (beneficiary, run) 批次，插入成功者才把未认领的 AVAILABLE 流水写入该批次。
     *
     * @return empty 表示本周期已被认领，或没有可认领的流水
     */
    @Transactional
    public Optional<PayoutBatch> claim(Long beneficiaryId, String runId, LocalDateTime now) {
        PayoutBatch batch = new PayoutBatch();
        batch.setRunId(runId);
        batch.setBeneficiaryId(beneficiaryId);
        batch.setIdempotencyKey(PayoutBatch.idempotencyKey(beneficiaryId, runId));
        batch.setAmount(BigDecimal.ZERO);
        batch.setTransactionCount(0);
        batch.setStatus(PayoutBatchStatus.CLAIMED);
        batch.setCreateTime(now);
        if (batchMapper.insertIgnore(batch) == 0) {
            log.info("Settlement already claimed: beneficiary={}, run={}", beneficiaryId, runId);
            return Optional.empty();
        }

        int claimed = transactionMapper.claimForBatch(beneficiaryId, batch.getId());
        if (claimed == 0) {
            batchMapper.markEmpty(batch.getId(), now);
            return Optional.empty();
        }
        BigDecimal amount = transactionMapper.sumByBatch(batch.getId());
        batchMapper.updateTotals(batch.getId(), amount, claimed);
        batch.setAmount(amount);
        batch.setTransactionCount(claimed);
        return Optional.of(batch);
    }

    @Transactional
    public void completePaid(PayoutBatch batch, String providerReference, LocalDateTime now) {
        int rows = transactionMapper.markBatchPaidOut(batch.getId(), now);
        batchMapper.markPaid(batch.getId(), providerReference, now);
        batch.setStatus(PayoutBatchStatus.PAID);
        batch.setProviderReference(providerReference);
        log.info("Batch {} paid out: beneficiary={}, amount={}, transactions={}", batch.getId(),
                batch.getBeneficiaryId(), batch.getAmount(), rows);
    }

    @Transactional
    public void completeFailed(PayoutBatch batch, String reason, LocalDateTime now) {
        transactionMapper.markBatchFailed(batch.getId(), reason, now);
        batchMapper.markFailed(batch.getId(), reason, now);
        batch.setStatus(PayoutBatchStatus.FAILED);
        batch.setFailureReason(reason);
    }
}
