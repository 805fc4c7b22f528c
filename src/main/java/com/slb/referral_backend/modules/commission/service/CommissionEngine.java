package com.slb.referral_backend.modules.commission.service;

import com.slb.referral_backend.common.exception.BizException;
import com.slb.referral_backend.modules.account.entity.Account;
import com.slb.referral_backend.modules.account.mapper.AccountMapper;
import com.slb.referral_backend.modules.account.service.ReferralChainService;
import com.slb.referral_backend.modules.commission.dto.PaymentCompletedEvent;
import com.slb.referral_backend.modules.commission.entity.CommissionTransaction;
import com.slb.referral_backend.modules.commission.enums.CommissionStatus;
import com.slb.referral_backend.modules.commission.mapper.CommissionTransactionMapper;
import com.slb.referral_backend.modules.commission.mapper.ListingDelegationMapper;
import com.slb.referral_backend.modules.pipeline.service.ReferralPipelineService;
import com.slb.referral_backend.modules.tier.dto.ActiveTier;
import com.slb.referral_backend.modules.tier.service.CommissionTierService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 多级佣金计算。
 * <ul>
 *     <li>第 k 级受益人是收款方自然推荐链上的第 k 个祖先；</li>
 *     <li>listing 设置了委托账户时，只替换第 1 级受益人，第 2 级及以上仍沿自然链计算；</li>
 *     <li>金额 = basePayable × 费率，向下取整到分，合计不超过 base × Σ费率；</li>
 *     <li>(bookingId, tier) 幂等，重复回调不会产生新流水。</li>
 * </ul>
 */
@Slf4j
@Service
public class CommissionEngine {

    private static final int AMOUNT_SCALE = 2;

    private final AccountMapper accountMapper;
    private final ReferralChainService chainService;
    private final ListingDelegationMapper delegationMapper;
    private final CommissionTransactionMapper transactionMapper;
    private final CommissionTierService tierService;
    private final ReferralPipelineService pipelineService;
    private final Clock clock;

    public CommissionEngine(AccountMapper accountMapper,
                            ReferralChainService chainService,
                            ListingDelegationMapper delegationMapper,
                            CommissionTransactionMapper transactionMapper,
                            CommissionTierService tierService,
                            ReferralPipelineService pipelineService,
                            Clock clock) {
        this.accountMapper = accountMapper;
        this.chainService = chainService;
        this.delegationMapper = delegationMapper;
        this.transactionMapper = transactionMapper;
        this.tierService = tierService;
        this.pipelineService = pipelineService;
        this.clock = clock;
    }

    @Transactional
    public List<CommissionTransaction> computeChain(PaymentCompletedEvent event) {
        if (event == null || !StringUtils.hasText(event.getBookingId()) || event.getPayeeAccountId() == null) {
            throw new BizException("bookingId 与 payeeAccountId 不能为空");
        }
        BigDecimal base = event.getBasePayable();
        if (base == null || base.signum() <= 0) {
            throw new BizException("basePayable 必须大于 0");
        }
        Account payee = accountMapper.selectById(event.getPayeeAccountId())
                .orElseThrow(() -> BizException.notFound("收款方账户不存在: " + event.getPayeeAccountId()));

        LocalDateTime now = LocalDateTime.now(clock);
        String bookingId = event.getBookingId().trim();
        List<ActiveTier> tiers = tierService.getActiveTiers();
        Long delegate = resolveDelegate(event.getListingId(), payee.getId());

        List<CommissionTransaction> result = new ArrayList<>();
        Set<Long> visited = new HashSet<>();
        visited.add(payee.getId());
        Long ancestor = payee.getReferredBy();
        for (ActiveTier tier : tiers) {
            if (tier.tier() > 1) {
                ancestor = chainService.naturalReferrer(ancestor);
            }
            if (ancestor != null && !visited.add(ancestor)) {
                log.warn("Referral chain of payee {} loops at account {}, stopping at tier {}", payee.getId(), ancestor, tier.tier());
                break;
            }
            boolean delegated = tier.tier() == 1 && delegate != null;
            Long beneficiary = delegated ? delegate : ancestor;
            if (beneficiary == null) {
                break;
            }

            BigDecimal amount = base.multiply(tier.rate()).setScale(AMOUNT_SCALE, RoundingMode.DOWN);
            if (amount.signum() <= 0) {
                log.debug("Tier {} commission for booking {} rounds to zero, skipped", tier.tier(), bookingId);
                continue;
            }

            CommissionTransaction tx = new CommissionTransaction();
            tx.setBeneficiaryId(beneficiary);
            tx.setBookingId(bookingId);
            tx.setPayeeAccountId(payee.getId());
            tx.setListingId(event.getListingId());
            tx.setTier(tier.tier());
            tx.setCommissionRate(tier.rate());
            tx.setBaseAmount(base);
            tx.setAmount(amount);
            tx.setDelegated(delegated);
            tx.setStatus(CommissionStatus.PENDING);
            tx.setCreateTime(now);

            if (transactionMapper.insertIgnore(tx) == 1) {
                result.add(tx);
            } else {
                log.info("Commission already recorded: booking={}, tier={}", bookingId, tier.tier());
                transactionMapper.selectByBookingAndTierForShare(bookingId, tier.tier()).ifPresent(result::add);
            }
        }

        LocalDateTime convertedAt = event.getOccurredAt() != null ? event.getOccurredAt() : now;
        pipelineService.markConverted(payee.getId(), bookingId, convertedAt);

        log.info("Commission chain computed: booking={}, payee={}, base={}, transactions={}",
                bookingId, payee.getId(), base, result.size());
        return result;
    }

    public List<CommissionTransaction> listByBooking(String bookingId) {
        return transactionMapper.selectByBookingId(bookingId);
    }

    private Long resolveDelegate(Long listingId, Long payeeId) {
        if (listingId == null) {
            return null;
        }
        Long delegate = delegationMapper.selectDelegate(listingId);
        // 委托给收款方自己等于没有委托
        if (delegate != null && delegate.equals(payeeId)) {
            return null;
        }
        return delegate;
    }
}
