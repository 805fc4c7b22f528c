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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CommissionEngineTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 6, 1, 12, 0);

    private static final ActiveTier TIER_1 = new ActiveTier(1, new BigDecimal("0.10000000"), new BigDecimal("10.0000"));
    private static final ActiveTier TIER_2 = new ActiveTier(2, new BigDecimal("0.03000000"), new BigDecimal("3.0000"));
    private static final ActiveTier TIER_3 = new ActiveTier(3, new BigDecimal("0.01000000"), new BigDecimal("1.0000"));

    @Mock
    private AccountMapper accountMapper;
    @Mock
    private ReferralChainService chainService;
    @Mock
    private ListingDelegationMapper delegationMapper;
    @Mock
    private CommissionTransactionMapper transactionMapper;
    @Mock
    private CommissionTierService tierService;
    @Mock
    private ReferralPipelineService pipelineService;

    private CommissionEngine engine;

    @BeforeEach
    void setUp() {
        engine = new CommissionEngine(accountMapper, chainService, delegationMapper, transactionMapper,
                tierService, pipelineService, Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void computeChain_onlyTierOneActive_paysDirectReferrerOnly() {
        givenPayee(100L, 30L);
        when(tierService.getActiveTiers()).thenReturn(List.of(TIER_1));
        when(transactionMapper.insertIgnore(any())).thenReturn(1);

        List<CommissionTransaction> txs = engine.computeChain(event("bk-1", 100L, "100.00", null));

        assertThat(txs).hasSize(1);
        CommissionTransaction tx = txs.get(0);
        assertEquals(30L, tx.getBeneficiaryId());
        assertEquals(1, tx.getTier());
        assertThat(tx.getAmount()).isEqualByComparingTo("10.00");
        assertEquals(CommissionStatus.PENDING, tx.getStatus());
        assertEquals(Boolean.FALSE, tx.getDelegated());
        verify(chainService, never()).naturalReferrer(any());
        verify(pipelineService).markConverted(100L, "bk-1", NOW);
    }

    @Test
    void computeChain_listingDelegation_redirectsTierOneOnly() {
        givenPayee(100L, 1L);
        when(tierService.getActiveTiers()).thenReturn(List.of(TIER_1, TIER_2));
        when(delegationMapper.selectDelegate(42L)).thenReturn(500L);
        when(chainService.naturalReferrer(1L)).thenReturn(9L);
        when(transactionMapper.insertIgnore(any())).thenReturn(1);

        List<CommissionTransaction> txs = engine.computeChain(event("bk-2", 100L, "100.00", 42L));

        assertThat(txs).extracting(CommissionTransaction::getBeneficiaryId).containsExactly(500L, 9L);
        assertEquals(Boolean.TRUE, txs.get(0).getDelegated());
        assertThat(txs.get(0).getAmount()).isEqualByComparingTo("10.00");
        assertEquals(Boolean.FALSE, txs.get(1).getDelegated());
        assertThat(txs.get(1).getAmount()).isEqualByComparingTo("3.00");
    }

    @Test
    void computeChain_delegateIsPayee_isIgnored() {
        givenPayee(100L, 30L);
        when(tierService.getActiveTiers()).thenReturn(List.of(TIER_1));
        when(delegationMapper.selectDelegate(42L)).thenReturn(100L);
        when(transactionMapper.insertIgnore(any())).thenReturn(1);

        List<CommissionTransaction> txs = engine.computeChain(event("bk-3", 100L, "100.00", 42L));

        assertEquals(30L, txs.get(0).getBeneficiaryId());
        assertEquals(Boolean.FALSE, txs.get(0).getDelegated());
    }

    @Test
    void computeChain_replayedEvent_returnsExistingRowsWithoutDuplicates() {
        givenPayee(100L, 30L);
        when(tierService.getActiveTiers()).thenReturn(List.of(TIER_1));
        when(transactionMapper.insertIgnore(any())).thenReturn(0);
        CommissionTransaction existing = new CommissionTransaction();
        existing.setId(77L);
        existing.setStatus(CommissionStatus.AVAILABLE);
        when(transactionMapper.selectByBookingAndTierForShare("bk-1", 1)).thenReturn(Optional.of(existing));

        List<CommissionTransaction> txs = engine.computeChain(event("bk-1", 100L, "100.00", null));

        assertThat(txs).containsExactly(existing);
        verify(transactionMapper).selectByBookingAndTierForShare("bk-1", 1);
    }

    @Test
    void computeChain_chainShorterThanActiveTiers_stopsAtRoot() {
        givenPayee(100L, 1L);
        when(tierService.getActiveTiers()).thenReturn(List.of(TIER_1, TIER_2, TIER_3));
        when(chainService.naturalReferrer(1L)).thenReturn(null);
        when(transactionMapper.insertIgnore(any())).thenReturn(1);

        List<CommissionTransaction> txs = engine.computeChain(event("bk-4", 100L, "100.00", null));

        assertThat(txs).hasSize(1);
        verify(chainService, times(1)).naturalReferrer(any());
    }

    @Test
    void computeChain_unreferredPayee_createsNothingButStillConverts() {
        givenPayee(100L, null);
        when(tierService.getActiveTiers()).thenReturn(List.of(TIER_1, TIER_2));

        assertThat(engine.computeChain(event("bk-5", 100L, "100.00", null))).isEmpty();
        verify(transactionMapper, never()).insertIgnore(any());
        verify(pipelineService).markConverted(100L, "bk-5", NOW);
    }

    @Test
    void computeChain_corruptLoop_stopsBeforeRevisitingAccount() {
        givenPayee(100L, 1L);
        when(tierService.getActiveTiers()).thenReturn(List.of(TIER_1, TIER_2, TIER_3));
        when(chainService.naturalReferrer(1L)).thenReturn(100L);
        when(transactionMapper.insertIgnore(any())).thenReturn(1);

        assertThat(engine.computeChain(event("bk-6", 100L, "100.00", null))).hasSize(1);
    }

    @Test
    void computeChain_roundsDownAndNeverExceedsBase() {
        givenPayee(100L, 1L);
        ActiveTier tier1 = new ActiveTier(1, new BigDecimal("0.01500000"), new BigDecimal("1.5000"));
        when(tierService.getActiveTiers()).thenReturn(List.of(tier1));
        when(transactionMapper.insertIgnore(any())).thenReturn(1);

        List<CommissionTransaction> txs = engine.computeChain(event("bk-7", 100L, "33.33", null));

        assertThat(txs.get(0).getAmount()).isEqualByComparingTo("0.49");
    }

    @Test
    void computeChain_amountRoundingToZero_isSkippedAndWalkContinues() {
        givenPayee(100L, 1L);
        when(tierService.getActiveTiers()).thenReturn(List.of(TIER_1, TIER_2));
        when(chainService.naturalReferrer(1L)).thenReturn(9L);
        when(transactionMapper.insertIgnore(any())).thenReturn(1);

        // 0.20 * 10% = 0.02, 0.20 * 3% = 0.006 -> 0.00
        List<CommissionTransaction> txs = engine.computeChain(event("bk-8", 100L, "0.20", null));

        assertThat(txs).extracting(CommissionTransaction::getTier).containsExactly(1);
    }

    @Test
    void computeChain_invalidInput_isRejected() {
        assertEquals(400, assertThrows(BizException.class,
                () -> engine.computeChain(event("bk-9", 100L, "0", null))).getCode());
        assertEquals(400, assertThrows(BizException.class,
                () -> engine.computeChain(event(" ", 100L, "10", null))).getCode());

        when(accountMapper.selectById(404L)).thenReturn(Optional.empty());
        assertEquals(404, assertThrows(BizException.class,
                () -> engine.computeChain(event("bk-9", 404L, "10", null))).getCode());
        verifyNoInteractions(transactionMapper, pipelineService);
    }

    private void givenPayee(Long id, Long referredBy) {
        Account payee = new Account();
        payee.setId(id);
        payee.setReferredBy(referredBy);
        payee.setStatus(1);
        when(accountMapper.selectById(id)).thenReturn(Optional.of(payee));
    }

    private static PaymentCompletedEvent event(String bookingId, Long payee, String base, Long listingId) {
        return new PaymentCompletedEvent(bookingId, payee, new BigDecimal(base), listingId, null);
    }
}
