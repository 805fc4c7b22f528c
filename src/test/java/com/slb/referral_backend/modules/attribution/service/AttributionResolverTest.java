package com.slb.referral_backend.modules.attribution.service;

import com.slb.referral_backend.common.exception.BizException;
import com.slb.referral_backend.modules.account.entity.Account;
import com.slb.referral_backend.modules.account.enums.ReferralSource;
import com.slb.referral_backend.modules.account.mapper.AccountMapper;
import com.slb.referral_backend.modules.account.service.ReferralChainService;
import com.slb.referral_backend.modules.account.service.ReferralCodeGenerator;
import com.slb.referral_backend.modules.attribution.config.AttributionProperties;
import com.slb.referral_backend.modules.attribution.dto.AttributionSignals;
import com.slb.referral_backend.modules.attribution.dto.SignupDraft;
import com.slb.referral_backend.modules.attribution.entity.AttributionAudit;
import com.slb.referral_backend.modules.attribution.mapper.AttributionAuditMapper;
import com.slb.referral_backend.modules.pipeline.mapper.ReferralAttemptMapper;
import com.slb.referral_backend.modules.pipeline.service.ReferralPipelineService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AttributionResolverTest {

    private static final Instant NOW_INSTANT = Instant.parse("2024-06-01T12:00:00Z");
    private static final LocalDateTime NOW = LocalDateTime.of(2024, 6, 1, 12, 0);
    private static final Long NEW_ID = 2L;
    private static final Long A_ID = 1L;
    private static final Long D_ID = 4L;

    @Mock
    private AccountMapper accountMapper;
    @Mock
    private AttributionAuditMapper auditMapper;
    @Mock
    private ReferralAttemptMapper attemptMapper;
    @Mock
    private ReferralChainService chainService;
    @Mock
    private ReferralCodeGenerator codeGenerator;
    @Mock
    private ReferralPipelineService pipelineService;

    @Captor
    private ArgumentCaptor<AttributionAudit> auditCaptor;

    private AttributionTokenCodec tokenCodec;
    private AttributionResolver resolver;

    private Account referrerA;
    private Account referrerD;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW_INSTANT, ZoneOffset.UTC);
        AttributionProperties properties = new AttributionProperties();
        properties.setTokenSecret("test-referral-token-secret-0123456789abcdef");
        properties.setVelocityMaxClicks(20);
        tokenCodec = new AttributionTokenCodec(properties, clock);
        resolver = new AttributionResolver(accountMapper, auditMapper, tokenCodec, new FraudGuard(attemptMapper),
                chainService, codeGenerator, pipelineService, properties, clock);

        referrerA = account(A_ID, "KRZ7BQ2", "a@example.com");
        referrerD = account(D_ID, "DQ4MN8P", "d@example.com");

        lenient().when(accountMapper.selectById(NEW_ID)).thenReturn(Optional.empty());
        lenient().when(codeGenerator.generateUniqueCode()).thenReturn("NEWB234");
    }

    @Test
    void resolveAndBind_validToken_attributesToTokenReferrer() {
        String token = tokenCodec.issue(A_ID, "/listings/7");
        when(accountMapper.selectById(A_ID)).thenReturn(Optional.of(referrerA));

        Account created = resolver.resolveAndBind(draft("b@example.com"),
                new AttributionSignals(null, token, null, null, null));

        assertEquals(A_ID, created.getReferredBy());
        assertEquals(ReferralSource.TOKEN, created.getReferralSource());
        assertEquals(NOW, created.getReferredAt());
        assertEquals("NEWB234", created.getReferralCode());
        verify(accountMapper).insert(created);
        verify(pipelineService).markAttributed(A_ID, "KRZ7BQ2", NEW_ID, ReferralSource.TOKEN, NOW);

        verify(auditMapper).insert(auditCaptor.capture());
        AttributionAudit audit = auditCaptor.getValue();
        assertTrue(audit.getSuccess());
        assertEquals(A_ID, audit.getCandidateReferrerId());
        assertEquals("OK", audit.getReason());
    }

    @Test
    void resolveAndBind_explicitCodeTakesPriorityOverTokenAndManualCode() {
        when(accountMapper.selectByReferralCode("KRZ7BQ2")).thenReturn(Optional.of(referrerA));
        String tokenForD = tokenCodec.issue(D_ID, null);

        Account created = resolver.resolveAndBind(draft("b@example.com"),
                new AttributionSignals(" krz7bq2 ", tokenForD, "DQ4MN8P", null, null));

        assertEquals(A_ID, created.getReferredBy());
        assertEquals(ReferralSource.EXPLICIT_CODE, created.getReferralSource());
        verify(accountMapper, never()).selectById(D_ID);
        verify(accountMapper, never()).selectByReferralCode("DQ4MN8P");
    }

    @Test
    void resolveAndBind_sharedEmail_fallsThroughToNextCandidate() {
        referrerA.setEmail(" B@Example.com");
        when(accountMapper.selectByReferralCode("KRZ7BQ2")).thenReturn(Optional.of(referrerA));
        when(accountMapper.selectByReferralCode("DQ4MN8P")).thenReturn(Optional.of(referrerD));

        Account created = resolver.resolveAndBind(draft("b@example.com"),
                new AttributionSignals("KRZ7BQ2", null, "DQ4MN8P", null, null));

        assertEquals(D_ID, created.getReferredBy());
        assertEquals(ReferralSource.MANUAL_CODE, created.getReferralSource());
        verify(pipelineService).markAttributed(D_ID, "DQ4MN8P", NEW_ID, ReferralSource.MANUAL_CODE, NOW);

        verify(auditMapper, times(2)).insert(auditCaptor.capture());
        List<AttributionAudit> audits = auditCaptor.getAllValues();
        assertFalse(audits.get(0).getSuccess());
        assertEquals(A_ID, audits.get(0).getCandidateReferrerId());
        assertEquals("SHARED_CONTACT", audits.get(0).getReason());
        assertTrue(audits.get(1).getSuccess());
        assertEquals(D_ID, audits.get(1).getCandidateReferrerId());
    }

    @Test
    void resolveAndBind_invalidToken_fallsThroughToManualCode() {
        when(accountMapper.selectByReferralCode("DQ4MN8P")).thenReturn(Optional.of(referrerD));

        Account created = resolver.resolveAndBind(draft("b@example.com"),
                new AttributionSignals(null, "not.a.token", "dq4mn8p", null, null));

        assertEquals(D_ID, created.getReferredBy());
        verify(auditMapper, times(2)).insert(auditCaptor.capture());
        AttributionAudit rejected = auditCaptor.getAllValues().get(0);
        assertEquals(ReferralSource.TOKEN, rejected.getSource());
        assertNull(rejected.getCandidateReferrerId());
        assertEquals("INVALID_TOKEN", rejected.getReason());
    }

    @Test
    void resolveAndBind_unknownCodeOnly_createsUnattributedAccount() {
        when(accountMapper.selectByReferralCode("ZZZZZZZ")).thenReturn(Optional.empty());

        Account created = resolver.resolveAndBind(draft("b@example.com"),
                new AttributionSignals("ZZZZZZZ", null, null, null, null));

        assertNull(created.getReferredBy());
        assertNull(created.getReferredAt());
        assertEquals(ReferralSource.NONE, created.getReferralSource());
        verify(accountMapper).insert(created);
        verify(auditMapper).insert(auditCaptor.capture());
        assertEquals("UNKNOWN_CODE", auditCaptor.getValue().getReason());
        verifyNoInteractions(pipelineService);
    }

    @Test
    void resolveAndBind_disabledReferrer_isNotAttributed() {
        referrerA.setStatus(0);
        when(accountMapper.selectByReferralCode("KRZ7BQ2")).thenReturn(Optional.of(referrerA));

        Account created = resolver.resolveAndBind(draft("b@example.com"),
                new AttributionSignals("KRZ7BQ2", null, null, null, null));

        assertEquals(ReferralSource.NONE, created.getReferralSource());
        verify(auditMapper).insert(auditCaptor.capture());
        assertEquals("INACTIVE_REFERRER", auditCaptor.getValue().getReason());
    }

    @Test
    void resolveAndBind_velocityExceeded_deniesEveryCandidateWithSingleQuery() {
        when(accountMapper.selectByReferralCode("KRZ7BQ2")).thenReturn(Optional.of(referrerA));
        when(accountMapper.selectByReferralCode("DQ4MN8P")).thenReturn(Optional.of(referrerD));
        when(attemptMapper.countClicksFromIpSince(eq("10.0.0.9"), any(), any())).thenReturn(20L);

        Account created = resolver.resolveAndBind(draft("b@example.com"),
                new AttributionSignals("KRZ7BQ2", null, "DQ4MN8P", "10.0.0.9", "ua"));

        assertEquals(ReferralSource.NONE, created.getReferralSource());
        verify(attemptMapper, times(1)).countClicksFromIpSince(eq("10.0.0.9"), any(), any());
        verify(auditMapper, times(2)).insert(auditCaptor.capture());
        assertTrue(auditCaptor.getAllValues().stream()
                .allMatch(a -> "VELOCITY_EXCEEDED".equals(a.getReason()) && "10.0.0.9".equals(a.getClientIp())));
        verifyNoInteractions(pipelineService);
    }

    @Test
    void resolveAndBind_candidateWouldCloseCycle_isDenied() {
        when(accountMapper.selectByReferralCode("KRZ7BQ2")).thenReturn(Optional.of(referrerA));
        when(chainService.wouldCreateCycle(A_ID, NEW_ID)).thenReturn(true);

        Account created = resolver.resolveAndBind(draft("b@example.com"),
                new AttributionSignals("KRZ7BQ2", null, null, null, null));

        assertNull(created.getReferredBy());
        verify(auditMapper).insert(auditCaptor.capture());
        assertEquals("REFERRAL_CYCLE", auditCaptor.getValue().getReason());
    }

    @Test
    void resolveAndBind_noSignals_createsAccountWithoutAudit() {
        Account created = resolver.resolveAndBind(draft("b@example.com"), null);

        assertEquals(ReferralSource.NONE, created.getReferralSource());
        assertEquals(1, created.getStatus());
        verify(accountMapper).insert(created);
        verifyNoInteractions(auditMapper, pipelineService);
    }

    @Test
    void resolveAndBind_existingAccount_conflicts() {
        when(accountMapper.selectById(NEW_ID)).thenReturn(Optional.of(new Account()));

        BizException ex = assertThrows(BizException.class,
                () -> resolver.resolveAndBind(draft("b@example.com"), AttributionSignals.none()));

        assertEquals(409, ex.getCode());
        verify(accountMapper, never()).insert(any());
    }

    @Test
    void resolveAndBind_concurrentInsertOfSameAccount_conflicts() {
        when(accountMapper.insert(any())).thenThrow(new DuplicateKeyException("uk_accounts_id"));

        BizException ex = assertThrows(BizException.class,
                () -> resolver.resolveAndBind(draft("b@example.com"), AttributionSignals.none()));

        assertEquals(409, ex.getCode());
    }

    @Test
    void resolveAndBind_referralCodeTakenConcurrently_retriesWithFreshCode() {
        when(codeGenerator.generateUniqueCode()).thenReturn("NEWB234", "FRSH567");
        when(accountMapper.insert(any()))
                .thenThrow(new DuplicateKeyException("Duplicate entry 'NEWB234' for key 'accounts.uk_accounts_referral_code'"))
                .thenReturn(1);

        Account created = resolver.resolveAndBind(draft("b@example.com"), AttributionSignals.none());

        assertEquals("FRSH567", created.getReferralCode());
        assertEquals(NEW_ID, created.getId());
        verify(accountMapper, times(2)).insert(created);
    }

    @Test
    void resolveAndBind_referralCodeTakenTwice_conflictsWithoutThirdAttempt() {
        when(accountMapper.insert(any()))
                .thenThrow(new DuplicateKeyException("Duplicate entry for key 'accounts.uk_accounts_referral_code'"));

        BizException ex = assertThrows(BizException.class,
                () -> resolver.resolveAndBind(draft("b@example.com"), AttributionSignals.none()));

        assertEquals(409, ex.getCode());
        assertFalse(ex.getMessage().contains("账户已存在"));
        verify(accountMapper, times(2)).insert(any());
    }

    private static SignupDraft draft(String email) {
        return new SignupDraft(NEW_ID, email, "B", null);
    }

    private static Account account(Long id, String code, String email) {
        Account account = new Account();
        account.setId(id);
        account.setReferralCode(code);
        account.setEmail(email);
        account.setStatus(1);
        return account;
    }
}
