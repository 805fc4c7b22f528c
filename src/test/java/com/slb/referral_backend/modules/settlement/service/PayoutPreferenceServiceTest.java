package com.slb.referral_backend.modules.settlement.service;

import com.slb.referral_backend.common.exception.BizException;
import com.slb.referral_backend.modules.account.entity.Account;
import com.slb.referral_backend.modules.account.mapper.AccountMapper;
import com.slb.referral_backend.modules.settlement.dto.PayoutPreferenceDto;
import com.slb.referral_backend.modules.settlement.entity.PayoutPreference;
import com.slb.referral_backend.modules.settlement.enums.PayoutCadence;
import com.slb.referral_backend.modules.settlement.mapper.PayoutPreferenceMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PayoutPreferenceServiceTest {

    @Mock
    private PayoutPreferenceMapper preferenceMapper;
    @Mock
    private AccountMapper accountMapper;

    private PayoutPreferenceService service;

    @BeforeEach
    void setUp() {
        service = new PayoutPreferenceService(preferenceMapper, accountMapper,
                Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void get_withoutStoredPreference_returnsWeeklyDefaults() {
        when(preferenceMapper.selectByAccountId(7L)).thenReturn(Optional.empty());

        PayoutPreference preference = service.get(7L);

        assertEquals(PayoutCadence.WEEKLY, preference.getCadence());
        assertFalse(preference.getOptedOut());
        assertNull(preference.getMinimumAmount());
    }

    @Test
    void save_upsertsPreference() {
        when(accountMapper.selectById(7L)).thenReturn(Optional.of(new Account()));
        PayoutPreferenceDto dto = new PayoutPreferenceDto();
        dto.setCadence(PayoutCadence.MONTHLY);
        dto.setMinimumAmount(new BigDecimal("50.00"));

        PayoutPreference saved = service.save(7L, dto);

        assertEquals(PayoutCadence.MONTHLY, saved.getCadence());
        assertEquals(new BigDecimal("50.00"), saved.getMinimumAmount());
        assertFalse(saved.getOptedOut());
        verify(preferenceMapper).upsert(saved);
    }

    @Test
    void save_unknownAccount_isNotFound() {
        when(accountMapper.selectById(404L)).thenReturn(Optional.empty());

        BizException ex = assertThrows(BizException.class, () -> service.save(404L, new PayoutPreferenceDto()));

        assertEquals(404, ex.getCode());
        verify(preferenceMapper, never()).upsert(any());
    }
}
