package com.slb.referral_backend.modules.settlement.service;

import com.slb.referral_backend.common.exception.BizException;
import com.slb.referral_backend.modules.account.mapper.AccountMapper;
import com.slb.referral_backend.modules.settlement.dto.PayoutPreferenceDto;
import com.slb.referral_backend.modules.settlement.entity.PayoutPreference;
import com.slb.referral_backend.modules.settlement.enums.PayoutCadence;
import com.slb.referral_backend.modules.settlement.mapper.PayoutPreferenceMapper;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;

@Service
public class PayoutPreferenceService {

    private final PayoutPreferenceMapper preferenceMapper;
    private final AccountMapper accountMapper;
    private final Clock clock;

    public PayoutPreferenceService(PayoutPreferenceMapper preferenceMapper, AccountMapper accountMapper, Clock clock) {
        this.preferenceMapper = preferenceMapper;
        this.accountMapper = accountMapper;
        this.clock = clock;
    }

    /** 未设置时返回默认偏好（每周、全局最低金额、不暂停） */
    public PayoutPreference get(Long accountId) {
        return preferenceMapper.selectByAccountId(accountId).orElseGet(() -> defaults(accountId));
    }

    public PayoutPreference save(Long accountId, PayoutPreferenceDto dto) {
        if (accountMapper.selectById(accountId).isEmpty()) {
            throw BizException.notFound("账户不存在: " + accountId);
        }
        PayoutPreference preference = defaults(accountId);
        if (dto.getCadence() != null) {
            preference.setCadence(dto.getCadence());
        }
        preference.setMinimumAmount(dto.getMinimumAmount());
        preference.setOptedOut(Boolean.TRUE.equals(dto.getOptedOut()));
        preference.setUpdateTime(LocalDateTime.now(clock));
        preferenceMapper.upsert(preference);
        return preference;
    }

    private static PayoutPreference defaults(Long accountId) {
        PayoutPreference preference = new PayoutPreference();
        preference.setAccountId(accountId);
        preference.setCadence(PayoutCadence.WEEKLY);
        preference.setOptedOut(false);
        return preference;
    }
}
