package com.slb.referral_backend.modules.account.service;

import com.slb.referral_backend.modules.account.mapper.AccountMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.Set;

/**
 * 推荐链查询。链上每一跳都是一次按主键的查询。
 */
@Slf4j
@Service
public class ReferralChainService {

    /** 超过该深度视为数据异常，停止遍历 */
    static final int MAX_DEPTH = 64;

    private final AccountMapper accountMapper;

    public ReferralChainService(AccountMapper accountMapper) {
        this.accountMapper = accountMapper;
    }

    public Long naturalReferrer(Long accountId) {
        if (accountId == null) {
            return null;
        }
        return accountMapper.selectReferredBy(accountId);
    }

    /**
     * 若把 candidateReferrer 设为 accountId 的推荐人会让链回到 accountId，则返回 true。
     */
    public boolean wouldCreateCycle(Long candidateReferrer, Long accountId) {
        if (candidateReferrer == null || accountId == null) {
            return false;
        }
        Set<Long> visited = new HashSet<>();
        Long current = candidateReferrer;
        while (current != null) {
            if (current.equals(accountId)) {
                return true;
            }
            if (!visited.add(current) || visited.size() > MAX_DEPTH) {
                log.warn("Referral chain above account {} is cyclic or too deep, treating as cycle", candidateReferrer);
                return true;
            }
            current = accountMapper.selectReferredBy(current);
        }
        return false;
    }
}
