package com.slb.referral_backend.modules.account.service;

import cn.hutool.core.util.RandomUtil;
import com.slb.referral_backend.common.exception.BizException;
import com.slb.referral_backend.modules.account.mapper.AccountMapper;
import org.springframework.stereotype.Component;

/**
 * 生成 7 位推荐码；字母表去掉了易混淆的 I、L、O、0、1。
 */
@Component
public class ReferralCodeGenerator {

    static final String ALPHABET = "ABCDEFGHJKMNPQRSTUVWXYZ23456789";
    static final int CODE_LENGTH = 7;
    private static final int MAX_ATTEMPTS = 10;

    private final AccountMapper accountMapper;

    public ReferralCodeGenerator(AccountMapper accountMapper) {
        this.accountMapper = accountMapper;
    }

    public String generateUniqueCode() {
        for (int i = 0; i < MAX_ATTEMPTS; i++) {
            String code = randomCode();
            if (accountMapper.selectByReferralCode(code).isEmpty()) {
                return code;
            }
        }
        throw new BizException(503, "推荐码生成失败，请稍后重试");
    }

    String randomCode() {
        return RandomUtil.randomString(ALPHABET, CODE_LENGTH);
    }

    /** 去空格并转大写；空串返回 null。 */
    public static String normalize(String rawCode) {
        if (rawCode == null) {
            return null;
        }
        String trimmed = rawCode.trim();
        return trimmed.isEmpty() ? null : trimmed.toUpperCase();
    }
}
