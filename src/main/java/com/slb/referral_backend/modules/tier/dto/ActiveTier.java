package com.slb.referral_backend.modules.tier.dto;

import java.math.BigDecimal;

/**
 * 生效中的佣金层级。
 *
 * @param rate        小数费率，例如 0.10000000
 * @param ratePercent 配置的百分比，例如 10.0000
 */
public record ActiveTier(int tier, BigDecimal rate, BigDecimal ratePercent) {
}
