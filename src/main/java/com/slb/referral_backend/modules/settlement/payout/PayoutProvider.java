package com.slb.referral_backend.modules.settlement.payout;

import java.math.BigDecimal;

/**
 * 打款渠道抽象。实现方必须按 idempotencyKey 去重：同一个 key 重复调用不能重复打款。
 */
public interface PayoutProvider {

    PayoutResult payout(String destinationRef, BigDecimal amount, String idempotencyKey);

    PayoutReadiness canReceivePayouts(String destinationRef);
}
