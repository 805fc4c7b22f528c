package com.slb.referral_backend.modules.attribution.vo;

import com.slb.referral_backend.modules.account.entity.Account;
import com.slb.referral_backend.modules.account.enums.ReferralSource;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@Builder
@Schema(description = "注册归因结果 / Signup attribution result")
public class SignupResultVo {
    private Long accountId;
    @Schema(description = "新账户自己的推荐码 / The new account's own referral code.")
    private String referralCode;
    @Schema(description = "推荐人ID，无归因时为空 / Referrer id, null when unattributed.", nullable = true)
    private Long referredBy;
    @Schema(description = "归因来源：EXPLICIT_CODE / TOKEN / MANUAL_CODE / NONE")
    private ReferralSource referralSource;
    private LocalDateTime referredAt;

    public static SignupResultVo from(Account account) {
        return SignupResultVo.builder()
                .accountId(account.getId())
                .referralCode(account.getReferralCode())
                .referredBy(account.getReferredBy())
                .referralSource(account.getReferralSource())
                .referredAt(account.getReferredAt())
                .build();
    }
}
