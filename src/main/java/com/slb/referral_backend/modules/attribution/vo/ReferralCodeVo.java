package com.slb.referral_backend.modules.attribution.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "推荐码校验结果 / Referral code lookup")
public class ReferralCodeVo {
    @Schema(example = "KRZ7BQ2")
    private String code;
    @Schema(description = "推荐码是否有效 / Whether the code belongs to a live account.")
    private boolean valid;
    @Schema(description = "推荐人展示名 / Referrer display name.", nullable = true)
    private String referrerName;
}
