package com.slb.referral_backend.modules.attribution.vo;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "点击上报结果 / Click result")
public class ReferralClickVo {

    @Schema(description = "是否记录了本次点击 / Whether the click was tracked.")
    private boolean tracked;

    @Schema(description = "客户端需保存的推广 token，注册时回传 / Token to keep until signup.", nullable = true)
    private String referralToken;

    @Schema(description = "跳转地址（无论是否记录都应跳转）/ Redirect destination.")
    private String destination;

    @Schema(description = "未记录的原因 / Reason when not tracked.", nullable = true, example = "VELOCITY_EXCEEDED")
    private String reason;
}
