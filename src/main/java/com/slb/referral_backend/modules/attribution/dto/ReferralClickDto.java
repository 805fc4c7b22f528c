package com.slb.referral_backend.modules.attribution.dto;

import com.slb.referral_backend.modules.pipeline.enums.AttemptChannel;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
@Schema(description = "推广链接点击上报 / Referral link click")
public class ReferralClickDto {

    @NotBlank(message = "推荐码不能为空")
    @Size(max = 32, message = "推荐码过长")
    @Schema(description = "推荐码（大小写不敏感）/ Referral code, case-insensitive.", example = "KRZ7BQ2")
    private String code;

    @Size(max = 512, message = "落地页地址过长")
    @Schema(description = "点击后的落地页（可选）/ Landing destination (optional).", example = "/listings/42")
    private String destination;

    @Schema(description = "点击渠道：LINK / QR / MANUAL，默认 LINK。/ Click channel.", example = "LINK")
    private AttemptChannel channel;
}
