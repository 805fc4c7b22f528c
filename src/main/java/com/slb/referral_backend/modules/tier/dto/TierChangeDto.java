package com.slb.referral_backend.modules.tier.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
@Schema(description = "层级启用/停用请求体 / Tier change request")
public class TierChangeDto {

    @Size(max = 500, message = "备注过长")
    @Schema(description = "备注，会追加到层级配置和审计记录（例如法务批复编号）/ Notes appended to the config and audit trail.",
            example = "Legal clearance LC-2024-031")
    private String notes;
}
