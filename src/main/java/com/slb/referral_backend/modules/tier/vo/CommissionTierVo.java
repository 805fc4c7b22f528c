package com.slb.referral_backend.modules.tier.vo;

import com.slb.referral_backend.modules.tier.entity.CommissionTierConfig;
import com.slb.referral_backend.modules.tier.enums.TierApprovalStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@Schema(description = "佣金层级配置 / Commission tier status")
public class CommissionTierVo {
    @Schema(example = "1")
    private Integer tier;
    @Schema(description = "费率百分比 / Rate in percent.", example = "10.0000")
    private BigDecimal ratePercent;
    private Boolean active;
    @Schema(description = "APPROVED / PENDING_REVIEW / REQUIRES_CLEARANCE / PROHIBITED")
    private TierApprovalStatus approvalStatus;
    @Schema(description = "是否参与佣金计算（启用且已审批且前面没有断档）/ Whether the tier pays out.")
    private boolean effective;
    private LocalDateTime activatedAt;
    private String activatedBy;
    private LocalDateTime deactivatedAt;
    private String deactivatedBy;
    private String notes;

    public static CommissionTierVo from(CommissionTierConfig config, boolean effective) {
        return CommissionTierVo.builder()
                .tier(config.getTier())
                .ratePercent(config.getRatePercent())
                .active(config.getActive())
                .approvalStatus(config.getApprovalStatus())
                .effective(effective)
                .activatedAt(config.getActivatedAt())
                .activatedBy(config.getActivatedBy())
                .deactivatedAt(config.getDeactivatedAt())
                .deactivatedBy(config.getDeactivatedBy())
                .notes(config.getNotes())
                .build();
    }
}
