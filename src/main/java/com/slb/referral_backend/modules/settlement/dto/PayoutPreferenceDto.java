package com.slb.referral_backend.modules.settlement.dto;

import com.slb.referral_backend.modules.settlement.enums.PayoutCadence;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMin;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Schema(description = "受益人打款偏好 / Beneficiary payout preference")
public class PayoutPreferenceDto {

    @Schema(description = "打款节奏：WEEKLY / MONTHLY，默认 WEEKLY", example = "WEEKLY")
    private PayoutCadence cadence;

    @DecimalMin(value = "0.00", message = "最低金额不能为负")
    @Schema(description = "个人最低打款金额（低于全局最低值时按全局值）/ Personal minimum, never below the global one.", example = "50.00")
    private BigDecimal minimumAmount;

    @Schema(description = "是否暂停打款 / Opt out of payouts.", example = "false")
    private Boolean optedOut;
}
