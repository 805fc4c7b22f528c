package com.slb.referral_backend.modules.commission.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "付款完成事件（支付服务回调，可重复投递）/ Payment completed notification, may be redelivered")
public class PaymentCompletedEvent {

    @NotBlank(message = "bookingId 不能为空")
    @Size(max = 64)
    @Schema(description = "订单/付款ID，与层级一起构成佣金幂等键 / Booking id, idempotency key together with tier.", example = "BK-20240601-0001")
    private String bookingId;

    @NotNull(message = "payeeAccountId 不能为空")
    @Schema(description = "本次付款的收款方账户（佣金沿其推荐链计算）/ Payee whose referral chain earns commission.", example = "10086")
    private Long payeeAccountId;

    @NotNull(message = "basePayable 不能为空")
    @Schema(description = "收款方应得金额，佣金按其比例计算 / Payee's share, the commission base.", example = "100.00")
    private BigDecimal basePayable;

    @Schema(description = "商品ID（可选，用于一级佣金委托）/ Listing id, used for tier-1 delegation.", example = "42")
    private Long listingId;

    @Schema(description = "付款完成时间（可选）/ When the payment completed.")
    private LocalDateTime occurredAt;
}
