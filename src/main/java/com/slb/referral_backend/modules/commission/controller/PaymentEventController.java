package com.slb.referral_backend.modules.commission.controller;

import com.slb.referral_backend.common.api.ApiResponse;
import com.slb.referral_backend.modules.commission.dto.PaymentCompletedEvent;
import com.slb.referral_backend.modules.commission.service.CommissionEngine;
import com.slb.referral_backend.modules.commission.vo.CommissionTransactionVo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/internal/payments")
@Tag(name = "内部/付款事件", description = "支付服务回调：按推荐链生成多级佣金（需要 SERVICE 或 ADMIN 角色）")
public class PaymentEventController {

    private final CommissionEngine commissionEngine;

    public PaymentEventController(CommissionEngine commissionEngine) {
        this.commissionEngine = commissionEngine;
    }

    @PostMapping("/completed")
    @Operation(
            summary = "付款完成，生成佣金 / Payment completed, compute the commission chain",
            description = """
                    可重复投递：同一 bookingId 重复回调返回已有流水，不会重复生成。
                    收款方不存在返回 404；basePayable <= 0 返回 400。
                    """
    )
    public ApiResponse<List<CommissionTransactionVo>> paymentCompleted(@Valid @RequestBody PaymentCompletedEvent event) {
        List<CommissionTransactionVo> result = commissionEngine.computeChain(event).stream()
                .map(CommissionTransactionVo::from)
                .toList();
        return ApiResponse.ok(result);
    }

    @GetMapping("/{bookingId}/commissions")
    @Operation(summary = "查询订单产生的佣金 / List commissions of a booking")
    public ApiResponse<List<CommissionTransactionVo>> listByBooking(@PathVariable String bookingId) {
        return ApiResponse.ok(commissionEngine.listByBooking(bookingId).stream()
                .map(CommissionTransactionVo::from)
                .toList());
    }
}
