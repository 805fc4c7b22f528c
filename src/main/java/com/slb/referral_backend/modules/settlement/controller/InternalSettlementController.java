package com.slb.referral_backend.modules.settlement.controller;

import com.slb.referral_backend.common.api.ApiResponse;
import com.slb.referral_backend.modules.settlement.service.TransactionLifecycleService;
import com.slb.referral_backend.modules.settlement.vo.MaturationReport;
import com.slb.referral_backend.modules.settlement.vo.SettlementReport;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDateTime;

@RestController
@RequestMapping("/api/v1/internal/settlement")
@Tag(name = "内部/佣金结算", description = "供外部调度器调用的清算与结算接口（需要 SERVICE 或 ADMIN 角色）")
public class InternalSettlementController {

    private final TransactionLifecycleService lifecycleService;
    private final Clock clock;

    public InternalSettlementController(TransactionLifecycleService lifecycleService, Clock clock) {
        this.lifecycleService = lifecycleService;
        this.clock = clock;
    }

    @PostMapping("/mature")
    @Operation(summary = "清算：PENDING → AVAILABLE / Mature pending commissions", description = "可重复调用，建议每小时一次。")
    public ApiResponse<MaturationReport> mature() {
        return ApiResponse.ok(new MaturationReport(lifecycleService.maturePending(LocalDateTime.now(clock))));
    }

    @PostMapping("/run")
    @Operation(
            summary = "执行批量结算 / Run batch settlement",
            description = """
                    结算周期为当前 ISO 周（例如 2024-W23）。同一周期重复或并发调用，
                    每个受益人最多打款一次；打款失败的流水置为 FAILED 并产生告警。
                    """
    )
    public ApiResponse<SettlementReport> run() {
        return ApiResponse.ok(lifecycleService.runBatchSettlement(LocalDateTime.now(clock)));
    }

    @PostMapping("/bookings/{bookingId}/void")
    @Operation(summary = "订单取消：作废未清算佣金 / Void pending commissions of a cancelled booking")
    public ApiResponse<Integer> voidBooking(@PathVariable String bookingId,
                                            @Parameter(description = "作废原因", example = "refund")
                                            @RequestParam(required = false) String reason) {
        return ApiResponse.ok(lifecycleService.voidPendingForBooking(bookingId, reason, LocalDateTime.now(clock)));
    }
}
