package com.slb.referral_backend.modules.settlement.controller;

import com.slb.referral_backend.common.api.ApiResponse;
import com.slb.referral_backend.common.exception.BizException;
import com.slb.referral_backend.common.security.OperatorPrincipal;
import com.slb.referral_backend.modules.settlement.dto.PayoutPreferenceDto;
import com.slb.referral_backend.modules.settlement.entity.PayoutPreference;
import com.slb.referral_backend.modules.settlement.entity.SettlementAlert;
import com.slb.referral_backend.modules.settlement.service.PayoutPreferenceService;
import com.slb.referral_backend.modules.settlement.service.SettlementAlertService;
import com.slb.referral_backend.modules.settlement.service.TransactionLifecycleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/admin")
@Tag(name = "管理端/佣金结算", description = "失败流水重置、打款偏好、结算告警（需要 ADMIN 角色）")
public class AdminSettlementController {

    private final TransactionLifecycleService lifecycleService;
    private final PayoutPreferenceService preferenceService;
    private final SettlementAlertService alertService;

    public AdminSettlementController(TransactionLifecycleService lifecycleService,
                                     PayoutPreferenceService preferenceService,
                                     SettlementAlertService alertService) {
        this.lifecycleService = lifecycleService;
        this.preferenceService = preferenceService;
        this.alertService = alertService;
    }

    @PostMapping("/commissions/{id}/reset")
    @Operation(summary = "重置失败流水 / Reset a FAILED commission to AVAILABLE", description = "流水不是 FAILED 时返回 409。")
    public ApiResponse<Void> reset(@PathVariable Long id, @AuthenticationPrincipal OperatorPrincipal operator) {
        if (!lifecycleService.resetFailed(id, operator.operatorRef())) {
            throw BizException.conflict("佣金流水不是 FAILED 状态: " + id);
        }
        return ApiResponse.ok();
    }

    @GetMapping("/payout-preferences/{accountId}")
    @Operation(summary = "查看打款偏好 / Get payout preference")
    public ApiResponse<PayoutPreference> getPreference(@PathVariable Long accountId) {
        return ApiResponse.ok(preferenceService.get(accountId));
    }

    @PutMapping("/payout-preferences/{accountId}")
    @Operation(summary = "设置打款偏好 / Save payout preference")
    public ApiResponse<PayoutPreference> savePreference(@PathVariable Long accountId,
                                                        @Valid @RequestBody PayoutPreferenceDto dto) {
        return ApiResponse.ok(preferenceService.save(accountId, dto));
    }

    @GetMapping("/settlement-alerts")
    @Operation(summary = "未处理的结算告警 / Open settlement alerts")
    public ApiResponse<List<SettlementAlert>> openAlerts(@RequestParam(defaultValue = "100") int limit) {
        return ApiResponse.ok(alertService.listOpen(limit));
    }
}
