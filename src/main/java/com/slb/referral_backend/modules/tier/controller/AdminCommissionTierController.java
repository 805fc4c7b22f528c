package com.slb.referral_backend.modules.tier.controller;

import com.slb.referral_backend.common.api.ApiResponse;
import com.slb.referral_backend.common.exception.BizException;
import com.slb.referral_backend.common.security.OperatorPrincipal;
import com.slb.referral_backend.modules.tier.dto.TierActivationResult;
import com.slb.referral_backend.modules.tier.dto.TierChangeDto;
import com.slb.referral_backend.modules.tier.entity.CommissionTierAudit;
import com.slb.referral_backend.modules.tier.service.CommissionTierService;
import com.slb.referral_backend.modules.tier.vo.CommissionTierVo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/admin/commission-tiers")
@Tag(name = "管理端/佣金层级", description = "多级佣金层级的查看、启用与停用（需要 ADMIN 角色）")
public class AdminCommissionTierController {

    private final CommissionTierService tierService;

    public AdminCommissionTierController(CommissionTierService tierService) {
        this.tierService = tierService;
    }

    @GetMapping
    @Operation(summary = "查看全部层级配置 / List all tiers")
    public ApiResponse<List<CommissionTierVo>> list() {
        return ApiResponse.ok(tierService.listAll());
    }

    @GetMapping("/audit")
    @Operation(summary = "层级变更审计（含被拒绝的启用）/ Tier change audit trail")
    public ApiResponse<List<CommissionTierAudit>> audit(@RequestParam(defaultValue = "50") int limit) {
        return ApiResponse.ok(tierService.recentAudit(limit));
    }

    @PostMapping("/{tier}/activate")
    @Operation(
            summary = "启用层级 / Activate a tier",
            description = """
                    以下情况返回 409 并附带原因，配置不变：
                    - UNKNOWN_TIER：层级不存在
                    - TIER_PROHIBITED：层级被禁止启用
                    - WOULD_CREATE_GAP：前一层级未生效，启用会产生断档
                    """
    )
    public ApiResponse<TierActivationResult> activate(@PathVariable int tier,
                                                      @Valid @RequestBody(required = false) TierChangeDto dto,
                                                      @AuthenticationPrincipal OperatorPrincipal operator) {
        TierActivationResult result = tierService.activate(tier, operator.operatorRef(), dto != null ? dto.getNotes() : null);
        if (!result.accepted()) {
            throw BizException.conflict(result.reason());
        }
        return ApiResponse.ok(result);
    }

    @PostMapping("/{tier}/deactivate")
    @Operation(summary = "停用层级 / Deactivate a tier", description = "总是允许；更高层级会因断档不再参与计算。")
    public ApiResponse<Void> deactivate(@PathVariable int tier,
                                        @Valid @RequestBody(required = false) TierChangeDto dto,
                                        @AuthenticationPrincipal OperatorPrincipal operator) {
        if (!tierService.deactivate(tier, operator.operatorRef(), dto != null ? dto.getNotes() : null)) {
            throw BizException.notFound("层级不存在: " + tier);
        }
        return ApiResponse.ok();
    }
}
