package com.slb.referral_backend.modules.attribution.controller;

import com.slb.referral_backend.common.api.ApiResponse;
import com.slb.referral_backend.modules.attribution.entity.AttributionAudit;
import com.slb.referral_backend.modules.attribution.service.AttributionResolver;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/admin/attribution-audit")
@Tag(name = "管理端/归因审计", description = "查看注册时每个候选推荐人的评估结果（含风控拦截）")
public class AdminAttributionController {

    private final AttributionResolver attributionResolver;

    public AdminAttributionController(AttributionResolver attributionResolver) {
        this.attributionResolver = attributionResolver;
    }

    @GetMapping("/{accountId}")
    @Operation(summary = "某账户注册时的归因审计 / Attribution audit of an account")
    public ApiResponse<List<AttributionAudit>> audit(@PathVariable Long accountId) {
        return ApiResponse.ok(attributionResolver.auditTrail(accountId));
    }
}
