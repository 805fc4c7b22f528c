package com.slb.referral_backend.modules.attribution.controller;

import com.slb.referral_backend.common.api.ApiResponse;
import com.slb.referral_backend.modules.account.entity.Account;
import com.slb.referral_backend.modules.attribution.dto.AttributionSignals;
import com.slb.referral_backend.modules.attribution.dto.SignupDraft;
import com.slb.referral_backend.modules.attribution.dto.SignupRequestDto;
import com.slb.referral_backend.modules.attribution.service.AttributionResolver;
import com.slb.referral_backend.modules.attribution.vo.SignupResultVo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 注册服务在创建账户时回调；账户ID、邮箱、打款账户均由调用方提供，因此只对 SERVICE/ADMIN 开放。
 */
@RestController
@RequestMapping("/api/v1/internal/referral")
@Tag(name = "内部/注册归因", description = "注册服务创建账户并写入永久归因（需要 SERVICE 或 ADMIN 角色）")
public class InternalSignupController {

    private final AttributionResolver attributionResolver;

    public InternalSignupController(AttributionResolver attributionResolver) {
        this.attributionResolver = attributionResolver;
    }

    @PostMapping("/signups")
    @Operation(
            summary = "注册并写入归因 / Create the account with its permanent attribution",
            description = """
                    归因优先级：explicitCode > referralToken > manualCode，取第一个通过校验的候选人。
                    信号无效只会导致无归因（referralSource=NONE），不会让注册失败；
                    accountId 已存在时返回 409。clientIp / userAgent 填终端用户的值，用于风控。
                    """
    )
    public ApiResponse<SignupResultVo> signup(@Valid @RequestBody SignupRequestDto dto, HttpServletRequest request) {
        SignupDraft draft = new SignupDraft(dto.getAccountId(), dto.getEmail(), dto.getDisplayName(), dto.getPayoutAccountRef());
        AttributionSignals signals = new AttributionSignals(
                dto.getExplicitCode(),
                dto.getReferralToken(),
                dto.getManualCode(),
                StringUtils.hasText(dto.getClientIp()) ? dto.getClientIp() : request.getRemoteAddr(),
                StringUtils.hasText(dto.getUserAgent()) ? dto.getUserAgent() : request.getHeader("User-Agent"));
        Account account = attributionResolver.resolveAndBind(draft, signals);
        return ApiResponse.ok(SignupResultVo.from(account));
    }
}
