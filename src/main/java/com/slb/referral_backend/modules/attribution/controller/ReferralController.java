package com.slb.referral_backend.modules.attribution.controller;

import com.slb.referral_backend.common.api.ApiResponse;
import com.slb.referral_backend.modules.attribution.dto.ReferralClickDto;
import com.slb.referral_backend.modules.attribution.service.ReferralLinkService;
import com.slb.referral_backend.modules.attribution.vo.ReferralClickVo;
import com.slb.referral_backend.modules.attribution.vo.ReferralCodeVo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/referral")
@Tag(name = "公开/推荐归因", description = "推广链接点击、推荐码校验 / Referral clicks and code lookup")
public class ReferralController {

    private final ReferralLinkService linkService;

    public ReferralController(ReferralLinkService linkService) {
        this.linkService = linkService;
    }

    @PostMapping("/clicks")
    @Operation(
            summary = "上报推广链接点击 / Record a referral click",
            description = """
                    记录一次推广链接点击并返回签名 token，客户端保存后在注册时回传。
                    命中速率风控时 tracked=false 且不返回 token，前端仍按 destination 跳转。

                    示例请求 (cURL):
                    curl -X POST "http://localhost:8080/api/v1/referral/clicks" \\
                      -H "Content-Type: application/json" \\
                      -d "{\\"code\\":\\"KRZ7BQ2\\",\\"destination\\":\\"/listings/42\\"}"
                    """
    )
    public ApiResponse<ReferralClickVo> recordClick(@Valid @RequestBody ReferralClickDto dto, HttpServletRequest request) {
        ReferralClickVo result = linkService.recordClick(dto, request.getRemoteAddr(), request.getHeader("User-Agent"));
        return ApiResponse.ok(result);
    }

    @GetMapping("/code/{code}")
    @Operation(summary = "校验推荐码 / Check a referral code")
    public ApiResponse<ReferralCodeVo> checkCode(
            @Parameter(description = "推荐码，大小写不敏感", example = "KRZ7BQ2") @PathVariable String code) {
        return ApiResponse.ok(linkService.checkCode(code));
    }
}
