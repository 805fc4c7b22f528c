package com.slb.referral_backend.modules.attribution.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
@Schema(description = "注册归因请求体，由注册服务在创建账户时调用 / Signup attribution request")
public class SignupRequestDto {

    @NotNull(message = "accountId 不能为空")
    @Schema(description = "外部身份服务分配的账户ID / Account id from the identity provider.", example = "10086")
    private Long accountId;

    @NotBlank(message = "邮箱不能为空")
    @Email(message = "邮箱格式不正确")
    @Schema(description = "联系邮箱，用于自推荐校验 / Contact email.", example = "b@example.com")
    private String email;

    @Size(max = 64)
    @Schema(description = "展示名（可选）/ Display name.")
    private String displayName;

    @Size(max = 128)
    @Schema(description = "外部打款账户引用（可选）/ External payout destination reference.")
    private String payoutAccountRef;

    @Size(max = 32)
    @Schema(description = "注册链接 URL 中的邀请码（优先级最高）/ Code carried in the signup URL.")
    private String explicitCode;

    @Size(max = 2048)
    @Schema(description = "点击推广链接时下发的 token / Token issued at click time.")
    private String referralToken;

    @Size(max = 32)
    @Schema(description = "用户手填的邀请码（优先级最低）/ Code typed by the user.")
    private String manualCode;

    @Size(max = 64)
    @Schema(description = "终端用户 IP，缺省取调用方地址 / End-user IP as seen by the signup surface.", example = "203.0.113.7")
    private String clientIp;

    @Size(max = 512)
    @Schema(description = "终端用户 User-Agent，缺省取调用方请求头 / End-user User-Agent.")
    private String userAgent;
}
