package com.slb.referral_backend.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SwaggerConfig {

    private static final String SECURITY_SCHEME_NAME = "BearerAuth";

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("推荐归因与多级佣金服务 API / Referral & Commission Backend API")
                        .version("1.0.0")
                        .description(
                                """
                                推荐链接点击、注册归因、多级佣金计算与结算接口。
                                Referral click tracking, signup attribution, multi-tier commission and settlement APIs.

                                - /api/v1/referral/clicks、/api/v1/referral/code/{code}：公开接口 / public endpoints
                                - /api/v1/internal/**：服务或管理员 token / service or admin bearer token
                                - /api/v1/admin/**：管理员 token / admin bearer token

                                所有接口统一返回 ApiResponse<T>：code=0 表示成功，非 0 与 HTTP 状态码一致。
                                All APIs return ApiResponse<T>: code 0 on success, otherwise the HTTP status code.
                                """
                        )
                )
                .components(new Components()
                        .addSecuritySchemes(SECURITY_SCHEME_NAME,
                                new SecurityScheme()
                                        .name(SECURITY_SCHEME_NAME)
                                        .type(SecurityScheme.Type.HTTP)
                                        .scheme("bearer")
                                        .bearerFormat("JWT")
                                        .description("格式：Bearer {token}")
                        )
                );
    }
}
