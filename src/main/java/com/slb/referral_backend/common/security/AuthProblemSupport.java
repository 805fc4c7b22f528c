package com.slb.referral_backend.common.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.slb.referral_backend.common.api.ApiResponse;
import com.slb.referral_backend.common.trace.TraceIdHolder;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.lang.Nullable;

import java.io.IOException;
import java.util.Map;

/**
 * JwtFilter 在请求上记录失败原因，EntryPoint / AccessDeniedHandler 再以 ApiResponse 输出。
 */
public final class AuthProblemSupport {

    public static final String AUTH_ERROR_TYPE_ATTR = AuthProblemSupport.class.getName() + ".TYPE";

    private AuthProblemSupport() {
    }

    public static void flag(HttpServletRequest request, AuthErrorType type) {
        if (request.getAttribute(AUTH_ERROR_TYPE_ATTR) == null) {
            request.setAttribute(AUTH_ERROR_TYPE_ATTR, type);
        }
    }

    @Nullable
    public static AuthErrorType get(HttpServletRequest request) {
        Object type = request.getAttribute(AUTH_ERROR_TYPE_ATTR);
        if (type instanceof AuthErrorType authErrorType) {
            return authErrorType;
        }
        return null;
    }

    public static void writeApiResponse(HttpServletResponse response, AuthErrorType type, ObjectMapper mapper) throws IOException {
        if (response.isCommitted()) {
            return;
        }
        int status = type.getStatus().value();
        response.setStatus(status);
        response.setContentType("application/json;charset=UTF-8");
        response.setHeader(TraceIdHolder.TRACE_ID_HEADER, TraceIdHolder.require());
        if (status == 401) {
            response.setHeader("WWW-Authenticate", "Bearer error=\"invalid_token\", error_description=\"" + type.getDefaultDetail() + "\"");
        }
        ApiResponse<Void> body = ApiResponse.error(status, type.getCode(), Map.of("detail", type.getDefaultDetail()));
        mapper.writeValue(response.getOutputStream(), body);
    }
}
