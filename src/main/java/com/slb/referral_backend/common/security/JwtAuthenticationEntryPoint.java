package com.slb.referral_backend.common.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;

@Component
public class JwtAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ObjectMapper objectMapper;

    public JwtAuthenticationEntryPoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException) throws IOException {
        AuthErrorType type = AuthProblemSupport.get(request);
        if (type == null) {
            type = StringUtils.hasText(request.getHeader("Authorization"))
                    ? AuthErrorType.INVALID_TOKEN
                    : AuthErrorType.MISSING_AUTHORIZATION;
        }
        AuthProblemSupport.writeApiResponse(response, type, objectMapper);
    }
}
