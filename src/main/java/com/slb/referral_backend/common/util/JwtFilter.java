package com.slb.referral_backend.common.util;

import com.slb.referral_backend.common.security.AuthErrorType;
import com.slb.referral_backend.common.security.AuthProblemSupport;
import com.slb.referral_backend.common.security.OperatorPrincipal;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

@Slf4j
@Component
public class JwtFilter extends OncePerRequestFilter {

    private static final String BEARER = "Bearer ";

    private final JwtUtil jwtUtil;

    public JwtFilter(JwtUtil jwtUtil) {
        this.jwtUtil = jwtUtil;
    }

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        if (SecurityContextHolder.getContext().getAuthentication() == null) {
            processAuthentication(request);
        }
        filterChain.doFilter(request, response);
    }

    private void processAuthentication(HttpServletRequest request) {
        String authHeader = request.getHeader("Authorization");
        if (!StringUtils.hasText(authHeader)) {
            // 公开接口无需 token；受保护接口交给 EntryPoint 处理
            return;
        }
        if (!authHeader.startsWith(BEARER)) {
            AuthProblemSupport.flag(request, AuthErrorType.BAD_AUTHORIZATION_HEADER);
            return;
        }
        String token = authHeader.substring(BEARER.length()).trim();
        if (!StringUtils.hasText(token)) {
            AuthProblemSupport.flag(request, AuthErrorType.MISSING_AUTHORIZATION);
            return;
        }

        try {
            Claims claims = jwtUtil.parseClaims(token);
            String tokenType = claims.get(JwtUtil.CLAIM_TYP, String.class);
            if (!JwtUtil.TOKEN_TYPE_ACCESS.equalsIgnoreCase(tokenType)) {
                AuthProblemSupport.flag(request, AuthErrorType.WRONG_TOKEN_TYPE);
                return;
            }
            OperatorPrincipal principal = jwtUtil.toPrincipal(claims);
            if (!StringUtils.hasText(principal.role())) {
                AuthProblemSupport.flag(request, AuthErrorType.INVALID_TOKEN);
                return;
            }
            UsernamePasswordAuthenticationToken authToken = new UsernamePasswordAuthenticationToken(
                    principal, null, principal.authorities());
            authToken.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
            SecurityContextHolder.getContext().setAuthentication(authToken);
        } catch (ExpiredJwtException e) {
            AuthProblemSupport.flag(request, AuthErrorType.TOKEN_EXPIRED);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected operator token: {}", e.getMessage());
            AuthProblemSupport.flag(request, AuthErrorType.INVALID_TOKEN);
        }
    }
}
