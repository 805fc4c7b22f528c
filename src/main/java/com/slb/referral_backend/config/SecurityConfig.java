package com.slb.referral_backend.config;

import com.slb.referral_backend.common.security.JwtAccessDeniedHandler;
import com.slb.referral_backend.common.security.JwtAuthenticationEntryPoint;
import com.slb.referral_backend.common.security.OperatorPrincipal;
import com.slb.referral_backend.common.trace.TraceIdFilter;
import com.slb.referral_backend.common.util.JwtFilter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.security.web.context.SecurityContextHolderFilter;

import static org.springframework.security.config.http.SessionCreationPolicy.STATELESS;

@Configuration
@EnableWebSecurity
@EnableMethodSecurity
public class SecurityConfig {

    private final TraceIdFilter traceIdFilter;
    private final JwtFilter jwtFilter;
    private final JwtAuthenticationEntryPoint unauthorizedHandler;
    private final JwtAccessDeniedHandler accessDeniedHandler;

    public SecurityConfig(TraceIdFilter traceIdFilter,
                          JwtFilter jwtFilter,
                          JwtAuthenticationEntryPoint unauthorizedHandler,
                          JwtAccessDeniedHandler accessDeniedHandler) {
        this.traceIdFilter = traceIdFilter;
        this.jwtFilter = jwtFilter;
        this.unauthorizedHandler = unauthorizedHandler;
        this.accessDeniedHandler = accessDeniedHandler;
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
                .csrf(csrf -> csrf.disable())
                .exceptionHandling(exceptions -> exceptions
                        .authenticationEntryPoint(unauthorizedHandler)
                        .accessDeniedHandler(accessDeniedHandler)
                )
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                        // 推广链接点击、邀请码校验由前端匿名调用；注册归因在 /api/v1/internal/** 下
                        .requestMatchers(HttpMethod.POST, "/api/v1/referral/clicks").permitAll()
                        .requestMatchers(HttpMethod.GET, "/api/v1/referral/code/**").permitAll()
                        .requestMatchers(
                                "/v3/api-docs/**",
                                "/swagger-ui.html",
                                "/swagger-ui/**"
                        ).permitAll()
                        .requestMatchers("/api/v1/admin/**").hasRole(OperatorPrincipal.ROLE_ADMIN)
                        .requestMatchers("/api/v1/internal/**")
                        .hasAnyRole(OperatorPrincipal.ROLE_ADMIN, OperatorPrincipal.ROLE_SERVICE)
                        .anyRequest().authenticated()
                )
                .sessionManagement(session -> session.sessionCreationPolicy(STATELESS))
                .addFilterBefore(traceIdFilter, SecurityContextHolderFilter.class)
                .addFilterBefore(jwtFilter, UsernamePasswordAuthenticationFilter.class);

        return http.build();
    }
}
