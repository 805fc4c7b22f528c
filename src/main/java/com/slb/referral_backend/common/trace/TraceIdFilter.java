package com.slb.referral_backend.common.trace;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * 为每个请求/响应带上 {@code X-Trace-Id}，并放进 MDC 供日志输出。
 */
@Component
public class TraceIdFilter extends OncePerRequestFilter {

    public static final String MDC_KEY = "traceId";

    private static final int MAX_SUPPLIED_LENGTH = 64;

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        String supplied = request.getHeader(TraceIdHolder.TRACE_ID_HEADER);
        String traceId = StringUtils.hasText(supplied) && supplied.trim().length() <= MAX_SUPPLIED_LENGTH
                ? supplied.trim()
                : TraceIdHolder.newTraceId();

        TraceIdHolder.set(traceId);
        MDC.put(MDC_KEY, traceId);
        response.setHeader(TraceIdHolder.TRACE_ID_HEADER, traceId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_KEY);
            TraceIdHolder.clear();
        }
    }
}
