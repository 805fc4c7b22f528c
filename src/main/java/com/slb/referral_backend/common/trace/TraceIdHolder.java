package com.slb.referral_backend.common.trace;

import cn.hutool.core.util.IdUtil;

import java.util.Optional;

/**
 * 每个请求的 traceId 线程本地存储。
 */
public final class TraceIdHolder {
    public static final String TRACE_ID_HEADER = "X-Trace-Id";

    private static final ThreadLocal<String> TRACE_ID = new ThreadLocal<>();

    private TraceIdHolder() {
    }

    public static void set(String traceId) {
        TRACE_ID.set(traceId);
    }

    public static Optional<String> getOptional() {
        return Optional.ofNullable(TRACE_ID.get());
    }

    /** 没有请求上下文时（定时任务、单测）现场生成一个。 */
    public static String require() {
        return getOptional().orElseGet(() -> {
            String generated = newTraceId();
            set(generated);
            return generated;
        });
    }

    public static String newTraceId() {
        return IdUtil.fastSimpleUUID();
    }

    public static void clear() {
        TRACE_ID.remove();
    }
}
