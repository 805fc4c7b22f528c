package com.slb.referral_backend.common.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.slb.referral_backend.common.trace.TraceIdHolder;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 统一响应封装结构 / Unified API response envelope.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "统一响应结构，所有接口（成功或异常）均返回该结构 / Unified response envelope used by all APIs.")
public class ApiResponse<T> {

    @Schema(description = "业务状态码，0 表示成功，非 0 与 HTTP 状态码含义一致。/ Business status code, 0 means success.", example = "0")
    private int code;

    @Schema(description = "提示信息；成功时为 'ok'，失败时为错误原因。/ 'ok' for success or error reason for failures.", example = "ok")
    private String message;

    @Schema(description = "业务数据载体 / Business payload.", nullable = true)
    private T data;

    @Schema(description = "请求链路追踪 ID / Trace identifier for request correlation.", example = "b3f7e6c9a1d24c31")
    private String traceId;

    @Schema(description = "字段级错误明细（可选）/ Field-level errors (optional).", nullable = true)
    private Map<String, String> errors;

    private ApiResponse(int code, String message, T data, String traceId) {
        this.code = code;
        this.message = message;
        this.data = data;
        this.traceId = traceId;
    }

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(0, "ok", data, TraceIdHolder.require());
    }

    public static ApiResponse<Void> ok() {
        return ok(null);
    }

    public static <T> ApiResponse<T> of(int code, String message, T data) {
        return new ApiResponse<>(code, message, data, TraceIdHolder.require());
    }

    public static ApiResponse<Void> error(int code, String message) {
        return of(code, message, null);
    }

    public static ApiResponse<Void> error(int code, String message, Map<String, String> errors) {
        ApiResponse<Void> resp = error(code, message);
        resp.setErrors(errors);
        return resp;
    }
}
