package com.slb.referral_backend.common.security;

import org.springframework.http.HttpStatus;

/**
 * 鉴权/授权失败类型。
 */
public enum AuthErrorType {
    MISSING_AUTHORIZATION(HttpStatus.UNAUTHORIZED, "AUTH_MISSING_AUTHZ", "Authorization header is required"),
    BAD_AUTHORIZATION_HEADER(HttpStatus.BAD_REQUEST, "AUTH_BAD_HEADER", "Expected 'Authorization: Bearer <token>'"),
    INVALID_TOKEN(HttpStatus.UNAUTHORIZED, "AUTH_INVALID_TOKEN", "Invalid access token"),
    TOKEN_EXPIRED(HttpStatus.UNAUTHORIZED, "AUTH_TOKEN_EXPIRED", "Expired access token"),
    WRONG_TOKEN_TYPE(HttpStatus.UNAUTHORIZED, "AUTH_WRONG_TOKEN_TYPE", "Wrong token type for this resource"),
    INSUFFICIENT_SCOPE(HttpStatus.FORBIDDEN, "AUTH_INSUFFICIENT_SCOPE", "Insufficient scope");

    private final HttpStatus status;
    private final String code;
    private final String defaultDetail;

    AuthErrorType(HttpStatus status, String code, String defaultDetail) {
        this.status = status;
        this.code = code;
        this.defaultDetail = defaultDetail;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultDetail() {
        return defaultDetail;
    }
}
