package com.slb.referral_backend.common.security;

import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.util.List;

/**
 * 运维/服务调用方身份，直接取自 bearer token 的 uid / username / role 声明。
 *
 * @param uid      操作人 ID（服务账号可能为空）
 * @param username 操作人名称
 * @param role     ADMIN 或 SERVICE
 */
public record OperatorPrincipal(Long uid, String username, String role) {

    public static final String ROLE_ADMIN = "ADMIN";
    public static final String ROLE_SERVICE = "SERVICE";

    public List<GrantedAuthority> authorities() {
        return List.of(new SimpleGrantedAuthority("ROLE_" + role));
    }

    /** 审计用的操作人标识：优先 uid，其次用户名。 */
    public String operatorRef() {
        return uid != null ? String.valueOf(uid) : username;
    }
}
