package com.slb.referral_backend.support;

import com.slb.referral_backend.common.util.JwtUtil;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;

/**
 * 测试用：按身份服务的格式签发运维 access token（生产环境由外部身份服务签发）。
 */
public final class OperatorTokens {

    public static final String SECRET = "test-operator-jwt-secret-0123456789abcdef";

    private OperatorTokens() {
    }

    public static String access(Long uid, String username, String role) {
        return access(SECRET, uid, username, role, Duration.ofHours(1));
    }

    public static String access(String secret, Long uid, String username, String role, Duration ttl) {
        Map<String, Object> claims = new HashMap<>();
        claims.put(JwtUtil.CLAIM_TYP, JwtUtil.TOKEN_TYPE_ACCESS);
        claims.put(JwtUtil.CLAIM_USERNAME, username);
        claims.put(JwtUtil.CLAIM_ROLE, role);
        if (uid != null) claims.put(JwtUtil.CLAIM_UID, uid);
        long now = System.currentTimeMillis();
        return Jwts.builder()
                .setClaims(claims)
                .setSubject(username)
                .setIssuedAt(new Date(now))
                .setExpiration(new Date(now + ttl.toMillis()))
                .signWith(Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8)), SignatureAlgorithm.HS256)
                .compact();
    }
}
