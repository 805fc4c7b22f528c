package com.slb.referral_backend.common.util;

import com.slb.referral_backend.common.security.OperatorPrincipal;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;

/**
 * 运维 bearer token 工具：token 由外部鉴权服务签发，本服务只解析。
 */
@Component
public class JwtUtil {

    public static final String CLAIM_TYP = "typ";
    public static final String CLAIM_USERNAME = "username";
    public static final String CLAIM_UID = "uid";
    public static final String CLAIM_ROLE = "role";
    public static final String TOKEN_TYPE_ACCESS = "access";

    @Value("${security.jwt.secret}")
    private String secret;

    private Key key;

    @PostConstruct
    public void init() {
        // secret 至少 32 bytes，HS256 可用
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    /** 解析并校验签名/过期；失败抛出 jjwt 的 JwtException 子类。 */
    public Claims parseClaims(String token) {
        return Jwts.parserBuilder()
                .setSigningKey(key)
                .build()
                .parseClaimsJws(token)
                .getBody();
    }

    public OperatorPrincipal toPrincipal(Claims claims) {
        Number uid = claims.get(CLAIM_UID, Number.class);
        String username = claims.get(CLAIM_USERNAME, String.class);
        if (username == null) {
            username = claims.getSubject();
        }
        String role = claims.get(CLAIM_ROLE, String.class);
        return new OperatorPrincipal(uid != null ? uid.longValue() : null, username, role);
    }
}
