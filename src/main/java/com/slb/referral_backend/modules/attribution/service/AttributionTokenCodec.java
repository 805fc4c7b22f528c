package com.slb.referral_backend.modules.attribution.service;

import com.slb.referral_backend.modules.attribution.config.AttributionProperties;
import com.slb.referral_backend.modules.attribution.dto.ReferralTokenClaims;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;

/**
 * 推广 token 编解码：HS256 签名的 JWS，claims = ref / dst / typ=referral / iat / exp。
 * <p>
 * 点击和注册之间可能换设备或丢 cookie，token 由客户端保存，注册时回传；
 * 服务端只信任验签通过且未过期的内容。
 */
@Slf4j
@Component
public class AttributionTokenCodec {

    public static final String CLAIM_REFERRER = "ref";
    public static final String CLAIM_DESTINATION = "dst";
    public static final String CLAIM_TYP = "typ";
    public static final String TOKEN_TYPE_REFERRAL = "referral";

    private final AttributionProperties properties;
    private final Clock clock;
    private final Key key;

    public AttributionTokenCodec(AttributionProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        if (!StringUtils.hasText(properties.getTokenSecret())) {
            throw new IllegalStateException("app.attribution.token-secret is not configured");
        }
        this.key = Keys.hmacShaKeyFor(properties.getTokenSecret().getBytes(StandardCharsets.UTF_8));
    }

    public String issue(Long referrerId, String destination) {
        if (referrerId == null) {
            throw new IllegalArgumentException("referrerId is required");
        }
        Instant now = clock.instant();
        Instant expiresAt = now.plus(properties.getTokenTtl());
        var builder = Jwts.builder()
                .claim(CLAIM_TYP, TOKEN_TYPE_REFERRAL)
                .claim(CLAIM_REFERRER, referrerId)
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(expiresAt));
        if (StringUtils.hasText(destination)) {
            builder.claim(CLAIM_DESTINATION, destination);
        }
        return builder.signWith(key, SignatureAlgorithm.HS256).compact();
    }

    /**
     * 校验 token；格式错误、签名不符、类型不符、已过期或缺少推荐人时返回 empty，不抛异常。
     */
    public Optional<ReferralTokenClaims> verify(String token) {
        if (!StringUtils.hasText(token)) {
            return Optional.empty();
        }
        try {
            Claims claims = Jwts.parserBuilder()
                    .setSigningKey(key)
                    .setClock(() -> Date.from(clock.instant()))
                    .build()
                    .parseClaimsJws(token.trim())
                    .getBody();

            if (!TOKEN_TYPE_REFERRAL.equals(claims.get(CLAIM_TYP, String.class))) {
                log.debug("Referral token rejected: wrong typ");
                return Optional.empty();
            }
            Number referrer = claims.get(CLAIM_REFERRER, Number.class);
            if (referrer == null) {
                log.debug("Referral token rejected: missing referrer");
                return Optional.empty();
            }
            return Optional.of(new ReferralTokenClaims(
                    referrer.longValue(),
                    claims.get(CLAIM_DESTINATION, String.class),
                    toInstant(claims.getIssuedAt()),
                    toInstant(claims.getExpiration())
            ));
        } catch (ExpiredJwtException e) {
            log.debug("Referral token expired at {}", e.getClaims().getExpiration());
            return Optional.empty();
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Referral token rejected: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static Instant toInstant(Date date) {
        return date != null ? date.toInstant() : null;
    }
}
