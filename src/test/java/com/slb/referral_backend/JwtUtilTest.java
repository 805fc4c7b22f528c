package com.slb.referral_backend;

import com.slb.referral_backend.common.security.OperatorPrincipal;
import com.slb.referral_backend.common.util.JwtUtil;
import com.slb.referral_backend.support.OperatorTokens;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 校验外部身份服务签发的运维 access token。
 */
class JwtUtilTest {

    private JwtUtil jwtUtil;

    @BeforeEach
    void setUp() {
        jwtUtil = newJwtUtil(OperatorTokens.SECRET);
    }

    @Test
    void parseClaims_roundTripsOperatorClaims() {
        String token = OperatorTokens.access(10001L, "ops-alice", OperatorPrincipal.ROLE_ADMIN);

        Claims claims = jwtUtil.parseClaims(token);
        OperatorPrincipal principal = jwtUtil.toPrincipal(claims);

        assertEquals(JwtUtil.TOKEN_TYPE_ACCESS, claims.get(JwtUtil.CLAIM_TYP, String.class));
        assertEquals(10001L, principal.uid());
        assertEquals("ops-alice", principal.username());
        assertEquals("ADMIN", principal.role());
        assertEquals("10001", principal.operatorRef());
        assertEquals("ROLE_ADMIN", principal.authorities().get(0).getAuthority());
    }

    @Test
    void serviceTokenWithoutUid_usesUsernameAsOperatorRef() {
        String token = OperatorTokens.access(null, "booking-service", OperatorPrincipal.ROLE_SERVICE);

        OperatorPrincipal principal = jwtUtil.toPrincipal(jwtUtil.parseClaims(token));

        assertNull(principal.uid());
        assertEquals("booking-service", principal.operatorRef());
    }

    @Test
    void parseClaims_tokenFromAnotherSecret_isRejected() {
        String foreign = OperatorTokens.access("another-operator-secret-with-32-bytes!!", 1L, "mallory",
                OperatorPrincipal.ROLE_ADMIN, Duration.ofHours(1));

        assertThrows(JwtException.class, () -> jwtUtil.parseClaims(foreign));
    }

    private static JwtUtil newJwtUtil(String secret) {
        JwtUtil util = new JwtUtil();
        ReflectionTestUtils.setField(util, "secret", secret);
        util.init();
        return util;
    }
}
