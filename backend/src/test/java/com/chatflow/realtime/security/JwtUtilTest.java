package com.chatflow.realtime.security;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Date;

import static org.assertj.core.api.Assertions.assertThat;

class JwtUtilTest {

    private static final String SECRET = "t2v9wdWsjVz+inE5usePw+O0IFDdDkwXx6MgQ/zYN2WMK57ApAgJiYfMQxW5enZS";

    private JwtUtil jwtUtil;

    @BeforeEach
    void setUp() {
        jwtUtil = new JwtUtil();
        ReflectionTestUtils.setField(jwtUtil, "secretKey", SECRET);
        ReflectionTestUtils.setField(jwtUtil, "accessTokenExpiration", 60_000L);
    }

    @Test
    void issuedAccessTokenResolvesToPrincipal() {
        String token = jwtUtil.generateAccessToken("u-1", "Alice");

        assertThat(jwtUtil.parseAccessToken(token))
                .contains(new ChatPrincipal("u-1", "Alice"));
    }

    @Test
    void tamperedOrMissingTokensAreRejected() {
        String token = jwtUtil.generateAccessToken("u-1", "Alice");

        String[] parts = token.split("\\.");
        String forgedSignature = parts[0] + "." + parts[1] + "." + flipFirstChar(parts[2]);
        String forgedClaims = parts[0] + "." + flipFirstChar(parts[1]) + "." + parts[2];

        assertThat(jwtUtil.parseAccessToken(forgedSignature)).isEmpty();
        assertThat(jwtUtil.parseAccessToken(forgedClaims)).isEmpty();
        assertThat(jwtUtil.parseAccessToken("not-a-jwt")).isEmpty();
        assertThat(jwtUtil.parseAccessToken(null)).isEmpty();
        assertThat(jwtUtil.parseAccessToken(" ")).isEmpty();
    }

    private static String flipFirstChar(String segment) {
        char replacement = segment.charAt(0) == 'A' ? 'B' : 'A';
        return replacement + segment.substring(1);
    }

    @Test
    void expiredTokenIsRejected() {
        ReflectionTestUtils.setField(jwtUtil, "accessTokenExpiration", -1_000L);

        assertThat(jwtUtil.parseAccessToken(jwtUtil.generateAccessToken("u-1", "Alice"))).isEmpty();
    }

    @Test
    void refreshTokensAreNotAccessTokens() {
        String refresh = Jwts.builder()
                .claim("tokenType", "refresh")
                .subject("u-1")
                .issuedAt(new Date())
                .expiration(new Date(System.currentTimeMillis() + 60_000))
                .signWith(Keys.hmacShaKeyFor(Decoders.BASE64.decode(SECRET)))
                .compact();

        assertThat(jwtUtil.parseAccessToken(refresh)).isEmpty();
    }
}
