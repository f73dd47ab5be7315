package com.chatflow.realtime.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;

/**
 * JwtUtil validates the access tokens presented by chat clients.
 *
 * Token issuance belongs to the external authentication service; both sides share
 * the HMAC secret. {@link #generateAccessToken} exists so that tooling and tests can
 * mint tokens with the same claims layout:
 * - sub       → user id
 * - name      → display name shown next to messages and typing indicators
 * - tokenType → "access"
 */
@Slf4j
@Component
public class JwtUtil {

    @Value("${jwt.secret}")
    private String secretKey;

    @Value("${jwt.access-token.expiration:900000}")
    private long accessTokenExpiration; // 15 minutes default

    private static final String TOKEN_TYPE_CLAIM = "tokenType";
    private static final String NAME_CLAIM = "name";
    private static final String ACCESS_TOKEN = "access";

    // ─────────────────────────────────────────────────────────────────────────
    // Token Generation
    // ─────────────────────────────────────────────────────────────────────────

    public String generateAccessToken(String userId, String displayName) {
        return Jwts.builder()
                .claim(TOKEN_TYPE_CLAIM, ACCESS_TOKEN)
                .claim(NAME_CLAIM, displayName)
                .subject(userId)
                .id(UUID.randomUUID().toString())
                .issuedAt(new Date(System.currentTimeMillis()))
                .expiration(new Date(System.currentTimeMillis() + accessTokenExpiration))
                .signWith(getSigningKey())
                .compact();
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Token Validation
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Verifies signature, expiry and token type.
     *
     * @return the principal, or empty if the token is not a valid access token
     */
    public Optional<ChatPrincipal> parseAccessToken(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            Claims claims = extractAllClaims(token);
            if (!ACCESS_TOKEN.equals(claims.get(TOKEN_TYPE_CLAIM, String.class))) {
                log.warn("Rejected token of type '{}' for subject={}",
                        claims.get(TOKEN_TYPE_CLAIM, String.class), claims.getSubject());
                return Optional.empty();
            }
            String userId = claims.getSubject();
            if (userId == null || userId.isBlank()) {
                return Optional.empty();
            }
            String name = claims.get(NAME_CLAIM, String.class);
            return Optional.of(new ChatPrincipal(userId, name != null ? name : userId));
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("JWT validation failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public long getAccessTokenExpiration() {
        return accessTokenExpiration;
    }

    private Claims extractAllClaims(String token) {
        return Jwts.parser()
                .verifyWith(getSigningKey())
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }

    private SecretKey getSigningKey() {
        byte[] keyBytes = Decoders.BASE64.decode(secretKey);
        return Keys.hmacShaKeyFor(keyBytes);
    }
}
