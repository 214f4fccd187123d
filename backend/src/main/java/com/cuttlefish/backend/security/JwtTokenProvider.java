package com.cuttlefish.backend.security;

import com.cuttlefish.backend.config.SecurityProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

/**
 * Issues and verifies the HS256 bearer tokens that carry an actor id as their subject.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwtTokenProvider {

    static final int MIN_SECRET_LENGTH = 32;

    private final SecurityProperties securityProperties;
    private final Clock clock;

    private SecretKey signingKey;

    @PostConstruct
    public void validateSecret() {
        String secret = securityProperties.getJwtSecret();
        if (secret == null || secret.isBlank()) {
            log.error("Missing JWT secret. Set AGENT_JWT_SECRET; tokens are signed with an ephemeral key");
            secret = ephemeralSecret();
        } else if (secret.length() < MIN_SECRET_LENGTH) {
            log.error("JWT secret must be at least {} characters; tokens are signed with an ephemeral key",
                    MIN_SECRET_LENGTH);
            secret = ephemeralSecret();
        }
        signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    public IssuedToken generateToken(String actorId) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(securityProperties.getTokenTtl());
        String token = Jwts.builder()
                .subject(actorId)
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiresAt))
                .signWith(signingKey, Jwts.SIG.HS256)
                .compact();
        return new IssuedToken(token, actorId, expiresAt);
    }

    public boolean validateToken(String token) {
        try {
            parser().parseSignedClaims(token);
            return true;
        } catch (JwtException | IllegalArgumentException ex) {
            log.warn("JWT validation error: {}", ex.getMessage());
            return false;
        }
    }

    public String getActorFromToken(String token) {
        Claims claims = parser().parseSignedClaims(token).getPayload();
        return claims.getSubject();
    }

    private JwtParser parser() {
        return Jwts.parser()
                .verifyWith(signingKey)
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    private static String ephemeralSecret() {
        return UUID.randomUUID() + UUID.randomUUID().toString();
    }

    public record IssuedToken(String token, String actorId, Instant expiresAt) {}
}
