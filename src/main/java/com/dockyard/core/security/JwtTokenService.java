package com.dockyard.core.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;

/**
 * Mints and verifies the HMAC-signed bearer tokens that guard administrative
 * queue actions.
 */
@Service
public class JwtTokenService {

    public static final String ROLE_CLAIM = "role";
    public static final String ADMIN_ROLE = "admin";

    private final SecretKey signingKey;
    private final int expirationSeconds;

    public JwtTokenService(
            @Value("${dockyard.security.jwt.secret}") String secret,
            @Value("${dockyard.security.jwt.expiration-seconds:3600}") int expirationSeconds) {
        this.signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.expirationSeconds = expirationSeconds;
    }

    public String generateAdminToken(String subject) {
        return generateAdminToken(subject, expirationSeconds);
    }

    public String generateAdminToken(String subject, int ttlSeconds) {
        Date now = new Date();
        Date expiration = new Date(now.getTime() + ttlSeconds * 1000L);

        return Jwts.builder()
                .subject(subject)
                .claim(ROLE_CLAIM, ADMIN_ROLE)
                .issuedAt(now)
                .expiration(expiration)
                .signWith(signingKey)
                .compact();
    }

    public Claims validateToken(String token) {
        return Jwts.parser()
                .verifyWith(signingKey)
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }

    /** False for expired, tampered or non-admin tokens. */
    public boolean isAdmin(String token) {
        try {
            return ADMIN_ROLE.equals(validateToken(token).get(ROLE_CLAIM, String.class));
        } catch (JwtException | IllegalArgumentException e) {
            return false;
        }
    }
}
