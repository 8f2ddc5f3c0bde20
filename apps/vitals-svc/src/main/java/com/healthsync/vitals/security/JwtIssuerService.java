package com.healthsync.vitals.security;

import com.healthsync.vitals.config.VitalsProperties;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;

@Service
public class JwtIssuerService {
    public static final String ISSUER = "vitals-dev";

    private final SecretKey key;
    private final boolean enabled;

    public JwtIssuerService(VitalsProperties properties) {
        String secret = properties.security().devJwtSecret();
        this.enabled = properties.security().hasDevJwtSecret();
        if (enabled) {
            byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
            if (bytes.length < 32) { // HS256 needs at least a 256-bit secret
                throw new IllegalStateException("devJwtSecret must be at least 32 bytes");
            }
            this.key = Keys.hmacShaKeyFor(bytes);
        } else {
            this.key = null;
        }
    }

    public boolean isEnabled() { return enabled; }

    public String issue(String email, long ttlSeconds) {
        if (!enabled) {
            throw new IllegalStateException("Dev JWT issuance not enabled (missing dev secret)");
        }
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("email must be provided");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be positive");
        }
        Instant now = Instant.now();
        return Jwts.builder()
                .setSubject(email)
                .claim("email", email)
                .claim("scope", "user")
                .setIssuer(ISSUER)
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(now.plusSeconds(ttlSeconds)))
                .signWith(key)
                .compact();
    }
}
