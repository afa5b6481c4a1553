package com.example.securevote.security;

import com.example.securevote.config.VoteProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.List;
import java.util.Optional;

/**
 * Issues and checks operator session tokens (HS256).
 */
@Component
@Slf4j
public class JwtTokenProvider {

    private static final String ROLES_CLAIM = "roles";

    private final SecretKey key;
    private final long expirationMillis;

    public JwtTokenProvider(VoteProperties properties) {
        String secret = properties.getSecurity().getJwtSecret();
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < 32) {
            throw new IllegalStateException("vote.security.jwt-secret must be at least 32 bytes");
        }
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.expirationMillis = properties.getSecurity().getJwtExpiration().toMillis();
    }

    public long getExpirationMillis() {
        return expirationMillis;
    }

    public String generateToken(Authentication authentication) {
        List<String> roles = authentication.getAuthorities().stream()
            .map(GrantedAuthority::getAuthority)
            .toList();
        Date now = new Date();
        return Jwts.builder()
            .subject(authentication.getName())
            .claim(ROLES_CLAIM, roles)
            .issuedAt(now)
            .expiration(new Date(now.getTime() + expirationMillis))
            .signWith(key)
            .compact();
    }

    /**
     * @return the verified claims, or empty when the token is malformed, forged or expired
     */
    public Optional<Claims> parse(String token) {
        try {
            return Optional.of(Jwts.parser().verifyWith(key).build().parseSignedClaims(token).getPayload());
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected operator token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public List<String> getRoles(Claims claims) {
        Object roles = claims.get(ROLES_CLAIM);
        if (!(roles instanceof List<?>)) {
            return List.of();
        }
        return ((List<?>) roles).stream().map(String::valueOf).toList();
    }
}
