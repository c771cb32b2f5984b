package com.todoapi.service;

import com.todoapi.config.JwtConfig;
import com.todoapi.config.JwtProperties;
import com.todoapi.security.TokenClaims;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Service for password hashing and signed access token handling.
 *
 * Tokens carry {@code user_id}, {@code email} and {@code exp} claims and are stateless:
 * there is no server-side revocation, so a token stays valid until it expires.
 */
@Slf4j
@Service
public class CredentialService {

    static final String USER_ID_CLAIM = "user_id";
    static final String EMAIL_CLAIM = "email";

    private final PasswordEncoder passwordEncoder;
    private final JwtEncoder jwtEncoder;
    private final JwtDecoder jwtDecoder;
    private final MacAlgorithm algorithm;
    private final Duration defaultTtl;
    private final Clock clock;

    public CredentialService(PasswordEncoder passwordEncoder,
                             JwtEncoder jwtEncoder,
                             JwtDecoder jwtDecoder,
                             JwtProperties properties,
                             Clock clock) {
        this.passwordEncoder = passwordEncoder;
        this.jwtEncoder = jwtEncoder;
        this.jwtDecoder = jwtDecoder;
        this.algorithm = JwtConfig.macAlgorithm(properties);
        this.defaultTtl = properties.getAccessTokenTtl();
        this.clock = clock;
    }

    /**
     * Hash a password with a fresh salt. Blocking and deliberately slow.
     *
     * @param plaintext Plain text password
     * @return BCrypt hash
     */
    public String hashPassword(String plaintext) {
        return passwordEncoder.encode(plaintext);
    }

    /**
     * Check a password against a stored hash.
     *
     * @param plaintext Plain text password
     * @param hash Stored BCrypt hash
     * @return true if the password matches
     */
    public boolean verifyPassword(String plaintext, String hash) {
        if (plaintext == null || hash == null) {
            return false;
        }
        return passwordEncoder.matches(plaintext, hash);
    }

    /**
     * Issue an access token with the configured lifetime.
     */
    public String issueToken(TokenClaims claims) {
        return issueToken(claims, defaultTtl);
    }

    /**
     * Issue an access token.
     *
     * @param claims User ID and email to embed
     * @param ttl Token lifetime
     * @return Compact signed token
     */
    public String issueToken(TokenClaims claims, Duration ttl) {
        Instant now = clock.instant();
        JwtClaimsSet claimsSet = JwtClaimsSet.builder()
                .subject(String.valueOf(claims.getUserId()))
                .claim(USER_ID_CLAIM, claims.getUserId())
                .claim(EMAIL_CLAIM, claims.getEmail())
                .issuedAt(now)
                .expiresAt(now.plus(ttl))
                .build();

        JwsHeader header = JwsHeader.with(algorithm).build();
        return jwtEncoder.encode(JwtEncoderParameters.from(header, claimsSet)).getTokenValue();
    }

    /**
     * Verify a token's signature and expiry and extract its claims.
     * Malformed, tampered or expired tokens and tokens lacking a required claim yield empty.
     *
     * @param token Compact token string
     * @return Decoded claims, or empty if the token is not acceptable
     */
    public Optional<TokenClaims> verifyToken(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }

        Jwt jwt;
        try {
            jwt = jwtDecoder.decode(token);
        } catch (JwtException e) {
            log.debug("Token rejected: {}", e.getMessage());
            return Optional.empty();
        }

        Object userId = jwt.getClaims().get(USER_ID_CLAIM);
        String email = jwt.getClaimAsString(EMAIL_CLAIM);
        if (!(userId instanceof Number) || email == null || jwt.getExpiresAt() == null) {
            log.debug("Token rejected: missing required claims");
            return Optional.empty();
        }

        return Optional.of(TokenClaims.builder()
                .userId(((Number) userId).longValue())
                .email(email)
                .expiresAt(jwt.getExpiresAt())
                .build());
    }
}
