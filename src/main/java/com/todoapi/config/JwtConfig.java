package com.todoapi.config;

import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.OctetSequenceKey;
import com.nimbusds.jose.jwk.source.ImmutableJWKSet;
import com.nimbusds.jose.jwk.source.JWKSource;
import com.nimbusds.jose.proc.SecurityContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtTimestampValidator;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtEncoder;

import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;

/**
 * Beans for password hashing and signed access tokens.
 */
@Configuration
public class JwtConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    @Bean
    public JwtEncoder jwtEncoder(JwtProperties properties) {
        MacAlgorithm algorithm = macAlgorithm(properties);
        OctetSequenceKey jwk = new OctetSequenceKey.Builder(secretBytes(properties))
                .algorithm(JWSAlgorithm.parse(algorithm.getName()))
                .build();

        JWKSource<SecurityContext> jwkSource = new ImmutableJWKSet<>(new JWKSet(jwk));
        return new NimbusJwtEncoder(jwkSource);
    }

    /**
     * Decoder that checks the signature and expiry against {@code clock}, with no clock skew.
     */
    @Bean
    public JwtDecoder jwtDecoder(JwtProperties properties, Clock clock) {
        MacAlgorithm algorithm = macAlgorithm(properties);
        SecretKeySpec key = new SecretKeySpec(secretBytes(properties), "HmacSHA" + algorithm.getName().substring(2));
        NimbusJwtDecoder decoder = NimbusJwtDecoder.withSecretKey(key)
                .macAlgorithm(algorithm)
                .build();

        JwtTimestampValidator timestampValidator = new JwtTimestampValidator(Duration.ZERO);
        timestampValidator.setClock(clock);
        decoder.setJwtValidator(timestampValidator);
        return decoder;
    }

    /**
     * Resolve the configured MAC algorithm and check that the secret is long enough for it:
     * HS256, HS384 and HS512 need at least 32, 48 and 64 bytes.
     *
     * @throws IllegalStateException if the algorithm is unknown or the secret too short
     */
    public static MacAlgorithm macAlgorithm(JwtProperties properties) {
        MacAlgorithm algorithm = MacAlgorithm.from(properties.getAlgorithm());
        if (algorithm == null) {
            throw new IllegalStateException("Unsupported JWT algorithm: " + properties.getAlgorithm());
        }

        int minimumBytes = minimumSecretBytes(algorithm);
        if (secretBytes(properties).length < minimumBytes) {
            throw new IllegalStateException("JWT secret must be at least " + minimumBytes
                    + " bytes for " + algorithm.getName());
        }
        return algorithm;
    }

    static int minimumSecretBytes(MacAlgorithm algorithm) {
        return Integer.parseInt(algorithm.getName().substring(2)) / 8;
    }

    private static byte[] secretBytes(JwtProperties properties) {
        return properties.getSecret().getBytes(StandardCharsets.UTF_8);
    }
}
