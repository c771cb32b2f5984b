package com.todoapi.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Token signing configuration, bound once at startup from {@code todo.security.jwt.*}.
 */
@Getter
@Validated
@ConfigurationProperties(prefix = "todo.security.jwt")
public class JwtProperties {

    /**
     * HMAC signing secret. HS384 and HS512 need at least 48 and 64 bytes, checked by
     * {@link JwtConfig#macAlgorithm(JwtProperties)} when the token beans are created.
     */
    @NotBlank
    @Size(min = 32, message = "JWT secret must be at least 32 characters")
    private final String secret;

    /**
     * MAC algorithm name: HS256, HS384 or HS512.
     */
    @NotBlank
    private final String algorithm;

    /**
     * Lifetime of issued access tokens.
     */
    @NotNull
    private final Duration accessTokenTtl;

    public JwtProperties(String secret,
                         @DefaultValue("HS256") String algorithm,
                         @DefaultValue("30m") Duration accessTokenTtl) {
        this.secret = secret;
        this.algorithm = algorithm;
        this.accessTokenTtl = accessTokenTtl;
    }
}
