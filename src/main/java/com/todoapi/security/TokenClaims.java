package com.todoapi.security;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Claims carried by an access token. Never stored server-side.
 */
@Value
@Builder
public class TokenClaims {
    Long userId;
    String email;
    Instant expiresAt; // set on decoded tokens, ignored when issuing
}
