package com.todoapi.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.todoapi.model.dto.ErrorResponse;
import com.todoapi.model.entity.User;
import com.todoapi.service.CredentialService;
import com.todoapi.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.Optional;
import java.util.UUID;

/**
 * Filter for bearer token authentication.
 *
 * Missing, invalid or expired tokens and tokens whose user no longer exists are all rejected
 * with the same 401 response. A valid token for an inactive user is rejected with 403.
 * Otherwise the resolved {@link User} becomes the authentication principal.
 */
@Slf4j
@RequiredArgsConstructor
public class BearerTokenAuthenticationFilter implements WebFilter {

    static final String CREDENTIALS_REJECTED = "Could not validate credentials";
    static final String INACTIVE_USER = "Inactive user";

    private static final String BEARER_PREFIX = "Bearer ";

    private final CredentialService credentialService;
    private final UserService userService;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();

        // Skip authentication for public endpoints
        if (isPublicEndpoint(path)) {
            return chain.filter(exchange);
        }

        String authHeader = exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        Optional<TokenClaims> claims = extractToken(authHeader).flatMap(credentialService::verifyToken);
        if (claims.isEmpty()) {
            log.warn("Missing or invalid bearer token for {}", path);
            return reject(exchange, HttpStatus.UNAUTHORIZED, CREDENTIALS_REJECTED);
        }

        Long userId = claims.get().getUserId();
        return userService.findById(userId)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(user -> {
                    if (user.isEmpty()) {
                        log.warn("Token refers to unknown user {}", userId);
                        return reject(exchange, HttpStatus.UNAUTHORIZED, CREDENTIALS_REJECTED);
                    }
                    if (!user.get().isActive()) {
                        log.warn("Inactive user {} rejected", userId);
                        return reject(exchange, HttpStatus.FORBIDDEN, INACTIVE_USER);
                    }

                    // Authentication token with the user as principal
                    UsernamePasswordAuthenticationToken authentication =
                            new UsernamePasswordAuthenticationToken(user.get(), null, Collections.emptyList());

                    return chain.filter(exchange)
                            .contextWrite(ReactiveSecurityContextHolder.withAuthentication(authentication));
                });
    }

    /**
     * Extract the token from an Authorization header value.
     *
     * @param authHeader Header value, may be null
     * @return Token, or empty if the header is not a bearer credential
     */
    static Optional<String> extractToken(String authHeader) {
        if (authHeader == null || authHeader.length() <= BEARER_PREFIX.length()
                || !authHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return Optional.empty();
        }
        return Optional.of(authHeader.substring(BEARER_PREFIX.length()).trim())
                .filter(token -> !token.isEmpty());
    }

    private Mono<Void> reject(ServerWebExchange exchange, HttpStatus status, String detail) {
        ServerHttpResponse response = exchange.getResponse();
        response.setStatusCode(status);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        if (status == HttpStatus.UNAUTHORIZED) {
            response.getHeaders().set(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        }

        ErrorResponse error = ErrorResponse.builder()
                .detail(detail)
                .traceId(UUID.randomUUID().toString())
                .build();
        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(error);
        } catch (JsonProcessingException e) {
            return Mono.error(e);
        }
        return response.writeWith(Mono.just(response.bufferFactory().wrap(body)));
    }

    private boolean isPublicEndpoint(String path) {
        return path.equals("/") ||
               path.equals("/auth/register") ||
               path.equals("/auth/login") ||
               path.startsWith("/actuator");
    }
}
