package com.todoapi.controller;

import com.todoapi.exception.AuthenticationFailedException;
import com.todoapi.model.dto.LoginForm;
import com.todoapi.model.dto.TokenResponse;
import com.todoapi.model.dto.UserRegisterRequest;
import com.todoapi.model.dto.UserResponse;
import com.todoapi.model.entity.User;
import com.todoapi.security.TokenClaims;
import com.todoapi.service.CredentialService;
import com.todoapi.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/**
 * Controller for registration, login and the current user's profile.
 */
@Slf4j
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
public class AuthController {

    private final UserService userService;
    private final CredentialService credentialService;

    @PostMapping("/register")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<UserResponse> register(@Valid @RequestBody UserRegisterRequest request) {
        return userService.createUser(request)
                .map(UserResponse::from);
    }

    /**
     * OAuth2 password-style login: the {@code username} form field carries the email.
     */
    @PostMapping(value = "/login", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public Mono<TokenResponse> login(@Valid @ModelAttribute LoginForm form) {
        return userService.authenticate(form.getUsername(), form.getPassword())
                .switchIfEmpty(Mono.error(new AuthenticationFailedException()))
                .map(user -> {
                    String token = credentialService.issueToken(TokenClaims.builder()
                            .userId(user.getId())
                            .email(user.getEmail())
                            .build());
                    log.info("User {} logged in", user.getId());
                    return TokenResponse.builder()
                            .accessToken(token)
                            .build();
                });
    }

    @GetMapping("/me")
    public Mono<UserResponse> me(@AuthenticationPrincipal User currentUser) {
        return Mono.just(UserResponse.from(currentUser));
    }

    @DeleteMapping("/me")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> deleteMe(@AuthenticationPrincipal User currentUser) {
        return userService.deleteUser(currentUser.getId());
    }
}
