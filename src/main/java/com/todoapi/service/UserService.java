package com.todoapi.service;

import com.todoapi.exception.DuplicateResourceException;
import com.todoapi.model.dto.UserRegisterRequest;
import com.todoapi.model.entity.User;
import com.todoapi.repository.TodoRepository;
import com.todoapi.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Service for user registration, lookup and authentication.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    private final UserRepository userRepository;
    private final TodoRepository todoRepository;
    private final CredentialService credentialService;

    /**
     * Register a new user.
     * Email uniqueness is checked before username uniqueness.
     *
     * @param request User registration request
     * @return Created user with server-assigned ID and timestamps
     */
    @Transactional
    public Mono<User> createUser(UserRegisterRequest request) {
        return userRepository.existsByEmail(request.getEmail())
                .flatMap(emailTaken -> {
                    if (emailTaken) {
                        return Mono.error(new DuplicateResourceException("Email already registered"));
                    }
                    return userRepository.existsByUsername(request.getUsername());
                })
                .flatMap(usernameTaken -> {
                    if (usernameTaken) {
                        return Mono.error(new DuplicateResourceException("Username already taken"));
                    }
                    return hashPassword(request.getPassword());
                })
                .flatMap(hashedPassword -> {
                    OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
                    User user = User.builder()
                            .email(request.getEmail())
                            .username(request.getUsername())
                            .hashedPassword(hashedPassword)
                            .active(true)
                            .createdAt(now)
                            .updatedAt(now)
                            .build();
                    return userRepository.save(user);
                })
                .doOnNext(saved -> log.info("Registered user {}", saved.getId()));
    }

    /**
     * Find user by email.
     *
     * @param email Email address (case-sensitive)
     * @return User, or empty if none
     */
    public Mono<User> findByEmail(String email) {
        return userRepository.findByEmail(email);
    }

    /**
     * Find user by ID.
     *
     * @param id User ID
     * @return User, or empty if none
     */
    public Mono<User> findById(Long id) {
        return userRepository.findById(id);
    }

    /**
     * Authenticate with email and password.
     * Unknown email, wrong password and inactive user all complete empty.
     *
     * @param email Email address
     * @param password Plain text password
     * @return Authenticated user, or empty
     */
    public Mono<User> authenticate(String email, String password) {
        return userRepository.findByEmail(email)
                .filterWhen(user -> Mono.fromCallable(() -> credentialService.verifyPassword(password, user.getHashedPassword()))
                        .subscribeOn(Schedulers.boundedElastic()))
                .filter(User::isActive);
    }

    /**
     * Delete a user together with all of their todos.
     *
     * @param id User ID
     * @return Mono<Void>
     */
    @Transactional
    public Mono<Void> deleteUser(Long id) {
        return todoRepository.deleteAllByUserId(id)
                .flatMap(removed -> {
                    log.info("Deleting user {} and {} todos", id, removed);
                    return userRepository.deleteById(id);
                });
    }

    private Mono<String> hashPassword(String password) {
        return Mono.fromCallable(() -> credentialService.hashPassword(password))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
