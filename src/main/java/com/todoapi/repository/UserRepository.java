package com.todoapi.repository;

import com.todoapi.model.entity.User;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

/**
 * Repository for User entities.
 */
@Repository
public interface UserRepository extends ReactiveCrudRepository<User, Long> {

    /**
     * Find user by email (case-sensitive).
     */
    Mono<User> findByEmail(String email);

    /**
     * Check if email is already registered.
     */
    Mono<Boolean> existsByEmail(String email);

    /**
     * Check if username is already taken.
     */
    Mono<Boolean> existsByUsername(String username);
}
