package com.todoapi.repository;

import com.todoapi.model.entity.Todo;
import com.todoapi.model.entity.TodoStatus;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Repository for Todo entities.
 *
 * Every lookup takes the owning user ID. Extends the bare {@link Repository} marker,
 * so there is no unscoped findById/deleteById.
 */
@org.springframework.stereotype.Repository
public interface TodoRepository extends Repository<Todo, Long> {

    /**
     * Insert a new todo or update an existing one.
     */
    Mono<Todo> save(Todo todo);

    /**
     * Find a todo by ID within the owner's todos.
     */
    Mono<Todo> findByIdAndUserId(Long id, Long userId);

    /**
     * Page through an owner's todos, ordered by ID.
     */
    @Query("SELECT * FROM todos WHERE user_id = :userId ORDER BY id LIMIT :limit OFFSET :offset")
    Flux<Todo> findPageByUserId(Long userId, int limit, long offset);

    /**
     * Page through an owner's todos with the given status (enum name), ordered by ID.
     */
    @Query("SELECT * FROM todos WHERE user_id = :userId AND status = :status "
            + "ORDER BY id LIMIT :limit OFFSET :offset")
    Flux<Todo> findPageByUserIdAndStatus(Long userId, String status, int limit, long offset);

    /**
     * Count an owner's todos.
     */
    Mono<Long> countByUserId(Long userId);

    /**
     * Count an owner's todos with the given status.
     */
    Mono<Long> countByUserIdAndStatus(Long userId, TodoStatus status);

    /**
     * Delete a todo by ID within the owner's todos.
     */
    @Modifying
    @Query("DELETE FROM todos WHERE id = :id AND user_id = :userId")
    Mono<Integer> deleteByIdAndUserId(Long id, Long userId);

    /**
     * Delete all todos of an owner.
     */
    @Modifying
    @Query("DELETE FROM todos WHERE user_id = :userId")
    Mono<Integer> deleteAllByUserId(Long userId);
}
