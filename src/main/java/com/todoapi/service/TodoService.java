package com.todoapi.service;

import com.todoapi.exception.InvalidRequestException;
import com.todoapi.exception.ResourceNotFoundException;
import com.todoapi.model.dto.TodoCreateRequest;
import com.todoapi.model.dto.TodoListResponse;
import com.todoapi.model.dto.TodoResponse;
import com.todoapi.model.entity.Todo;
import com.todoapi.model.entity.TodoStatus;
import com.todoapi.model.patch.TodoPatch;
import com.todoapi.repository.TodoRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Service for todo management.
 * Every operation is scoped to the owning user; todos of other users behave as if absent.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TodoService {

    public static final int MAX_LIMIT = 1000;

    private final TodoRepository todoRepository;

    /**
     * Create a todo. Status always starts as Pending.
     *
     * @param userId Owner ID
     * @param request Todo create request
     * @return Created todo
     */
    @Transactional
    public Mono<TodoResponse> createTodo(Long userId, TodoCreateRequest request) {
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        Todo todo = Todo.builder()
                .title(request.getTitle())
                .description(request.getDescription())
                .dueDate(request.getDueDate())
                .status(TodoStatus.PENDING)
                .userId(userId)
                .createdAt(now)
                .updatedAt(now)
                .build();

        return todoRepository.save(todo)
                .doOnNext(saved -> log.info("Created todo {} for user {}", saved.getId(), userId))
                .map(this::toResponse);
    }

    /**
     * Get a specific todo.
     *
     * @param userId Owner ID
     * @param todoId Todo ID
     * @return Todo response
     */
    public Mono<TodoResponse> getTodo(Long userId, Long todoId) {
        return findOwned(userId, todoId)
                .map(this::toResponse);
    }

    /**
     * List a page of todos.
     *
     * @param userId Owner ID
     * @param statusFilter Optional status to narrow by
     * @param skip Number of todos to skip, at least 0
     * @param limit Maximum number of todos to return, 1 to 1000
     * @return Page of todos and the total count before pagination
     */
    public Mono<TodoListResponse> listTodos(Long userId, TodoStatus statusFilter, long skip, int limit) {
        if (skip < 0) {
            return Mono.error(new InvalidRequestException("skip", "must be greater than or equal to 0"));
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            return Mono.error(new InvalidRequestException("limit", "must be between 1 and " + MAX_LIMIT));
        }

        Flux<Todo> page;
        Mono<Long> total;
        if (statusFilter == null) {
            page = todoRepository.findPageByUserId(userId, limit, skip);
            total = todoRepository.countByUserId(userId);
        } else {
            page = todoRepository.findPageByUserIdAndStatus(userId, statusFilter.name(), limit, skip);
            total = todoRepository.countByUserIdAndStatus(userId, statusFilter);
        }

        return Mono.zip(page.map(this::toResponse).collectList(), total)
                .map(tuple -> TodoListResponse.builder()
                        .todos(tuple.getT1())
                        .total(tuple.getT2())
                        .build());
    }

    /**
     * Apply a partial update. Only fields present in the patch change;
     * the update timestamp is refreshed even for an empty patch.
     *
     * @param userId Owner ID
     * @param todoId Todo ID
     * @param patch Fields to change
     * @return Updated todo
     */
    @Transactional
    public Mono<TodoResponse> updateTodo(Long userId, Long todoId, TodoPatch patch) {
        return findOwned(userId, todoId)
                .flatMap(todo -> {
                    patch.getTitle().ifPresent(todo::setTitle);
                    patch.getDescription().ifPresent(todo::setDescription);
                    patch.getStatus().ifPresent(todo::setStatus);
                    patch.getDueDate().ifPresent(todo::setDueDate);
                    todo.setUpdatedAt(OffsetDateTime.now(ZoneOffset.UTC));
                    return todoRepository.save(todo);
                })
                .map(this::toResponse);
    }

    /**
     * Delete a todo.
     *
     * @param userId Owner ID
     * @param todoId Todo ID
     * @return Mono<Void>
     */
    @Transactional
    public Mono<Void> deleteTodo(Long userId, Long todoId) {
        return findOwned(userId, todoId)
                .flatMap(todo -> todoRepository.deleteByIdAndUserId(todo.getId(), userId))
                .doOnNext(removed -> log.info("Deleted todo {} for user {}", todoId, userId))
                .then();
    }

    private Mono<Todo> findOwned(Long userId, Long todoId) {
        return todoRepository.findByIdAndUserId(todoId, userId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Todo", todoId)));
    }

    /**
     * Convert entity to response DTO.
     */
    private TodoResponse toResponse(Todo todo) {
        return TodoResponse.builder()
                .id(todo.getId())
                .title(todo.getTitle())
                .description(todo.getDescription())
                .status(todo.getStatus())
                .dueDate(todo.getDueDate())
                .userId(todo.getUserId())
                .createdAt(todo.getCreatedAt())
                .updatedAt(todo.getUpdatedAt())
                .build();
    }
}
