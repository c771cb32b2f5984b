package com.todoapi.controller;

import com.todoapi.exception.InvalidRequestException;
import com.todoapi.model.dto.TodoCreateRequest;
import com.todoapi.model.dto.TodoListResponse;
import com.todoapi.model.dto.TodoResponse;
import com.todoapi.model.dto.TodoUpdateRequest;
import com.todoapi.model.entity.TodoStatus;
import com.todoapi.model.entity.User;
import com.todoapi.service.TodoService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/**
 * Controller for the authenticated user's todos.
 */
@RestController
@RequestMapping("/todos")
@RequiredArgsConstructor
public class TodoController {

    private final TodoService todoService;

    @PostMapping({"", "/"})
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<TodoResponse> createTodo(
            @AuthenticationPrincipal User currentUser,
            @Valid @RequestBody TodoCreateRequest request) {
        return todoService.createTodo(currentUser.getId(), request);
    }

    @GetMapping({"", "/"})
    public Mono<TodoListResponse> listTodos(
            @AuthenticationPrincipal User currentUser,
            @RequestParam(name = "status_filter", required = false) String statusFilter,
            @RequestParam(defaultValue = "0") long skip,
            @RequestParam(defaultValue = "100") int limit) {
        TodoStatus status = parseStatus(statusFilter);
        return todoService.listTodos(currentUser.getId(), status, skip, limit);
    }

    @GetMapping("/{todoId}")
    public Mono<TodoResponse> getTodo(
            @AuthenticationPrincipal User currentUser,
            @PathVariable Long todoId) {
        return todoService.getTodo(currentUser.getId(), todoId);
    }

    @PutMapping("/{todoId}")
    public Mono<TodoResponse> updateTodo(
            @AuthenticationPrincipal User currentUser,
            @PathVariable Long todoId,
            @Valid @RequestBody TodoUpdateRequest request) {
        return todoService.updateTodo(currentUser.getId(), todoId, request.toPatch());
    }

    @DeleteMapping("/{todoId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> deleteTodo(
            @AuthenticationPrincipal User currentUser,
            @PathVariable Long todoId) {
        return todoService.deleteTodo(currentUser.getId(), todoId);
    }

    private TodoStatus parseStatus(String statusFilter) {
        if (statusFilter == null || statusFilter.isEmpty()) {
            return null;
        }
        try {
            return TodoStatus.fromValue(statusFilter);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("status_filter", "must be one of Pending, Done, Cancelled");
        }
    }
}
