package com.todoapi.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for a page of todos.
 * {@code total} counts every matching todo, independent of skip and limit.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TodoListResponse {
    private List<TodoResponse> todos;
    private long total;
}
