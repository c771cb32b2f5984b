package com.todoapi.model.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.todoapi.model.entity.TodoStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * Response DTO for a single todo.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TodoResponse {
    private Long id;
    private String title;
    private String description;
    private TodoStatus status;
    private OffsetDateTime dueDate;
    private Long userId;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
}
