package com.todoapi.model.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.todoapi.validation.CharacterLength;
import jakarta.validation.constraints.Future;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * Request DTO for creating a todo. Status is not accepted; new todos are always Pending.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TodoCreateRequest {

    @NotNull(message = "Title is required")
    @CharacterLength(min = 1, max = 60, message = "Title must be between 1 and 60 characters")
    private String title;

    @NotNull(message = "Description is required")
    @CharacterLength(min = 1, message = "Description must not be empty")
    private String description;

    @Future(message = "due_date must be in the future")
    private OffsetDateTime dueDate;
}
