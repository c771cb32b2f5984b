package com.todoapi.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.todoapi.model.entity.TodoStatus;
import com.todoapi.model.patch.PatchField;
import com.todoapi.model.patch.TodoPatch;
import com.todoapi.validation.CharacterLength;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Future;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * Request DTO for a partial todo update.
 *
 * Setters record which properties appeared in the JSON body, so an absent field can be told
 * apart from an explicit {@code null}. An explicit {@code null} due date clears it; an explicit
 * {@code null} title, description or status is rejected.
 */
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TodoUpdateRequest {

    @CharacterLength(min = 1, max = 60, message = "Title must be between 1 and 60 characters")
    private String title;

    @CharacterLength(min = 1, message = "Description must not be empty")
    private String description;

    private TodoStatus status;

    @Future(message = "due_date must be in the future")
    private OffsetDateTime dueDate;

    private boolean titlePresent;
    private boolean descriptionPresent;
    private boolean statusPresent;
    private boolean dueDatePresent;

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
        this.titlePresent = true;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
        this.descriptionPresent = true;
    }

    public TodoStatus getStatus() {
        return status;
    }

    public void setStatus(TodoStatus status) {
        this.status = status;
        this.statusPresent = true;
    }

    public OffsetDateTime getDueDate() {
        return dueDate;
    }

    public void setDueDate(OffsetDateTime dueDate) {
        this.dueDate = dueDate;
        this.dueDatePresent = true;
    }

    @JsonIgnore
    @AssertTrue(message = "title must not be null")
    public boolean isTitleNotNull() {
        return !titlePresent || title != null;
    }

    @JsonIgnore
    @AssertTrue(message = "description must not be null")
    public boolean isDescriptionNotNull() {
        return !descriptionPresent || description != null;
    }

    @JsonIgnore
    @AssertTrue(message = "status must not be null")
    public boolean isStatusNotNull() {
        return !statusPresent || status != null;
    }

    /**
     * Convert to a patch holding only the supplied fields.
     */
    public TodoPatch toPatch() {
        return TodoPatch.builder()
                .title(titlePresent ? PatchField.of(title) : PatchField.absent())
                .description(descriptionPresent ? PatchField.of(description) : PatchField.absent())
                .status(statusPresent ? PatchField.of(status) : PatchField.absent())
                .dueDate(dueDatePresent ? PatchField.of(dueDate) : PatchField.absent())
                .build();
    }
}
