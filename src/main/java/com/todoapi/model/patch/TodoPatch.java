package com.todoapi.model.patch;

import com.todoapi.model.entity.TodoStatus;
import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;

/**
 * Partial update of a todo. Only present fields are applied.
 */
@Value
@Builder
public class TodoPatch {

    @Builder.Default
    PatchField<String> title = PatchField.absent();

    @Builder.Default
    PatchField<String> description = PatchField.absent();

    @Builder.Default
    PatchField<TodoStatus> status = PatchField.absent();

    @Builder.Default
    PatchField<OffsetDateTime> dueDate = PatchField.absent();

    public static TodoPatch empty() {
        return TodoPatch.builder().build();
    }
}
