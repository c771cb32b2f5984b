package com.todoapi.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.OffsetDateTime;

/**
 * Todo entity for a single task owned by exactly one user.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("todos")
public class Todo {

    @Id
    private Long id;

    @Column("title")
    private String title;

    @Column("description")
    private String description;

    @Column("status")
    private TodoStatus status;

    @Column("due_date")
    private OffsetDateTime dueDate; // optional

    @Column("user_id")
    private Long userId;

    @Column("created_at")
    private OffsetDateTime createdAt;

    @Column("updated_at")
    private OffsetDateTime updatedAt;
}
