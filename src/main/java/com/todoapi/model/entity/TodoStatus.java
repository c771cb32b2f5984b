package com.todoapi.model.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of a todo. Stored by enum name, exposed on the wire by display value.
 */
public enum TodoStatus {

    PENDING("Pending"),
    DONE("Done"),
    CANCELLED("Cancelled");

    private final String value;

    TodoStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Resolve a status from its display value or enum name, ignoring case.
     *
     * @param text Status text, e.g. "Done" or "DONE"
     * @return Matching status
     * @throws IllegalArgumentException if the text matches no status
     */
    @JsonCreator
    public static TodoStatus fromValue(String text) {
        if (text != null) {
            for (TodoStatus status : values()) {
                if (status.value.equalsIgnoreCase(text) || status.name().equalsIgnoreCase(text)) {
                    return status;
                }
            }
        }
        throw new IllegalArgumentException("Unknown todo status: " + text);
    }
}
