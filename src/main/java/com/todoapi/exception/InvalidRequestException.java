package com.todoapi.exception;

import lombok.Getter;

/**
 * Exception thrown when a request parameter is outside its allowed range.
 */
@Getter
public class InvalidRequestException extends RuntimeException {

    private final String field;

    public InvalidRequestException(String field, String message) {
        super(message);
        this.field = field;
    }
}
