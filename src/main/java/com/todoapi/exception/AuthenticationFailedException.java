package com.todoapi.exception;

/**
 * Exception thrown when login credentials are rejected.
 * The message never reveals whether the email or the password was wrong.
 */
public class AuthenticationFailedException extends RuntimeException {

    public static final String INCORRECT_CREDENTIALS = "Incorrect email or password";

    public AuthenticationFailedException() {
        super(INCORRECT_CREDENTIALS);
    }
}
