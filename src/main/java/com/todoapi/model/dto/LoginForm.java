package com.todoapi.model.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Form DTO for login. {@code username} carries the email address.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoginForm {

    @NotBlank(message = "Username is required")
    private String username;

    @ToString.Exclude
    @NotBlank(message = "Password is required")
    private String password;
}
