package com.todoapi.model.dto;

import com.todoapi.validation.CharacterLength;
import com.todoapi.validation.StrongPassword;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Request DTO for user registration.
 *
 * Password must be at least 8 characters and contain an uppercase letter,
 * a lowercase letter, a digit and a special character.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserRegisterRequest {

    @NotBlank(message = "Email is required")
    @Email(regexp = ".+@.+\\..+", message = "Email must be a valid email address")
    private String email;

    @NotNull(message = "Username is required")
    @CharacterLength(min = 3, max = 50, message = "Username must be between 3 and 50 characters")
    private String username;

    @ToString.Exclude
    @NotNull(message = "Password is required")
    @CharacterLength(min = 8, message = "Password must be at least 8 characters")
    @StrongPassword
    private String password;
}
