package com.todoapi.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Validator for {@link StrongPassword}.
 */
public class StrongPasswordValidator implements ConstraintValidator<StrongPassword, String> {

    public static final String SPECIAL_CHARACTERS = "!@#$%^&*(),.?\":{}|<>";

    static final String MISSING_UPPERCASE = "Password must contain at least one uppercase letter";
    static final String MISSING_LOWERCASE = "Password must contain at least one lowercase letter";
    static final String MISSING_DIGIT = "Password must contain at least one digit";
    static final String MISSING_SPECIAL =
            "Password must contain at least one special character (" + SPECIAL_CHARACTERS + ")";

    @Override
    public boolean isValid(String password, ConstraintValidatorContext context) {
        // null is handled by @NotNull
        if (password == null) {
            return true;
        }

        List<String> violations = violations(password);
        if (violations.isEmpty()) {
            return true;
        }

        context.disableDefaultConstraintViolation();
        for (String violation : violations) {
            context.buildConstraintViolationWithTemplate(escapeTemplate(violation)).addConstraintViolation();
        }
        return false;
    }

    // message templates treat braces and dollar signs as expressions
    private static String escapeTemplate(String message) {
        return message.replace("\\", "\\\\")
                .replace("{", "\\{")
                .replace("}", "\\}")
                .replace("$", "\\$");
    }

    /**
     * List every character-class rule the password breaks.
     *
     * @param password Plain text password
     * @return Violation messages, empty if the password is acceptable
     */
    public static List<String> violations(String password) {
        boolean upper = false;
        boolean lower = false;
        boolean digit = false;
        boolean special = false;

        for (char c : password.toCharArray()) {
            if (c >= 'A' && c <= 'Z') {
                upper = true;
            } else if (c >= 'a' && c <= 'z') {
                lower = true;
            } else if (c >= '0' && c <= '9') {
                digit = true;
            } else if (SPECIAL_CHARACTERS.indexOf(c) >= 0) {
                special = true;
            }
        }

        List<String> violations = new ArrayList<>();
        if (!upper) {
            violations.add(MISSING_UPPERCASE);
        }
        if (!lower) {
            violations.add(MISSING_LOWERCASE);
        }
        if (!digit) {
            violations.add(MISSING_DIGIT);
        }
        if (!special) {
            violations.add(MISSING_SPECIAL);
        }
        return violations;
    }
}
