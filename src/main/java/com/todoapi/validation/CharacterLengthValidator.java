package com.todoapi.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

/**
 * Validator for {@link CharacterLength}.
 */
public class CharacterLengthValidator implements ConstraintValidator<CharacterLength, String> {

    private int min;
    private int max;

    @Override
    public void initialize(CharacterLength constraint) {
        this.min = constraint.min();
        this.max = constraint.max();
    }

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        if (value == null) {
            return true;
        }
        int length = value.codePointCount(0, value.length());
        return length >= min && length <= max;
    }
}
