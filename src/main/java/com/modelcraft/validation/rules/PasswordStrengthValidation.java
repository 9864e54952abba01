package com.modelcraft.validation.rules;

import com.modelcraft.fields.FieldBase;
import com.modelcraft.validation.ValidationRule;

import java.util.List;

/**
 * At least 8 characters with an upper-case letter, a lower-case letter and a digit.
 */
public class PasswordStrengthValidation extends ValidationRule {

    public static final int MIN_LENGTH = 8;

    public PasswordStrengthValidation() {
        super("Password must be at least 8 characters long and contain at least one uppercase letter, "
            + "one lowercase letter, and one number.");
    }

    @Override
    public String description() {
        return "Validates password strength (1 uppercase, 1 lowercase, 1 number, min 8 chars)";
    }

    @Override
    public boolean validate(Object value, FieldBase field) {
        if (isEmpty(value)) {
            return true;
        }
        var password = String.valueOf(value);
        return password.length() >= MIN_LENGTH
            && password.chars().anyMatch(Character::isUpperCase)
            && password.chars().anyMatch(Character::isLowerCase)
            && password.chars().anyMatch(Character::isDigit);
    }

    @Override
    public List<String> applicableFieldTypes() {
        return List.of("Password");
    }

    @Override
    public String javascriptValidation() {
        return """
            function validatePasswordStrength(value, fieldName) {
                if (!value || value === '') return { valid: true };
                if (value.length < 8) return { valid: false, message: 'Password must be at least 8 characters long.' };
                if (!/[A-Z]/.test(value)) return { valid: false, message: 'Password must contain at least one uppercase letter.' };
                if (!/[a-z]/.test(value)) return { valid: false, message: 'Password must contain at least one lowercase letter.' };
                if (!/[0-9]/.test(value)) return { valid: false, message: 'Password must contain at least one number.' };
                return { valid: true };
            }
            """;
    }
}
