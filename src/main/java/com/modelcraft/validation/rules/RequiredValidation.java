package com.modelcraft.validation.rules;

import com.modelcraft.fields.FieldBase;
import com.modelcraft.validation.ValidationRule;

public class RequiredValidation extends ValidationRule {

    public RequiredValidation() {
        super("{fieldName} is required.");
    }

    @Override
    public String description() {
        return "Value must be present and not blank";
    }

    @Override
    public boolean validate(Object value, FieldBase field) {
        if (value instanceof Boolean || value instanceof Number) {
            return true;
        }
        return !isEmpty(value);
    }

    @Override
    public String javascriptValidation() {
        return """
            function validateRequired(value, fieldName) {
                if (value === null || value === undefined) return { valid: false, message: fieldName + ' is required.' };
                if (typeof value === 'string' && value.trim() === '') return { valid: false, message: fieldName + ' is required.' };
                if (Array.isArray(value) && value.length === 0) return { valid: false, message: fieldName + ' is required.' };
                return { valid: true };
            }
            """;
    }
}
