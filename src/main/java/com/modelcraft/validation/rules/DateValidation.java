package com.modelcraft.validation.rules;

import com.modelcraft.fields.FieldBase;
import com.modelcraft.validation.ValidationRule;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.List;

public class DateValidation extends ValidationRule {

    public DateValidation() {
        super("Invalid date format for {fieldName}, expected yyyy-MM-dd.");
    }

    @Override
    public String description() {
        return "Value must be a calendar date (yyyy-MM-dd)";
    }

    @Override
    public boolean validate(Object value, FieldBase field) {
        if (isEmpty(value) || value instanceof TemporalAccessor) {
            return true;
        }
        try {
            LocalDate.parse(String.valueOf(value).trim());
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    @Override
    public List<String> applicableFieldTypes() {
        return List.of("Date");
    }

    @Override
    public String javascriptValidation() {
        return """
            function validateDate(value, fieldName) {
                if (!value || value === '') return { valid: true };
                return /^\\d{4}-\\d{2}-\\d{2}$/.test(value) && !isNaN(Date.parse(value))
                    ? { valid: true }
                    : { valid: false, message: 'Invalid date format for ' + fieldName + ', expected yyyy-MM-dd.' };
            }
            """;
    }
}
