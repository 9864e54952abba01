package com.modelcraft.validation.rules;

import com.modelcraft.fields.FieldBase;
import com.modelcraft.validation.ValidationRule;

import java.util.List;
import java.util.regex.Pattern;

public class AlphanumericValidation extends ValidationRule {

    private static final Pattern ALPHANUMERIC = Pattern.compile("^[A-Za-z0-9]+$");

    public AlphanumericValidation() {
        super("{fieldName} may only contain letters and numbers.");
    }

    @Override
    public String description() {
        return "Value may only contain letters and digits";
    }

    @Override
    public boolean validate(Object value, FieldBase field) {
        return isEmpty(value) || ALPHANUMERIC.matcher(String.valueOf(value)).matches();
    }

    @Override
    public List<String> applicableFieldTypes() {
        return List.of("Text");
    }

    @Override
    public String javascriptValidation() {
        return """
            function validateAlphanumeric(value, fieldName) {
                if (!value || value === '') return { valid: true };
                return /^[A-Za-z0-9]+$/.test(value)
                    ? { valid: true }
                    : { valid: false, message: fieldName + ' may only contain letters and numbers.' };
            }
            """;
    }
}
