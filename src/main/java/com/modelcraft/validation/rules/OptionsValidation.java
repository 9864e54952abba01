package com.modelcraft.validation.rules;

import com.modelcraft.fields.EnumField;
import com.modelcraft.fields.FieldBase;
import com.modelcraft.validation.ValidationRule;

import java.util.Collection;
import java.util.List;

/**
 * Value (or, for multi-choice fields, every element) must be one of the field's option keys.
 * A field without options accepts anything.
 */
public class OptionsValidation extends ValidationRule {

    public OptionsValidation() {
        super("{fieldName} must be one of the allowed options.");
    }

    @Override
    public String description() {
        return "Value must be one of the field's options";
    }

    @Override
    public boolean validate(Object value, FieldBase field) {
        if (isEmpty(value) || !(field instanceof EnumField enumField)) {
            return true;
        }
        var options = enumField.options();
        if (options.isEmpty()) {
            return true;
        }
        if (value instanceof Collection<?> values) {
            return values.stream().allMatch(v -> options.containsKey(String.valueOf(v)));
        }
        return options.containsKey(String.valueOf(value));
    }

    @Override
    public List<String> applicableFieldTypes() {
        return List.of("Enum", "MultiEnum", "RadioButtonSet");
    }

    @Override
    public String javascriptValidation() {
        return """
            function validateOptions(value, fieldName, options) {
                if (!options || Object.keys(options).length === 0) return { valid: true };
                if (value === null || value === undefined || value === '') return { valid: true };
                const values = Array.isArray(value) ? value : [value];
                return values.every(v => Object.prototype.hasOwnProperty.call(options, String(v)))
                    ? { valid: true }
                    : { valid: false, message: fieldName + ' must be one of the allowed options.' };
            }
            """;
    }
}
