package com.modelcraft.validation.rules;

import com.modelcraft.fields.FieldBase;
import com.modelcraft.validation.ValidationRule;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Empty values pass; presence is {@link RequiredValidation}'s job.
 */
public class EmailValidation extends ValidationRule {

    private static final Pattern EMAIL = Pattern.compile("^[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}$");

    public EmailValidation() {
        super("Invalid email address format.");
    }

    @Override
    public String description() {
        return "Value must be a valid email address";
    }

    @Override
    public boolean validate(Object value, FieldBase field) {
        return isEmpty(value) || EMAIL.matcher(String.valueOf(value).trim()).matches();
    }

    @Override
    public List<String> applicableFieldTypes() {
        return List.of("Email", "Text");
    }

    @Override
    public String javascriptValidation() {
        return """
            function validateEmail(value, fieldName) {
                if (!value || value === '') return { valid: true };
                const emailRegex = /^[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}$/;
                return emailRegex.test(value) ? { valid: true } : { valid: false, message: 'Invalid email address format.' };
            }
            """;
    }
}
