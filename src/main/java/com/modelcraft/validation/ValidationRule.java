package com.modelcraft.validation;

import com.modelcraft.fields.FieldBase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * A named check applied to a field value. Concrete rules are discovered by
 * {@link ValidationRuleCatalog} and need a public no-arg constructor.
 *
 * <p>The rule name is the simple class name without the {@code Validation} suffix.
 */
public abstract class ValidationRule {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final String errorMessage;

    protected ValidationRule(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public String name() {
        return ruleName(getClass());
    }

    public abstract String description();

    /**
     * @return true when {@code value} passes; {@code field} gives access to the field's
     *         descriptor and table
     */
    public abstract boolean validate(Object value, FieldBase field);

    /** Client-side equivalent of {@link #validate}, empty when the rule is server-side only. */
    public String javascriptValidation() {
        return "";
    }

    /** Field types the rule makes sense for; empty means all. */
    public List<String> applicableFieldTypes() {
        return List.of();
    }

    public String errorMessage() {
        return errorMessage;
    }

    /** Error message with {@code {fieldName}} and {@code {value}} substituted. */
    public String formatErrorMessage(FieldBase field, Object value) {
        var message = errorMessage();
        if (field != null) {
            message = message.replace("{fieldName}", field.name());
        }
        if (value != null) {
            message = message.replace("{value}", String.valueOf(value));
        }
        return message;
    }

    public static String ruleName(Class<? extends ValidationRule> type) {
        var simple = type.getSimpleName();
        return simple.endsWith("Validation") && simple.length() > "Validation".length()
            ? simple.substring(0, simple.length() - "Validation".length())
            : simple;
    }

    /** Null, blank strings and empty collections or maps. */
    protected static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence s) {
            return s.toString().isBlank();
        }
        if (value instanceof Collection<?> c) {
            return c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return m.isEmpty();
        }
        return false;
    }
}
