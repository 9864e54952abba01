package com.modelcraft.validation.rules;

import com.modelcraft.fields.FieldBase;
import com.modelcraft.validation.ValidationRule;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.List;

/**
 * Accepts {@code yyyy-MM-dd HH:mm:ss}, ISO local and ISO offset date-times, and temporal objects.
 */
public class DateTimeValidation extends ValidationRule {

    private static final List<DateTimeFormatter> FORMATS = List.of(
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
        DateTimeFormatter.ISO_LOCAL_DATE_TIME,
        DateTimeFormatter.ISO_OFFSET_DATE_TIME);

    public DateTimeValidation() {
        super("Invalid date-time format for {fieldName}.");
    }

    @Override
    public String description() {
        return "Value must be a date and time (yyyy-MM-dd HH:mm:ss or ISO 8601)";
    }

    @Override
    public boolean validate(Object value, FieldBase field) {
        if (isEmpty(value) || value instanceof TemporalAccessor) {
            return true;
        }
        var text = String.valueOf(value).trim();
        return FORMATS.stream().anyMatch(format -> parses(text, format));
    }

    private static boolean parses(String text, DateTimeFormatter format) {
        try {
            if (format == DateTimeFormatter.ISO_OFFSET_DATE_TIME) {
                OffsetDateTime.parse(text, format);
            } else {
                LocalDateTime.parse(text, format);
            }
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    @Override
    public List<String> applicableFieldTypes() {
        return List.of("DateTime");
    }

    @Override
    public String javascriptValidation() {
        return """
            function validateDateTime(value, fieldName) {
                if (!value || value === '') return { valid: true };
                return isNaN(Date.parse(value.replace(' ', 'T')))
                    ? { valid: false, message: 'Invalid date-time format for ' + fieldName + '.' }
                    : { valid: true };
            }
            """;
    }
}
