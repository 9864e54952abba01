package com.modelcraft.validation.rules;

import com.modelcraft.fields.FieldBase;
import com.modelcraft.validation.ValidationRule;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Absolute http(s) or ftp URL with a host.
 */
public class URLValidation extends ValidationRule {

    private static final Set<String> SCHEMES = Set.of("http", "https", "ftp");

    public URLValidation() {
        super("Invalid URL format.");
    }

    @Override
    public String description() {
        return "Value must be an absolute http, https or ftp URL";
    }

    @Override
    public boolean validate(Object value, FieldBase field) {
        if (isEmpty(value)) {
            return true;
        }
        try {
            var uri = new URI(String.valueOf(value).trim());
            return uri.getScheme() != null
                && SCHEMES.contains(uri.getScheme().toLowerCase(Locale.ROOT))
                && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    @Override
    public List<String> applicableFieldTypes() {
        return List.of("Text", "Image", "Video");
    }

    @Override
    public String javascriptValidation() {
        return """
            function validateURL(value, fieldName) {
                if (!value || value === '') return { valid: true };
                try {
                    const url = new URL(value);
                    return ['http:', 'https:', 'ftp:'].includes(url.protocol)
                        ? { valid: true }
                        : { valid: false, message: 'Invalid URL format.' };
                } catch (e) {
                    return { valid: false, message: 'Invalid URL format.' };
                }
            }
            """;
    }
}
