package com.modelcraft.fields;

import com.modelcraft.metadata.FieldDescriptor;
import com.modelcraft.validation.ValidationRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * A live field of a model: descriptor, current value and the rules guarding it.
 *
 * <p>Concrete subclasses are discovered by {@link FieldTypeCatalog} and must expose a public
 * {@code (FieldDescriptor)} constructor. Their type name is the class name without the
 * {@code Field} suffix.
 */
public abstract class FieldBase {

    private static final Logger log = LoggerFactory.getLogger(FieldBase.class);

    protected static final List<String> BASIC_OPERATORS = List.of("equals", "notEquals", "isNull", "isNotNull");

    private final FieldDescriptor descriptor;
    private final List<ValidationRule> validationRules = new ArrayList<>();
    private final List<String> validationErrors = new ArrayList<>();

    private String tableName = "";
    private Supplier<Object> recordId = () -> null;
    private Object value;
    private Object originalValue;

    protected FieldBase(FieldDescriptor descriptor) {
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
        this.value = descriptor.defaultValue();
        this.originalValue = value;
    }

    /** Name of the front-end component that renders this type. */
    public abstract String uiComponent();

    /** Operators of the type when metadata does not declare its own. */
    protected List<String> defaultOperators() {
        return BASIC_OPERATORS;
    }

    public List<String> operators() {
        return descriptor.operators().isEmpty() ? defaultOperators() : descriptor.operators();
    }

    public String name() {
        return descriptor.name();
    }

    public String type() {
        return typeName(getClass());
    }

    public FieldDescriptor descriptor() {
        return descriptor;
    }

    public boolean isDbField() {
        return descriptor.dbField();
    }

    public boolean isRequired() {
        return descriptor.required();
    }

    public boolean isReadOnly() {
        return descriptor.readOnly();
    }

    public Object getValue() {
        return value;
    }

    public Object getOriginalValue() {
        return originalValue;
    }

    /**
     * Validate and store {@code newValue}. On failure the previous value is kept and the errors
     * are available from {@link #validationErrors()}.
     *
     * @return whether the value was accepted
     */
    public boolean setValue(Object newValue) {
        var previous = value;
        value = normalize(newValue);
        if (validate()) {
            originalValue = previous;
            return true;
        }
        log.warn("setValue failed validation for field '{}': attempted {}, errors {}, keeping {}",
            name(), newValue, validationErrors, previous);
        value = previous;
        return false;
    }

    /** Store a value loaded from the database without validating it. */
    public void setValueFromTrustedSource(Object newValue) {
        originalValue = value;
        value = newValue;
    }

    /** Type coercion applied before validation, e.g. numeric strings to numbers. */
    protected Object normalize(Object raw) {
        return raw;
    }

    /** Run every rule against the current value. */
    public boolean validate() {
        validationErrors.clear();
        for (var rule : validationRules) {
            if (!rule.validate(value, this)) {
                validationErrors.add(rule.formatErrorMessage(this, value));
            }
        }
        return validationErrors.isEmpty();
    }

    public List<String> validationErrors() {
        return List.copyOf(validationErrors);
    }

    public void addValidationRule(ValidationRule rule) {
        validationRules.add(rule);
    }

    public List<ValidationRule> validationRules() {
        return List.copyOf(validationRules);
    }

    public String tableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName != null ? tableName : "";
    }

    /** Id of the record owning this field, null while unsaved or detached. */
    public Object recordId() {
        return recordId.get();
    }

    public void setRecordIdSource(Supplier<Object> recordId) {
        this.recordId = recordId != null ? recordId : () -> null;
    }

    public static String typeName(Class<? extends FieldBase> type) {
        var simple = type.getSimpleName();
        return simple.endsWith("Field") && simple.length() > "Field".length()
            ? simple.substring(0, simple.length() - "Field".length())
            : simple;
    }

    @Override
    public String toString() {
        return "%s[%s=%s]".formatted(getClass().getSimpleName(), name(), value);
    }
}
