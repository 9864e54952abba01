package com.modelcraft.fields;

import com.modelcraft.validation.ValidationRuleDescriptor;

import java.util.List;

/**
 * Catalog entry for one discovered field type.
 *
 * @param validationRules rules applicable to this type
 */
public record FieldTypeDescriptor(
    String type,
    Class<? extends FieldBase> implementingClass,
    String description,
    String uiComponent,
    List<String> operators,
    List<ValidationRuleDescriptor> validationRules
) {
    public FieldTypeDescriptor {
        operators = operators != null ? List.copyOf(operators) : List.of();
        validationRules = validationRules != null ? List.copyOf(validationRules) : List.of();
    }

    public List<String> validationRuleNames() {
        return validationRules.stream().map(ValidationRuleDescriptor::name).toList();
    }
}
