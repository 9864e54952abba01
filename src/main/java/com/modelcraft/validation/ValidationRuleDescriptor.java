package com.modelcraft.validation;

import java.util.List;

/**
 * Catalog entry for one discovered validation rule.
 */
public record ValidationRuleDescriptor(
    String name,
    Class<? extends ValidationRule> implementingClass,
    String description,
    String clientSideExpression,
    List<String> applicableFieldTypes
) {
    public ValidationRuleDescriptor {
        description = description != null ? description : "";
        clientSideExpression = clientSideExpression != null ? clientSideExpression : "";
        applicableFieldTypes = applicableFieldTypes != null ? List.copyOf(applicableFieldTypes) : List.of();
    }

    public boolean appliesTo(String fieldType) {
        return applicableFieldTypes.isEmpty() || applicableFieldTypes.contains(fieldType);
    }
}
