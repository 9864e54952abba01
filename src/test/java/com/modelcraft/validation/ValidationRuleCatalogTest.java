package com.modelcraft.validation;

import com.modelcraft.database.InMemoryDatabaseConnector;
import com.modelcraft.exception.SchemaException;
import com.modelcraft.fields.RelatedRecordField;
import com.modelcraft.fixtures.rules.EvenNumberValidation;
import com.modelcraft.metadata.FieldDescriptor;
import com.modelcraft.validation.rules.ForeignKeyExistsValidation;
import com.modelcraft.validation.rules.RequiredValidation;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ValidationRuleCatalogTest {

    // -----------------------------------------------------------------------
    // Catalog
    // -----------------------------------------------------------------------

    @Test
    void scan_findsEveryBundledRuleSortedByName() {
        var names = new ValidationRuleCatalog().scan().stream().map(ValidationRuleDescriptor::name).toList();

        assertEquals(List.of("Alphanumeric", "Date", "DateTime", "Email", "ForeignKeyExists",
            "Options", "PasswordStrength", "Required", "URL", "Unique"), names);
    }

    @Test
    void scan_describesRule() {
        var rule = new ValidationRuleCatalog().find("PasswordStrength").orElseThrow();

        assertEquals("Validates password strength (1 uppercase, 1 lowercase, 1 number, min 8 chars)", rule.description());
        assertEquals(List.of("Password"), rule.applicableFieldTypes());
        assertTrue(rule.clientSideExpression().contains("validatePasswordStrength"));
        assertTrue(rule.appliesTo("Password"));
        assertFalse(rule.appliesTo("Text"));
    }

    @Test
    void scan_ruleWithoutTypesAppliesToAll() {
        var required = new ValidationRuleCatalog().find("Required").orElseThrow();

        assertEquals(RequiredValidation.class, required.implementingClass());
        assertTrue(required.applicableFieldTypes().isEmpty());
        assertTrue(required.appliesTo("Video"));
    }

    @Test
    void scan_skipsRulesThatCannotBeInstantiated() {
        var rules = new ValidationRuleCatalog("com.modelcraft.fixtures.rules").scan();

        assertEquals(1, rules.size());
        assertEquals("EvenNumber", rules.get(0).name());
        assertEquals(EvenNumberValidation.class, rules.get(0).implementingClass());
    }

    @Test
    void find_unknownName() {
        assertTrue(new ValidationRuleCatalog().find("Telepathy").isEmpty());
    }

    // -----------------------------------------------------------------------
    // Factory
    // -----------------------------------------------------------------------

    @Test
    void factory_createsFreshInstances() {
        var factory = new ValidationRuleFactory(new ValidationRuleCatalog(), null);

        var first = factory.create("Required");

        assertInstanceOf(RequiredValidation.class, first);
        assertNotSame(first, factory.create("Required"));
    }

    @Test
    void factory_unknownRule() {
        var factory = new ValidationRuleFactory(new ValidationRuleCatalog(), null);

        var ex = assertThrows(SchemaException.class, () -> factory.create("Telepathy"));
        assertEquals("Unknown validation rule: Telepathy", ex.getMessage());
    }

    @Test
    void factory_wiresConnectorIntoDatabaseRules() {
        var connector = new InMemoryDatabaseConnector().insert("users", Map.of("id", "u-1"));
        var factory = new ValidationRuleFactory(new ValidationRuleCatalog(), connector);
        var owner = new RelatedRecordField(FieldDescriptor.builder("owner_id", "RelatedRecord")
            .attribute(FieldDescriptor.RELATED_MODEL, "Users")
            .build());

        var rule = factory.create("ForeignKeyExists");

        assertInstanceOf(ForeignKeyExistsValidation.class, rule);
        assertTrue(rule.validate("u-1", owner));
        assertFalse(rule.validate("u-2", owner));
        assertEquals(List.of("recordExists", "recordExists"), connector.calls());
    }

    @Test
    void factory_databaseRuleWithoutConnectorFails() {
        var factory = new ValidationRuleFactory(new ValidationRuleCatalog(), null);
        var owner = new RelatedRecordField(FieldDescriptor.builder("owner_id", "RelatedRecord")
            .attribute(FieldDescriptor.RELATED_MODEL, "Users")
            .build());

        assertFalse(factory.create("ForeignKeyExists").validate("u-1", owner));
    }
}
