package com.modelcraft.relationships;

import com.modelcraft.exception.SchemaException;
import com.modelcraft.metadata.FieldDescriptor;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RelationshipResolverTest {

    private final RelationshipResolver resolver = new RelationshipResolver();

    // -----------------------------------------------------------------------
    // validate
    // -----------------------------------------------------------------------

    @Test
    void validate_oneToMany() {
        var definition = resolver.validate(oneToMany("movies_movie_quotes", "Movies", "Movie_Quotes"));

        assertEquals(RelationshipType.ONE_TO_MANY, definition.type());
        assertEquals(List.of("Movies", "Movie_Quotes"), definition.participants());
        assertEquals(CascadeAction.RESTRICT, definition.cascadeAction());
        assertNull(definition.sourceModel());
    }

    @Test
    void validate_missingModelOne() {
        var raw = Map.of("name", "movies_movie_quotes", "type", "OneToMany", "modelMany", "Movie_Quotes");

        var ex = assertThrows(SchemaException.class, () -> resolver.validate(raw));
        assertEquals("Relationship 'movies_movie_quotes' is missing required key 'modelOne'", ex.getMessage());
    }

    @Test
    void validate_missingName() {
        var ex = assertThrows(SchemaException.class,
            () -> resolver.validate(Map.of("type", "ManyToMany", "modelA", "Users", "modelB", "Roles")));
        assertEquals("Relationship metadata is missing required key 'name'", ex.getMessage());
    }

    @Test
    void validate_unknownType() {
        var raw = Map.of("name", "x", "type", "Bogus", "modelA", "A", "modelB", "B");

        var ex = assertThrows(SchemaException.class, () -> resolver.validate(raw));
        assertEquals("Unknown relationship type: Bogus", ex.getMessage());
    }

    @Test
    void validate_unknownCascadeAction() {
        var raw = Map.of("name", "x", "type", "ManyToMany", "modelA", "A", "modelB", "B", "cascadeAction", "explode");

        assertThrows(SchemaException.class, () -> resolver.validate(raw));
    }

    @Test
    void validate_additionalFieldsAsList() {
        var raw = new LinkedHashMap<String, Object>(manyToMany("users_roles", "Users", "Roles"));
        raw.put("additionalFields", List.of(Map.of("name", "assigned_reason", "type", "Text")));

        var definition = resolver.validate(raw);

        assertEquals("Text", definition.additionalFields().get("assigned_reason").type());
    }

    // -----------------------------------------------------------------------
    // Table names
    // -----------------------------------------------------------------------

    @Test
    void tableName_perType() {
        assertEquals("rel_1_movies_M_movie_quotes",
            resolver.tableName(resolver.validate(oneToMany("movies_movie_quotes", "Movies", "Movie_Quotes"))));
        assertEquals("rel_1_users_1_profiles",
            resolver.tableName(resolver.validate(oneToOne("users_profiles", "Users", "Profiles"))));
        assertEquals("rel_N_users_M_roles",
            resolver.tableName(resolver.validate(manyToMany("users_roles", "Users", "Roles"))));
    }

    @Test
    void tableName_truncatedTo64() {
        var definition = resolver.validate(manyToMany("long",
            "Organisation_Membership_Applications", "Organisation_Membership_Approvals"));

        var untruncated = "rel_N_organisation_membership_applications_M_organisation_membership_approvals";
        var table = resolver.tableName(definition);

        assertEquals(RelationshipResolver.MAX_TABLE_NAME_LENGTH, table.length());
        assertEquals(untruncated.substring(0, 64), table);
    }

    @Test
    void tableName_independentOfDefaultLocale() {
        var previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            var definition = resolver.validate(oneToOne("items_ids", "ITEMS", "ID_CARDS"));

            assertEquals("rel_1_items_1_id_cards", resolver.tableName(definition));
            assertEquals(List.of("items_id", "id_cards_id"), List.copyOf(resolver.foreignKeyFields(definition).keySet()));
        } finally {
            Locale.setDefault(previous);
        }
    }

    // -----------------------------------------------------------------------
    // Generated keys
    // -----------------------------------------------------------------------

    @Test
    void foreignKeyFields_oneToMany() {
        var keys = resolver.foreignKeyFields(resolver.validate(oneToMany("movies_movie_quotes", "Movies", "Movie_Quotes")));

        assertEquals(List.of("one_movies_id", "many_movie_quotes_id"), List.copyOf(keys.keySet()));
        var one = keys.get("one_movies_id");
        assertEquals("ID", one.type());
        assertTrue(one.required());
        assertEquals("Movies", one.relatedModel());
        assertEquals("id", one.stringAttribute(FieldDescriptor.RELATED_FIELD_NAME));
        assertEquals("Movies ID", one.label());
        assertEquals(List.of("ForeignKeyExists"), one.validationRules());
    }

    @Test
    void foreignKeyFields_oneToOneAreUnique() {
        var keys = resolver.foreignKeyFields(resolver.validate(oneToOne("users_profiles", "Users", "Profiles")));

        assertEquals(List.of("users_id", "profiles_id"), List.copyOf(keys.keySet()));
        assertEquals(List.of("ForeignKeyExists", "Unique"), keys.get("profiles_id").validationRules());
    }

    // -----------------------------------------------------------------------
    // resolve
    // -----------------------------------------------------------------------

    @Test
    void resolve_orderCoreKeysAdditional() {
        var raw = new LinkedHashMap<String, Object>(manyToMany("users_roles", "Users", "Roles"));
        raw.put("additionalFields", Map.of("assigned_reason", Map.of("type", "Text")));

        var metadata = resolver.resolve(resolver.validate(raw), core());

        assertEquals(List.of("id", "deleted_at", "users_id", "roles_id", "assigned_reason"),
            List.copyOf(metadata.fields().keySet()));
        assertEquals("rel_N_users_M_roles", metadata.tableName());
    }

    @Test
    void resolve_additionalFieldCannotReplaceKey() {
        var raw = new LinkedHashMap<String, Object>(manyToMany("users_roles", "Users", "Roles"));
        raw.put("additionalFields", Map.of("users_id", Map.of("type", "Text")));

        var metadata = resolver.resolve(resolver.validate(raw), core());

        assertEquals("ID", metadata.fields().get("users_id").type());
    }

    @Test
    void resolve_additionalFieldMayReplaceCoreField() {
        var raw = new LinkedHashMap<String, Object>(manyToMany("users_roles", "Users", "Roles"));
        raw.put("additionalFields", Map.of("deleted_at", Map.of("type", "Date")));

        var metadata = resolver.resolve(resolver.validate(raw), core());

        assertEquals("Date", metadata.fields().get("deleted_at").type());
    }

    // -----------------------------------------------------------------------
    // modelIdField
    // -----------------------------------------------------------------------

    @Test
    void modelIdField_oneToManySides() {
        var metadata = resolver.resolve(resolver.validate(oneToMany("movies_movie_quotes", "Movies", "Movie_Quotes")), core());

        assertEquals("one_movies_id", resolver.modelIdField(metadata, "Movies"));
        assertEquals("one_movies_id", resolver.modelIdField(metadata, "movies"));
        assertEquals("many_movie_quotes_id", resolver.modelIdField(metadata, "Movie_Quotes"));
    }

    @Test
    void modelIdField_symmetricTypes() {
        var metadata = resolver.resolve(resolver.validate(manyToMany("users_roles", "Users", "Roles")), core());

        assertEquals("users_id", resolver.modelIdField(metadata, "Users"));
        assertEquals("roles_id", resolver.modelIdField(metadata, "Roles"));
    }

    // -----------------------------------------------------------------------
    // Enum parsing
    // -----------------------------------------------------------------------

    @Test
    void cascadeAction_fromValue() {
        assertEquals(CascadeAction.SOFT_DELETE, CascadeAction.fromValue("softDelete"));
        var ex = assertThrows(SchemaException.class, () -> CascadeAction.fromValue("nuke"));
        assertEquals("Unknown cascade action: nuke", ex.getMessage());
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    private static Map<String, FieldDescriptor> core() {
        var fields = new LinkedHashMap<String, FieldDescriptor>();
        fields.put("id", FieldDescriptor.builder("id", "ID").required(true).build());
        fields.put("deleted_at", FieldDescriptor.builder("deleted_at", "DateTime").nullable(true).build());
        return fields;
    }

    private static Map<String, Object> oneToMany(String name, String one, String many) {
        return Map.of("name", name, "type", "OneToMany", "modelOne", one, "modelMany", many);
    }

    private static Map<String, Object> oneToOne(String name, String a, String b) {
        return Map.of("name", name, "type", "OneToOne", "modelA", a, "modelB", b);
    }

    private static Map<String, Object> manyToMany(String name, String a, String b) {
        return Map.of("name", name, "type", "ManyToMany", "modelA", a, "modelB", b);
    }
}
