package com.modelcraft.relationships;

import com.modelcraft.database.InMemoryDatabaseConnector;
import com.modelcraft.exception.ConstraintException;
import com.modelcraft.exception.ModelcraftException;
import com.modelcraft.exception.SchemaException;
import com.modelcraft.model.Model;
import com.modelcraft.model.ModelContext;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.modelcraft.TestFixtureLoader.NOW;
import static com.modelcraft.TestFixtureLoader.context;
import static com.modelcraft.TestFixtureLoader.engine;
import static com.modelcraft.TestFixtureLoader.fixtureProperties;
import static org.junit.jupiter.api.Assertions.*;

class RelationshipTest {

    private static final String QUOTES_TABLE = "rel_1_movies_M_movie_quotes";

    private final InMemoryDatabaseConnector connector = new InMemoryDatabaseConnector();
    private final ModelContext context = context(engine(fixtureProperties()), connector, "tester");

    // -----------------------------------------------------------------------
    // add / has
    // -----------------------------------------------------------------------

    @Test
    void add_insertsKeyedAndStampedRow() {
        var quotes = relationship("movies_movie_quotes");

        assertTrue(quotes.add(model("Movies", "m-1"), model("Movie_Quotes", "q-1")));

        var rows = connector.rows(QUOTES_TABLE);
        assertEquals(1, rows.size());
        var row = rows.get(0);
        assertEquals("m-1", row.get("one_movies_id"));
        assertEquals("q-1", row.get("many_movie_quotes_id"));
        assertNotNull(row.get("id"));
        assertEquals(NOW, row.get("created_at"));
        assertEquals("tester", row.get("created_by"));
        assertNull(row.get("deleted_at"));
        assertFalse(row.containsKey("created_by_name"));
    }

    @Test
    void add_alreadyLinkedRefused() {
        var quotes = relationship("movies_movie_quotes");
        var movie = model("Movies", "m-1");
        var quote = model("Movie_Quotes", "q-1");
        quotes.add(movie, quote);

        assertFalse(quotes.add(movie, quote));
        assertEquals(1, connector.rows(QUOTES_TABLE).size());
    }

    @Test
    void has_eitherArgumentOrder() {
        var quotes = relationship("movies_movie_quotes");
        var movie = model("Movies", "m-1");
        var quote = model("Movie_Quotes", "q-1");
        assertFalse(quotes.has(movie, quote));

        quotes.add(movie, quote);

        assertTrue(quotes.has(movie, quote));
        assertTrue(quotes.has(quote, movie));
        assertFalse(quotes.has(movie, model("Movie_Quotes", "q-2")));
    }

    @Test
    void add_setsAdditionalFields() {
        var usersRoles = relationship("users_roles");

        usersRoles.add(model("Users", "u-1"), model("Roles", "r-1"),
            Map.of("assigned_reason", "onboarding", "unknown_column", "ignored"));

        var row = connector.rows("rel_N_users_M_roles").get(0);
        assertEquals("onboarding", row.get("assigned_reason"));
        assertEquals("u-1", row.get("users_id"));
        assertFalse(row.containsKey("unknown_column"));
    }

    @Test
    void add_oneToOneReplacesExistingLink() {
        var profiles = relationship("users_profiles");
        var user = model("Users", "u-1");
        profiles.add(user, model("Profiles", "p-1"));

        assertTrue(profiles.add(user, model("Profiles", "p-2")));

        var rows = connector.rows("rel_1_users_1_profiles");
        assertEquals(2, rows.size());
        assertEquals(InMemoryDatabaseConnector.DELETED_AT, rows.get(0).get("deleted_at"));
        var related = profiles.relatedRecords(user);
        assertEquals(1, related.size());
        assertEquals("p-2", related.get(0).get("profiles_id"));
    }

    // -----------------------------------------------------------------------
    // remove / restore
    // -----------------------------------------------------------------------

    @Test
    void remove_softDeletesThroughSameInstance() {
        var quotes = relationship("movies_movie_quotes");
        var movie = model("Movies", "m-1");
        var quote = model("Movie_Quotes", "q-1");
        quotes.add(movie, quote);

        assertTrue(quotes.remove(movie, quote));

        var written = connector.written();
        assertSame(quotes, written.get(written.size() - 1));
        var row = connector.rows(QUOTES_TABLE).get(0);
        assertEquals(NOW, row.get("deleted_at"));
        assertEquals("tester", row.get("deleted_by"));
        assertFalse(quotes.has(movie, quote));
    }

    @Test
    void remove_nothingLinked() {
        var quotes = relationship("movies_movie_quotes");

        assertFalse(quotes.remove(model("Movies", "m-1"), model("Movie_Quotes", "q-1")));
        assertFalse(connector.calls().contains("update"));
    }

    @Test
    void restore_pairAfterRemove() {
        var quotes = relationship("movies_movie_quotes");
        var movie = model("Movies", "m-1");
        var quote = model("Movie_Quotes", "q-1");
        quotes.add(movie, quote);
        quotes.remove(movie, quote);

        assertTrue(quotes.restore(movie, quote));

        assertTrue(quotes.has(movie, quote));
        assertFalse(quotes.restore(movie, quote));
    }

    @Test
    void restore_everyRowOfModel() {
        var quotes = relationship("movies_movie_quotes");
        var movie = model("Movies", "m-1");
        quotes.add(movie, model("Movie_Quotes", "q-1"));
        quotes.add(movie, model("Movie_Quotes", "q-2"));
        quotes.handleModelDeletion(movie, CascadeAction.CASCADE);
        assertEquals(0, quotes.activeRelatedCount(movie));

        assertTrue(quotes.restore(movie));

        assertEquals(2, quotes.activeRelatedCount(movie));
    }

    @Test
    void relatedRecords_activeOnly() {
        var quotes = relationship("movies_movie_quotes");
        var movie = model("Movies", "m-1");
        var first = model("Movie_Quotes", "q-1");
        quotes.add(movie, first);
        quotes.add(movie, model("Movie_Quotes", "q-2"));
        quotes.remove(movie, first);

        var related = quotes.relatedRecords(movie);

        assertEquals(List.of("q-2"), related.stream().map(r -> r.get("many_movie_quotes_id")).toList());
        assertEquals(1, quotes.activeRelatedCount(movie));
    }

    @Test
    void deletedRelationshipRecords_softDeletedOnly() {
        var quotes = relationship("movies_movie_quotes");
        var movie = model("Movies", "m-1");
        var first = model("Movie_Quotes", "q-1");
        quotes.add(movie, first);
        quotes.add(movie, model("Movie_Quotes", "q-2"));
        quotes.remove(movie, first);

        var deleted = quotes.deletedRelationshipRecords(movie);

        assertEquals(List.of("q-1"), deleted.stream().map(r -> r.get("many_movie_quotes_id")).toList());
        assertEquals(NOW, deleted.get(0).get("deleted_at"));
    }

    // -----------------------------------------------------------------------
    // updateRelation
    // -----------------------------------------------------------------------

    @Test
    void updateRelation_changesAdditionalFields() {
        var usersRoles = relationship("users_roles");
        var user = model("Users", "u-1");
        var role = model("Roles", "r-1");
        usersRoles.add(user, role, Map.of("assigned_reason", "onboarding"));
        connector.rows("rel_N_users_M_roles").get(0).put("updated_at", "2020-01-01 00:00:00");

        assertTrue(usersRoles.updateRelation(user, role, Map.of("assigned_reason", "promotion", "users_id", "u-9")));

        var rows = connector.rows("rel_N_users_M_roles");
        assertEquals(1, rows.size());
        assertEquals("promotion", rows.get(0).get("assigned_reason"));
        assertEquals("u-1", rows.get(0).get("users_id"));
        assertEquals(NOW, rows.get(0).get("updated_at"));
        assertSame(usersRoles, connector.written().get(connector.written().size() - 1));
    }

    @Test
    void updateRelation_notLinked() {
        var usersRoles = relationship("users_roles");

        assertFalse(usersRoles.updateRelation(model("Users", "u-1"), model("Roles", "r-1"),
            Map.of("assigned_reason", "promotion")));
        assertFalse(connector.calls().contains("update"));
    }

    @Test
    void updateRelation_emptyDataIsNoOp() {
        var usersRoles = relationship("users_roles");

        assertTrue(usersRoles.updateRelation(model("Users", "u-1"), model("Roles", "r-1"), Map.of()));
        assertTrue(connector.calls().isEmpty());
    }

    // -----------------------------------------------------------------------
    // Pagination
    // -----------------------------------------------------------------------

    @Test
    void relatedPaginated_pagesOverActiveRows() {
        var quotes = relationship("movies_movie_quotes");
        var movie = model("Movies", "m-1");
        for (var id : List.of("q-1", "q-2", "q-3", "q-4", "q-5")) {
            quotes.add(movie, model("Movie_Quotes", id));
        }
        quotes.remove(movie, model("Movie_Quotes", "q-1"));

        var first = quotes.relatedPaginated(movie, 1, 3);
        var second = quotes.relatedPaginated(movie, 2, 3);

        assertEquals(List.of("q-2", "q-3", "q-4"), first.records().stream().map(r -> r.get("many_movie_quotes_id")).toList());
        assertEquals(4, first.total());
        assertEquals(2, first.totalPages());
        assertTrue(first.hasMore());
        assertEquals(List.of("q-5"), second.records().stream().map(r -> r.get("many_movie_quotes_id")).toList());
        assertFalse(second.hasMore());
    }

    @Test
    void relatedPaginated_rejectsPageZero() {
        var quotes = relationship("movies_movie_quotes");

        assertThrows(IllegalArgumentException.class, () -> quotes.relatedPaginated(model("Movies", "m-1"), 0, 10));
    }

    // -----------------------------------------------------------------------
    // Bulk removal
    // -----------------------------------------------------------------------

    @Test
    void softDeleteRelationship_everyActiveRowOfModel() {
        var usersRoles = relationship("users_roles");
        var user = model("Users", "u-1");
        usersRoles.add(user, model("Roles", "r-1"));
        usersRoles.add(user, model("Roles", "r-2"));
        usersRoles.add(model("Users", "u-2"), model("Roles", "r-1"));

        assertTrue(usersRoles.softDeleteRelationship(user));

        assertEquals(0, usersRoles.activeRelatedCount(user));
        assertEquals(1, usersRoles.activeRelatedCount(model("Users", "u-2")));
        assertFalse(usersRoles.softDeleteRelationship(user));
    }

    @Test
    void removeAllRelations_deletesRowsIncludingSoftDeleted() {
        var usersRoles = relationship("users_roles");
        var user = model("Users", "u-1");
        var admin = model("Roles", "r-1");
        usersRoles.add(user, admin);
        usersRoles.add(user, model("Roles", "r-2"));
        usersRoles.remove(user, admin);
        usersRoles.add(model("Users", "u-2"), admin);

        assertTrue(usersRoles.removeAllRelations(user));

        var rows = connector.rows("rel_N_users_M_roles");
        assertEquals(List.of("u-2"), rows.stream().map(r -> r.get("users_id")).toList());
        assertFalse(usersRoles.removeAllRelations(user));
    }

    // -----------------------------------------------------------------------
    // handleModelDeletion
    // -----------------------------------------------------------------------

    @Test
    void restrict_blocksWhileActiveRowsExist() {
        var quotes = relationship("movies_movie_quotes");
        var movie = model("Movies", "m-1");
        quotes.add(movie, model("Movie_Quotes", "q-1"));

        var ex = assertThrows(ConstraintException.class,
            () -> quotes.handleModelDeletion(movie, CascadeAction.RESTRICT));

        assertEquals("Cannot delete Movies with existing OneToMany relationships", ex.getMessage());
        assertEquals(1L, ex.getContext().get("activeRelationships"));
        assertNull(connector.rows(QUOTES_TABLE).get(0).get("deleted_at"));
    }

    @Test
    void restrict_allowsWithoutActiveRows() {
        var quotes = relationship("movies_movie_quotes");

        assertTrue(quotes.handleModelDeletion(model("Movies", "m-1"), "restrict"));
        assertFalse(connector.calls().contains("bulkSoftDeleteByFieldValue"));
    }

    @Test
    void cascade_softDeletesEveryRowOfModel() {
        var quotes = relationship("movies_movie_quotes");
        var movie = model("Movies", "m-1");
        quotes.add(movie, model("Movie_Quotes", "q-1"));
        quotes.add(movie, model("Movie_Quotes", "q-2"));
        quotes.add(model("Movies", "m-2"), model("Movie_Quotes", "q-3"));

        assertTrue(quotes.handleModelDeletion(movie, "cascade"));

        var rows = connector.rows(QUOTES_TABLE);
        assertEquals(InMemoryDatabaseConnector.DELETED_AT, rows.get(0).get("deleted_at"));
        assertEquals("tester", rows.get(1).get("deleted_by"));
        assertNull(rows.get(2).get("deleted_at"));
    }

    @Test
    void softDelete_sameAsCascade() {
        var quotes = relationship("movies_movie_quotes");
        var movie = model("Movies", "m-1");
        quotes.add(movie, model("Movie_Quotes", "q-1"));

        assertTrue(quotes.handleModelDeletion(movie, "softDelete"));
        assertEquals(0, quotes.activeRelatedCount(movie));
    }

    @Test
    void handleModelDeletion_unknownAction() {
        var quotes = relationship("movies_movie_quotes");

        assertThrows(SchemaException.class, () -> quotes.handleModelDeletion(model("Movies", "m-1"), "explode"));
    }

    @Test
    void connectorFailureWrapped() {
        var quotes = relationship("movies_movie_quotes");
        connector.failBulkOperationsWith(new IllegalStateException("database unavailable"));

        var ex = assertThrows(ModelcraftException.class,
            () -> quotes.handleModelDeletion(model("Movies", "m-1"), CascadeAction.CASCADE));

        assertEquals(ModelcraftException.class, ex.getClass());
        assertInstanceOf(IllegalStateException.class, ex.getCause());
        assertEquals(QUOTES_TABLE, ex.getContext().get("table"));
    }

    // -----------------------------------------------------------------------
    // Naming
    // -----------------------------------------------------------------------

    @Test
    void otherModelName_eitherSide() {
        var quotes = relationship("movies_movie_quotes");

        assertEquals("Movie_Quotes", quotes.otherModelName("Movies"));
        assertEquals("Movies", quotes.otherModelName("Movie_Quotes"));
        assertEquals("many_movie_quotes_id", quotes.modelIdField(model("Movie_Quotes", "q-1")));
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    private Relationship relationship(String name) {
        return context.relationshipFactory().create(name);
    }

    private Model model(String entity, String id) {
        var model = context.modelFactory().newModel(entity);
        model.populateFromRow(Map.of("id", id));
        return model;
    }
}
