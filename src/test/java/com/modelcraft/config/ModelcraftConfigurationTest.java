package com.modelcraft.config;

import com.modelcraft.TestFixtureLoader;
import com.modelcraft.database.DatabaseConnector;
import com.modelcraft.database.InMemoryDatabaseConnector;
import com.modelcraft.metadata.FieldDescriptor;
import com.modelcraft.metadata.MetadataEngine;
import com.modelcraft.metadata.OptionsProvider;
import com.modelcraft.model.CurrentUserProvider;
import com.modelcraft.model.ModelFactory;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelcraftConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
        .withUserConfiguration(ModelcraftConfiguration.class, MetadataWarmup.class)
        .withPropertyValues(
            "modelcraft.metadata.models-path=" + TestFixtureLoader.fixtureDirectory("models"),
            "modelcraft.metadata.relationships-path=" + TestFixtureLoader.fixtureDirectory("relationships"),
            "modelcraft.metadata.cache-enabled=false");

    @Test
    void properties_defaults() {
        new ApplicationContextRunner()
            .withUserConfiguration(ModelcraftConfiguration.class)
            .run(context -> {
                var properties = context.getBean(MetadataProperties.class);
                assertEquals("metadata/models", properties.modelsPath());
                assertEquals("cache/metadata_cache.json", properties.effectiveCachePath());
                assertEquals("classpath:metadata/core_fields_metadata.json", properties.coreFieldsTemplate());
                assertEquals("com.modelcraft.fields", properties.fieldsPackage());
            });
    }

    @Test
    void engine_wiredAndColdUntilWarmup() {
        runner.run(context -> {
            assertNull(context.getStartupFailure());
            var engine = context.getBean(MetadataEngine.class);
            assertEquals(MetadataEngine.State.COLD, engine.state());

            context.getBean(MetadataWarmup.class).run();

            assertTrue(engine.isLoaded());
            assertTrue(engine.entityExists("Movies"));
        });
    }

    @Test
    void warmup_disabledByProperty() {
        runner.withPropertyValues("modelcraft.metadata.warmup=false")
            .run(context -> assertTrue(context.getBeansOfType(MetadataWarmup.class).isEmpty()));
    }

    @Test
    void applicationBeansContributed() {
        var connector = new InMemoryDatabaseConnector();
        runner
            .withBean(DatabaseConnector.class, () -> connector)
            .withBean(CurrentUserProvider.class, () -> () -> "operator")
            .withBean("genres", OptionsProvider.class, () -> TestFixtureLoader.options("genres", Map.of("drama", "Drama")))
            .run(context -> {
                var genre = context.getBean(MetadataEngine.class).entityMetadata("Movies").field("genre").orElseThrow();
                assertEquals(Map.of("drama", "Drama"), genre.attribute(FieldDescriptor.OPTIONS));

                var role = context.getBean(ModelFactory.class).newModel("Roles");
                role.set("name", "editor");
                assertTrue(role.create());
                assertEquals("operator", connector.rows("roles").get(0).get("created_by"));
            });
    }
}
