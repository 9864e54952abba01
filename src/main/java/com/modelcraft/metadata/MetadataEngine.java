package com.modelcraft.metadata;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.modelcraft.config.MetadataProperties;
import com.modelcraft.exception.ConfigurationException;
import com.modelcraft.exception.NotFoundException;
import com.modelcraft.exception.SchemaException;
import com.modelcraft.fields.FieldBase;
import com.modelcraft.fields.FieldTypeCatalog;
import com.modelcraft.fields.FieldTypeDescriptor;
import com.modelcraft.model.ModelClassRegistry;
import com.modelcraft.relationships.Relationship;
import com.modelcraft.relationships.RelationshipMetadata;
import com.modelcraft.relationships.RelationshipResolver;
import com.modelcraft.validation.ValidationRule;
import com.modelcraft.validation.ValidationRuleCatalog;
import com.modelcraft.validation.ValidationRuleDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.ClassUtils;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads entity and relationship schemas, merges core fields, resolves relationships and keeps the
 * result for the life of the process.
 *
 * <p>The engine starts {@link State#COLD}. The first load (explicit, or triggered by the first
 * lookup) reads the cache file when there is one, otherwise the schema directories, and leaves it
 * {@link State#WARM}. While warm every call is answered from memory.
 *
 * <p>Not thread-safe.
 */
public class MetadataEngine {

    private static final Logger log = LoggerFactory.getLogger(MetadataEngine.class);

    public enum State { COLD, LOADING, WARM }

    /** Overview row of one entity. */
    public record EntitySummary(String name, String table, String description, int fieldCount, int relationshipCount) {
    }

    private final MetadataProperties properties;
    private final CoreFieldsProvider coreFields;
    private final ValidationRuleCatalog ruleCatalog;
    private final FieldTypeCatalog fieldTypeCatalog;
    private final RelationshipResolver resolver;
    private final OptionsProviderRegistry optionsProviders;
    private final ModelClassRegistry modelClasses;
    private final SchemaSource schemaSource;
    private final MetadataCacheStore cacheStore;

    private State state = State.COLD;
    private MetadataSnapshot snapshot;
    private boolean skipCacheStore;

    public MetadataEngine(MetadataProperties properties,
                          ObjectMapper mapper,
                          CoreFieldsProvider coreFields,
                          ValidationRuleCatalog ruleCatalog,
                          FieldTypeCatalog fieldTypeCatalog,
                          RelationshipResolver resolver,
                          OptionsProviderRegistry optionsProviders,
                          ModelClassRegistry modelClasses) {
        this.properties = properties;
        this.coreFields = coreFields;
        this.ruleCatalog = ruleCatalog;
        this.fieldTypeCatalog = fieldTypeCatalog;
        this.resolver = resolver;
        this.optionsProviders = optionsProviders;
        this.modelClasses = modelClasses;
        this.schemaSource = new SchemaSource(mapper);
        this.cacheStore = new MetadataCacheStore(mapper, properties.effectiveCachePath());
    }

    public State state() {
        return state;
    }

    public boolean isLoaded() {
        return state == State.WARM;
    }

    /**
     * The warm snapshot, loading it first when the engine is cold. A warm engine returns the same
     * instance without touching the file system.
     *
     * @throws ConfigurationException when the core field template or a schema directory setting is missing
     */
    public MetadataSnapshot loadAllMetadata() {
        if (state == State.WARM && snapshot != null) {
            return snapshot;
        }
        state = State.LOADING;
        try {
            var loaded = skipCacheStore ? null : readCacheStore();
            if (loaded == null) {
                loaded = buildFromSources();
                cacheStore.write(loaded.toMap());
            }
            snapshot = loaded;
            skipCacheStore = false;
            state = State.WARM;
            log.info("Metadata loaded: {} entities, {} relationships, {} field types, {} validation rules",
                loaded.entities().size(), loaded.relationships().size(),
                loaded.fieldTypes().size(), loaded.validationRules().size());
            return loaded;
        } catch (RuntimeException e) {
            state = State.COLD;
            throw e;
        }
    }

    /** Drop everything and load again from the schema files. */
    public MetadataSnapshot reload() {
        clearAllCaches();
        return loadAllMetadata();
    }

    /**
     * @throws NotFoundException when no entity has exactly this name
     */
    public EntityMetadata entityMetadata(String entityName) {
        var entities = warm().entities();
        var entity = entities.get(entityName);
        if (entity == null) {
            log.warn("Entity metadata not found for '{}'", entityName);
            throw new NotFoundException("Entity", entityName, sortedNames(entities));
        }
        return entity;
    }

    /**
     * @throws NotFoundException when no relationship has exactly this name
     */
    public RelationshipMetadata relationshipMetadata(String relationshipName) {
        var relationships = warm().relationships();
        var relationship = relationships.get(relationshipName);
        if (relationship == null) {
            log.warn("Relationship metadata not found for '{}'", relationshipName);
            throw new NotFoundException("Relationship", relationshipName, sortedNames(relationships));
        }
        return relationship;
    }

    public List<String> availableEntities() {
        return List.copyOf(warm().entities().keySet());
    }

    public boolean entityExists(String entityName) {
        return warm().entities().containsKey(entityName);
    }

    /**
     * Every relationship: standalone ones under their name, ones declared inside an entity schema
     * under {@code Entity.relationship}.
     */
    public Map<String, RelationshipMetadata> allRelationships() {
        var all = new LinkedHashMap<String, RelationshipMetadata>();
        warm().relationships().values().forEach(relationship -> {
            var key = relationship.sourceModel() == null
                ? relationship.name()
                : relationship.sourceModel() + "." + relationship.name();
            all.put(key, relationship);
        });
        return all;
    }

    public Map<String, FieldTypeDescriptor> fieldTypeDefinitions() {
        return warm().fieldTypes();
    }

    public Map<String, ValidationRuleDescriptor> validationRuleDefinitions() {
        return warm().validationRules();
    }

    public List<EntitySummary> entitySummaries() {
        return warm().entities().values().stream()
            .map(e -> new EntitySummary(e.name(), e.table(), e.description(), e.fields().size(), e.relationships().size()))
            .toList();
    }

    /** Where the schema of {@code entityName} lives by convention. */
    public Path modelMetadataPath(String entityName) {
        return conventionalPath(properties.modelsPath(), "entity", entityName);
    }

    public Path relationshipMetadataPath(String relationshipName) {
        return conventionalPath(properties.relationshipsPath(), "relationship", relationshipName);
    }

    /**
     * Forget one entity (and a relationship of the same name). The engine goes cold; the next load
     * reads the schema files rather than the cache file.
     */
    public void clearCacheForEntity(String entityName) {
        var name = resolveEntityIdentifier(entityName);
        if (snapshot != null) {
            snapshot = snapshot.withoutEntity(name);
        }
        skipCacheStore = true;
        state = State.COLD;
        log.info("Cache cleared for entity: {}", name);
    }

    /** Empty the in-memory cache, delete the cache file and clear the core field caches. */
    public void clearAllCaches() {
        snapshot = null;
        state = State.COLD;
        cacheStore.delete();
        coreFields.clearCache();
        ruleCatalog.refresh();
        fieldTypeCatalog.refresh();
        log.info("All metadata caches cleared");
    }

    /**
     * Last segment of a possibly namespaced identifier: {@code com.example.Movies},
     * {@code App\Models\Movies} and {@code models/Movies} all give {@code Movies}.
     */
    public String resolveEntityIdentifier(String identifier) {
        if (identifier == null) {
            return null;
        }
        var segments = Arrays.stream(identifier.split("[.\\\\/$]"))
            .filter(s -> !s.isBlank())
            .toList();
        return segments.isEmpty() ? identifier : segments.get(segments.size() - 1);
    }

    // -----------------------------------------------------------------------
    // Loading
    // -----------------------------------------------------------------------

    private MetadataSnapshot warm() {
        return state == State.WARM && snapshot != null ? snapshot : loadAllMetadata();
    }

    private MetadataSnapshot buildFromSources() {
        log.info("Rebuilding metadata from {} and {}", properties.modelsPath(), properties.relationshipsPath());

        var rules = new LinkedHashMap<String, ValidationRuleDescriptor>();
        ruleCatalog.scan().forEach(rule -> rules.put(rule.name(), rule));
        var fieldTypes = new LinkedHashMap<String, FieldTypeDescriptor>();
        fieldTypeCatalog.scan().forEach(type -> fieldTypes.put(type.type(), type));

        // template problems are configuration errors, not per-entity ones
        coreFields.standardCoreFields();

        var entities = new LinkedHashMap<String, EntityMetadata>();
        for (var document : schemaSource.scan(properties.modelsPath(), "entity")) {
            try {
                var declared = EntityMetadata.fromMap(document.name(), document.data());
                var merged = declared.withCoreFields(coreFields.allCoreFieldsForModel(modelClasses.classFor(declared.name())));
                entities.put(merged.name(), resolveOptions(merged));
            } catch (SchemaException e) {
                log.warn("Skipping entity schema {}: {}", document.path(), e.getMessage());
            }
        }

        var relationshipCore = coreFields.allCoreFieldsForModel(Relationship.class);
        var relationships = new LinkedHashMap<String, RelationshipMetadata>();
        for (var document : schemaSource.scan(properties.relationshipsPath(), "relationship")) {
            try {
                var definition = resolver.validate(document.data());
                relationships.put(definition.name(), resolver.resolve(definition, relationshipCore));
            } catch (SchemaException e) {
                log.warn("Skipping relationship schema {}: {}", document.path(), e.getMessage());
            }
        }
        for (var entity : entities.values()) {
            for (var inline : entity.inlineRelationships()) {
                try {
                    var definition = resolver.validate(inline).withSourceModel(entity.name());
                    var existing = relationships.get(definition.name());
                    if (existing != null) {
                        log.warn("Relationship '{}' declared in {} is shadowed by the one from {}", definition.name(),
                            entity.name(), existing.sourceModel() != null ? existing.sourceModel() : "the relationships directory");
                        continue;
                    }
                    relationships.put(definition.name(), resolver.resolve(definition, relationshipCore));
                } catch (SchemaException e) {
                    log.warn("Skipping relationship declared in entity {}: {}", entity.name(), e.getMessage());
                }
            }
        }

        var built = new MetadataSnapshot(entities, relationships, fieldTypes, rules);
        validateAggregate(built);
        return built;
    }

    private EntityMetadata resolveOptions(EntityMetadata entity) {
        var fields = new LinkedHashMap<String, FieldDescriptor>();
        entity.fields().forEach((fieldName, field) -> {
            var providerName = field.stringAttribute(FieldDescriptor.OPTIONS_PROVIDER);
            if (providerName == null) {
                fields.put(fieldName, field);
                return;
            }
            var provider = optionsProviders.find(providerName);
            if (provider.isEmpty()) {
                log.warn("Field {}.{} names unknown options provider '{}'; known: {}",
                    entity.name(), fieldName, providerName, optionsProviders.names());
                fields.put(fieldName, field);
                return;
            }
            Map<String, String> options;
            try {
                options = new LinkedHashMap<>(provider.get().options());
            } catch (RuntimeException e) {
                throw new SchemaException("Options provider '%s' failed for %s.%s".formatted(providerName, entity.name(), fieldName),
                    Map.of("entity", entity.name(), "field", fieldName, "optionsProvider", providerName), e);
            }
            fields.put(fieldName, field.withAttribute(FieldDescriptor.OPTIONS, options));
        });
        return entity.withFields(fields);
    }

    /** Cross-references between entities, relationships and field types. Reported, not enforced. */
    private void validateAggregate(MetadataSnapshot loaded) {
        for (var entity : loaded.entities().values()) {
            for (var field : entity.fields().values()) {
                if (!loaded.fieldTypes().containsKey(field.type())) {
                    log.warn("Entity {} field '{}' has unknown type '{}'", entity.name(), field.name(), field.type());
                }
            }
            for (var relationshipName : entity.relationships()) {
                if (!loaded.relationships().containsKey(relationshipName)) {
                    log.warn("Entity {} references undefined relationship '{}'", entity.name(), relationshipName);
                }
            }
        }
        for (var relationship : loaded.relationships().values()) {
            for (var participant : relationship.definition().participants()) {
                if (!loaded.entities().containsKey(participant)) {
                    log.warn("Relationship {} refers to unknown entity '{}'", relationship.name(), participant);
                }
            }
        }
    }

    // -----------------------------------------------------------------------
    // Cache file
    // -----------------------------------------------------------------------

    private MetadataSnapshot readCacheStore() {
        if (!cacheStore.isEnabled()) {
            return null;
        }
        var blob = cacheStore.read();
        if (blob.isEmpty()) {
            return null;
        }
        try {
            var restored = fromBlob(blob.get());
            log.debug("Using cached metadata: {} entities, {} relationships",
                restored.entities().size(), restored.relationships().size());
            return restored;
        } catch (ClassNotFoundException | RuntimeException e) {
            log.warn("Ignoring metadata cache, rebuilding from schema files: {}", e.getMessage());
            return null;
        }
    }

    private MetadataSnapshot fromBlob(Map<String, Object> blob) throws ClassNotFoundException {
        var loader = getClass().getClassLoader();

        var rules = new LinkedHashMap<String, ValidationRuleDescriptor>();
        for (var entry : section(blob, "validationRules").entrySet()) {
            var raw = cacheObject(entry.getKey(), entry.getValue());
            rules.put(entry.getKey(), new ValidationRuleDescriptor(
                entry.getKey(),
                ClassUtils.forName(String.valueOf(raw.get("class")), loader).asSubclass(ValidationRule.class),
                stringOrNull(raw.get("description")),
                stringOrNull(raw.get("javascriptValidation")),
                SchemaMaps.strings(raw.get("applicableFieldTypes"))));
        }

        var fieldTypes = new LinkedHashMap<String, FieldTypeDescriptor>();
        for (var entry : section(blob, "fieldTypes").entrySet()) {
            var raw = cacheObject(entry.getKey(), entry.getValue());
            var applicable = new ArrayList<ValidationRuleDescriptor>();
            for (var ruleName : SchemaMaps.strings(raw.get("validationRules"))) {
                if (rules.containsKey(ruleName)) {
                    applicable.add(rules.get(ruleName));
                }
            }
            fieldTypes.put(entry.getKey(), new FieldTypeDescriptor(
                entry.getKey(),
                ClassUtils.forName(String.valueOf(raw.get("class")), loader).asSubclass(FieldBase.class),
                stringOrNull(raw.get("description")),
                stringOrNull(raw.get("uiComponent")),
                SchemaMaps.strings(raw.get("operators")),
                applicable));
        }

        var entities = new LinkedHashMap<String, EntityMetadata>();
        for (var entry : section(blob, "entities").entrySet()) {
            var entity = EntityMetadata.fromMap(entry.getKey(), cacheObject(entry.getKey(), entry.getValue()));
            entities.put(entity.name(), entity);
        }

        var relationshipCore = coreFields.allCoreFieldsForModel(Relationship.class);
        var relationships = new LinkedHashMap<String, RelationshipMetadata>();
        for (var entry : section(blob, "relationships").entrySet()) {
            var definition = resolver.validate(cacheObject(entry.getKey(), entry.getValue()));
            relationships.put(definition.name(), resolver.resolve(definition, relationshipCore));
        }
        return new MetadataSnapshot(entities, relationships, fieldTypes, rules);
    }

    private static Map<String, Object> section(Map<String, Object> blob, String key) {
        if (!(blob.get(key) instanceof Map<?, ?> section)) {
            throw new SchemaException("Metadata cache has no '%s' section".formatted(key), Map.of("section", key));
        }
        return SchemaMaps.stringKeyed(section);
    }

    private static Map<String, Object> cacheObject(String key, Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            throw new SchemaException("Metadata cache entry '%s' is not an object".formatted(key), Map.of("entry", key));
        }
        return SchemaMaps.stringKeyed(map);
    }

    private static String stringOrNull(Object value) {
        return value != null ? String.valueOf(value) : null;
    }

    private Path conventionalPath(String directory, String kind, String name) {
        if (directory == null || directory.isBlank()) {
            throw new ConfigurationException("No %s schema directory configured".formatted(kind), Map.of("kind", kind));
        }
        var folder = resolveEntityIdentifier(name).toLowerCase(Locale.ROOT);
        return Path.of(directory, folder, folder + SchemaSource.FILE_SUFFIX);
    }

    private static List<String> sortedNames(Map<String, ?> map) {
        return map.keySet().stream().sorted().toList();
    }
}
