package com.modelcraft.metadata;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.modelcraft.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Supplies the fields every entity carries (id, audit timestamps, soft-delete markers)
 * plus per-class additional core fields.
 *
 * <p>Per-class registrations are inherited: a class sees everything registered on its
 * superclasses, with the most derived registration winning on a name collision.
 */
public class CoreFieldsProvider {

    private static final Logger log = LoggerFactory.getLogger(CoreFieldsProvider.class);

    public static final String DEFAULT_TEMPLATE = "classpath:metadata/core_fields_metadata.json";

    private static final Set<String> PROTECTED_KEYS = Set.of("name", "type");
    private static final List<String> REQUIRED_KEYS = List.of("name", "type", "label", "isDBField");

    private final ObjectMapper mapper;
    private final Map<Class<?>, Map<String, FieldDescriptor>> modelCoreFields = new HashMap<>();
    private final Map<Class<?>, Map<String, FieldDescriptor>> mergedCache = new HashMap<>();

    private String templateLocation;
    private Map<String, FieldDescriptor> standardCoreFields;

    public CoreFieldsProvider(ObjectMapper mapper, String templateLocation) {
        this.mapper = mapper;
        this.templateLocation = templateLocation != null ? templateLocation : DEFAULT_TEMPLATE;
    }

    public CoreFieldsProvider(ObjectMapper mapper) {
        this(mapper, DEFAULT_TEMPLATE);
    }

    /**
     * The standard template, loaded once per instance.
     *
     * @throws ConfigurationException when the template is missing or is not a JSON object
     */
    public Map<String, FieldDescriptor> standardCoreFields() {
        if (standardCoreFields == null) {
            standardCoreFields = loadTemplate();
            log.debug("Loaded {} standard core fields from {}: {}",
                standardCoreFields.size(), templateLocation, standardCoreFields.keySet());
        }
        return standardCoreFields;
    }

    public void registerModelCoreFields(Class<?> modelClass, Map<String, FieldDescriptor> fields) {
        modelCoreFields.put(modelClass, new LinkedHashMap<>(fields));
        // merged entries of subclasses were built from the old registration too
        mergedCache.keySet().removeIf(modelClass::isAssignableFrom);
        log.debug("Registered core fields for {}: {}", modelClass.getName(), fields.keySet());
    }

    /** Fields registered on the class and its ancestors, base class first. */
    public Map<String, FieldDescriptor> modelCoreFields(Class<?> modelClass) {
        var result = new LinkedHashMap<String, FieldDescriptor>();
        for (var type : hierarchy(modelClass)) {
            var registered = modelCoreFields.get(type);
            if (registered != null) {
                result.putAll(registered);
            }
        }
        return result;
    }

    public Map<String, FieldDescriptor> allCoreFieldsForModel(Class<?> modelClass) {
        var cached = mergedCache.get(modelClass);
        if (cached != null) {
            return cached;
        }
        var standard = standardCoreFields();
        var specific = modelCoreFields(modelClass);
        var merged = new LinkedHashMap<>(standard);
        merged.putAll(specific);
        var result = Collections.unmodifiableMap(merged);
        mergedCache.put(modelClass, result);
        log.debug("Core fields for {}: {} standard, {} model specific, {} total",
            modelClass.getSimpleName(), standard.size(), specific.size(), result.size());
        return result;
    }

    public List<String> coreFieldNames(Class<?> modelClass) {
        return List.copyOf(allCoreFieldsForModel(modelClass).keySet());
    }

    /**
     * The named core field with {@code overrides} applied. {@code name} and {@code type} cannot be
     * overridden; attempts are logged and ignored.
     */
    public Optional<FieldDescriptor> coreFieldWithOverrides(String fieldName, Class<?> modelClass,
                                                            Map<String, ?> overrides) {
        var coreFields = allCoreFieldsForModel(modelClass);
        var field = coreFields.get(fieldName);
        if (field == null) {
            log.warn("Core field '{}' not found for {}; available: {}",
                fieldName, modelClass.getSimpleName(), coreFields.keySet());
            return Optional.empty();
        }
        var merged = field.toMap();
        overrides.forEach((key, value) -> {
            if (PROTECTED_KEYS.contains(key)) {
                log.warn("Ignoring override of protected property '{}' on core field '{}' (attempted value: {})",
                    key, fieldName, value);
            } else {
                merged.put(key, value);
            }
        });
        return Optional.of(FieldDescriptor.fromMap(fieldName, merged));
    }

    public boolean isCoreField(String fieldName) {
        return standardCoreFields().containsKey(fieldName);
    }

    public boolean isCoreField(String fieldName, Class<?> modelClass) {
        return isCoreField(fieldName) || modelClass != null && modelCoreFields(modelClass).containsKey(fieldName);
    }

    /** Checks that a raw core field definition carries name, type, label and isDBField. */
    public boolean validateCoreFieldMetadata(Map<String, ?> fieldMetadata) {
        for (var key : REQUIRED_KEYS) {
            if (fieldMetadata.get(key) == null) {
                log.warn("Core field metadata is missing '{}': {}", key, fieldMetadata);
                return false;
            }
        }
        return true;
    }

    /** Drops every cached result, including the loaded template. */
    public void clearCache() {
        mergedCache.clear();
        standardCoreFields = null;
        log.debug("Cleared all core field caches");
    }

    public void clearCacheForModel(Class<?> modelClass) {
        mergedCache.remove(modelClass);
        log.debug("Cleared core field cache for {}", modelClass.getName());
    }

    public void setTemplateLocation(String templateLocation) {
        this.templateLocation = templateLocation;
        this.standardCoreFields = null;
        mergedCache.clear();
        log.debug("Core field template location set to {}", templateLocation);
    }

    private Map<String, FieldDescriptor> loadTemplate() {
        var resource = resource(templateLocation);
        if (!resource.exists()) {
            log.error("Core fields template not found: {}", templateLocation);
            throw new ConfigurationException("Core fields template not found at: " + templateLocation,
                Map.of("template", templateLocation));
        }

        JsonNode root;
        try (InputStream in = resource.getInputStream()) {
            root = mapper.readTree(in);
        } catch (IOException e) {
            log.error("Core fields template could not be read: {}", templateLocation, e);
            throw new ConfigurationException("Failed to read core fields template: " + templateLocation,
                Map.of("template", templateLocation), e);
        }
        if (root == null || !root.isObject()) {
            log.error("Core fields template {} returned {} instead of an object",
                templateLocation, root == null ? "nothing" : root.getNodeType());
            throw new ConfigurationException("Core fields template must contain a JSON object",
                Map.of("template", templateLocation));
        }

        var fields = new LinkedHashMap<String, FieldDescriptor>();
        var entries = root.fields();
        while (entries.hasNext()) {
            var entry = entries.next();
            if (!entry.getValue().isObject()) {
                throw new ConfigurationException("Core field '%s' in %s is not an object".formatted(entry.getKey(), templateLocation),
                    Map.of("template", templateLocation, "field", entry.getKey()));
            }
            Map<String, Object> definition = mapper.convertValue(entry.getValue(), new TypeReference<>() {});
            var field = FieldDescriptor.fromMap(entry.getKey(), definition);
            fields.put(field.name(), field);
        }
        return Collections.unmodifiableMap(fields);
    }

    private static Resource resource(String location) {
        if (location.startsWith("classpath:")) {
            return new ClassPathResource(location.substring("classpath:".length()));
        }
        return new FileSystemResource(location);
    }

    /** Base class first, {@code modelClass} last. */
    private static List<Class<?>> hierarchy(Class<?> modelClass) {
        var chain = new ArrayDeque<Class<?>>();
        for (Class<?> type = modelClass; type != null && type != Object.class; type = type.getSuperclass()) {
            chain.addFirst(type);
        }
        return List.copyOf(chain);
    }
}
