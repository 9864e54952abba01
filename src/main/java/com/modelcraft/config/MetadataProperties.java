package com.modelcraft.config;

import com.modelcraft.fields.FieldTypeCatalog;
import com.modelcraft.metadata.CoreFieldsProvider;
import com.modelcraft.validation.ValidationRuleCatalog;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Settings under {@code modelcraft.metadata}.
 *
 * @param modelsPath             directory with one subdirectory per entity schema
 * @param relationshipsPath      directory with one subdirectory per relationship schema
 * @param cachePath              JSON file holding the last load
 * @param cacheEnabled           whether {@code cachePath} is read and written
 * @param coreFieldsTemplate     core field template, a file path or a {@code classpath:} location
 * @param fieldsPackage          package scanned for field types
 * @param validationRulesPackage package scanned for validation rules
 */
@ConfigurationProperties(prefix = "modelcraft.metadata")
public record MetadataProperties(
    @DefaultValue("metadata/models") String modelsPath,
    @DefaultValue("metadata/relationships") String relationshipsPath,
    @DefaultValue("cache/metadata_cache.json") String cachePath,
    @DefaultValue("true") boolean cacheEnabled,
    String coreFieldsTemplate,
    String fieldsPackage,
    String validationRulesPackage
) {
    public MetadataProperties {
        coreFieldsTemplate = coreFieldsTemplate != null ? coreFieldsTemplate : CoreFieldsProvider.DEFAULT_TEMPLATE;
        fieldsPackage = fieldsPackage != null ? fieldsPackage : FieldTypeCatalog.DEFAULT_PACKAGE;
        validationRulesPackage = validationRulesPackage != null
            ? validationRulesPackage
            : ValidationRuleCatalog.DEFAULT_PACKAGE;
    }

    /** Schema directories only; the on-disk cache is off. */
    public static MetadataProperties of(String modelsPath, String relationshipsPath) {
        return new MetadataProperties(modelsPath, relationshipsPath, null, false, null, null, null);
    }

    /** The cache file, or null when caching is off. */
    public String effectiveCachePath() {
        return cacheEnabled ? cachePath : null;
    }
}
