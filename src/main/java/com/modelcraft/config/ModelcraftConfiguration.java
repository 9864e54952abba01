package com.modelcraft.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.modelcraft.database.DatabaseConnector;
import com.modelcraft.fields.FieldFactory;
import com.modelcraft.fields.FieldTypeCatalog;
import com.modelcraft.metadata.CoreFieldsProvider;
import com.modelcraft.metadata.MetadataEngine;
import com.modelcraft.metadata.OptionsProvider;
import com.modelcraft.metadata.OptionsProviderRegistry;
import com.modelcraft.model.CurrentUserProvider;
import com.modelcraft.model.ModelClassRegistry;
import com.modelcraft.model.ModelContext;
import com.modelcraft.model.ModelFactory;
import com.modelcraft.relationships.RelationshipResolver;
import com.modelcraft.validation.ValidationRuleCatalog;
import com.modelcraft.validation.ValidationRuleFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the metadata engine and the model runtime. Applications contribute a
 * {@link DatabaseConnector}, {@link OptionsProvider}s and optionally a {@link CurrentUserProvider}.
 */
@Configuration
@EnableConfigurationProperties(MetadataProperties.class)
public class ModelcraftConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Bean
    public CoreFieldsProvider coreFieldsProvider(ObjectMapper objectMapper, MetadataProperties properties) {
        return new CoreFieldsProvider(objectMapper, properties.coreFieldsTemplate());
    }

    @Bean
    public ValidationRuleCatalog validationRuleCatalog(MetadataProperties properties) {
        return new ValidationRuleCatalog(properties.validationRulesPackage());
    }

    @Bean
    public FieldTypeCatalog fieldTypeCatalog(MetadataProperties properties, ValidationRuleCatalog ruleCatalog) {
        return new FieldTypeCatalog(properties.fieldsPackage(), ruleCatalog);
    }

    @Bean
    public RelationshipResolver relationshipResolver() {
        return new RelationshipResolver();
    }

    @Bean
    public OptionsProviderRegistry optionsProviderRegistry(ObjectProvider<OptionsProvider> providers) {
        return new OptionsProviderRegistry(providers.orderedStream().toList());
    }

    @Bean
    @ConditionalOnMissingBean
    public ModelClassRegistry modelClassRegistry() {
        return new ModelClassRegistry();
    }

    @Bean
    public MetadataEngine metadataEngine(MetadataProperties properties,
                                         ObjectMapper objectMapper,
                                         CoreFieldsProvider coreFieldsProvider,
                                         ValidationRuleCatalog ruleCatalog,
                                         FieldTypeCatalog fieldTypeCatalog,
                                         RelationshipResolver relationshipResolver,
                                         OptionsProviderRegistry optionsProviders,
                                         ModelClassRegistry modelClassRegistry) {
        return new MetadataEngine(properties, objectMapper, coreFieldsProvider, ruleCatalog, fieldTypeCatalog,
            relationshipResolver, optionsProviders, modelClassRegistry);
    }

    @Bean
    public ValidationRuleFactory validationRuleFactory(ValidationRuleCatalog ruleCatalog,
                                                       ObjectProvider<DatabaseConnector> connector) {
        return new ValidationRuleFactory(ruleCatalog, connector.getIfAvailable());
    }

    @Bean
    public FieldFactory fieldFactory(FieldTypeCatalog fieldTypeCatalog, ValidationRuleFactory ruleFactory) {
        return new FieldFactory(fieldTypeCatalog, ruleFactory);
    }

    @Bean
    @ConditionalOnMissingBean
    public CurrentUserProvider currentUserProvider() {
        return CurrentUserProvider.SYSTEM;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public ModelContext modelContext(MetadataEngine metadataEngine,
                                     FieldFactory fieldFactory,
                                     RelationshipResolver relationshipResolver,
                                     ObjectProvider<DatabaseConnector> connector,
                                     CurrentUserProvider currentUserProvider,
                                     Clock clock,
                                     ModelClassRegistry modelClassRegistry) {
        return new ModelContext(metadataEngine, fieldFactory, relationshipResolver, connector.getIfAvailable(),
            currentUserProvider, clock, modelClassRegistry);
    }

    @Bean
    public ModelFactory modelFactory(ModelContext modelContext) {
        return modelContext.modelFactory();
    }
}
