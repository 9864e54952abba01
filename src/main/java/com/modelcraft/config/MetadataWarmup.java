package com.modelcraft.config;

import com.modelcraft.metadata.MetadataEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Loads all metadata on startup so the first request finds a warm cache, and logs what was found.
 *
 * Disabled with {@code modelcraft.metadata.warmup=false}.
 */
@Service
@ConditionalOnProperty(prefix = "modelcraft.metadata", name = "warmup", havingValue = "true", matchIfMissing = true)
public class MetadataWarmup implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(MetadataWarmup.class);

    private final MetadataEngine engine;

    public MetadataWarmup(MetadataEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run(String... args) {
        var snapshot = engine.loadAllMetadata();
        for (var summary : engine.entitySummaries()) {
            log.debug("Entity {} (table {}): {} fields, {} relationships",
                summary.name(), summary.table(), summary.fieldCount(), summary.relationshipCount());
        }
        log.info("Metadata warm-up complete: {} entities, {} relationships",
            snapshot.entities().size(), snapshot.relationships().size());
    }
}
