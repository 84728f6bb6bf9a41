package com.example.flowerclassifier.repository;

import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.CompoundIndexDefinition;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.stereotype.Component;

/**
 * Creates the collection indexes once the application is up. An unreachable
 * store only produces a warning; the API keeps running in degraded mode.
 */
@Component
@ConditionalOnProperty(prefix = "classifier.store", name = "create-indexes", havingValue = "true", matchIfMissing = true)
public class MongoIndexInitializer {

    private static final Logger log = LoggerFactory.getLogger(MongoIndexInitializer.class);

    private final MongoTemplate mongoTemplate;

    public MongoIndexInitializer(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void createIndexes() {
        try {
            IndexOperations indexOps = mongoTemplate.indexOps(ClassificationDocument.COLLECTION);
            indexOps.ensureIndex(new Index().on("timestamp", Sort.Direction.DESC));
            indexOps.ensureIndex(new CompoundIndexDefinition(new Document("latitude", 1).append("longitude", 1)));
            log.info("MongoDB indexes ensured on collection '{}'", ClassificationDocument.COLLECTION);
        } catch (DataAccessException ex) {
            log.warn("Failed to connect to MongoDB: {}. API will still start, but database operations will fail until MongoDB is reachable.",
                    ex.getMessage());
        }
    }
}
