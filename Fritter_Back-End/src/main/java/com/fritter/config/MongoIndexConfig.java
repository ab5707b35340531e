package com.fritter.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.stereotype.Component;

/**
 * Creates the indexes used by the friendship and user queries on startup.
 * <p>
 * There is deliberately no unique index on the pair of users of a friendship.
 */
@Component
public class MongoIndexConfig {

    private static final Logger log = LoggerFactory.getLogger(MongoIndexConfig.class);

    static final String FRIENDSHIPS = "friendships";
    static final String USERS = "users";

    private final MongoTemplate mongoTemplate;

    public MongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void createIndexes() {
        log.info("Creating MongoDB indexes for '{}' and '{}'", FRIENDSHIPS, USERS);

        // findAllInvolving / removeAllInvolving: $or on both DBRef ids
        createIndexIfNotExists(FRIENDSHIPS, "userOne.$id", Sort.Direction.ASC, false,
                "friendships by first user");
        createIndexIfNotExists(FRIENDSHIPS, "userTwo.$id", Sort.Direction.ASC, false,
                "friendships by second user");
        createIndexIfNotExists(FRIENDSHIPS, "dateCreated", Sort.Direction.DESC, false,
                "friendships sorted by creation date");

        createIndexIfNotExists(USERS, "username", Sort.Direction.ASC, true,
                "user lookup by username");

        listExistingIndexes(FRIENDSHIPS);
        listExistingIndexes(USERS);
    }

    private void listExistingIndexes(String collectionName) {
        try {
            IndexOperations indexOps = mongoTemplate.indexOps(collectionName);
            var indexes = indexOps.getIndexInfo();
            log.info("Existing indexes on '{}' collection: {}", collectionName, indexes.size());
            for (var indexInfo : indexes) {
                log.debug("  - {}: {}", indexInfo.getName(), indexInfo);
            }
        } catch (Exception e) {
            log.warn("Could not list existing indexes for collection '{}': {}", collectionName, e.getMessage());
        }
    }

    private void createIndexIfNotExists(String collectionName, String field, Sort.Direction direction,
                                        boolean unique, String description) {
        try {
            IndexOperations indexOps = mongoTemplate.indexOps(collectionName);
            Index index = new Index().on(field, direction).named(indexName(field));
            if (unique) {
                index.unique();
            }
            String created = indexOps.ensureIndex(index);
            log.info("Index on '{}'.{} ready: {} ({})", collectionName, field, created, description);
        } catch (Exception e) {
            log.error("Error creating index on '{}'.{}: {}", collectionName, field, e.getMessage(), e);
        }
    }

    static String indexName(String field) {
        return field.replace(".", "_").replace("$", "") + "_idx";
    }
}
