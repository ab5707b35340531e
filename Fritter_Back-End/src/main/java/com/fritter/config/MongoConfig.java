package com.fritter.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Component;

/**
 * Logs which MongoDB the application talks to and checks the connection once the
 * context is ready. Connection settings come from application.properties, either a
 * URI (MongoDB Atlas) or host/port/database (local MongoDB).
 */
@Component
public class MongoConfig {

    private static final Logger log = LoggerFactory.getLogger(MongoConfig.class);

    @Value("${spring.data.mongodb.uri:}")
    private String uri;

    @Value("${spring.data.mongodb.host:}")
    private String host;

    @Value("${spring.data.mongodb.port:27017}")
    private int port;

    @Value("${spring.data.mongodb.database:fritter}")
    private String database;

    private final MongoTemplate mongoTemplate;

    public MongoConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void verifyMongoConnection() {
        try {
            if (uri != null && !uri.isEmpty()) {
                log.info("MongoDB connection by URI: {}", maskUri(uri));
            } else {
                log.info("MongoDB connection to {}:{}, database {}",
                        host == null || host.isEmpty() ? "localhost" : host, port, database);
            }

            String dbName = mongoTemplate.getDb().getName();
            log.info("Connected to MongoDB database: {}", dbName);
        } catch (Exception e) {
            log.error("Failed to verify MongoDB connection", e);
        }
    }

    /**
     * Hide the password part of a connection string.
     */
    static String maskUri(String uri) {
        return uri.replaceAll("://([^:/@]+):([^@]+)@", "://$1:***@");
    }
}
