package com.fritter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

@SpringBootApplication(scanBasePackages = {"com.fritter"})
@EnableMongoRepositories(basePackages = "com.fritter.repo")
public class FritterApplication {

    private static final Logger log = LoggerFactory.getLogger(FritterApplication.class);

    @Value("${spring.application.name:fritter}")
    private String applicationName;

    public static void main(String[] args) {
        SpringApplication.run(FritterApplication.class, args);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        log.info("{} is ready (Java {}, {} {})", applicationName,
                System.getProperty("java.version"),
                System.getProperty("os.name"),
                System.getProperty("os.version"));
    }
}
