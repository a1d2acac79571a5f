package com.eventsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main Spring Boot application for the event scrapers service.
 * MongoDB is wired by {@link com.eventsync.infrastructure.config.MongoConfig} only when enabled.
 */
@SpringBootApplication(exclude = {MongoAutoConfiguration.class, MongoDataAutoConfiguration.class})
@EnableScheduling
public class EventScrapersApplication {

    public static void main(String[] args) {
        SpringApplication.run(EventScrapersApplication.class, args);
    }
}
