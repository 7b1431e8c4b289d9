package com.basepulse.indexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * BasePulse Indexer Application
 * Poll contract event ingestion and checkpointed projection sync
 */
@SpringBootApplication
public class BasePulseIndexerApplication {

    private static final Logger logger = LoggerFactory.getLogger(BasePulseIndexerApplication.class);

    public static void main(String[] args) {
        logger.info("Starting BasePulse Indexer...");
        SpringApplication.run(BasePulseIndexerApplication.class, args);
        logger.info("BasePulse Indexer started successfully!");
    }
}
