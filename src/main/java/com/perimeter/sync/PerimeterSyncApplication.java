package com.perimeter.sync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main entry point for the Perimeter State Sync service.
 *
 * Annotations Explained:
 * - @SpringBootApplication: Combines @Configuration, @EnableAutoConfiguration, @ComponentScan
 * - @EnableScheduling: Enables the fixed-delay reconciliation poll
 *
 * Architecture Overview:
 * The production database holds the raw status text of every perimeter
 * device. This service keeps a cache of derived states next to it and
 * propagates each change to the devices it affects.
 *
 * Flow:
 * 1. On startup the checkpoint is taken from the cache, or an empty cache is backfilled
 * 2. Every poll fetches production rows changed after the checkpoint
 * 3. Each row is classified and cascaded over its line (or the whole system)
 * 4. Affected devices are stored in the cache and their text written back to production
 * 5. Committed changes are published to Redis and WebSocket subscribers
 */
@SpringBootApplication
@EnableScheduling
public class PerimeterSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(PerimeterSyncApplication.class, args);
    }
}
