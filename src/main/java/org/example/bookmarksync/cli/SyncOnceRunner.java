package org.example.bookmarksync.cli;

import org.example.bookmarksync.model.SyncResult;
import org.example.bookmarksync.service.BookmarkSyncService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Runs a single sync at startup.
 *
 * Run with: mvn spring-boot:run -Dspring-boot.run.profiles=sync-once
 * Or: java -jar target/bookmark-sync.jar --spring.profiles.active=sync-once
 */
@Component
@Profile("sync-once")
public class SyncOnceRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(SyncOnceRunner.class);

    private final BookmarkSyncService syncService;

    public SyncOnceRunner(BookmarkSyncService syncService) {
        this.syncService = syncService;
    }

    @Override
    public void run(String... args) {
        log.info("========================================");
        log.info("Karakeep -> SiYuan one-shot sync");
        log.info("========================================");

        SyncResult result = syncService.runSync();

        log.info("[{}] {}", result.success() ? "OK" : "FAILED", result.message());
        log.info("  - Created: {}", result.created());
        log.info("  - Updated: {}", result.updated());
        log.info("  - Skipped: {} ({} filtered)", result.skipped() + result.skippedFiltered(), result.skippedFiltered());
        log.info("  - Errors: {}", result.errors());
    }
}
