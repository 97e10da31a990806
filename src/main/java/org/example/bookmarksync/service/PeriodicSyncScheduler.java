package org.example.bookmarksync.service;

import org.example.bookmarksync.config.SyncSettingsStore;
import org.example.bookmarksync.model.SyncResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * Triggers a sync every {@code syncIntervalMinutes}. An interval of zero or less disables
 * periodic sync. The schedule is rebuilt whenever settings are saved.
 */
@Service
public class PeriodicSyncScheduler {

    private static final Logger log = LoggerFactory.getLogger(PeriodicSyncScheduler.class);

    private final TaskScheduler taskScheduler;
    private final BookmarkSyncService syncService;
    private final SyncSettingsStore settingsStore;
    private final Clock clock;

    private ScheduledFuture<?> scheduledSync;

    public PeriodicSyncScheduler(TaskScheduler taskScheduler,
                                 BookmarkSyncService syncService,
                                 SyncSettingsStore settingsStore,
                                 Clock clock) {
        this.taskScheduler = taskScheduler;
        this.syncService = syncService;
        this.settingsStore = settingsStore;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        restart();
    }

    public synchronized void restart() {
        stop();

        int intervalMinutes = settingsStore.current().syncIntervalMinutes();
        if (intervalMinutes <= 0) {
            log.info("Periodic sync disabled (interval <= 0)");
            return;
        }

        Duration interval = Duration.ofMinutes(intervalMinutes);
        log.info("Starting periodic sync every {} minutes", intervalMinutes);
        scheduledSync = taskScheduler.scheduleAtFixedRate(this::runScheduledSync, clock.instant().plus(interval), interval);
    }

    @PreDestroy
    public synchronized void stop() {
        if (scheduledSync != null) {
            scheduledSync.cancel(false);
            scheduledSync = null;
            log.info("Periodic sync stopped");
        }
    }

    public synchronized boolean isScheduled() {
        return scheduledSync != null;
    }

    void runScheduledSync() {
        if (syncService.isRunning()) {
            log.info("Skipping scheduled sync: previous sync still running");
            return;
        }
        log.info("Performing scheduled Karakeep sync");
        try {
            SyncResult result = syncService.runSync();
            log.info("Scheduled sync finished: {}", result.message());
        } catch (RuntimeException e) {
            log.error("Critical error during scheduled sync", e);
        }
    }
}
