package org.example.bookmarksync.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Configuration
public class SyncConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Single thread: periodic runs never overlap each other, and the run flag in the sync
     * service keeps them apart from manual runs.
     */
    @Bean
    public TaskScheduler syncTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("karakeep-sync-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }
}
