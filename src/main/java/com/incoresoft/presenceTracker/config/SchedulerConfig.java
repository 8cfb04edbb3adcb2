package com.incoresoft.presenceTracker.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

/**
 * Single thread for the daily history export. A failed run is logged and the next cron run still fires.
 */
@Slf4j(topic = "com.incoresoft.presenceTracker.export")
@Configuration
@RequiredArgsConstructor
public class SchedulerConfig implements SchedulingConfigurer {
    static final String THREAD_PREFIX = "history-export-";
    /** Long enough for a workbook of a full ledger to be flushed on shutdown. */
    static final int SHUTDOWN_WAIT_SECONDS = 30;

    private final PresenceProps props;

    @Bean(name = "taskScheduler")
    public TaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix(THREAD_PREFIX);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(SHUTDOWN_WAIT_SECONDS);
        scheduler.setErrorHandler(t -> log.error("History export to {} failed, schedule '{}' ({}) stays active: {}",
                props.getExport().getOutputDir(), props.getExport().getScheduleCron(),
                props.getExport().getTimezone(), t.getMessage(), t));
        scheduler.initialize();
        return scheduler;
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        registrar.setTaskScheduler(taskScheduler());
    }
}
