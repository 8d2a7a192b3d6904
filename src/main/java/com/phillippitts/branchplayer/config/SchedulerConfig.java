package com.phillippitts.branchplayer.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

/**
 * Scheduler that drives the flow tick loop.
 *
 * <p>Pool size is exactly one: the flow state machine, playback session and subtitle driver are
 * single-threaded and rely on every tick running on the same thread, one after another.
 *
 * <p>Thread naming: {@code flow-tick-N} for easy identification in logs.
 */
@Configuration
public class SchedulerConfig implements SchedulingConfigurer {

    private static final Logger LOG = LogManager.getLogger(SchedulerConfig.class);

    @Bean(name = "flowTaskScheduler")
    public ThreadPoolTaskScheduler flowTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("flow-tick-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setErrorHandler(t -> LOG.error("Unhandled error in flow tick", t));
        scheduler.initialize();
        return scheduler;
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        registrar.setTaskScheduler(flowTaskScheduler());
    }
}
