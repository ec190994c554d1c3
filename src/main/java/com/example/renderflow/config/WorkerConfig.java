package com.example.renderflow.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

import java.time.Clock;

/**
 * Threads for {@link com.example.renderflow.service.RenderWorker}. The poll loop gets its own
 * single thread so at most one job runs per process; the watchdog ticks on a separate scheduler
 * so it can fire while the poll thread is blocked on the encoder.
 */
@Configuration
@EnableConfigurationProperties(RenderflowProperties.class)
public class WorkerConfig implements SchedulingConfigurer {

    @Bean
    public Clock systemClock() {
        return Clock.systemUTC();
    }

    @Bean(name = "pollScheduler")
    public ThreadPoolTaskScheduler pollScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("render-poll-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.initialize();
        return scheduler;
    }

    @Bean(name = "watchdogScheduler")
    public ThreadPoolTaskScheduler watchdogScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("render-watchdog-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        registrar.setTaskScheduler(pollScheduler());
    }
}
