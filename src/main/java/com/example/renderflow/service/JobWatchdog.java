package com.example.renderflow.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Wall-clock ceiling for one in-flight job. On breach it raises the timeout signal and kills the
 * attached encoder; it never writes job state. The worker observes {@link #hasFired()} and
 * records the outcome.
 */
public class JobWatchdog implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(JobWatchdog.class);

    private final String jobId;
    private final Duration maxRuntime;
    private final long startNanos;
    private final AtomicBoolean inFlight = new AtomicBoolean(true);
    private final AtomicBoolean fired = new AtomicBoolean(false);
    private final AtomicReference<Process> encoder = new AtomicReference<>();
    private volatile ScheduledFuture<?> tick;

    JobWatchdog(String jobId, Duration maxRuntime) {
        this.jobId = jobId;
        this.maxRuntime = maxRuntime;
        this.startNanos = System.nanoTime();
    }

    public static JobWatchdog start(String jobId, TaskScheduler scheduler, Duration maxRuntime, Duration interval) {
        JobWatchdog watchdog = new JobWatchdog(jobId, maxRuntime);
        watchdog.tick = scheduler.scheduleAtFixedRate(watchdog::check, interval);
        return watchdog;
    }

    /** Registers the running encoder; kills it right away if the ceiling was already hit. */
    public void attach(Process process) {
        encoder.set(process);
        if (fired.get()) {
            process.destroyForcibly();
        }
    }

    public void detach() {
        encoder.set(null);
    }

    public boolean hasFired() {
        return fired.get();
    }

    public Duration elapsed() {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    /** Time left before the ceiling; negative once it has passed. */
    public Duration remaining() {
        return maxRuntime.minus(elapsed());
    }

    public boolean isExpired() {
        return fired.get() || remaining().isNegative();
    }

    public Duration getMaxRuntime() {
        return maxRuntime;
    }

    void check() {
        if (!inFlight.get() || fired.get()) {
            return;
        }
        Duration elapsed = elapsed();
        if (elapsed.compareTo(maxRuntime) <= 0) {
            return;
        }
        if (fired.compareAndSet(false, true)) {
            LOGGER.error("JOB TIMEOUT jobId={} elapsed={}ms max={}ms", jobId, elapsed.toMillis(), maxRuntime.toMillis());
            Process p = encoder.get();
            if (p != null && inFlight.get()) {
                p.destroyForcibly();
            }
        }
    }

    @Override
    public void close() {
        inFlight.set(false);
        ScheduledFuture<?> t = tick;
        if (t != null) {
            t.cancel(false);
        }
        encoder.set(null);
    }
}
