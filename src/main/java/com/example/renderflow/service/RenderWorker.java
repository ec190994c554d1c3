package com.example.renderflow.service;

import com.example.renderflow.config.RenderflowProperties;
import com.example.renderflow.dto.RenderError;
import com.example.renderflow.dto.RenderOutput;
import com.example.renderflow.dto.plan.ExecutionPlan;
import com.example.renderflow.dto.plan.RenderInput;
import com.example.renderflow.engine.EncoderCommand;
import com.example.renderflow.engine.EncoderLauncher;
import com.example.renderflow.engine.EncoderProgressParser;
import com.example.renderflow.engine.FfmpegErrorClassifier;
import com.example.renderflow.engine.PlanCompiler;
import com.example.renderflow.exception.AssetDownloadException;
import com.example.renderflow.exception.RenderJobException;
import com.example.renderflow.model.RenderJob;
import com.example.renderflow.util.JobState;
import com.example.renderflow.util.RenderErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Polls the job store and runs one claimed job at a time through
 * {@code PREPARING -> DOWNLOADING -> ENCODING -> FINALIZING} to a single terminal write.
 */
@Service
public class RenderWorker {
    private static final Logger LOGGER = LoggerFactory.getLogger(RenderWorker.class);

    private final JobStoreService jobStore;
    private final AssetFetcher assetFetcher;
    private final PlanCompiler planCompiler;
    private final EncoderLauncher encoderLauncher;
    private final TaskScheduler watchdogScheduler;
    private final RenderflowProperties properties;
    private final String workerOwner;
    private final Path outputDir;

    private boolean recovered;

    public RenderWorker(JobStoreService jobStore,
                        AssetFetcher assetFetcher,
                        PlanCompiler planCompiler,
                        EncoderLauncher encoderLauncher,
                        @Qualifier("watchdogScheduler") TaskScheduler watchdogScheduler,
                        RenderflowProperties properties) {
        this.jobStore = jobStore;
        this.assetFetcher = assetFetcher;
        this.planCompiler = planCompiler;
        this.encoderLauncher = encoderLauncher;
        this.watchdogScheduler = watchdogScheduler;
        this.properties = properties;
        this.workerOwner = resolveOwner(properties.getWorker().getOwner());
        this.outputDir = Path.of(properties.getStorage().getOutputDir()).toAbsolutePath().normalize();
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output dir " + outputDir, e);
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        try {
            recoverOrphansOnce();
        } catch (RuntimeException e) {
            LOGGER.error("Startup recovery failed, retrying on next poll: {}", e.toString(), e);
        }
    }

    @Scheduled(fixedDelayString = "${renderflow.worker.poll-interval-ms:1000}")
    public void poll() {
        try {
            recoverOrphansOnce();
            Optional<RenderJob> claimed = jobStore.claimNext(workerOwner);
            if (claimed.isEmpty()) {
                LOGGER.debug("Worker poll tick - no job claimed owner={}", workerOwner);
                return;
            }
            process(claimed.get());
        } catch (Exception e) {
            LOGGER.error("Worker poll failed owner={}: {}", workerOwner, e.toString(), e);
        }
    }

    /**
     * Runs before the first claim. A failed attempt leaves the flag unset so nothing is claimed
     * until recovery succeeds.
     */
    synchronized void recoverOrphansOnce() {
        if (recovered) {
            return;
        }
        int count = jobStore.recoverOrphans();
        recovered = true;
        LOGGER.info("Orphan recovery complete owner={} recovered={}", workerOwner, count);
    }

    /**
     * Drives a claimed job to a terminal state.
     *
     * @return whether the job finished {@code DONE}
     */
    boolean process(RenderJob job) {
        String jobId = job.getId();
        long t0 = System.nanoTime();
        LOGGER.info("JOB START jobId={} project={} variation={} owner={}",
                jobId, job.getProjectId(), job.getVariationId(), workerOwner);
        boolean ok = false;
        try (JobWatchdog watchdog = JobWatchdog.start(jobId, watchdogScheduler,
                properties.getWorker().getMaxRuntime(), properties.getWorker().getWatchdogInterval())) {
            try {
                ok = runPipeline(job, watchdog);
            } catch (StaleJobException e) {
                LOGGER.warn("JOB ABANDONED jobId={} reason={}", jobId, e.getMessage());
            } catch (RenderJobException e) {
                LOGGER.error("JOB FAILED jobId={} code={} msg={}", jobId, e.getCode(), e.getMessage(), e);
                fail(jobId, RenderError.from(e));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail(jobId, RenderError.of(RenderErrorCode.INTERNAL, "Worker interrupted"));
            } catch (Exception e) {
                LOGGER.error("Job {} failed: {}", jobId, e.toString(), e);
                fail(jobId, new RenderError(RenderErrorCode.INTERNAL, String.valueOf(e.getMessage()),
                        Map.of("exception", e.getClass().getName(), "stack", stackTop(e))));
            }
        }
        LOGGER.info("JOB {} jobId={} in={}ms", ok ? "DONE" : "FAILED", jobId, (System.nanoTime() - t0) / 1_000_000);
        return ok;
    }

    private boolean runPipeline(RenderJob job, JobWatchdog watchdog) throws InterruptedException {
        String jobId = job.getId();
        RenderInput input = job.getInput();

        // PREPARING: claimNext already moved the row here
        ExecutionPlan plan = input.effectivePlan();
        planCompiler.validate(plan);
        checkTimeout(watchdog);

        advance(jobId, JobState.DOWNLOADING);
        Map<String, Path> localPaths = download(input, plan, watchdog);
        LOGGER.info("Assets ready jobId={} count={}", jobId, localPaths.size());
        checkTimeout(watchdog);

        advance(jobId, JobState.ENCODING);
        Path outputFile = outputDir.resolve(jobId + ".mp4");
        EncoderCommand command = planCompiler.compile(plan, localPaths, outputFile);
        EncoderProgressParser progress = new EncoderProgressParser(plan.expectedDurationMs());
        int exitCode = runEncoder(jobId, command, progress, watchdog);

        if (watchdog.hasFired()) {
            throw timeout(watchdog);
        }
        advance(jobId, JobState.FINALIZING);
        if (!Files.isRegularFile(outputFile)) {
            throw new RenderJobException(RenderErrorCode.ENCODER_EXEC,
                    "Encoder exited " + exitCode + " but produced no output file");
        }
        long size;
        try {
            size = Files.size(outputFile);
        } catch (IOException e) {
            throw new RenderJobException(RenderErrorCode.ENCODER_EXEC, "Cannot read output file " + outputFile, e);
        }
        long durationMs = progress.lastPositionMs() > 0 ? progress.lastPositionMs() : plan.expectedDurationMs();
        RenderOutput output = new RenderOutput(outputFile.toString(), publicUrl(outputFile), size, durationMs);

        if (!jobStore.markDone(jobId, output)) {
            return false;
        }
        LOGGER.info("Render output jobId={} path={} size={} durationMs={}", jobId, output.outputPath(), size, durationMs);
        return true;
    }

    /** Downloads within the job's remaining runtime; running out of time is a timeout, not a download error. */
    private Map<String, Path> download(RenderInput input, ExecutionPlan plan, JobWatchdog watchdog) {
        try {
            return assetFetcher.resolve(AssetFetcher.collectUrls(input, plan), watchdog.remaining());
        } catch (AssetDownloadException e) {
            if (watchdog.isExpired()) {
                RenderJobException timeout = timeout(watchdog);
                timeout.addSuppressed(e);
                throw timeout;
            }
            throw e;
        }
    }

    private int runEncoder(String jobId, EncoderCommand command, EncoderProgressParser progress, JobWatchdog watchdog)
            throws InterruptedException {
        LOGGER.debug("Encoder command jobId={} cmd={}", jobId, command.commandLine());
        Process process;
        try {
            process = encoderLauncher.launch(command);
        } catch (IOException e) {
            throw new RenderJobException(RenderErrorCode.ENCODER_SPAWN,
                    "Failed to start encoder '" + command.program() + "': " + e.getMessage(), e);
        }
        watchdog.attach(process);
        int tailLimit = Math.max(1, properties.getEncoder().getLogTailLines());
        Deque<String> tail = new ArrayDeque<>(tailLimit);
        try {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (tail.size() == tailLimit) {
                        tail.removeFirst();
                    }
                    tail.addLast(line);
                    OptionalInt pct = progress.onLine(line);
                    if (pct.isPresent()) {
                        reportProgress(jobId, pct.getAsInt());
                    }
                }
            } catch (IOException e) {
                // stream is closed under us when the watchdog kills the encoder
                LOGGER.debug("Encoder output closed jobId={}: {}", jobId, e.toString());
            }
            int exitCode = process.waitFor();
            if (exitCode != 0 && !watchdog.hasFired()) {
                throw encoderFailure(exitCode, new ArrayList<>(tail));
            }
            return exitCode;
        } finally {
            watchdog.detach();
            if (process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }

    private void reportProgress(String jobId, int pct) {
        try {
            jobStore.updateProgress(jobId, pct);
        } catch (RuntimeException e) {
            LOGGER.warn("Progress update failed jobId={} pct={}: {}", jobId, pct, e.toString());
        }
    }

    private static RenderJobException encoderFailure(int exitCode, List<String> tail) {
        FfmpegErrorClassifier.Diagnosis diagnosis = FfmpegErrorClassifier.classify(tail);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("exitCode", exitCode);
        details.put("hint", diagnosis.hint());
        details.put("logTail", String.join("\n", tail));
        String message = "Encoder exited with code " + exitCode + ": " + diagnosis.summary();
        if (diagnosis.lastErrorLine() != null) {
            message += " (" + diagnosis.lastErrorLine() + ")";
        }
        return new RenderJobException(RenderErrorCode.ENCODER_EXEC, message, null, details);
    }

    private void checkTimeout(JobWatchdog watchdog) {
        if (watchdog.hasFired()) {
            throw timeout(watchdog);
        }
    }

    private static RenderJobException timeout(JobWatchdog watchdog) {
        return new RenderJobException(RenderErrorCode.TIMEOUT,
                "Job exceeded max runtime of " + watchdog.getMaxRuntime().toMillis() + "ms");
    }

    private void advance(String jobId, JobState state) {
        if (!jobStore.advanceState(jobId, state)) {
            throw new StaleJobException("job no longer active when moving to " + state);
        }
    }

    /** Records the failure; if the detailed write is rejected, retries once without details. */
    private void fail(String jobId, RenderError error) {
        try {
            jobStore.markFail(jobId, error);
            return;
        } catch (RuntimeException e) {
            LOGGER.error("markFail failed jobId={} code={}, retrying without details: {}",
                    jobId, error.code(), e.toString(), e);
        }
        try {
            jobStore.markFail(jobId, RenderError.of(error.code(), error.message()));
        } catch (RuntimeException e) {
            LOGGER.error("markFail retry failed jobId={} code={}: {}", jobId, error.code(), e.toString(), e);
        }
    }

    private String publicUrl(Path outputFile) {
        String prefix = properties.getStorage().getPublicOutputPrefix();
        if (prefix == null) {
            prefix = "";
        }
        if (prefix.endsWith("/")) {
            prefix = prefix.substring(0, prefix.length() - 1);
        }
        return prefix + "/" + outputFile.getFileName();
    }

    String getWorkerOwner() {
        return workerOwner;
    }

    private static String resolveOwner(String configured) {
        if (configured != null && !configured.isBlank()) {
            return configured.trim();
        }
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            host = "localhost";
        }
        return host + "-" + ProcessHandle.current().pid();
    }

    private static String stackTop(Throwable e) {
        StackTraceElement[] st = e.getStackTrace();
        return st.length > 0 ? st[0].toString() : "";
    }

    /** The row left the active states under us (e.g. failed by another process's recovery). */
    private static final class StaleJobException extends RuntimeException {
        StaleJobException(String message) {
            super(message);
        }
    }
}
