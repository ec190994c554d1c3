package com.example.renderflow.service;

import com.example.renderflow.dto.RenderError;
import com.example.renderflow.dto.RenderOutput;
import com.example.renderflow.dto.plan.ExecutionPlan;
import com.example.renderflow.dto.plan.OutputFormat;
import com.example.renderflow.dto.plan.RenderInput;
import com.example.renderflow.dto.plan.TimelineSegment;
import com.example.renderflow.exception.DuplicateJobIdException;
import com.example.renderflow.exception.JobNotFoundException;
import com.example.renderflow.model.RenderJob;
import com.example.renderflow.repository.RenderJobRepository;
import com.example.renderflow.util.JobState;
import com.example.renderflow.util.RenderErrorCode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DataJpaTest
@Import({JobStoreService.class, JobStoreServiceTest.Config.class})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class JobStoreServiceTest {

    @TestConfiguration
    static class Config {
        @Bean
        MutableClock clock() {
            return new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        }

        @Bean
        ObjectMapper objectMapper() {
            return new ObjectMapper();
        }
    }

    @Autowired
    private JobStoreService jobStore;

    @Autowired
    private RenderJobRepository jobRepo;

    @Autowired
    private MutableClock clock;

    @AfterEach
    void cleanup() {
        jobRepo.deleteAll();
    }

    static RenderJob newJob(String id) {
        ExecutionPlan plan = new ExecutionPlan(
                List.of(new TimelineSegment("https://cdn.example.com/" + id + ".mp4", 0L, 2000L)),
                List.of(), List.of(), OutputFormat.DEFAULT);
        return new RenderJob(id, new RenderInput("proj-1", "var-1", null, null, plan));
    }

    private RenderJob insertQueued(String id) {
        RenderJob job = jobStore.insert(newJob(id));
        clock.advance(Duration.ofSeconds(1));
        return job;
    }

    private RenderJob claimAndEncode(String id) {
        insertQueued(id);
        RenderJob claimed = jobStore.claimNext("worker-a").orElseThrow();
        assertEquals(id, claimed.getId());
        assertTrue(jobStore.advanceState(claimed.getId(), JobState.DOWNLOADING));
        assertTrue(jobStore.advanceState(claimed.getId(), JobState.ENCODING));
        return claimed;
    }

    @Test
    void insertStoresQueuedJobWithInput() {
        Instant now = clock.instant();
        jobStore.insert(newJob("job-1"));

        RenderJob stored = jobStore.get("job-1");
        assertEquals(JobState.QUEUED, stored.getState());
        assertEquals(0, stored.getProgressPct());
        assertEquals("proj-1", stored.getProjectId());
        assertEquals(now, stored.getCreatedAt());
        assertEquals("https://cdn.example.com/job-1.mp4", stored.getInput().plan().timeline().get(0).assetUrl());
        assertEquals(1, jobStore.countByState(JobState.QUEUED));
    }

    @Test
    void duplicateIdIsRejected() {
        jobStore.insert(newJob("job-1"));

        assertThrows(DuplicateJobIdException.class, () -> jobStore.insert(newJob("job-1")));
    }

    @Test
    void unknownIdIsNotFound() {
        assertThrows(JobNotFoundException.class, () -> jobStore.get("nope"));
    }

    @Test
    void claimTakesOldestQueuedJobFirst() {
        insertQueued("b-second");
        insertQueued("a-third");
        clock.advance(Duration.ofHours(-1));
        insertQueued("z-first");

        RenderJob first = jobStore.claimNext("worker-a").orElseThrow();
        RenderJob second = jobStore.claimNext("worker-a").orElseThrow();

        assertEquals("z-first", first.getId());
        assertEquals(JobState.PREPARING, first.getState());
        assertEquals("worker-a", first.getWorkerOwner());
        assertThat(first.getStartedAt()).isNotNull();
        assertEquals("b-second", second.getId());
    }

    @Test
    void claimOnEmptyQueueReturnsEmpty() {
        assertEquals(Optional.empty(), jobStore.claimNext("worker-a"));
    }

    @Test
    void concurrentClaimsNeverHandOutAJobTwice() throws Exception {
        int jobs = 6;
        int workers = 8;
        for (int i = 0; i < jobs; i++) {
            insertQueued("job-" + i);
        }

        ExecutorService pool = Executors.newFixedThreadPool(workers);
        CountDownLatch start = new CountDownLatch(1);
        List<String> claimed = Collections.synchronizedList(new ArrayList<>());
        List<Future<?>> futures = new ArrayList<>();
        for (int w = 0; w < workers; w++) {
            String owner = "worker-" + w;
            futures.add(pool.submit(() -> {
                start.await();
                while (true) {
                    Optional<RenderJob> job;
                    try {
                        job = jobStore.claimNext(owner);
                    } catch (ConcurrencyFailureException e) {
                        continue;
                    }
                    if (job.isEmpty()) {
                        return null;
                    }
                    claimed.add(job.get().getId());
                }
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertThat(claimed).hasSize(jobs).doesNotHaveDuplicates();
        assertEquals(0, jobStore.countByState(JobState.QUEUED));
        assertEquals(jobs, jobStore.countByState(JobState.PREPARING));
    }

    @Test
    void advanceStateMovesForwardOnly() {
        insertQueued("job-1");
        jobStore.claimNext("worker-a");

        assertTrue(jobStore.advanceState("job-1", JobState.DOWNLOADING));
        assertTrue(jobStore.advanceState("job-1", JobState.ENCODING));
        assertFalse(jobStore.advanceState("job-1", JobState.DOWNLOADING));
        assertEquals(JobState.ENCODING, jobStore.get("job-1").getState());
        assertThrows(IllegalArgumentException.class, () -> jobStore.advanceState("job-1", JobState.DONE));
    }

    @Test
    void progressOnlyRisesWhileEncodingAndStaysBelowFull() {
        claimAndEncode("job-1");
        insertQueued("queued");
        assertFalse(jobStore.updateProgress("queued", 10));

        assertTrue(jobStore.updateProgress("job-1", 30));
        assertFalse(jobStore.updateProgress("job-1", 20));
        assertFalse(jobStore.updateProgress("job-1", 30));
        assertTrue(jobStore.updateProgress("job-1", 250));
        assertFalse(jobStore.updateProgress("job-1", 100));

        assertEquals(99, jobStore.get("job-1").getProgressPct());
        assertEquals(0, jobStore.get("queued").getProgressPct());
    }

    @Test
    void markDoneFinishesWithFullProgressAndOutput() {
        claimAndEncode("job-1");
        jobStore.updateProgress("job-1", 42);

        assertTrue(jobStore.markDone("job-1", new RenderOutput("/out/job-1.mp4", "/outputs/job-1.mp4", 1234L, 2000L)));

        RenderJob done = jobStore.get("job-1");
        assertEquals(JobState.DONE, done.getState());
        assertEquals(100, done.getProgressPct());
        assertEquals("/outputs/job-1.mp4", done.getOutputUrl());
        assertEquals(1234L, done.getOutputSizeBytes());
        assertEquals(2000L, done.getOutputDurationMs());
        assertNull(done.getWorkerOwner());
        assertThat(done.getCompletedAt()).isNotNull();
    }

    @Test
    void firstTerminalWriteWins() {
        claimAndEncode("job-1");

        assertTrue(jobStore.markFail("job-1", RenderError.of(RenderErrorCode.TIMEOUT, "too slow")));
        assertFalse(jobStore.markDone("job-1", new RenderOutput("/out/job-1.mp4", "/outputs/job-1.mp4", 1L, 1L)));
        assertFalse(jobStore.markFail("job-1", RenderError.of(RenderErrorCode.ENCODER_EXEC, "late")));

        RenderJob failed = jobStore.get("job-1");
        assertEquals(JobState.FAILED, failed.getState());
        assertEquals(RenderErrorCode.TIMEOUT, failed.getErrorCode());
        assertEquals("too slow", failed.getErrorMessage());
        assertNull(failed.getOutputPath());
        assertFalse(jobStore.updateProgress("job-1", 99));
    }

    @Test
    void failureDetailsAreStoredAsJson() {
        claimAndEncode("job-1");

        jobStore.markFail("job-1", new RenderError(RenderErrorCode.ENCODER_EXEC, "exit 1",
                Map.of("exitCode", 1)));

        assertEquals("{\"exitCode\":1}", jobStore.get("job-1").getErrorDetail());
    }

    @Test
    void oversizedDetailsAreTruncatedToValidJson() throws Exception {
        claimAndEncode("job-1");

        jobStore.markFail("job-1", new RenderError(RenderErrorCode.ENCODER_EXEC, "exit 1",
                Map.of("logTail", "x".repeat(20_000))));

        String detail = jobStore.get("job-1").getErrorDetail();
        assertThat(detail.length()).isLessThanOrEqualTo(8000);
        assertThat(new ObjectMapper().readTree(detail).has("truncated")).isTrue();
    }

    @Test
    void escapeHeavyDetailsStillFitAndFailTheJob() throws Exception {
        claimAndEncode("job-1");
        String logTail = "\"\\".repeat(3000);

        assertTrue(jobStore.markFail("job-1", new RenderError(RenderErrorCode.ENCODER_EXEC, "exit 1",
                Map.of("logTail", logTail))));

        RenderJob failed = jobStore.get("job-1");
        assertEquals(JobState.FAILED, failed.getState());
        assertThat(failed.getErrorDetail().length()).isLessThanOrEqualTo(8000);
        assertThat(new ObjectMapper().readTree(failed.getErrorDetail()).get("truncated").asText())
                .startsWith("{\"logTail\":\"\\\"");
    }

    @Test
    void recoverOrphansFailsActiveJobsOnlyAndIsIdempotent() {
        claimAndEncode("encoding");
        insertQueued("preparing");
        jobStore.claimNext("worker-a");
        claimAndEncode("done");
        jobStore.markDone("done", new RenderOutput("/out/done.mp4", "/outputs/done.mp4", 1L, 1L));
        insertQueued("queued");

        assertEquals(2, jobStore.recoverOrphans());
        assertEquals(0, jobStore.recoverOrphans());

        RenderJob recovered = jobStore.get("encoding");
        assertEquals(JobState.FAILED, recovered.getState());
        assertEquals(RenderErrorCode.SYSTEM_RESTART, recovered.getErrorCode());
        assertEquals(JobStoreService.SYSTEM_RESTART_MESSAGE, recovered.getErrorMessage());
        assertEquals(JobState.FAILED, jobStore.get("preparing").getState());
        assertEquals(JobState.QUEUED, jobStore.get("queued").getState());
        assertEquals(JobState.DONE, jobStore.get("done").getState());
    }

    @Test
    void findRecentListsNewestFirst() {
        insertQueued("old");
        insertQueued("mid");
        insertQueued("new");

        List<RenderJob> recent = jobStore.findRecent(2);

        assertThat(recent).extracting(RenderJob::getId).containsExactly("new", "mid");
    }
}
