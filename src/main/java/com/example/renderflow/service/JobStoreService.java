package com.example.renderflow.service;

import com.example.renderflow.dto.RenderError;
import com.example.renderflow.dto.RenderOutput;
import com.example.renderflow.exception.DuplicateJobIdException;
import com.example.renderflow.exception.JobNotFoundException;
import com.example.renderflow.model.RenderJob;
import com.example.renderflow.repository.RenderJobRepository;
import com.example.renderflow.util.JobState;
import com.example.renderflow.util.RenderErrorCode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Durable store of render jobs. The database row is the only shared state between workers;
 * every transition out of {@code QUEUED} and every terminal write is a conditional update.
 */
@Service
public class JobStoreService {
    private static final Logger LOGGER = LoggerFactory.getLogger(JobStoreService.class);

    static final int CLAIM_CANDIDATES = 5;
    static final String SYSTEM_RESTART_MESSAGE = "Job failed due to system crash/restart";
    static final int MAX_DETAIL_CHARS = 8000;
    static final int MAX_RUNNING_PCT = 99;
    private static final Set<JobState> ACTIVE_STATES =
            EnumSet.of(JobState.PREPARING, JobState.DOWNLOADING, JobState.ENCODING, JobState.FINALIZING);

    private final RenderJobRepository jobRepo;
    private final ObjectMapper mapper;
    private final Clock clock;

    public JobStoreService(RenderJobRepository jobRepo, ObjectMapper mapper, Clock clock) {
        this.jobRepo = jobRepo;
        this.mapper = mapper;
        this.clock = clock;
    }

    @Transactional
    public RenderJob insert(RenderJob job) {
        if (jobRepo.existsById(job.getId())) {
            throw new DuplicateJobIdException(job.getId());
        }
        job.setState(JobState.QUEUED);
        job.setProgressPct(0);
        job.setCreatedAt(clock.instant());
        try {
            return jobRepo.saveAndFlush(job);
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateJobIdException(job.getId());
        }
    }

    @Transactional(readOnly = true)
    public RenderJob get(String id) {
        return jobRepo.findById(id).orElseThrow(() -> new JobNotFoundException(id));
    }

    @Transactional(readOnly = true)
    public List<RenderJob> findRecent(int limit) {
        return jobRepo.findAllByOrderByCreatedAtDesc(PageRequest.of(0, Math.max(1, limit)));
    }

    @Transactional(readOnly = true)
    public long countByState(JobState state) {
        return jobRepo.countByState(state);
    }

    /**
     * Claims the oldest queued job for {@code workerOwner}. A candidate is only taken when the
     * conditional update still sees it {@code QUEUED}; a lost race moves on to the next candidate.
     *
     * @return the claimed job in {@code PREPARING}, or empty when nothing is claimable
     */
    @Transactional
    public Optional<RenderJob> claimNext(String workerOwner) {
        List<String> candidates = jobRepo.findQueuedIdsOldestFirst(PageRequest.of(0, CLAIM_CANDIDATES));
        for (String id : candidates) {
            int updated = jobRepo.claimIfQueued(id, workerOwner, clock.instant());
            if (updated == 1) {
                return jobRepo.findById(id);
            }
            LOGGER.debug("Claim lost race jobId={} owner={}", id, workerOwner);
        }
        return Optional.empty();
    }

    /**
     * Moves a claimed job forward. Re-writing the current state is a no-op; terminal rows and
     * backwards moves are left untouched.
     *
     * @return whether the row is now in {@code state}
     */
    @Transactional
    public boolean advanceState(String id, JobState state) {
        if (!state.isActive()) {
            throw new IllegalArgumentException("Not a pipeline state: " + state);
        }
        List<JobState> from = new ArrayList<>();
        for (JobState s : ACTIVE_STATES) {
            if (s.ordinal() <= state.ordinal()) {
                from.add(s);
            }
        }
        int updated = jobRepo.advanceState(id, state, from);
        if (updated == 0) {
            LOGGER.warn("advanceState ignored jobId={} target={}", id, state);
        }
        return updated == 1;
    }

    /**
     * Raises the stored progress while the job is encoding; lower or repeated values are ignored.
     * Running progress stays below 100, which only {@link #markDone} writes.
     * Callers treat failures here as non-fatal.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean updateProgress(String id, int pct) {
        int clamped = Math.max(0, Math.min(MAX_RUNNING_PCT, pct));
        return jobRepo.raiseProgress(id, clamped) == 1;
    }

    /** @return {@code false} when the job already reached a terminal state (first writer wins) */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean markDone(String id, RenderOutput output) {
        int updated = jobRepo.markDone(id, clock.instant(), output.outputPath(), output.outputUrl(),
                output.fileSizeBytes(), output.durationMs());
        if (updated == 0) {
            LOGGER.warn("markDone ignored, job already terminal jobId={}", id);
        }
        return updated == 1;
    }

    /** @return {@code false} when the job already reached a terminal state (first writer wins) */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean markFail(String id, RenderError error) {
        String detail = serializeDetails(error);
        int updated = jobRepo.markFailed(id, clock.instant(), error.code(), truncate(error.message(), 4000), detail);
        if (updated == 0) {
            LOGGER.warn("markFail ignored, job already terminal jobId={} code={}", id, error.code());
        }
        return updated == 1;
    }

    /**
     * Fails every job a previous process claimed but never finished. Must run before the
     * worker's first claim.
     *
     * @return number of recovered jobs
     */
    @Transactional
    public int recoverOrphans() {
        List<String> orphaned = jobRepo.findIdsByStateIn(ACTIVE_STATES);
        if (orphaned.isEmpty()) {
            return 0;
        }
        LOGGER.info("Recovering orphaned jobs count={} ids={}", orphaned.size(), orphaned);
        return jobRepo.failAllInStates(ACTIVE_STATES, clock.instant(),
                RenderErrorCode.SYSTEM_RESTART, SYSTEM_RESTART_MESSAGE);
    }

    private String serializeDetails(RenderError error) {
        if (error.details() == null || error.details().isEmpty()) {
            return null;
        }
        try {
            String json = mapper.writeValueAsString(error.details());
            if (json.length() <= MAX_DETAIL_CHARS) {
                return json;
            }
            // re-encoding escapes quotes and backslashes, so shrink until the wrapper fits
            int keep = MAX_DETAIL_CHARS / 2;
            while (keep > 0) {
                if (Character.isHighSurrogate(json.charAt(keep - 1))) {
                    keep--;
                }
                String wrapped = mapper.writeValueAsString(Map.of("truncated", json.substring(0, keep)));
                if (wrapped.length() <= MAX_DETAIL_CHARS) {
                    return wrapped;
                }
                keep /= 2;
            }
            return mapper.writeValueAsString(Map.of("truncated", ""));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Serialize error detail JSON failed", e);
        }
    }

    private static String truncate(String s, int max) {
        if (s == null) return null;
        return s.length() > max ? s.substring(0, max) : s;
    }
}
