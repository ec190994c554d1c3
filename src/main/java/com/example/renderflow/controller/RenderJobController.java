package com.example.renderflow.controller;

import com.example.renderflow.dto.plan.ExecutionPlan;
import com.example.renderflow.dto.plan.LegacyTrim;
import com.example.renderflow.dto.plan.RenderInput;
import com.example.renderflow.exception.DuplicateJobIdException;
import com.example.renderflow.exception.JobNotFoundException;
import com.example.renderflow.model.RenderJob;
import com.example.renderflow.service.JobStoreService;
import com.example.renderflow.util.JobState;
import com.example.renderflow.util.RenderErrorCode;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Pattern;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/v1/render/jobs")
public class RenderJobController {
    private static final int MAX_LIMIT = 200;

    private final JobStoreService jobStore;

    public RenderJobController(JobStoreService jobStore) {
        this.jobStore = jobStore;
    }

    public record SubmitRenderRequest(
            @Pattern(regexp = "[A-Za-z0-9_-]{1,64}") String jobId,
            String projectId,
            String variationId,
            String sourceVideoUrl,
            @Valid LegacyTrim trim,
            @Valid ExecutionPlan plan
    ) {}
    public record SubmitRenderResponse(String jobId, JobState state) {}
    public record OutputRes(String path, String url, Long sizeBytes, Long durationMs) {}
    public record ErrorRes(RenderErrorCode code, String message, String detail) {}
    public record JobStatusResponse(
            String id,
            JobState state,
            int progressPct,
            String projectId,
            String variationId,
            OutputRes output,
            ErrorRes error,
            Instant createdAt,
            Instant startedAt,
            Instant completedAt
    ) {}

    @Operation(summary = "Queue a render job from an execution plan or a trimmed source video")
    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public SubmitRenderResponse submit(@Valid @RequestBody SubmitRenderRequest req) {
        if (req.plan() == null && (req.sourceVideoUrl() == null || req.sourceVideoUrl().isBlank())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "PLAN_OR_SOURCE_REQUIRED");
        }
        if (req.plan() == null && req.trim() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "TRIM_REQUIRED");
        }
        String id = req.jobId() != null ? req.jobId() : UUID.randomUUID().toString();
        RenderInput input = new RenderInput(req.projectId(), req.variationId(), req.sourceVideoUrl(), req.trim(), req.plan());
        try {
            RenderJob job = jobStore.insert(new RenderJob(id, input));
            return new SubmitRenderResponse(job.getId(), job.getState());
        } catch (DuplicateJobIdException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "JOB_ID_CONFLICT");
        }
    }

    @Operation(summary = "Current state, progress and result of a render job")
    @GetMapping("/{id}")
    public JobStatusResponse get(@PathVariable String id) {
        try {
            return toResponse(jobStore.get(id));
        } catch (JobNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "JOB_NOT_FOUND");
        }
    }

    @GetMapping
    public List<JobStatusResponse> recent(@RequestParam(defaultValue = "20") int limit) {
        int capped = Math.max(1, Math.min(MAX_LIMIT, limit));
        return jobStore.findRecent(capped).stream().map(RenderJobController::toResponse).toList();
    }

    static JobStatusResponse toResponse(RenderJob j) {
        OutputRes output = j.getState() == JobState.DONE
                ? new OutputRes(j.getOutputPath(), j.getOutputUrl(), j.getOutputSizeBytes(), j.getOutputDurationMs())
                : null;
        ErrorRes error = j.getErrorCode() != null
                ? new ErrorRes(j.getErrorCode(), j.getErrorMessage(), j.getErrorDetail())
                : null;
        return new JobStatusResponse(
                j.getId(),
                j.getState(),
                j.getProgressPct(),
                j.getProjectId(),
                j.getVariationId(),
                output,
                error,
                j.getCreatedAt(),
                j.getStartedAt(),
                j.getCompletedAt()
        );
    }
}
