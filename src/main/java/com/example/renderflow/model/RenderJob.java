package com.example.renderflow.model;

import com.example.renderflow.dto.plan.RenderInput;
import com.example.renderflow.util.JobState;
import com.example.renderflow.util.RenderErrorCode;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

@Entity
@Table(
        name = "render_job",
        indexes = {
                @Index(name = "idx_render_job_state_created", columnList = "state, created_at")
        }
)
public class RenderJob {
    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 32)
    private JobState state = JobState.QUEUED;

    @Column(name = "project_id", length = 128)
    private String projectId;

    @Column(name = "variation_id", length = 128)
    private String variationId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "input_json", nullable = false, updatable = false)
    private RenderInput input;

    @Column(name = "progress_pct", nullable = false)
    private int progressPct = 0;

    @Column(name = "output_path", length = 1024)
    private String outputPath;

    @Column(name = "output_url", length = 1024)
    private String outputUrl;

    @Column(name = "output_size_bytes")
    private Long outputSizeBytes;

    @Column(name = "output_duration_ms")
    private Long outputDurationMs;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_code", length = 32)
    private RenderErrorCode errorCode;

    @Column(name = "error_message", length = 4000)
    private String errorMessage;

    // JSON object, serialized by JobStoreService
    @Column(name = "error_detail", length = 8000)
    private String errorDetail;

    @Column(name = "worker_owner", length = 128)
    private String workerOwner;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    // Null until first persist so Spring Data treats assigned ids as new rows
    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    protected RenderJob() {}

    public RenderJob(String id, RenderInput input) {
        this.id = id;
        this.input = input;
        if (input != null) {
            this.projectId = input.projectId();
            this.variationId = input.variationId();
        }
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public JobState getState() {
        return state;
    }

    public void setState(JobState state) {
        this.state = state;
    }

    public String getProjectId() {
        return projectId;
    }

    public void setProjectId(String projectId) {
        this.projectId = projectId;
    }

    public String getVariationId() {
        return variationId;
    }

    public void setVariationId(String variationId) {
        this.variationId = variationId;
    }

    public RenderInput getInput() {
        return input;
    }

    public void setInput(RenderInput input) {
        this.input = input;
    }

    public int getProgressPct() {
        return progressPct;
    }

    public void setProgressPct(int progressPct) {
        this.progressPct = progressPct;
    }

    public String getOutputPath() {
        return outputPath;
    }

    public void setOutputPath(String outputPath) {
        this.outputPath = outputPath;
    }

    public String getOutputUrl() {
        return outputUrl;
    }

    public void setOutputUrl(String outputUrl) {
        this.outputUrl = outputUrl;
    }

    public Long getOutputSizeBytes() {
        return outputSizeBytes;
    }

    public void setOutputSizeBytes(Long outputSizeBytes) {
        this.outputSizeBytes = outputSizeBytes;
    }

    public Long getOutputDurationMs() {
        return outputDurationMs;
    }

    public void setOutputDurationMs(Long outputDurationMs) {
        this.outputDurationMs = outputDurationMs;
    }

    public RenderErrorCode getErrorCode() {
        return errorCode;
    }

    public void setErrorCode(RenderErrorCode errorCode) {
        this.errorCode = errorCode;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public String getErrorDetail() {
        return errorDetail;
    }

    public void setErrorDetail(String errorDetail) {
        this.errorDetail = errorDetail;
    }

    public String getWorkerOwner() {
        return workerOwner;
    }

    public void setWorkerOwner(String workerOwner) {
        this.workerOwner = workerOwner;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    public Long getVersion() {
        return version;
    }

    public void setVersion(Long version) {
        this.version = version;
    }

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
        if (state == null) state = JobState.QUEUED;
    }
}
