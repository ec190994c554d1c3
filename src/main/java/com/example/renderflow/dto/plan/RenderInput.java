package com.example.renderflow.dto.plan;

import com.example.renderflow.exception.PlanValidationException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.Valid;

import java.util.List;

/**
 * Submission payload stored with the job. Either {@code plan} is set, or the legacy pair
 * {@code sourceVideoUrl} + {@code trim} describes a single-cut render.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RenderInput(String projectId,
                          String variationId,
                          String sourceVideoUrl,
                          @Valid LegacyTrim trim,
                          @Valid ExecutionPlan plan) {

    public static RenderInput ofPlan(ExecutionPlan plan) {
        return new RenderInput(null, null, null, null, plan);
    }

    /**
     * Plan the worker should compile. A legacy submission becomes a one-segment timeline in the
     * default output format.
     */
    public ExecutionPlan effectivePlan() {
        if (plan != null) {
            return plan;
        }
        if (sourceVideoUrl == null || sourceVideoUrl.isBlank()) {
            throw new PlanValidationException("Job has neither an execution plan nor a source video");
        }
        if (trim == null || trim.start() == null || trim.end() == null) {
            throw new PlanValidationException("Legacy source render requires a trim window");
        }
        TimelineSegment segment = new TimelineSegment(sourceVideoUrl,
                Math.round(trim.start() * 1000), Math.round(trim.end() * 1000));
        return new ExecutionPlan(List.of(segment), List.of(), List.of(), OutputFormat.DEFAULT);
    }
}
