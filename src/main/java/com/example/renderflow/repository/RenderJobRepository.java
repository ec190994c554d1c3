package com.example.renderflow.repository;

import com.example.renderflow.model.RenderJob;
import com.example.renderflow.util.JobState;
import com.example.renderflow.util.RenderErrorCode;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface RenderJobRepository extends JpaRepository<RenderJob, String> {
    long countByState(JobState state);

    List<RenderJob> findAllByOrderByCreatedAtDesc(Pageable pageable);

    @Query("select j.id from RenderJob j where j.state in :states order by j.createdAt asc, j.id asc")
    List<String> findIdsByStateIn(@Param("states") Collection<JobState> states);

    // FIFO candidates for a claim; the claim itself is the conditional update below
    @Query("""
        select j.id from RenderJob j
         where j.state = com.example.renderflow.util.JobState.QUEUED
         order by j.createdAt asc, j.id asc
        """)
    List<String> findQueuedIdsOldestFirst(Pageable pageable);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update RenderJob j
           set j.state = com.example.renderflow.util.JobState.PREPARING,
               j.workerOwner = :owner,
               j.startedAt = :now,
               j.version = j.version + 1
         where j.id = :id
           and j.state = com.example.renderflow.util.JobState.QUEUED
        """)
    int claimIfQueued(@Param("id") String id, @Param("owner") String owner, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update RenderJob j
           set j.state = :state,
               j.version = j.version + 1
         where j.id = :id
           and j.state in :from
        """)
    int advanceState(@Param("id") String id, @Param("state") JobState state, @Param("from") Collection<JobState> from);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update RenderJob j
           set j.progressPct = :pct
         where j.id = :id
           and j.state = com.example.renderflow.util.JobState.ENCODING
           and j.progressPct < :pct
        """)
    int raiseProgress(@Param("id") String id, @Param("pct") int pct);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update RenderJob j
           set j.state = com.example.renderflow.util.JobState.DONE,
               j.completedAt = :now,
               j.progressPct = 100,
               j.outputPath = :outputPath,
               j.outputUrl = :outputUrl,
               j.outputSizeBytes = :sizeBytes,
               j.outputDurationMs = :durationMs,
               j.workerOwner = null,
               j.version = j.version + 1
         where j.id = :id
           and j.state not in (com.example.renderflow.util.JobState.DONE,
                               com.example.renderflow.util.JobState.FAILED)
        """)
    int markDone(@Param("id") String id,
                 @Param("now") Instant now,
                 @Param("outputPath") String outputPath,
                 @Param("outputUrl") String outputUrl,
                 @Param("sizeBytes") Long sizeBytes,
                 @Param("durationMs") Long durationMs);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update RenderJob j
           set j.state = com.example.renderflow.util.JobState.FAILED,
               j.completedAt = :now,
               j.errorCode = :code,
               j.errorMessage = :message,
               j.errorDetail = :detail,
               j.workerOwner = null,
               j.version = j.version + 1
         where j.id = :id
           and j.state not in (com.example.renderflow.util.JobState.DONE,
                               com.example.renderflow.util.JobState.FAILED)
        """)
    int markFailed(@Param("id") String id,
                   @Param("now") Instant now,
                   @Param("code") RenderErrorCode code,
                   @Param("message") String message,
                   @Param("detail") String detail);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update RenderJob j
           set j.state = com.example.renderflow.util.JobState.FAILED,
               j.completedAt = :now,
               j.errorCode = :code,
               j.errorMessage = :message,
               j.workerOwner = null,
               j.version = j.version + 1
         where j.state in :states
        """)
    int failAllInStates(@Param("states") Collection<JobState> states,
                        @Param("now") Instant now,
                        @Param("code") RenderErrorCode code,
                        @Param("message") String message);
}
