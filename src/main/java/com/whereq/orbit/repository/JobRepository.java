package com.whereq.orbit.repository;

import com.whereq.orbit.model.Job;
import com.whereq.orbit.model.JobCheckpoint;
import com.whereq.orbit.model.JobLog;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.function.UnaryOperator;

/**
 * Persistence for jobs, their logs and checkpoints
 */
public interface JobRepository {
    /**
     * Persist a new job, assigning its identifier and timestamps
     *
     * @param job the job to create
     * @return Mono with the stored job
     */
    Mono<Job> create(Job job);

    /**
     * Overwrite a stored job with the given value
     *
     * @param job the job to store
     * @return Mono with the stored job
     */
    Mono<Job> update(Job job);

    /**
     * Read the latest stored value, apply the mutation to a copy and store the result.
     * All status writers go through here so that no writer works from a stale copy.
     * The write is atomic against other writers of the same job; the mutation may run
     * more than once when a concurrent write wins, so it must not have side effects.
     *
     * @param jobId job identifier
     * @param mutation returns the job to store, or null to leave the stored job untouched
     * @return Mono with the stored job, empty when the mutation declined,
     *         or an error with JobNotFoundException when the job does not exist
     *         or JobUpdateConflictException when concurrent writes kept winning
     */
    Mono<Job> modify(Long jobId, UnaryOperator<Job> mutation);

    /**
     * Find a job by id
     *
     * @param jobId job identifier
     * @return Mono with the job, empty if absent
     */
    Mono<Job> findById(Long jobId);

    Flux<Job> findAll();

    Flux<Job> findByUserId(Long userId);

    Flux<Job> findByProjectId(Long projectId);

    /**
     * Jobs currently in the queued state, oldest first
     */
    Flux<Job> findQueued();

    /**
     * Append a log chunk
     */
    Mono<JobLog> saveLog(JobLog log);

    /**
     * Log chunks of a job in append order
     */
    Flux<JobLog> findLogs(Long jobId);

    /**
     * Record a checkpoint written by a workload
     */
    Mono<JobCheckpoint> saveCheckpoint(JobCheckpoint checkpoint);

    Flux<JobCheckpoint> findCheckpoints(Long jobId);
}
