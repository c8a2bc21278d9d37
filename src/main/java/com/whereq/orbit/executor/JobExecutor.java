package com.whereq.orbit.executor;

import com.whereq.orbit.model.Job;
import com.whereq.orbit.model.JobStatus;
import reactor.core.publisher.Mono;

/**
 * Backend capable of running jobs of one or more job types
 */
public interface JobExecutor {
    /**
     * Start a job. Completes once the job has been handed to the backend;
     * the terminal status is written asynchronously.
     *
     * @param job the job, as last persisted by the scheduler
     * @return Mono that completes when the job is submitted
     */
    Mono<Void> execute(Job job);

    /**
     * Stop a job and mark it cancelled
     *
     * @param jobId job identifier
     * @return Mono that completes when the job is cancelled
     */
    Mono<Void> cancel(Long jobId);

    /**
     * Current status of a job as known to the backend
     *
     * @param jobId job identifier
     * @return Mono with the status
     */
    Mono<JobStatus> getStatus(Long jobId);

    /**
     * Collected output of a job
     *
     * @param jobId job identifier
     * @return Mono with the log text, empty string when nothing was collected
     */
    Mono<String> getLogs(Long jobId);

    /**
     * @param jobType job-type tag
     * @return true if this executor can run jobs of the given type
     */
    boolean supportsType(String jobType);
}
