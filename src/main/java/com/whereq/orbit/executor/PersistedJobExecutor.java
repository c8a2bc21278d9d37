package com.whereq.orbit.executor;

import com.whereq.orbit.exception.JobNotFoundException;
import com.whereq.orbit.model.Job;
import com.whereq.orbit.model.JobLog;
import com.whereq.orbit.model.JobStatus;
import com.whereq.orbit.repository.JobRepository;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Base for executors whose status and logs are read back from the job store
 */
public abstract class PersistedJobExecutor implements JobExecutor {

    protected final JobRepository jobRepository;

    protected PersistedJobExecutor(JobRepository jobRepository) {
        this.jobRepository = jobRepository;
    }

    @Override
    public Mono<JobStatus> getStatus(Long jobId) {
        return jobRepository.findById(jobId)
            .map(Job::getStatus)
            .switchIfEmpty(Mono.error(new JobNotFoundException(jobId)));
    }

    @Override
    public Mono<String> getLogs(Long jobId) {
        return jobRepository.findLogs(jobId)
            .map(JobLog::getContent)
            .collect(Collectors.joining("\n"));
    }

    /**
     * Mark a job cancelled unless it already reached a terminal state
     */
    protected Mono<Job> markCancelled(Long jobId) {
        return jobRepository.modify(jobId, current -> {
            if (current.getStatus().isTerminal()) {
                return null;
            }
            current.setStatus(JobStatus.CANCELLED);
            current.setCompletedAt(Instant.now());
            return current;
        });
    }
}
