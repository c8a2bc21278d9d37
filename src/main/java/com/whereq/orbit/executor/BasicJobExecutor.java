package com.whereq.orbit.executor;

import com.whereq.orbit.model.Job;
import com.whereq.orbit.model.JobStatus;
import com.whereq.orbit.repository.JobRepository;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Executor that only records state changes. Used for job types that have
 * no cluster backend and when the Kubernetes executor is disabled.
 */
@Slf4j
public class BasicJobExecutor extends PersistedJobExecutor {

    public BasicJobExecutor(JobRepository jobRepository) {
        super(jobRepository);
    }

    @Override
    public Mono<Void> execute(Job job) {
        log.info("Recording job {} as running without a cluster backend", job.getId());
        return jobRepository.modify(job.getId(), current -> {
            if (current.getStatus().isTerminal()) {
                log.info("Job {} is already {}, not marking it running", current.getId(), current.getStatus());
                return null;
            }
            current.setStatus(JobStatus.RUNNING);
            current.setStartedAt(Instant.now());
            return current;
        }).then();
    }

    @Override
    public Mono<Void> cancel(Long jobId) {
        return markCancelled(jobId)
            .doOnNext(cancelled -> log.info("Job {} cancelled", jobId))
            .then();
    }

    @Override
    public boolean supportsType(String jobType) {
        return true;
    }
}
