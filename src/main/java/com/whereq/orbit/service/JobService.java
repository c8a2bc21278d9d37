package com.whereq.orbit.service;

import com.whereq.orbit.dto.JobSubmitRequest;
import com.whereq.orbit.exception.CheckpointNotFoundException;
import com.whereq.orbit.exception.ExecutorNotFoundException;
import com.whereq.orbit.exception.InvalidJobTransitionException;
import com.whereq.orbit.exception.JobNotFoundException;
import com.whereq.orbit.executor.ExecutorRegistry;
import com.whereq.orbit.model.Job;
import com.whereq.orbit.model.JobCheckpoint;
import com.whereq.orbit.model.JobLog;
import com.whereq.orbit.model.JobStatus;
import com.whereq.orbit.repository.JobRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Job lifecycle operations exposed to the API layer
 */
@Slf4j
@Service
public class JobService {

    private final AdmissionController admissionController;
    private final JobScheduler jobScheduler;
    private final ExecutorRegistry executorRegistry;
    private final JobRepository jobRepository;

    @Autowired
    public JobService(AdmissionController admissionController,
                      JobScheduler jobScheduler,
                      ExecutorRegistry executorRegistry,
                      JobRepository jobRepository) {
        this.admissionController = admissionController;
        this.jobScheduler = jobScheduler;
        this.executorRegistry = executorRegistry;
        this.jobRepository = jobRepository;
    }

    public Mono<Job> createJob(Long requesterId, JobSubmitRequest request) {
        return admissionController.admit(requesterId, request);
    }

    /**
     * @param userId requesting user
     * @param admin admins see every job
     */
    public Flux<Job> listJobs(Long userId, boolean admin) {
        return admin ? jobRepository.findAll() : jobRepository.findByUserId(userId);
    }

    public Mono<Job> getJob(Long jobId) {
        return jobRepository.findById(jobId)
            .switchIfEmpty(Mono.error(new JobNotFoundException(jobId)));
    }

    /**
     * Cancel a job that has not reached a terminal state.
     * Queued jobs are cancelled in place; later states go through their executor.
     *
     * @return Mono with the cancelled job
     */
    public Mono<Job> cancelJob(Long jobId) {
        return getJob(jobId).flatMap(job -> {
            if (job.getStatus().isTerminal()) {
                return Mono.error(new InvalidJobTransitionException(
                    "Cannot cancel job " + jobId + " in status " + job.getStatus()));
            }
            Mono<Void> stop;
            if (job.getStatus() == JobStatus.QUEUED) {
                jobScheduler.removeJob(jobId);
                stop = Mono.empty();
            } else {
                stop = executorRegistry.cancel(job)
                    .onErrorResume(ExecutorNotFoundException.class, e -> {
                        log.warn("No executor for job type '{}', cancelling job {} in place", e.getJobType(), jobId);
                        return Mono.empty();
                    });
            }
            return stop
                .then(jobRepository.modify(jobId, current -> {
                    if (current.getStatus().isTerminal()) {
                        return null;
                    }
                    current.setStatus(JobStatus.CANCELLED);
                    current.setCompletedAt(Instant.now());
                    return current;
                }))
                .then(getJob(jobId))
                .doOnNext(cancelled -> log.info("Job {} cancelled (was {})", jobId, job.getStatus()));
        });
    }

    /**
     * Put a finished or stuck job back in the queue
     *
     * @param jobId job to restart
     * @param checkpointId checkpoint to resume from, or null to start over
     * @return Mono with the re-queued job
     */
    public Mono<Job> restartJob(Long jobId, Long checkpointId) {
        return getJob(jobId).flatMap(job -> {
            if (job.getStatus() == JobStatus.RUNNING) {
                return Mono.error(new InvalidJobTransitionException("Cannot restart running job " + jobId));
            }
            Mono<String> resumePath = checkpointId == null
                ? Mono.just("")
                : jobRepository.findCheckpoints(jobId)
                    .filter(checkpoint -> checkpointId.equals(checkpoint.getId()))
                    .next()
                    .map(JobCheckpoint::getPath)
                    .switchIfEmpty(Mono.error(new CheckpointNotFoundException(jobId, checkpointId)));

            return resumePath.flatMap(path -> jobRepository.modify(jobId, current -> {
                if (current.getStatus() == JobStatus.RUNNING) {
                    return null;
                }
                int restarts = current.getRestartCount() + 1;
                current.setRestartCount(restarts);
                current.setStatus(JobStatus.QUEUED);
                current.setClusterJobName(clusterJobName(current.getName(), restarts));
                current.setResumeCheckpointPath(path.isEmpty() ? null : path);
                current.setStartedAt(null);
                current.setCompletedAt(null);
                current.setExitCode(null);
                current.setErrorMessage(null);
                return current;
            }))
            .switchIfEmpty(Mono.error(new InvalidJobTransitionException("Cannot restart running job " + jobId)))
            .doOnNext(restarted -> log.info("Job {} re-queued as {} (restart {})",
                jobId, restarted.getClusterJobName(), restarted.getRestartCount()));
        });
    }

    /**
     * @param limit maximum entries, 0 or less for all
     * @param offset entries to skip
     */
    public Flux<JobLog> getJobLogs(Long jobId, int limit, int offset) {
        Flux<JobLog> logs = getJob(jobId)
            .thenMany(jobRepository.findLogs(jobId))
            .skip(Math.max(offset, 0));
        return limit > 0 ? logs.take(limit) : logs;
    }

    public Flux<JobCheckpoint> getJobCheckpoints(Long jobId) {
        return getJob(jobId).thenMany(jobRepository.findCheckpoints(jobId));
    }

    /**
     * Cluster job name for a restart, kept within the 63 character DNS label limit
     */
    static String clusterJobName(String name, int restartCount) {
        String suffix = "-r" + restartCount;
        String base = name.length() + suffix.length() > 63 ? name.substring(0, 63 - suffix.length()) : name;
        return base.replaceAll("-+$", "") + suffix;
    }
}
