package com.whereq.orbit.executor;

import com.whereq.orbit.exception.ExecutorNotFoundException;
import com.whereq.orbit.model.Job;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps job-type tags to the executor that runs them
 */
@Slf4j
public class ExecutorRegistry {

    private final Map<String, JobExecutor> executors = new ConcurrentHashMap<>();

    /**
     * Bind a job type to an executor. The last registration for a type wins.
     *
     * @param jobType job-type tag
     * @param executor the executor
     */
    public void register(String jobType, JobExecutor executor) {
        String tag = normalize(jobType);
        if (!executor.supportsType(tag)) {
            log.warn("Executor {} does not declare support for job type '{}'",
                executor.getClass().getSimpleName(), tag);
        }
        JobExecutor previous = executors.put(tag, executor);
        if (previous != null && previous != executor) {
            log.info("Executor for job type '{}' replaced: {} -> {}", tag,
                previous.getClass().getSimpleName(), executor.getClass().getSimpleName());
        } else {
            log.info("Registered {} for job type '{}'", executor.getClass().getSimpleName(), tag);
        }
    }

    /**
     * @param jobType job-type tag
     * @return the executor bound to the type, if any
     */
    public Optional<JobExecutor> resolve(String jobType) {
        return Optional.ofNullable(executors.get(normalize(jobType)));
    }

    /**
     * Dispatch a job to the executor registered for its type
     *
     * @param job the job
     * @return Mono that completes when the executor accepted the job,
     *         or errors with ExecutorNotFoundException when no executor is bound
     */
    public Mono<Void> execute(Job job) {
        return resolveOrError(job.getJobType())
            .flatMap(executor -> executor.execute(job));
    }

    /**
     * Cancel a job through the executor registered for its type
     */
    public Mono<Void> cancel(Job job) {
        return resolveOrError(job.getJobType())
            .flatMap(executor -> executor.cancel(job.getId()));
    }

    public Set<String> registeredTypes() {
        return new TreeSet<>(executors.keySet());
    }

    private Mono<JobExecutor> resolveOrError(String jobType) {
        return Mono.defer(() -> resolve(jobType)
            .map(Mono::just)
            .orElseGet(() -> Mono.error(new ExecutorNotFoundException(normalize(jobType)))));
    }

    private static String normalize(String jobType) {
        return jobType == null ? "" : jobType.trim();
    }
}
