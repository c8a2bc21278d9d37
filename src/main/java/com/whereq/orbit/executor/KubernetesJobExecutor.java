package com.whereq.orbit.executor;

import com.whereq.orbit.exception.JobExecutionException;
import com.whereq.orbit.exception.JobNotFoundException;
import com.whereq.orbit.kubernetes.ClusterClient;
import com.whereq.orbit.kubernetes.JobCompletionWatcher;
import com.whereq.orbit.kubernetes.KubernetesJobFactory;
import com.whereq.orbit.kubernetes.PodLogFollower;
import com.whereq.orbit.model.Job;
import com.whereq.orbit.model.JobStatus;
import com.whereq.orbit.model.JobType;
import com.whereq.orbit.repository.JobRepository;
import io.kubernetes.client.openapi.ApiException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs jobs as Kubernetes batch Jobs.
 *
 * Each running job gets a completion watcher and a log follower, held in a
 * per-job scope that cancel and shutdown dispose.
 */
@Slf4j
public class KubernetesJobExecutor extends PersistedJobExecutor {

    private final ClusterClient clusterClient;
    private final KubernetesJobFactory jobFactory;
    private final JobCompletionWatcher completionWatcher;
    private final PodLogFollower logFollower;

    private final Map<Long, Disposable.Composite> watchers = new ConcurrentHashMap<>();
    // cancel flags of submissions still in flight
    private final Map<Long, AtomicBoolean> submissions = new ConcurrentHashMap<>();

    private final Counter submittedCounter;
    private final Counter completedCounter;
    private final Counter failedCounter;

    public KubernetesJobExecutor(ClusterClient clusterClient,
                                 JobRepository jobRepository,
                                 KubernetesJobFactory jobFactory,
                                 JobCompletionWatcher completionWatcher,
                                 PodLogFollower logFollower,
                                 MeterRegistry meterRegistry) {
        super(jobRepository);
        this.clusterClient = clusterClient;
        this.jobFactory = jobFactory;
        this.completionWatcher = completionWatcher;
        this.logFollower = logFollower;

        this.submittedCounter = Counter.builder("orbit.jobs.submitted")
            .description("Jobs submitted to the cluster")
            .register(meterRegistry);
        this.completedCounter = Counter.builder("orbit.jobs.completed")
            .description("Cluster jobs that completed")
            .register(meterRegistry);
        this.failedCounter = Counter.builder("orbit.jobs.failed")
            .description("Cluster jobs that failed")
            .register(meterRegistry);
    }

    @Override
    public Mono<Void> execute(Job job) {
        Long jobId = job.getId();
        return Mono.defer(() -> {
            AtomicBoolean cancelled = new AtomicBoolean();
            submissions.put(jobId, cancelled);
            return Mono.fromCallable(() -> jobFactory.build(job))
                .flatMap(manifest -> Mono.fromCallable(() -> clusterClient.createJob(manifest))
                    .subscribeOn(Schedulers.boundedElastic()))
                .onErrorMap(ApiException.class, e -> new JobExecutionException(
                    "Failed to submit job " + jobId + " (HTTP " + e.getCode() + "): " + describe(e), e))
                .doOnNext(created -> {
                    submittedCounter.increment();
                    log.info("Submitted cluster job {}/{} for job {}",
                        job.getNamespace(), job.getClusterJobName(), jobId);
                })
                .then(Mono.defer(() -> {
                    if (cancelled.get()) {
                        log.info("Job {} was cancelled while its cluster job was being created", jobId);
                        return discard(job);
                    }
                    return jobRepository.modify(jobId, current -> {
                            if (current.getStatus().isTerminal()) {
                                return null;
                            }
                            current.setStatus(JobStatus.RUNNING);
                            current.setStartedAt(Instant.now());
                            return current;
                        })
                        .switchIfEmpty(Mono.defer(() -> discard(job)))
                        .doOnNext(this::startWatchers);
                }))
                .doFinally(signal -> submissions.remove(jobId, cancelled));
        }).then();
    }

    @Override
    public Mono<Void> cancel(Long jobId) {
        AtomicBoolean submission = submissions.get(jobId);
        if (submission != null) {
            submission.set(true);
        }
        return jobRepository.findById(jobId)
            .switchIfEmpty(Mono.error(new JobNotFoundException(jobId)))
            .flatMap(job -> Mono.fromCallable(() -> clusterClient.deleteJob(job.getNamespace(), job.getClusterJobName()))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(ApiException.class, e -> new JobExecutionException(
                    "Failed to delete cluster job for job " + jobId + ": " + describe(e), e))
                .doOnNext(deleted -> {
                    if (!deleted) {
                        log.info("Cluster job {} for job {} was already gone", job.getClusterJobName(), jobId);
                    }
                    stopWatchers(jobId);
                }))
            .then(markCancelled(jobId))
            .doOnNext(cancelled -> log.info("Job {} cancelled", jobId))
            .then();
    }

    @Override
    public boolean supportsType(String jobType) {
        return jobType == null
            || jobType.isEmpty()
            || JobType.NORMAL.getTag().equals(jobType)
            || JobType.GPU.getTag().equals(jobType);
    }

    /**
     * @return number of jobs with live watchers
     */
    public int getWatchedJobCount() {
        return watchers.size();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Stopping watchers for {} jobs", watchers.size());
        watchers.values().forEach(Disposable::dispose);
        watchers.clear();
    }

    private void startWatchers(Job job) {
        Long jobId = job.getId();
        Disposable.Composite scope = Disposables.composite();
        Disposable previous = watchers.put(jobId, scope);
        if (previous != null) {
            previous.dispose();
        }

        Sinks.Empty<Void> finished = Sinks.empty();

        scope.add(logFollower.follow(job, finished.asMono())
            .subscribe(
                lines -> log.debug("Stored {} streamed log lines for job {}", lines, jobId),
                error -> log.error("Log follower for job {} failed", jobId, error)));

        scope.add(completionWatcher.watch(job)
            .doFinally(signal -> {
                finished.tryEmitEmpty();
                watchers.remove(jobId, scope);
            })
            .subscribe(
                this::recordOutcome,
                error -> log.error("Completion watcher for job {} failed", jobId, error)));
    }

    /**
     * Deletes a cluster Job whose record ended before the submission finished.
     */
    private Mono<Job> discard(Job job) {
        return Mono.fromCallable(() -> clusterClient.deleteJob(job.getNamespace(), job.getClusterJobName()))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnNext(deleted -> log.info("Deleted cluster job {}/{} of ended job {}",
                job.getNamespace(), job.getClusterJobName(), job.getId()))
            .onErrorResume(e -> {
                log.warn("Failed to delete cluster job {}/{} of ended job {}",
                    job.getNamespace(), job.getClusterJobName(), job.getId(), e);
                return Mono.empty();
            })
            .then(Mono.<Job>empty());
    }

    private void recordOutcome(Job finished) {
        if (finished.getStatus() == JobStatus.COMPLETED) {
            completedCounter.increment();
        } else if (finished.getStatus() == JobStatus.FAILED) {
            failedCounter.increment();
        }
    }

    private void stopWatchers(Long jobId) {
        Disposable scope = watchers.remove(jobId);
        if (scope != null) {
            scope.dispose();
            log.debug("Stopped watchers for job {}", jobId);
        }
    }

    private static String describe(ApiException e) {
        if (e.getResponseBody() != null && !e.getResponseBody().isBlank()) {
            return e.getResponseBody();
        }
        return e.getMessage();
    }
}
