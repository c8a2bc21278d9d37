package com.whereq.orbit.service;

import com.whereq.orbit.config.OrbitProperties;
import com.whereq.orbit.exception.ExecutorNotFoundException;
import com.whereq.orbit.exception.JobNotFoundException;
import com.whereq.orbit.executor.ExecutorRegistry;
import com.whereq.orbit.model.Job;
import com.whereq.orbit.model.JobStatus;
import com.whereq.orbit.queue.JobQueue;
import com.whereq.orbit.queue.PriorityJobQueue;
import com.whereq.orbit.repository.JobRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Background loop that moves queued jobs to their executors.
 *
 * Each tick reconciles persisted queued jobs into the in-memory priority queue,
 * then dispatches at most one job.
 */
@Slf4j
@Service
public class JobScheduler {

    private final JobRepository jobRepository;
    private final ExecutorRegistry executorRegistry;
    private final OrbitProperties.SchedulerConfig config;

    private final JobQueue jobQueue = new PriorityJobQueue();

    // ids currently waiting in jobQueue, guarded by queueLock together with the queue
    private final Set<Long> enqueued = new HashSet<>();
    private final Object queueLock = new Object();

    private Disposable loop;

    private final Counter dispatchedCounter;
    private final Counter dispatchFailedCounter;
    private final Counter unroutableCounter;

    @Autowired
    public JobScheduler(JobRepository jobRepository,
                        ExecutorRegistry executorRegistry,
                        OrbitProperties properties,
                        MeterRegistry meterRegistry) {
        this.jobRepository = jobRepository;
        this.executorRegistry = executorRegistry;
        this.config = properties.getScheduler();

        Gauge.builder("orbit.scheduler.queue.size", this, JobScheduler::getQueueSize)
            .description("Jobs waiting in the scheduler queue")
            .register(meterRegistry);
        this.dispatchedCounter = Counter.builder("orbit.scheduler.dispatched")
            .description("Jobs handed to an executor")
            .register(meterRegistry);
        this.dispatchFailedCounter = Counter.builder("orbit.scheduler.dispatch.failed")
            .description("Jobs whose executor rejected them")
            .register(meterRegistry);
        this.unroutableCounter = Counter.builder("orbit.scheduler.unroutable")
            .description("Jobs left in scheduling because no executor serves their type")
            .register(meterRegistry);
    }

    @PostConstruct
    public void initialize() {
        if (config.isEnabled()) {
            start();
        } else {
            log.info("Job scheduler disabled");
        }
    }

    /**
     * Start the tick loop. No-op when already running.
     */
    public synchronized void start() {
        if (isRunning()) {
            return;
        }
        Duration interval = config.getTickInterval();
        loop = Flux.interval(interval, interval)
            .onBackpressureDrop(tick -> log.debug("Scheduler tick {} dropped, previous tick still running", tick))
            .concatMap(tick -> tick()
                .onErrorResume(e -> {
                    log.error("Scheduler tick failed", e);
                    return Mono.empty();
                }))
            .subscribe();
        log.info("Job scheduler started (tick interval {})", interval);
    }

    @PreDestroy
    public synchronized void stop() {
        if (loop != null && !loop.isDisposed()) {
            loop.dispose();
            log.info("Job scheduler stopped");
        }
        loop = null;
    }

    public synchronized boolean isRunning() {
        return loop != null && !loop.isDisposed();
    }

    public int getQueueSize() {
        synchronized (queueLock) {
            return jobQueue.size();
        }
    }

    /**
     * Add a job to the in-memory queue unless it is already waiting there
     *
     * @return true if the job was added
     */
    public boolean enqueueJob(Job job) {
        synchronized (queueLock) {
            if (!enqueued.add(job.getId())) {
                return false;
            }
            jobQueue.push(job);
            return true;
        }
    }

    /**
     * Drop a job from the in-memory queue
     *
     * @return true if the job was waiting in the queue
     */
    public boolean removeJob(Long jobId) {
        synchronized (queueLock) {
            enqueued.remove(jobId);
            return jobQueue.remove(jobId);
        }
    }

    /**
     * One scheduling round: reconcile, then dispatch at most one job
     */
    public Mono<Void> tick() {
        return reconcile().then(dispatchNext()).then();
    }

    /**
     * Enqueue persisted queued jobs that are not waiting in memory yet
     *
     * @return Mono with the number of newly enqueued jobs
     */
    public Mono<Integer> reconcile() {
        return jobRepository.findQueued()
            .filter(this::enqueueJob)
            .count()
            .map(Long::intValue)
            .doOnNext(added -> {
                if (added > 0) {
                    log.info("Reconciled {} queued jobs into the scheduler queue", added);
                }
            })
            .onErrorResume(e -> {
                log.error("Failed to load queued jobs", e);
                return Mono.just(0);
            });
    }

    /**
     * Pop the highest-priority job and hand it to its executor
     *
     * @return Mono with the job as last written by the scheduler; empty when nothing was dispatched
     */
    public Mono<Job> dispatchNext() {
        Optional<Job> next;
        synchronized (queueLock) {
            next = jobQueue.pop();
            next.ifPresent(job -> enqueued.remove(job.getId()));
        }
        if (next.isEmpty()) {
            return Mono.empty();
        }
        Long jobId = next.get().getId();

        return jobRepository.modify(jobId, current -> {
                if (current.getStatus() != JobStatus.QUEUED) {
                    return null;
                }
                current.setStatus(JobStatus.SCHEDULING);
                return current;
            })
            .switchIfEmpty(Mono.defer(() -> {
                log.info("Job {} is no longer queued, skipping dispatch", jobId);
                return Mono.empty();
            }))
            .flatMap(scheduling -> {
                log.info("Dispatching job {} ({}, priority {})",
                    jobId, scheduling.getJobType(), scheduling.getPriority());
                return executorRegistry.execute(scheduling)
                    .then(markRunning(jobId))
                    .doOnSuccess(running -> dispatchedCounter.increment())
                    .switchIfEmpty(jobRepository.findById(jobId))
                    .onErrorResume(ExecutorNotFoundException.class, e -> {
                        unroutableCounter.increment();
                        log.warn("No executor registered for job type '{}', job {} stays in scheduling",
                            e.getJobType(), jobId);
                        return Mono.just(scheduling);
                    })
                    .onErrorResume(e -> !(e instanceof ExecutorNotFoundException), e -> {
                        dispatchFailedCounter.increment();
                        log.error("Failed to execute job {}: {}", jobId, e.getMessage(), e);
                        return markFailed(jobId, e);
                    });
            })
            .onErrorResume(JobNotFoundException.class, e -> {
                log.warn("Job {} vanished before dispatch", jobId);
                return Mono.empty();
            });
    }

    private Mono<Job> markRunning(Long jobId) {
        return jobRepository.modify(jobId, current -> {
            if (current.getStatus() != JobStatus.SCHEDULING) {
                return null;
            }
            current.setStatus(JobStatus.RUNNING);
            if (current.getStartedAt() == null) {
                current.setStartedAt(Instant.now());
            }
            return current;
        });
    }

    private Mono<Job> markFailed(Long jobId, Throwable cause) {
        return jobRepository.modify(jobId, current -> {
                if (current.getStatus().isTerminal()) {
                    return null;
                }
                current.setStatus(JobStatus.FAILED);
                current.setErrorMessage(cause.getMessage());
                current.setCompletedAt(Instant.now());
                return current;
            })
            .onErrorResume(e -> {
                log.error("Failed to record failure of job {}", jobId, e);
                return Mono.empty();
            });
    }
}
