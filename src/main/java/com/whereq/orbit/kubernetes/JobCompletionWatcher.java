package com.whereq.orbit.kubernetes;

import com.whereq.orbit.model.Job;
import com.whereq.orbit.model.JobLog;
import com.whereq.orbit.model.JobStatus;
import com.whereq.orbit.repository.JobRepository;
import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.models.V1ContainerStateTerminated;
import io.kubernetes.client.openapi.models.V1ContainerStatus;
import io.kubernetes.client.openapi.models.V1Job;
import io.kubernetes.client.openapi.models.V1JobStatus;
import io.kubernetes.client.openapi.models.V1Pod;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Polls a cluster Job until it succeeds, fails or disappears and writes the outcome back
 */
@Slf4j
public class JobCompletionWatcher {

    enum ClusterJobState {
        ACTIVE, SUCCEEDED, FAILED, GONE
    }

    private final ClusterClient clusterClient;
    private final JobRepository jobRepository;
    private final Duration pollInterval;

    public JobCompletionWatcher(ClusterClient clusterClient, JobRepository jobRepository, Duration pollInterval) {
        this.clusterClient = clusterClient;
        this.jobRepository = jobRepository;
        this.pollInterval = pollInterval;
    }

    /**
     * Watch a running job.
     *
     * @param job the job as marked running
     * @return Mono with the terminal record written by this watcher; empty when the cluster Job
     *         vanished or the record had already reached a terminal state
     */
    public Mono<Job> watch(Job job) {
        return Flux.interval(pollInterval, pollInterval)
            .onBackpressureDrop()
            .concatMap(tick -> poll(job))
            .filter(state -> state != ClusterJobState.ACTIVE)
            .next()
            .flatMap(state -> {
                if (state == ClusterJobState.GONE) {
                    log.info("Cluster job {} for job {} no longer exists, stopping watch",
                        job.getClusterJobName(), job.getId());
                    return Mono.empty();
                }
                return finish(job, state == ClusterJobState.SUCCEEDED ? JobStatus.COMPLETED : JobStatus.FAILED);
            });
    }

    private Mono<ClusterJobState> poll(Job job) {
        return Mono.fromCallable(() -> clusterClient.getJob(job.getNamespace(), job.getClusterJobName()))
            .subscribeOn(Schedulers.boundedElastic())
            .map(found -> found.map(JobCompletionWatcher::evaluate).orElse(ClusterJobState.GONE))
            .onErrorResume(e -> {
                log.warn("Failed to poll cluster job {} for job {}: {}",
                    job.getClusterJobName(), job.getId(), e.getMessage());
                return Mono.empty();
            });
    }

    static ClusterJobState evaluate(V1Job clusterJob) {
        V1JobStatus status = clusterJob.getStatus();
        if (status == null) {
            return ClusterJobState.ACTIVE;
        }
        if (status.getSucceeded() != null && status.getSucceeded() > 0) {
            return ClusterJobState.SUCCEEDED;
        }
        if (status.getFailed() != null && status.getFailed() > 0) {
            return ClusterJobState.FAILED;
        }
        return ClusterJobState.ACTIVE;
    }

    private Mono<Job> finish(Job job, JobStatus outcome) {
        return collectOutput(job)
            .flatMap(output -> jobRepository.modify(job.getId(), current -> {
                    if (current.getStatus().isTerminal()) {
                        return null;
                    }
                    current.setStatus(outcome);
                    current.setCompletedAt(Instant.now());
                    current.setExitCode(output.exitCode);
                    if (outcome == JobStatus.FAILED && current.getErrorMessage() == null) {
                        current.setErrorMessage("Kubernetes job " + job.getClusterJobName() + " failed");
                    }
                    return current;
                })
                .flatMap(updated -> {
                    log.info("Job {} finished with status {}", updated.getId(), updated.getStatus());
                    if (output.logs.isEmpty()) {
                        return Mono.just(updated);
                    }
                    return jobRepository.saveLog(JobLog.of(updated.getId(), output.logs))
                        .thenReturn(updated);
                }));
    }

    private Mono<PodOutput> collectOutput(Job job) {
        return Mono.fromCallable(() -> {
                List<V1Pod> pods = clusterClient.listPods(job.getNamespace(), "job-name=" + job.getClusterJobName());
                StringBuilder logs = new StringBuilder();
                Integer exitCode = null;
                for (V1Pod pod : pods) {
                    try {
                        logs.append(clusterClient.readPodLog(pod));
                    } catch (ApiException e) {
                        log.warn("Failed to read log of pod {}: {}", pod.getMetadata().getName(), e.getMessage());
                    }
                    Integer podExit = exitCode(pod);
                    if (podExit != null) {
                        exitCode = podExit;
                    }
                }
                return new PodOutput(logs.toString(), exitCode);
            })
            .subscribeOn(Schedulers.boundedElastic())
            .onErrorResume(e -> {
                log.warn("Failed to collect pod output for job {}: {}", job.getId(), e.getMessage());
                return Mono.just(new PodOutput("", null));
            });
    }

    private static Integer exitCode(V1Pod pod) {
        if (pod.getStatus() == null || pod.getStatus().getContainerStatuses() == null) {
            return null;
        }
        for (V1ContainerStatus status : pod.getStatus().getContainerStatuses()) {
            if (status.getState() != null) {
                V1ContainerStateTerminated terminated = status.getState().getTerminated();
                if (terminated != null) {
                    return terminated.getExitCode();
                }
            }
        }
        return null;
    }

    private static final class PodOutput {
        private final String logs;
        private final Integer exitCode;

        private PodOutput(String logs, Integer exitCode) {
            this.logs = logs;
            this.exitCode = exitCode;
        }
    }
}
