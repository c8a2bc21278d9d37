package com.whereq.orbit.kubernetes;

import com.whereq.orbit.model.Job;
import com.whereq.orbit.model.JobLog;
import com.whereq.orbit.repository.JobRepository;
import io.kubernetes.client.openapi.models.V1Pod;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Attaches to the log stream of a job's pod and stores each line as it arrives
 */
@Slf4j
public class PodLogFollower {

    private static final Set<String> KNOWN_PHASES = Set.of("Running", "Pending", "Succeeded", "Failed");

    private final ClusterClient clusterClient;
    private final JobRepository jobRepository;
    private final Duration pollInterval;

    public PodLogFollower(ClusterClient clusterClient, JobRepository jobRepository, Duration pollInterval) {
        this.clusterClient = clusterClient;
        this.jobRepository = jobRepository;
        this.pollInterval = pollInterval;
    }

    /**
     * Follow the job's pod log.
     * Attach attempts repeat until a stream opens or {@code stopAttaching} fires;
     * an opened stream is read to its end.
     *
     * @return Mono with the number of lines stored
     */
    public Mono<Long> follow(Job job, Mono<?> stopAttaching) {
        return Flux.interval(pollInterval, pollInterval)
            .onBackpressureDrop()
            .takeUntilOther(stopAttaching)
            .concatMap(tick -> open(job))
            .next()
            .flatMapMany(stream -> readLines(job, stream))
            .concatMap(line -> jobRepository.saveLog(JobLog.of(job.getId(), line))
                .onErrorResume(e -> {
                    log.warn("Failed to store log line for job {}: {}", job.getId(), e.getMessage());
                    return Mono.empty();
                }))
            .count()
            .doOnNext(lines -> log.debug("Log stream for job {} closed after {} lines", job.getId(), lines));
    }

    private Mono<InputStream> open(Job job) {
        return Mono.fromCallable(() -> {
                V1Pod pod = pickPod(job);
                if (pod == null) {
                    return null;
                }
                log.debug("Attaching to log of pod {} for job {}", pod.getMetadata().getName(), job.getId());
                return clusterClient.followPodLog(pod);
            })
            .subscribeOn(Schedulers.boundedElastic())
            .onErrorResume(e -> {
                log.debug("Log stream for job {} not available yet: {}", job.getId(), e.getMessage());
                return Mono.empty();
            });
    }

    private V1Pod pickPod(Job job) throws Exception {
        List<V1Pod> pods = clusterClient.listPods(job.getNamespace(), "job-name=" + job.getClusterJobName());
        for (V1Pod pod : pods) {
            if (pod.getStatus() != null && KNOWN_PHASES.contains(pod.getStatus().getPhase())) {
                return pod;
            }
        }
        return null;
    }

    private Flux<String> readLines(Job job, InputStream stream) {
        return Flux.using(
                () -> new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8)),
                reader -> Flux.fromStream(reader.lines()),
                reader -> close(job, reader))
            .subscribeOn(Schedulers.boundedElastic())
            .onErrorResume(e -> {
                log.warn("Log stream for job {} interrupted: {}", job.getId(), e.getMessage());
                return Flux.empty();
            });
    }

    private static void close(Job job, BufferedReader reader) {
        try {
            reader.close();
        } catch (IOException e) {
            log.debug("Failed to close log stream for job {}: {}", job.getId(), e.getMessage());
        }
    }
}
