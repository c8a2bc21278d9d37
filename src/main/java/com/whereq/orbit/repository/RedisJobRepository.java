package com.whereq.orbit.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.orbit.exception.JobNotFoundException;
import com.whereq.orbit.exception.JobUpdateConflictException;
import com.whereq.orbit.model.Job;
import com.whereq.orbit.model.JobCheckpoint;
import com.whereq.orbit.model.JobLog;
import com.whereq.orbit.model.JobStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Redis-backed job store.
 *
 * Jobs are JSON strings under {@code orbit:job:<id>}, indexed by sets of ids
 * (all, per user, per project). Logs and checkpoints are append-only lists.
 */
@Slf4j
@Repository
public class RedisJobRepository implements JobRepository {

    private static final String JOB_SEQUENCE_KEY = "orbit:jobs:seq";
    private static final String LOG_SEQUENCE_KEY = "orbit:logs:seq";
    private static final String CHECKPOINT_SEQUENCE_KEY = "orbit:checkpoints:seq";
    private static final String JOB_KEY_PREFIX = "orbit:job:";
    private static final String ALL_JOBS_KEY = "orbit:jobs";
    private static final String USER_INDEX_PREFIX = "orbit:jobs:user:";
    private static final String PROJECT_INDEX_PREFIX = "orbit:jobs:project:";

    private static final int MAX_MODIFY_RETRIES = 16;
    private static final RedisScript<Long> COMPARE_AND_SET = RedisScript.of(
        "if redis.call('GET', KEYS[1]) == ARGV[1] then redis.call('SET', KEYS[1], ARGV[2]) return 1 else return 0 end",
        Long.class);

    private final ReactiveStringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    @Autowired
    public RedisJobRepository(ReactiveStringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Job> create(Job job) {
        return redisTemplate.opsForValue().increment(JOB_SEQUENCE_KEY)
            .map(id -> {
                Instant now = Instant.now();
                return job.toBuilder().id(id).createdAt(now).updatedAt(now).build();
            })
            .flatMap(created -> write(created)
                .then(redisTemplate.opsForSet().add(ALL_JOBS_KEY, created.getId().toString()))
                .then(redisTemplate.opsForSet().add(USER_INDEX_PREFIX + created.getUserId(),
                    created.getId().toString()))
                .then(created.getProjectId() == null
                    ? Mono.<Long>empty()
                    : redisTemplate.opsForSet().add(PROJECT_INDEX_PREFIX + created.getProjectId(),
                        created.getId().toString()))
                .thenReturn(created))
            .doOnSuccess(created -> log.debug("Stored new job {}", created.getId()));
    }

    @Override
    public Mono<Job> update(Job job) {
        Job updated = job.toBuilder().updatedAt(Instant.now()).build();
        return write(updated).thenReturn(updated);
    }

    /**
     * Applies the mutation to the stored JSON and writes the result only if the
     * stored value is still the one that was read. A lost race re-reads and
     * re-applies the mutation, up to {@value #MAX_MODIFY_RETRIES} times.
     */
    @Override
    public Mono<Job> modify(Long jobId, UnaryOperator<Job> mutation) {
        String key = JOB_KEY_PREFIX + jobId;
        return Mono.defer(() -> redisTemplate.opsForValue().get(key)
                .switchIfEmpty(Mono.error(new JobNotFoundException(jobId)))
                .flatMap(stored -> read(stored, Job.class)
                    .flatMap(current -> {
                        Job changed = mutation.apply(current.toBuilder().build());
                        if (changed == null) {
                            return Mono.<Job>empty();
                        }
                        Job updated = changed.toBuilder().updatedAt(Instant.now()).build();
                        return serialize(updated)
                            .flatMap(json -> redisTemplate.execute(COMPARE_AND_SET, List.of(key), List.of(stored, json))
                                .next())
                            .flatMap(swapped -> swapped == 1L
                                ? Mono.just(updated)
                                : Mono.<Job>error(new JobUpdateConflictException(jobId)));
                    })))
            .retryWhen(Retry.max(MAX_MODIFY_RETRIES)
                .filter(JobUpdateConflictException.class::isInstance)
                .doBeforeRetry(signal -> log.debug("Job {} changed during update, retrying", jobId))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure()));
    }

    @Override
    public Mono<Job> findById(Long jobId) {
        return redisTemplate.opsForValue().get(JOB_KEY_PREFIX + jobId)
            .flatMap(json -> read(json, Job.class));
    }

    @Override
    public Flux<Job> findAll() {
        return findByIndex(ALL_JOBS_KEY);
    }

    @Override
    public Flux<Job> findByUserId(Long userId) {
        return findByIndex(USER_INDEX_PREFIX + userId);
    }

    @Override
    public Flux<Job> findByProjectId(Long projectId) {
        return findByIndex(PROJECT_INDEX_PREFIX + projectId);
    }

    @Override
    public Flux<Job> findQueued() {
        return findAll().filter(job -> job.getStatus() == JobStatus.QUEUED);
    }

    @Override
    public Mono<JobLog> saveLog(JobLog entry) {
        return redisTemplate.opsForValue().increment(LOG_SEQUENCE_KEY)
            .map(id -> JobLog.builder()
                .id(id)
                .jobId(entry.getJobId())
                .content(entry.getContent())
                .createdAt(entry.getCreatedAt() != null ? entry.getCreatedAt() : Instant.now())
                .build())
            .flatMap(saved -> serialize(saved)
                .flatMap(json -> redisTemplate.opsForList().rightPush(logKey(saved.getJobId()), json))
                .thenReturn(saved));
    }

    @Override
    public Flux<JobLog> findLogs(Long jobId) {
        return redisTemplate.opsForList().range(logKey(jobId), 0, -1)
            .concatMap(json -> read(json, JobLog.class));
    }

    @Override
    public Mono<JobCheckpoint> saveCheckpoint(JobCheckpoint checkpoint) {
        return redisTemplate.opsForValue().increment(CHECKPOINT_SEQUENCE_KEY)
            .map(id -> JobCheckpoint.builder()
                .id(id)
                .jobId(checkpoint.getJobId())
                .checkpointNum(checkpoint.getCheckpointNum())
                .path(checkpoint.getPath())
                .createdAt(checkpoint.getCreatedAt() != null ? checkpoint.getCreatedAt() : Instant.now())
                .build())
            .flatMap(saved -> serialize(saved)
                .flatMap(json -> redisTemplate.opsForList().rightPush(checkpointKey(saved.getJobId()), json))
                .thenReturn(saved));
    }

    @Override
    public Flux<JobCheckpoint> findCheckpoints(Long jobId) {
        return redisTemplate.opsForList().range(checkpointKey(jobId), 0, -1)
            .concatMap(json -> read(json, JobCheckpoint.class));
    }

    private Flux<Job> findByIndex(String indexKey) {
        return redisTemplate.opsForSet().members(indexKey)
            .map(Long::valueOf)
            .sort(Comparator.naturalOrder())
            .concatMap(this::findById);
    }

    private Mono<Boolean> write(Job job) {
        return serialize(job)
            .flatMap(json -> redisTemplate.opsForValue().set(JOB_KEY_PREFIX + job.getId(), json));
    }

    private Mono<String> serialize(Object value) {
        return Mono.fromCallable(() -> {
            try {
                return objectMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
            }
        });
    }

    private <T> Mono<T> read(String json, Class<T> type) {
        try {
            return Mono.just(objectMapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize {}", type.getSimpleName(), e);
            return Mono.empty();
        }
    }

    private static String logKey(Long jobId) {
        return JOB_KEY_PREFIX + jobId + ":logs";
    }

    private static String checkpointKey(Long jobId) {
        return JOB_KEY_PREFIX + jobId + ":checkpoints";
    }
}
