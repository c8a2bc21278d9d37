package com.whereq.orbit.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.whereq.orbit.exception.JobNotFoundException;
import com.whereq.orbit.exception.JobUpdateConflictException;
import com.whereq.orbit.model.Job;
import com.whereq.orbit.model.JobStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.ReactiveValueOperations;
import org.springframework.data.redis.core.script.RedisScript;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisJobRepositoryTest {

    private static final String KEY = "orbit:job:7";

    private final ObjectMapper objectMapper = JsonMapper.builder().addModule(new JavaTimeModule()).build();

    private ReactiveStringRedisTemplate redisTemplate;
    private ReactiveValueOperations<String, String> valueOperations;
    private RedisJobRepository repository;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redisTemplate = mock(ReactiveStringRedisTemplate.class);
        valueOperations = mock(ReactiveValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        repository = new RedisJobRepository(redisTemplate, objectMapper);
    }

    @Test
    @SuppressWarnings("unchecked")
    void lostWriteIsRetriedAgainstFreshValue() throws Exception {
        String running = json(JobStatus.RUNNING);
        String cancelled = json(JobStatus.CANCELLED);
        when(valueOperations.get(KEY)).thenReturn(Mono.just(running), Mono.just(cancelled));
        when(redisTemplate.execute(ArgumentMatchers.<RedisScript<Long>>any(), anyList(), anyList()))
            .thenReturn(Flux.just(0L), Flux.just(1L));

        AtomicInteger applied = new AtomicInteger();
        StepVerifier.create(repository.modify(7L, current -> {
                applied.incrementAndGet();
                current.setErrorMessage("seen " + current.getStatus().getToken());
                return current;
            }))
            .assertNext(job -> {
                assertEquals(JobStatus.CANCELLED, job.getStatus());
                assertEquals("seen cancelled", job.getErrorMessage());
            })
            .verifyComplete();

        assertEquals(2, applied.get());
        ArgumentCaptor<List<Object>> args = ArgumentCaptor.forClass(List.class);
        verify(redisTemplate, times(2)).execute(ArgumentMatchers.<RedisScript<Long>>any(), anyList(), args.capture());
        assertEquals(running, args.getAllValues().get(0).get(0));
        assertEquals(cancelled, args.getAllValues().get(1).get(0));
        assertTrue(((String) args.getAllValues().get(1).get(1)).contains("seen cancelled"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void declinedMutationWritesNothing() throws Exception {
        when(valueOperations.get(KEY)).thenReturn(Mono.just(json(JobStatus.COMPLETED)));

        StepVerifier.create(repository.modify(7L, current -> null)).verifyComplete();

        verify(redisTemplate, never()).execute(ArgumentMatchers.<RedisScript<Long>>any(), anyList(), anyList());
        verify(valueOperations, never()).set(ArgumentMatchers.anyString(), ArgumentMatchers.anyString());
    }

    @Test
    void missingJobIsReported() {
        when(valueOperations.get(KEY)).thenReturn(Mono.empty());

        StepVerifier.create(repository.modify(7L, current -> current))
            .expectError(JobNotFoundException.class)
            .verify();
    }

    @Test
    @SuppressWarnings("unchecked")
    void persistentContentionGivesUp() throws Exception {
        when(valueOperations.get(KEY)).thenReturn(Mono.just(json(JobStatus.RUNNING)));
        when(redisTemplate.execute(ArgumentMatchers.<RedisScript<Long>>any(), anyList(), anyList()))
            .thenReturn(Flux.just(0L));

        StepVerifier.create(repository.modify(7L, current -> current))
            .expectError(JobUpdateConflictException.class)
            .verify();
    }

    private String json(JobStatus status) throws Exception {
        return objectMapper.writeValueAsString(Job.builder()
            .id(7L)
            .name("train")
            .status(status)
            .createdAt(Instant.parse("2026-01-02T03:04:05Z"))
            .build());
    }
}
