package com.whereq.orbit.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.orbit.model.Project;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

/**
 * Reads projects published by the project administration service under {@code orbit:project:<id>}
 */
@Slf4j
@Repository
public class RedisProjectRepository implements ProjectRepository {

    private static final String PROJECT_KEY_PREFIX = "orbit:project:";

    private final ReactiveStringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    @Autowired
    public RedisProjectRepository(ReactiveStringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Project> findById(Long projectId) {
        return redisTemplate.opsForValue().get(PROJECT_KEY_PREFIX + projectId)
            .flatMap(json -> {
                try {
                    return Mono.just(objectMapper.readValue(json, Project.class));
                } catch (JsonProcessingException e) {
                    log.error("Corrupt project record {}", projectId, e);
                    return Mono.empty();
                }
            });
    }
}
