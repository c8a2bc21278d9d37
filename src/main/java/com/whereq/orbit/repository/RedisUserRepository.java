package com.whereq.orbit.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.orbit.model.User;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

/**
 * Reads users published by the identity service under {@code orbit:user:<id>}
 */
@Slf4j
@Repository
public class RedisUserRepository implements UserRepository {

    private static final String USER_KEY_PREFIX = "orbit:user:";

    private final ReactiveStringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    @Autowired
    public RedisUserRepository(ReactiveStringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<User> findById(Long userId) {
        return redisTemplate.opsForValue().get(USER_KEY_PREFIX + userId)
            .flatMap(json -> {
                try {
                    return Mono.just(objectMapper.readValue(json, User.class));
                } catch (JsonProcessingException e) {
                    log.error("Corrupt user record {}", userId, e);
                    return Mono.empty();
                }
            });
    }
}
