package com.whereq.orbit.repository;

import com.whereq.orbit.model.User;
import reactor.core.publisher.Mono;

/**
 * Read access to users managed by the identity service
 */
public interface UserRepository {
    /**
     * @param userId user identifier
     * @return Mono with the user, empty if absent
     */
    Mono<User> findById(Long userId);
}
