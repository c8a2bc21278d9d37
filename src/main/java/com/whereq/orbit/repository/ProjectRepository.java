package com.whereq.orbit.repository;

import com.whereq.orbit.model.Project;
import reactor.core.publisher.Mono;

/**
 * Read access to projects managed by the project administration service
 */
public interface ProjectRepository {
    /**
     * @param projectId project identifier
     * @return Mono with the project, empty if absent
     */
    Mono<Project> findById(Long projectId);
}
