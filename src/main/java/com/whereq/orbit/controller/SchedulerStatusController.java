package com.whereq.orbit.controller;

import com.whereq.orbit.dto.SchedulerStatusResponse;
import com.whereq.orbit.executor.ExecutorRegistry;
import com.whereq.orbit.service.JobScheduler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Scheduler status endpoint.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("/api/v1/scheduler")
@Tag(name = "Scheduler", description = "Job scheduler status")
public class SchedulerStatusController {

    @Autowired
    private JobScheduler jobScheduler;

    @Autowired
    private ExecutorRegistry executorRegistry;

    @GetMapping("/status")
    @Operation(summary = "Scheduler status", description = "Queue size, loop state and registered job types")
    public Mono<ResponseEntity<SchedulerStatusResponse>> status() {
        return Mono.fromSupplier(() -> ResponseEntity.ok(SchedulerStatusResponse.builder()
            .running(jobScheduler.isRunning())
            .queueSize(jobScheduler.getQueueSize())
            .executorTypes(executorRegistry.registeredTypes())
            .build()));
    }
}
