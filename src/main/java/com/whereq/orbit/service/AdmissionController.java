package com.whereq.orbit.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.orbit.config.OrbitProperties;
import com.whereq.orbit.dto.JobSubmitRequest;
import com.whereq.orbit.exception.GpuAccessDeniedException;
import com.whereq.orbit.exception.InvalidJobRequestException;
import com.whereq.orbit.exception.OrbitException;
import com.whereq.orbit.exception.ProjectNotFoundException;
import com.whereq.orbit.exception.QuotaExceededException;
import com.whereq.orbit.exception.UserNotFoundException;
import com.whereq.orbit.model.GpuAccessType;
import com.whereq.orbit.model.Job;
import com.whereq.orbit.model.JobPriority;
import com.whereq.orbit.model.JobStatus;
import com.whereq.orbit.model.JobType;
import com.whereq.orbit.repository.JobRepository;
import com.whereq.orbit.repository.ProjectRepository;
import com.whereq.orbit.repository.UserRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Comparator;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Admission control for job submissions.
 * Validates the request, enforces project GPU access and quota, and persists the job as queued.
 */
@Slf4j
@Service
public class AdmissionController {

    private final UserRepository userRepository;
    private final ProjectRepository projectRepository;
    private final JobRepository jobRepository;
    private final Validator validator;
    private final ObjectMapper objectMapper;
    private final OrbitProperties.AdmissionConfig config;

    private final Map<Long, Semaphore> projectLocks = new ConcurrentHashMap<>();

    private final MeterRegistry meterRegistry;
    private final Counter admittedCounter;

    @Autowired
    public AdmissionController(UserRepository userRepository,
                               ProjectRepository projectRepository,
                               JobRepository jobRepository,
                               Validator validator,
                               ObjectMapper objectMapper,
                               OrbitProperties properties,
                               MeterRegistry meterRegistry) {
        this.userRepository = userRepository;
        this.projectRepository = projectRepository;
        this.jobRepository = jobRepository;
        this.validator = validator;
        this.objectMapper = objectMapper;
        this.config = properties.getAdmission();
        this.meterRegistry = meterRegistry;

        this.admittedCounter = Counter.builder("orbit.admission.admitted")
            .description("Number of jobs admitted and queued")
            .register(meterRegistry);
    }

    /**
     * Admit a job submission
     *
     * @param requesterId submitting user
     * @param request the submission
     * @return Mono with the persisted job in queued state
     */
    public Mono<Job> admit(Long requesterId, JobSubmitRequest request) {
        return validate(request)
            .then(userRepository.findById(requesterId)
                .switchIfEmpty(Mono.error(new UserNotFoundException(requesterId))))
            .flatMap(user -> {
                Long projectId = resolveProjectId(request.getNamespace());
                String gpuType = resolveGpuType(request);
                boolean serialize = config.isSerializePerProject() && request.getGpuCount() > 0 && projectId != null;
                Supplier<Mono<Job>> admission = () -> checkGpuQuota(projectId, request.getGpuCount(), gpuType)
                    .then(persist(user.getId(), projectId, gpuType, request));
                return serialize ? withProjectLock(projectId, admission) : admission.get();
            })
            .doOnSuccess(job -> {
                admittedCounter.increment();
                log.info("Job {} ({}) admitted for user {} in namespace {}",
                    job.getId(), job.getName(), requesterId, job.getNamespace());
            })
            .doOnError(OrbitException.class, e -> {
                Counter.builder("orbit.admission.rejected")
                    .description("Number of rejected job submissions")
                    .tag("reason", e.getKind().name().toLowerCase())
                    .register(meterRegistry)
                    .increment();
                log.warn("Job {} rejected for user {}: {}",
                    request == null ? null : request.getName(), requesterId, e.getMessage());
            });
    }

    /**
     * Project id encoded as the numeric prefix of a {@code <projectId>-<suffix>} namespace
     *
     * @return the project id, or null when the namespace carries none
     */
    static Long resolveProjectId(String namespace) {
        if (namespace == null) {
            return null;
        }
        int dash = namespace.indexOf('-');
        if (dash <= 0) {
            return null;
        }
        try {
            return Long.parseLong(namespace.substring(0, dash));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private Mono<Void> validate(JobSubmitRequest request) {
        return Mono.defer(() -> {
            if (request == null) {
                return Mono.error(new InvalidJobRequestException("Job request is required"));
            }
            Set<ConstraintViolation<JobSubmitRequest>> violations = validator.validate(request);
            if (violations.isEmpty()) {
                return Mono.empty();
            }
            String message = violations.stream()
                .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                .map(ConstraintViolation::getMessage)
                .collect(Collectors.joining("; "));
            return Mono.error(new InvalidJobRequestException(message));
        });
    }

    private static String resolveGpuType(JobSubmitRequest request) {
        if (request.getGpuType() != null && !request.getGpuType().isBlank()) {
            return request.getGpuType().trim();
        }
        return request.getGpuCount() > 0 ? GpuAccessType.DEDICATED.getTag() : null;
    }

    private Mono<Void> checkGpuQuota(Long projectId, int gpuCount, String gpuType) {
        if (gpuCount <= 0) {
            return Mono.empty();
        }
        if (projectId == null) {
            return Mono.error(new ProjectNotFoundException(
                "GPU jobs must run in a project namespace (<projectId>-<name>)"));
        }
        return projectRepository.findById(projectId)
            .switchIfEmpty(Mono.error(new ProjectNotFoundException(projectId)))
            .flatMap(project -> {
                if (!project.allowsGpuAccess(gpuType)) {
                    return Mono.error(new GpuAccessDeniedException(gpuType, projectId));
                }
                int requested;
                try {
                    requested = GpuAccessType.quotaUnits(gpuCount, gpuType);
                } catch (ArithmeticException e) {
                    return Mono.error(new InvalidJobRequestException(
                        "GPU request of " + gpuCount + " " + gpuType + " GPUs is out of range"));
                }
                return currentUsage(projectId).flatMap(usage -> {
                    if (usage + requested > project.getGpuQuota()) {
                        return Mono.error(new QuotaExceededException(usage, requested, project.getGpuQuota()));
                    }
                    log.debug("Project {} quota check passed: current={}, requested={}, quota={}",
                        projectId, usage, requested, project.getGpuQuota());
                    return Mono.<Void>empty();
                });
            });
    }

    /**
     * Quota units held by the project's running and pending jobs
     */
    private Mono<Long> currentUsage(Long projectId) {
        return jobRepository.findByProjectId(projectId)
            .filter(job -> job.getStatus().isConsumingQuota())
            .map(job -> (long) job.getGpuQuotaUnits())
            .reduce(0L, Long::sum);
    }

    private Mono<Job> persist(Long userId, Long projectId, String gpuType, JobSubmitRequest request) {
        return Mono.fromCallable(() -> toJob(userId, projectId, gpuType, request))
            .flatMap(jobRepository::create)
            .flatMap(created -> {
                String root = config.getPathRoot() + "/" + created.getId();
                Job withPaths = created.toBuilder()
                    .outputPath(isBlank(created.getOutputPath()) ? root + "/output" : created.getOutputPath())
                    .checkpointPath(isBlank(created.getCheckpointPath()) ? root + "/checkpoints" : created.getCheckpointPath())
                    .logPath(root + "/logs")
                    .build();
                return jobRepository.update(withPaths)
                    .onErrorResume(e -> {
                        log.warn("Failed to store generated paths for job {}: {}", created.getId(), e.getMessage());
                        return Mono.just(withPaths);
                    });
            });
    }

    private Job toJob(Long userId, Long projectId, String gpuType, JobSubmitRequest request) {
        JobPriority priority;
        try {
            priority = JobPriority.fromToken(request.getPriority());
        } catch (IllegalArgumentException e) {
            throw new InvalidJobRequestException(e.getMessage());
        }

        String jobType = request.getJobType() == null || request.getJobType().isBlank()
            ? JobType.NORMAL.getTag()
            : request.getJobType().trim();

        int checkpointInterval = request.getCheckpointInterval();
        if (request.isEnableCheckpoint() && checkpointInterval == 0) {
            checkpointInterval = config.getDefaultCheckpointInterval();
        }

        return Job.builder()
            .userId(userId)
            .projectId(projectId)
            .name(request.getName())
            .namespace(request.getNamespace())
            .clusterJobName(request.getName())
            .image(request.getImage())
            .command(toJson(request.getCommand(), "command"))
            .args(toJson(request.getArgs(), "args"))
            .workingDir(request.getWorkingDir())
            .envVars(toJson(request.getEnvVars(), "envVars"))
            .volumes(toJson(request.getVolumes(), "volumes"))
            .gpuCount(request.getGpuCount())
            .gpuType(gpuType)
            .cpuRequest(request.getCpuRequest())
            .memoryRequest(request.getMemoryRequest())
            .mpiProcesses(request.getMpiProcesses())
            .jobType(jobType)
            .priority(priority)
            .status(JobStatus.QUEUED)
            .enableCheckpoint(request.isEnableCheckpoint())
            .checkpointInterval(checkpointInterval)
            .outputPath(request.getOutputPath())
            .checkpointPath(request.getCheckpointPath())
            .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private String toJson(Object value, String field) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new InvalidJobRequestException("Cannot serialize " + field + ": " + e.getOriginalMessage());
        }
    }

    /**
     * Run the admission step while holding the project's lock.
     * The permit is taken on a bounded elastic thread and released when the step terminates.
     */
    private <T> Mono<T> withProjectLock(Long projectId, Supplier<Mono<T>> step) {
        Semaphore lock = projectLocks.computeIfAbsent(projectId, id -> new Semaphore(1));
        return Mono.usingWhen(
            Mono.fromCallable(() -> {
                lock.acquire();
                return lock;
            }).subscribeOn(Schedulers.boundedElastic()),
            held -> step.get(),
            held -> Mono.fromRunnable(held::release));
    }
}
