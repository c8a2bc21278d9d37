package com.whereq.orbit.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.orbit.config.OrbitProperties;
import com.whereq.orbit.dto.JobSubmitRequest;
import com.whereq.orbit.exception.GpuAccessDeniedException;
import com.whereq.orbit.exception.InvalidJobRequestException;
import com.whereq.orbit.exception.ProjectNotFoundException;
import com.whereq.orbit.exception.QuotaExceededException;
import com.whereq.orbit.exception.UserNotFoundException;
import com.whereq.orbit.model.Job;
import com.whereq.orbit.model.JobPriority;
import com.whereq.orbit.model.JobStatus;
import com.whereq.orbit.model.Project;
import com.whereq.orbit.model.User;
import com.whereq.orbit.repository.ProjectRepository;
import com.whereq.orbit.repository.UserRepository;
import com.whereq.orbit.support.InMemoryJobRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.validation.Validation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AdmissionControllerTest {

    private static final Long USER_ID = 11L;
    private static final Long PROJECT_ID = 42L;

    private InMemoryJobRepository jobRepository;
    private ProjectRepository projectRepository;
    private SimpleMeterRegistry meterRegistry;
    private AdmissionController admissionController;

    @BeforeEach
    void setUp() {
        jobRepository = new InMemoryJobRepository();
        UserRepository userRepository = mock(UserRepository.class);
        projectRepository = mock(ProjectRepository.class);
        meterRegistry = new SimpleMeterRegistry();

        when(userRepository.findById(anyLong())).thenReturn(Mono.empty());
        when(userRepository.findById(USER_ID))
            .thenReturn(Mono.just(User.builder().id(USER_ID).username("alice").build()));
        when(projectRepository.findById(anyLong())).thenReturn(Mono.empty());

        admissionController = new AdmissionController(
            userRepository,
            projectRepository,
            jobRepository,
            Validation.buildDefaultValidatorFactory().getValidator(),
            new ObjectMapper(),
            new OrbitProperties(),
            meterRegistry);
    }

    @Test
    void admitsCpuJobWithDefaults() {
        JobSubmitRequest request = request("train", "7-alice").toBuilder()
            .enableCheckpoint(true)
            .command(List.of("python", "train.py"))
            .envVars(Map.of("EPOCHS", "3"))
            .build();

        StepVerifier.create(admissionController.admit(USER_ID, request))
            .assertNext(job -> {
                assertEquals(JobStatus.QUEUED, job.getStatus());
                assertEquals("normal", job.getJobType());
                assertEquals(JobPriority.LOW, job.getPriority());
                assertEquals(300, job.getCheckpointInterval());
                assertEquals(7L, job.getProjectId());
                assertEquals("train", job.getClusterJobName());
                assertEquals("/personal-drive/jobs/" + job.getId() + "/output", job.getOutputPath());
                assertEquals("/personal-drive/jobs/" + job.getId() + "/checkpoints", job.getCheckpointPath());
                assertEquals("/personal-drive/jobs/" + job.getId() + "/logs", job.getLogPath());
                assertEquals("[\"python\",\"train.py\"]", job.getCommand());
            })
            .verifyComplete();

        Job stored = jobRepository.get(1L);
        assertEquals("/personal-drive/jobs/1/logs", stored.getLogPath());
        assertEquals(1.0, meterRegistry.counter("orbit.admission.admitted").count());
    }

    @Test
    void suppliedPriorityIsKept() {
        JobSubmitRequest request = request("urgent", "team").toBuilder().priority("high").build();

        StepVerifier.create(admissionController.admit(USER_ID, request))
            .assertNext(job -> {
                assertEquals(JobPriority.HIGH, job.getPriority());
                assertNull(job.getProjectId());
            })
            .verifyComplete();
    }

    @Test
    void unknownUserIsRejected() {
        StepVerifier.create(admissionController.admit(99L, request("train", "7-alice")))
            .expectError(UserNotFoundException.class)
            .verify();
        assertTrue(jobRepository.findAll().collectList().block().isEmpty());
    }

    @Test
    void invalidRequestIsRejected() {
        JobSubmitRequest request = request("Not_A_Label", "7-alice").toBuilder().image(" ").build();

        StepVerifier.create(admissionController.admit(USER_ID, request))
            .expectError(InvalidJobRequestException.class)
            .verify();
    }

    @Test
    void gpuJobOutsideProjectNamespaceIsRejected() {
        JobSubmitRequest request = gpuRequest("gpu-job", "sandbox", 1, "shared");

        StepVerifier.create(admissionController.admit(USER_ID, request))
            .expectError(ProjectNotFoundException.class)
            .verify();
    }

    @Test
    void gpuJobForUnknownProjectIsRejected() {
        StepVerifier.create(admissionController.admit(USER_ID, gpuRequest("gpu-job", "5-alice", 1, "shared")))
            .expectError(ProjectNotFoundException.class)
            .verify();
    }

    @Test
    void disallowedAccessTypeIsRejected() {
        project(10, "dedicated");

        StepVerifier.create(admissionController.admit(USER_ID, gpuRequest("gpu-job", "42-alice", 1, "shared")))
            .expectError(GpuAccessDeniedException.class)
            .verify();
        assertEquals(1.0, meterRegistry.counter("orbit.admission.rejected", "reason", "forbidden").count());
    }

    @Test
    void dedicatedRequestOverQuotaIsRejected() {
        project(15, "shared,dedicated");

        StepVerifier.create(admissionController.admit(USER_ID, gpuRequest("gpu-job", "42-alice", 2, "dedicated")))
            .expectErrorSatisfies(error -> {
                assertTrue(error instanceof QuotaExceededException);
                QuotaExceededException quota = (QuotaExceededException) error;
                assertEquals(0, quota.getCurrentUsage());
                assertEquals(20, quota.getRequestedUnits());
                assertEquals(15, quota.getQuota());
            })
            .verify();
        assertTrue(jobRepository.findAll().collectList().block().isEmpty());
    }

    @Test
    void oversizedDedicatedRequestIsRejectedNotWrapped() {
        project(10, "dedicated");

        StepVerifier.create(admissionController.admit(USER_ID, gpuRequest("huge", "42-alice", 214_748_365, "dedicated")))
            .expectError(InvalidJobRequestException.class)
            .verify();
        assertTrue(jobRepository.findAll().collectList().block().isEmpty());
    }

    @Test
    void usageBeyondIntRangeStillBlocksAdmission() {
        project(10, "shared");
        for (int i = 0; i < 11; i++) {
            existing(JobStatus.RUNNING, 200_000_000, "shared");
        }

        StepVerifier.create(admissionController.admit(USER_ID, gpuRequest("one-more", "42-alice", 1, "shared")))
            .expectErrorSatisfies(error -> {
                assertTrue(error instanceof QuotaExceededException);
                assertEquals(2_200_000_000L, ((QuotaExceededException) error).getCurrentUsage());
            })
            .verify();
    }

    @Test
    void usageCountsRunningAndPendingJobsOnly() {
        project(12, "shared,dedicated");
        existing(JobStatus.RUNNING, 1, "dedicated");
        existing(JobStatus.SCHEDULING, 1, "shared");
        existing(JobStatus.COMPLETED, 1, "dedicated");
        existing(JobStatus.CANCELLED, 5, "shared");

        StepVerifier.create(admissionController.admit(USER_ID, gpuRequest("fits", "42-alice", 1, "shared")))
            .assertNext(job -> assertEquals(JobStatus.QUEUED, job.getStatus()))
            .verifyComplete();

        StepVerifier.create(admissionController.admit(USER_ID, gpuRequest("too-many", "42-alice", 1, "shared")))
            .expectErrorSatisfies(error -> assertEquals(12, ((QuotaExceededException) error).getCurrentUsage()))
            .verify();
    }

    @Test
    void gpuTypeDefaultsToDedicated() {
        project(10, "dedicated");

        StepVerifier.create(admissionController.admit(USER_ID, gpuRequest("gpu-job", "42-alice", 1, null)))
            .assertNext(job -> {
                assertEquals("dedicated", job.getGpuType());
                assertEquals(10, job.getGpuQuotaUnits());
            })
            .verifyComplete();
    }

    @Test
    void suppliedPathsAreKeptAndMissingOnesGenerated() {
        JobSubmitRequest request = request("train", "7-alice").toBuilder()
            .outputPath("/data/results/train")
            .build();

        StepVerifier.create(admissionController.admit(USER_ID, request))
            .assertNext(job -> {
                String root = "/personal-drive/jobs/" + job.getId();
                assertEquals("/data/results/train", job.getOutputPath());
                assertEquals(root + "/checkpoints", job.getCheckpointPath());
                assertEquals(root + "/logs", job.getLogPath());
            })
            .verifyComplete();

        JobSubmitRequest withCheckpoints = request("resume", "7-alice").toBuilder()
            .checkpointPath("/data/ckpt/resume")
            .build();

        StepVerifier.create(admissionController.admit(USER_ID, withCheckpoints))
            .assertNext(job -> {
                assertEquals("/personal-drive/jobs/" + job.getId() + "/output", job.getOutputPath());
                assertEquals("/data/ckpt/resume", jobRepository.get(job.getId()).getCheckpointPath());
            })
            .verifyComplete();
    }

    @Test
    void pathPatchFailureDoesNotFailAdmission() {
        jobRepository.failUpdates();

        StepVerifier.create(admissionController.admit(USER_ID, request("train", "7-alice")))
            .assertNext(job -> assertEquals("/personal-drive/jobs/" + job.getId() + "/output", job.getOutputPath()))
            .verifyComplete();
        assertNull(jobRepository.get(1L).getOutputPath());
    }

    @Test
    void concurrentAdmissionsForOneProjectCannotOvercommit() {
        project(10, "dedicated");

        List<Object> outcomes = Flux.range(0, 6)
            .flatMap(i -> admissionController.admit(USER_ID, gpuRequest("job-" + i, "42-alice", 1, "dedicated"))
                .<Object>map(job -> job)
                .onErrorResume(QuotaExceededException.class, Mono::just))
            .collectList()
            .block(Duration.ofSeconds(10));

        long admitted = outcomes.stream().filter(outcome -> outcome instanceof Job).count();
        assertEquals(1, admitted);
        assertEquals(5, outcomes.size() - admitted);
    }

    @Test
    void resolvesProjectIdFromNamespacePrefix() {
        assertEquals(42L, AdmissionController.resolveProjectId("42-alice"));
        assertEquals(42L, AdmissionController.resolveProjectId("42-alice-dev"));
        assertNull(AdmissionController.resolveProjectId("alice"));
        assertNull(AdmissionController.resolveProjectId("team-42"));
        assertNull(AdmissionController.resolveProjectId("-42"));
        assertNull(AdmissionController.resolveProjectId(null));
    }

    private void project(int quota, String access) {
        when(projectRepository.findById(PROJECT_ID)).thenReturn(Mono.just(Project.builder()
            .id(PROJECT_ID)
            .name("vision")
            .gpuQuota(quota)
            .gpuAccess(access)
            .build()));
    }

    private void existing(JobStatus status, int gpuCount, String gpuType) {
        jobRepository.put(Job.builder()
            .userId(USER_ID)
            .projectId(PROJECT_ID)
            .name("existing")
            .namespace("42-alice")
            .gpuCount(gpuCount)
            .gpuType(gpuType)
            .status(status)
            .build());
    }

    private static JobSubmitRequest request(String name, String namespace) {
        return JobSubmitRequest.builder()
            .name(name)
            .namespace(namespace)
            .image("registry.local/train:1.0")
            .build();
    }

    private static JobSubmitRequest gpuRequest(String name, String namespace, int gpuCount, String gpuType) {
        return request(name, namespace).toBuilder()
            .jobType("gpu")
            .gpuCount(gpuCount)
            .gpuType(gpuType)
            .build();
    }
}
