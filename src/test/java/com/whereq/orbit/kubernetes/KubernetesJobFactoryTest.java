package com.whereq.orbit.kubernetes;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.orbit.exception.InvalidJobRequestException;
import com.whereq.orbit.model.Job;
import io.kubernetes.client.custom.Quantity;
import io.kubernetes.client.openapi.models.V1Container;
import io.kubernetes.client.openapi.models.V1EnvVar;
import io.kubernetes.client.openapi.models.V1Job;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KubernetesJobFactoryTest {

    private final KubernetesJobFactory factory = new KubernetesJobFactory(new ObjectMapper(), "low-priority");

    @Test
    void buildsSingleRunJobWithPriorityClass() {
        V1Job manifest = factory.build(baseJob().build());

        assertEquals("train-r1", manifest.getMetadata().getName());
        assertEquals("42-alice", manifest.getMetadata().getNamespace());
        assertEquals("5", manifest.getMetadata().getLabels().get(KubernetesJobFactory.JOB_ID_LABEL));
        assertEquals(1, manifest.getSpec().getParallelism());
        assertEquals(1, manifest.getSpec().getCompletions());
        assertEquals("OnFailure", manifest.getSpec().getTemplate().getSpec().getRestartPolicy());
        assertEquals("low-priority", manifest.getSpec().getTemplate().getSpec().getPriorityClassName());
        assertTrue(manifest.getSpec().getTemplate().getMetadata().getAnnotations().isEmpty());

        V1Container container = container(manifest);
        assertEquals("registry.local/train:1.0", container.getImage());
        assertEquals(List.of("python", "train.py"), container.getCommand());
        assertEquals(List.of("--epochs", "3"), container.getArgs());
        assertEquals("/workspace", container.getWorkingDir());
        assertEquals(new Quantity("2"), container.getResources().getRequests().get("cpu"));
        assertEquals(new Quantity("4Gi"), container.getResources().getRequests().get("memory"));
        assertTrue(container.getResources().getLimits() == null || container.getResources().getLimits().isEmpty());
        assertEquals("1", env(container).get("SEED"));
        assertFalse(env(container).containsKey("GPU_QUOTA"));
    }

    @Test
    void dedicatedGpusUseWholeDeviceResource() {
        V1Container container = container(factory.build(baseJob().gpuCount(2).gpuType("dedicated").build()));

        Quantity two = new Quantity("2");
        assertEquals(two, container.getResources().getRequests().get(KubernetesJobFactory.GPU_RESOURCE));
        assertEquals(two, container.getResources().getLimits().get(KubernetesJobFactory.GPU_RESOURCE));
        assertEquals("20", env(container).get("GPU_QUOTA"));
    }

    @Test
    void sharedGpusUseSharedResource() {
        V1Container container = container(factory.build(baseJob().gpuCount(3).gpuType("shared").build()));

        assertEquals(new Quantity("3"), container.getResources().getLimits().get(KubernetesJobFactory.SHARED_GPU_RESOURCE));
        assertNull(container.getResources().getLimits().get(KubernetesJobFactory.GPU_RESOURCE));
        assertEquals("3", env(container).get("GPU_QUOTA"));
    }

    @Test
    void checkpointSettingsAreExposedAsEnvironment() {
        V1Container container = container(factory.build(baseJob()
            .enableCheckpoint(true)
            .checkpointInterval(600)
            .checkpointPath("/personal-drive/jobs/5/checkpoints")
            .resumeCheckpointPath("/personal-drive/jobs/5/checkpoints/ckpt-2")
            .build()));

        Map<String, String> env = env(container);
        assertEquals("/personal-drive/jobs/5/checkpoints", env.get("CHECKPOINT_PATH"));
        assertEquals("600", env.get("CHECKPOINT_INTERVAL"));
        assertEquals("/personal-drive/jobs/5/checkpoints/ckpt-2", env.get("RESUME_CHECKPOINT_PATH"));
    }

    @Test
    void malformedCommandIsRejected() {
        assertThrows(InvalidJobRequestException.class,
            () -> factory.build(baseJob().command("python train.py").build()));
    }

    private static Job.JobBuilder baseJob() {
        return Job.builder()
            .id(5L)
            .name("train")
            .clusterJobName("train-r1")
            .namespace("42-alice")
            .image("registry.local/train:1.0")
            .command("[\"python\",\"train.py\"]")
            .args("[\"--epochs\",\"3\"]")
            .envVars("{\"SEED\":\"1\"}")
            .workingDir("/workspace")
            .cpuRequest("2")
            .memoryRequest("4Gi");
    }

    private static V1Container container(V1Job manifest) {
        return manifest.getSpec().getTemplate().getSpec().getContainers().get(0);
    }

    private static Map<String, String> env(V1Container container) {
        return container.getEnv().stream().collect(Collectors.toMap(V1EnvVar::getName, V1EnvVar::getValue));
    }
}
