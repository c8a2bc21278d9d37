package com.whereq.orbit.kubernetes;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.orbit.exception.InvalidJobRequestException;
import com.whereq.orbit.model.Job;
import io.kubernetes.client.custom.Quantity;
import io.kubernetes.client.openapi.models.V1Container;
import io.kubernetes.client.openapi.models.V1EnvVar;
import io.kubernetes.client.openapi.models.V1Job;
import io.kubernetes.client.openapi.models.V1JobSpec;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1PodSpec;
import io.kubernetes.client.openapi.models.V1PodTemplateSpec;
import io.kubernetes.client.openapi.models.V1ResourceRequirements;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the Kubernetes Job manifest for a job record
 */
public class KubernetesJobFactory {

    public static final String GPU_RESOURCE = "nvidia.com/gpu";
    public static final String SHARED_GPU_RESOURCE = "nvidia.com/gpu.shared";
    public static final String JOB_ID_LABEL = "orbit.whereq.com/job-id";

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final String priorityClassName;

    public KubernetesJobFactory(ObjectMapper objectMapper, String priorityClassName) {
        this.objectMapper = objectMapper;
        this.priorityClassName = priorityClassName;
    }

    public V1Job build(Job job) {
        String name = job.getClusterJobName() != null ? job.getClusterJobName() : job.getName();

        V1Container container = new V1Container()
            .name(name)
            .image(job.getImage())
            .env(buildEnv(job))
            .resources(buildResources(job));

        List<String> command = readList(job.getCommand(), "command");
        if (!command.isEmpty()) {
            container.command(command);
        }
        List<String> args = readList(job.getArgs(), "args");
        if (!args.isEmpty()) {
            container.args(args);
        }
        if (job.getWorkingDir() != null && !job.getWorkingDir().isBlank()) {
            container.workingDir(job.getWorkingDir());
        }

        Map<String, String> labels = new HashMap<>();
        if (job.getId() != null) {
            labels.put(JOB_ID_LABEL, job.getId().toString());
        }

        return new V1Job()
            .apiVersion("batch/v1")
            .kind("Job")
            .metadata(new V1ObjectMeta()
                .name(name)
                .namespace(job.getNamespace())
                .labels(labels))
            .spec(new V1JobSpec()
                .parallelism(1)
                .completions(1)
                .template(new V1PodTemplateSpec()
                    .metadata(new V1ObjectMeta()
                        .labels(new HashMap<>(labels))
                        .annotations(new HashMap<>()))
                    .spec(new V1PodSpec()
                        .restartPolicy("OnFailure")
                        .priorityClassName(priorityClassName)
                        .containers(Collections.singletonList(container)))));
    }

    private List<V1EnvVar> buildEnv(Job job) {
        Map<String, String> env = new LinkedHashMap<>(readMap(job.getEnvVars()));
        if (job.getGpuCount() > 0) {
            env.put("GPU_QUOTA", Integer.toString(job.getGpuQuotaUnits()));
        }
        if (job.isEnableCheckpoint()) {
            if (job.getCheckpointPath() != null) {
                env.put("CHECKPOINT_PATH", job.getCheckpointPath());
            }
            env.put("CHECKPOINT_INTERVAL", Integer.toString(job.getCheckpointInterval()));
        }
        if (job.getResumeCheckpointPath() != null && !job.getResumeCheckpointPath().isEmpty()) {
            env.put("RESUME_CHECKPOINT_PATH", job.getResumeCheckpointPath());
        }

        List<V1EnvVar> vars = new ArrayList<>(env.size());
        env.forEach((key, value) -> vars.add(new V1EnvVar().name(key).value(value)));
        return vars;
    }

    private V1ResourceRequirements buildResources(Job job) {
        Map<String, Quantity> requests = new HashMap<>();
        Map<String, Quantity> limits = new HashMap<>();

        if (job.getCpuRequest() != null && !job.getCpuRequest().isBlank()) {
            requests.put("cpu", Quantity.fromString(job.getCpuRequest()));
        }
        if (job.getMemoryRequest() != null && !job.getMemoryRequest().isBlank()) {
            requests.put("memory", Quantity.fromString(job.getMemoryRequest()));
        }
        if (job.getGpuCount() > 0) {
            String resource = job.usesMps() ? SHARED_GPU_RESOURCE : GPU_RESOURCE;
            Quantity count = Quantity.fromString(Integer.toString(job.getGpuCount()));
            requests.put(resource, count);
            limits.put(resource, count);
        }

        V1ResourceRequirements resources = new V1ResourceRequirements();
        if (!requests.isEmpty()) {
            resources.requests(requests);
        }
        if (!limits.isEmpty()) {
            resources.limits(limits);
        }
        return resources;
    }

    private List<String> readList(String json, String field) {
        if (json == null || json.isBlank()) {
            return Collections.emptyList();
        }
        try {
            List<String> values = objectMapper.readValue(json, STRING_LIST);
            return values == null ? Collections.emptyList() : values;
        } catch (JsonProcessingException e) {
            throw new InvalidJobRequestException("Malformed " + field + ": " + e.getOriginalMessage());
        }
    }

    private Map<String, String> readMap(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            Map<String, String> values = objectMapper.readValue(json, STRING_MAP);
            return values == null ? Collections.emptyMap() : values;
        } catch (JsonProcessingException e) {
            throw new InvalidJobRequestException("Malformed env vars: " + e.getOriginalMessage());
        }
    }
}
