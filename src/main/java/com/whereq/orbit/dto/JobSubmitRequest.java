package com.whereq.orbit.dto;

import com.whereq.orbit.model.VolumeMount;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Job submission as received from the API layer.
 *
 * @author WhereQ Inc.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class JobSubmitRequest implements Serializable {
    private static final long serialVersionUID = 1L;

    /**
     * Job name, also used as the Kubernetes Job name.
     * Must be a valid DNS label.
     */
    @NotBlank(message = "name is required")
    @Size(max = 63, message = "name must be at most 63 characters")
    @Pattern(regexp = "[a-z0-9]([-a-z0-9]*[a-z0-9])?", message = "name must be a valid DNS label")
    private String name;

    /**
     * Target namespace. Project namespaces are named {@code <projectId>-<suffix>}.
     */
    @NotBlank(message = "namespace is required")
    private String namespace;

    /**
     * Job type: normal, gpu or mpi.
     * Defaults to normal.
     */
    private String jobType;

    @NotBlank(message = "image is required")
    private String image;

    private List<String> command;

    private List<String> args;

    private String workingDir;

    private Map<String, String> envVars;

    @Min(value = 0, message = "gpuCount must not be negative")
    @Max(value = 1024, message = "gpuCount must be at most 1024")
    private int gpuCount;

    /**
     * GPU access tag: shared or dedicated
     */
    private String gpuType;

    private String cpuRequest;

    private String memoryRequest;

    @Min(value = 0, message = "mpiProcesses must not be negative")
    private int mpiProcesses;

    private boolean enableCheckpoint;

    /**
     * Seconds between checkpoints. Defaults to the configured interval when checkpointing is enabled.
     */
    @Min(value = 0, message = "checkpointInterval must not be negative")
    private int checkpointInterval;

    /**
     * Where the job writes results. Generated under the job's directory when blank.
     */
    private String outputPath;

    /**
     * Where checkpoints go. Generated under the job's directory when blank.
     */
    private String checkpointPath;

    @Valid
    private List<VolumeMount> volumes;

    /**
     * Priority: low, medium or high. Defaults to low.
     */
    private String priority;
}
