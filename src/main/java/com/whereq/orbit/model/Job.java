package com.whereq.orbit.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Persisted unit of work tracked through admission, queueing and cluster execution
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Job {
    /**
     * Job identifier, assigned on creation
     */
    private Long id;

    /**
     * User who submitted the job
     */
    private Long userId;

    /**
     * Owning project, derived from the namespace (may be null)
     */
    private Long projectId;

    private String name;

    private String namespace;

    private String image;

    /**
     * Name of the Kubernetes Job object backing this record
     */
    private String clusterJobName;

    /**
     * Container command, serialized as a JSON array
     */
    private String command;

    /**
     * Container args, serialized as a JSON array
     */
    private String args;

    private String workingDir;

    /**
     * Environment variables, serialized as a JSON object
     */
    private String envVars;

    /**
     * Volume mounts, serialized as a JSON array
     */
    private String volumes;

    private int gpuCount;

    /**
     * GPU access tag: none, shared or dedicated
     */
    private String gpuType;

    private String cpuRequest;

    private String memoryRequest;

    private int mpiProcesses;

    /**
     * Job-type tag used to resolve the executor
     */
    @Builder.Default
    private String jobType = JobType.NORMAL.getTag();

    @Builder.Default
    private JobPriority priority = JobPriority.LOW;

    @Builder.Default
    private JobStatus status = JobStatus.QUEUED;

    private int restartCount;

    private boolean enableCheckpoint;

    /**
     * Checkpoint interval in seconds
     */
    private int checkpointInterval;

    private String checkpointPath;

    /**
     * Checkpoint to resume from on the next run (set by restart)
     */
    private String resumeCheckpointPath;

    private String outputPath;

    private String logPath;

    private Integer exitCode;

    private String errorMessage;

    private Instant createdAt;

    private Instant updatedAt;

    private Instant startedAt;

    private Instant completedAt;

    /**
     * Quota units this job consumes while running or pending
     */
    @JsonIgnore
    public int getGpuQuotaUnits() {
        return GpuAccessType.quotaUnits(gpuCount, gpuType);
    }

    @JsonIgnore
    public boolean usesMps() {
        return GpuAccessType.SHARED.getTag().equals(gpuType);
    }
}
