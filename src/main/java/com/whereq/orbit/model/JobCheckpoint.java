package com.whereq.orbit.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Checkpoint saved by a running workload, read back for restart
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobCheckpoint {
    private Long id;

    private Long jobId;

    /**
     * Sequence number of the checkpoint within the job
     */
    private int checkpointNum;

    /**
     * Location of the checkpoint data
     */
    private String path;

    private Instant createdAt;
}
