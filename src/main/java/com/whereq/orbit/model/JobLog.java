package com.whereq.orbit.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Append-only chunk of job output
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobLog {
    private Long id;

    private Long jobId;

    private String content;

    private Instant createdAt;

    public static JobLog of(Long jobId, String content) {
        return JobLog.builder()
            .jobId(jobId)
            .content(content)
            .createdAt(Instant.now())
            .build();
    }
}
