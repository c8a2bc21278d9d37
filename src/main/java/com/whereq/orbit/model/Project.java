package com.whereq.orbit.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Arrays;

/**
 * Project with GPU quota, owned by the project administration service
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Project {
    private Long id;

    private String name;

    /**
     * Owning group
     */
    private Long groupId;

    /**
     * GPU quota in integer units (one dedicated GPU = 10 units)
     */
    private int gpuQuota;

    /**
     * Allowed GPU access tags, comma separated (e.g. "shared,dedicated")
     */
    private String gpuAccess;

    /**
     * MPS memory limit in MB (0 = no limit)
     */
    private int mpsMemory;

    /**
     * Check whether the given access tag appears in the allow-list
     */
    public boolean allowsGpuAccess(String accessTag) {
        if (gpuAccess == null || gpuAccess.isBlank() || accessTag == null) {
            return false;
        }
        return Arrays.stream(gpuAccess.split(","))
            .map(String::trim)
            .anyMatch(accessTag::equals);
    }
}
