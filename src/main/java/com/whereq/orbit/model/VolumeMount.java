package com.whereq.orbit.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Volume mount requested for a job container
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VolumeMount {
    private String name;

    @JsonProperty("mount_path")
    private String mountPath;

    @JsonProperty("read_only")
    private boolean readOnly;
}
