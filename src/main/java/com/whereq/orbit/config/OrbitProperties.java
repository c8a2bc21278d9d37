package com.whereq.orbit.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for WhereQ Orbit.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "orbit")
@Data
public class OrbitProperties {

    private SchedulerConfig scheduler = new SchedulerConfig();

    private AdmissionConfig admission = new AdmissionConfig();

    private ExecutorConfig executor = new ExecutorConfig();

    @Data
    public static class SchedulerConfig {
        /**
         * Start the scheduling loop with the application.
         */
        private boolean enabled = true;

        /**
         * Interval between scheduling ticks. At most one job is dispatched per tick.
         */
        private Duration tickInterval = Duration.ofSeconds(5);
    }

    @Data
    public static class AdmissionConfig {
        /**
         * Serialize quota check and job creation per project.
         * When disabled, concurrent admissions may jointly exceed the quota.
         */
        private boolean serializePerProject = true;

        /**
         * Checkpoint interval in seconds used when checkpointing is enabled without one.
         */
        private int defaultCheckpointInterval = 300;

        /**
         * Root under which output, checkpoint and log paths are generated.
         */
        private String pathRoot = "/personal-drive/jobs";
    }

    @Data
    public static class ExecutorConfig {
        /**
         * Job-type tags served by the no-op executor.
         */
        private List<String> basicTypes = new ArrayList<>();

        private KubernetesConfig kubernetes = new KubernetesConfig();
    }

    @Data
    public static class KubernetesConfig {
        /**
         * Run normal and GPU jobs as Kubernetes Jobs.
         * When disabled, those types fall back to the no-op executor.
         */
        private boolean enabled = true;

        /**
         * Interval between cluster Job status polls.
         */
        private Duration statusPollInterval = Duration.ofSeconds(3);

        /**
         * Interval between attempts to attach to the job's pod log.
         */
        private Duration logPollInterval = Duration.ofSeconds(2);

        /**
         * Read timeout for API server calls other than followed log streams.
         */
        private Duration requestTimeout = Duration.ofSeconds(30);

        /**
         * Priority class assigned to job pods.
         */
        private String priorityClassName = "low-priority";
    }
}
