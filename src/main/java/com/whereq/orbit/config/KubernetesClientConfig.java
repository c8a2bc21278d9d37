package com.whereq.orbit.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.orbit.executor.KubernetesJobExecutor;
import com.whereq.orbit.kubernetes.ClusterClient;
import com.whereq.orbit.kubernetes.JobCompletionWatcher;
import com.whereq.orbit.kubernetes.KubernetesClusterClient;
import com.whereq.orbit.kubernetes.KubernetesJobFactory;
import com.whereq.orbit.kubernetes.PodLogFollower;
import com.whereq.orbit.repository.JobRepository;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.util.ClientBuilder;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.time.Duration;

/**
 * Kubernetes client and executor wiring.
 * Disabled with {@code orbit.executor.kubernetes.enabled=false}.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "orbit.executor.kubernetes", name = "enabled", havingValue = "true", matchIfMissing = true)
public class KubernetesClientConfig {

    @Bean
    public ApiClient kubernetesApiClient(OrbitProperties properties) throws IOException {
        return configureReadTimeout(newApiClient(), properties.getExecutor().getKubernetes().getRequestTimeout());
    }

    @Bean
    public ClusterClient clusterClient(ApiClient kubernetesApiClient) throws IOException {
        // log streams stay open for the life of the pod
        ApiClient streamingClient = configureReadTimeout(newApiClient(), Duration.ZERO);
        return new KubernetesClusterClient(kubernetesApiClient, streamingClient);
    }

    @Bean
    public KubernetesJobFactory kubernetesJobFactory(ObjectMapper objectMapper, OrbitProperties properties) {
        return new KubernetesJobFactory(objectMapper,
            properties.getExecutor().getKubernetes().getPriorityClassName());
    }

    @Bean
    public KubernetesJobExecutor kubernetesJobExecutor(ClusterClient clusterClient,
                                                       JobRepository jobRepository,
                                                       KubernetesJobFactory kubernetesJobFactory,
                                                       OrbitProperties properties,
                                                       MeterRegistry meterRegistry) {
        OrbitProperties.KubernetesConfig kubernetes = properties.getExecutor().getKubernetes();
        return new KubernetesJobExecutor(
            clusterClient,
            jobRepository,
            kubernetesJobFactory,
            new JobCompletionWatcher(clusterClient, jobRepository, kubernetes.getStatusPollInterval()),
            new PodLogFollower(clusterClient, jobRepository, kubernetes.getLogPollInterval()),
            meterRegistry);
    }

    /**
     * Set the client's read timeout. {@link Duration#ZERO} disables it.
     */
    static ApiClient configureReadTimeout(ApiClient client, Duration timeout) {
        return client.setReadTimeout((int) Math.min(timeout.toMillis(), Integer.MAX_VALUE));
    }

    private static ApiClient newApiClient() throws IOException {
        String serviceHost = System.getenv("KUBERNETES_SERVICE_HOST");
        if (serviceHost != null && !serviceHost.isEmpty()) {
            log.info("Kubernetes client using in-cluster configuration (host={})", serviceHost);
            return ClientBuilder.cluster().build();
        }
        ApiClient client = ClientBuilder.defaultClient();
        log.info("Kubernetes client using default kubeconfig ({})", client.getBasePath());
        return client;
    }
}
