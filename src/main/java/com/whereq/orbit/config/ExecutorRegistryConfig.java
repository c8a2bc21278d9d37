package com.whereq.orbit.config;

import com.whereq.orbit.executor.BasicJobExecutor;
import com.whereq.orbit.executor.ExecutorRegistry;
import com.whereq.orbit.executor.JobExecutor;
import com.whereq.orbit.executor.KubernetesJobExecutor;
import com.whereq.orbit.model.JobType;
import com.whereq.orbit.repository.JobRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the executor registry at startup
 */
@Slf4j
@Configuration
public class ExecutorRegistryConfig {

    @Bean
    public BasicJobExecutor basicJobExecutor(JobRepository jobRepository) {
        return new BasicJobExecutor(jobRepository);
    }

    @Bean
    public ExecutorRegistry executorRegistry(OrbitProperties properties,
                                             BasicJobExecutor basicJobExecutor,
                                             ObjectProvider<KubernetesJobExecutor> kubernetesJobExecutor) {
        ExecutorRegistry registry = new ExecutorRegistry();

        JobExecutor clusterExecutor = kubernetesJobExecutor.getIfAvailable();
        if (clusterExecutor == null) {
            log.warn("Kubernetes executor disabled, normal and gpu jobs will only be recorded");
            clusterExecutor = basicJobExecutor;
        }
        registry.register(JobType.NORMAL.getTag(), clusterExecutor);
        registry.register(JobType.GPU.getTag(), clusterExecutor);

        for (String type : properties.getExecutor().getBasicTypes()) {
            registry.register(type, basicJobExecutor);
        }
        return registry;
    }
}
