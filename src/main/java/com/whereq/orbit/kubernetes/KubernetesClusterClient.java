package com.whereq.orbit.kubernetes;

import io.kubernetes.client.PodLogs;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.apis.BatchV1Api;
import io.kubernetes.client.openapi.apis.CoreV1Api;
import io.kubernetes.client.openapi.models.V1Job;
import io.kubernetes.client.openapi.models.V1JobList;
import io.kubernetes.client.openapi.models.V1Pod;
import io.kubernetes.client.openapi.models.V1PodList;
import io.kubernetes.client.util.generic.GenericKubernetesApi;
import io.kubernetes.client.util.generic.KubernetesApiResponse;
import io.kubernetes.client.util.generic.options.ListOptions;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * {@link ClusterClient} backed by the official Kubernetes Java client
 */
@Slf4j
public class KubernetesClusterClient implements ClusterClient {

    private static final String FOREGROUND = "Foreground";

    private final GenericKubernetesApi<V1Job, V1JobList> jobApi;
    private final GenericKubernetesApi<V1Pod, V1PodList> podApi;
    private final BatchV1Api batchApi;
    private final CoreV1Api coreApi;
    private final PodLogs podLogs;

    /**
     * @param apiClient client for request/response calls
     * @param streamingClient client for followed pod logs, without a read timeout
     */
    public KubernetesClusterClient(ApiClient apiClient, ApiClient streamingClient) {
        this.jobApi = new GenericKubernetesApi<>(V1Job.class, V1JobList.class, "batch", "v1", "jobs", apiClient);
        this.podApi = new GenericKubernetesApi<>(V1Pod.class, V1PodList.class, "", "v1", "pods", apiClient);
        this.batchApi = new BatchV1Api(apiClient);
        this.coreApi = new CoreV1Api(apiClient);
        this.podLogs = new PodLogs(streamingClient);
    }

    @Override
    public V1Job createJob(V1Job job) throws ApiException {
        KubernetesApiResponse<V1Job> response = jobApi.create(job);
        if (!response.isSuccess()) {
            throw failure("create job " + job.getMetadata().getName(), response);
        }
        return response.getObject();
    }

    @Override
    public Optional<V1Job> getJob(String namespace, String name) throws ApiException {
        KubernetesApiResponse<V1Job> response = jobApi.get(namespace, name);
        if (response.getHttpStatusCode() == HttpURLConnection.HTTP_NOT_FOUND) {
            return Optional.empty();
        }
        if (!response.isSuccess()) {
            throw failure("get job " + namespace + "/" + name, response);
        }
        return Optional.ofNullable(response.getObject());
    }

    @Override
    public boolean deleteJob(String namespace, String name) throws ApiException {
        try {
            batchApi.deleteNamespacedJob(name, namespace, null, null, null, null, FOREGROUND, null);
            return true;
        } catch (ApiException e) {
            if (e.getCode() == HttpURLConnection.HTTP_NOT_FOUND) {
                log.debug("Job {}/{} already deleted", namespace, name);
                return false;
            }
            throw e;
        }
    }

    @Override
    public List<V1Pod> listPods(String namespace, String labelSelector) throws ApiException {
        ListOptions options = new ListOptions();
        options.setLabelSelector(labelSelector);
        KubernetesApiResponse<V1PodList> response = podApi.list(namespace, options);
        if (!response.isSuccess()) {
            throw failure("list pods " + namespace + " [" + labelSelector + "]", response);
        }
        V1PodList pods = response.getObject();
        return pods == null || pods.getItems() == null ? Collections.emptyList() : pods.getItems();
    }

    @Override
    public String readPodLog(V1Pod pod) throws ApiException {
        String log = coreApi.readNamespacedPodLog(pod.getMetadata().getName(), pod.getMetadata().getNamespace(),
            null, false, null, null, null, false, null, null, false);
        return log == null ? "" : log;
    }

    @Override
    public InputStream followPodLog(V1Pod pod) throws ApiException, IOException {
        return podLogs.streamNamespacedPodLog(pod);
    }

    private static ApiException failure(String operation, KubernetesApiResponse<?> response) {
        String detail = response.getStatus() != null ? response.getStatus().getMessage() : "no status";
        return new ApiException(response.getHttpStatusCode(), "Failed to " + operation + ": " + detail);
    }
}
