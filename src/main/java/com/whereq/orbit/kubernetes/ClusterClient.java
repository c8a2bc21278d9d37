package com.whereq.orbit.kubernetes;

import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.models.V1Job;
import io.kubernetes.client.openapi.models.V1Pod;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Optional;

/**
 * Blocking operations against the cluster API used by the Kubernetes executor.
 * Callers run these on a bounded elastic scheduler.
 */
public interface ClusterClient {

    V1Job createJob(V1Job job) throws ApiException;

    /**
     * @return the Job, or empty when it does not exist
     */
    Optional<V1Job> getJob(String namespace, String name) throws ApiException;

    /**
     * Delete a Job and its pods in the foreground
     *
     * @return false when the Job did not exist
     */
    boolean deleteJob(String namespace, String name) throws ApiException;

    List<V1Pod> listPods(String namespace, String labelSelector) throws ApiException;

    /**
     * Full log of the pod's first container
     */
    String readPodLog(V1Pod pod) throws ApiException;

    /**
     * Open a following stream over the pod's log. The stream ends when the container exits.
     */
    InputStream followPodLog(V1Pod pod) throws ApiException, IOException;
}
