package com.whereq.orbit.queue;

import com.whereq.orbit.model.Job;

import java.util.Optional;

/**
 * Holding area for jobs awaiting dispatch
 */
public interface JobQueue {
    /**
     * Add a job to the queue
     *
     * @param job the job to enqueue
     */
    void push(Job job);

    /**
     * Remove and return the next job to dispatch
     *
     * @return the highest-priority waiting job, empty if the queue is empty
     */
    Optional<Job> pop();

    /**
     * Remove a waiting job (for cancellation)
     *
     * @param jobId the job identifier
     * @return true if the job was waiting and has been removed
     */
    boolean remove(Long jobId);

    /**
     * Get current queue size
     *
     * @return number of waiting jobs
     */
    int size();

    default boolean isEmpty() {
        return size() == 0;
    }
}
