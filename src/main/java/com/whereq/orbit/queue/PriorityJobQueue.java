package com.whereq.orbit.queue;

import com.whereq.orbit.model.Job;
import com.whereq.orbit.model.JobPriority;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * In-memory job queue ordered by priority tier, FIFO within a tier.
 * All operations are guarded by the queue's monitor.
 */
@Slf4j
public class PriorityJobQueue implements JobQueue {

    private static final Comparator<Entry> DISPATCH_ORDER =
        Comparator.comparing((Entry entry) -> entry.priority).reversed()
            .thenComparingLong(entry -> entry.sequence);

    private final PriorityQueue<Entry> entries = new PriorityQueue<>(DISPATCH_ORDER);

    private long nextSequence;

    @Override
    public synchronized void push(Job job) {
        if (job == null) {
            return;
        }
        JobPriority priority = job.getPriority() != null ? job.getPriority() : JobPriority.LOW;
        entries.add(new Entry(job, priority, nextSequence++));
        log.debug("Queued job {} with priority {}, queue size: {}", job.getId(), priority, entries.size());
    }

    @Override
    public synchronized Optional<Job> pop() {
        Entry next = entries.poll();
        return next == null ? Optional.empty() : Optional.of(next.job);
    }

    @Override
    public synchronized boolean remove(Long jobId) {
        return entries.removeIf(entry -> jobId.equals(entry.job.getId()));
    }

    @Override
    public synchronized int size() {
        return entries.size();
    }

    private static final class Entry {
        private final Job job;
        private final JobPriority priority;
        private final long sequence;

        private Entry(Job job, JobPriority priority, long sequence) {
            this.job = job;
            this.priority = priority;
            this.sequence = sequence;
        }
    }
}
