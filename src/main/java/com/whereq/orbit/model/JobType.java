package com.whereq.orbit.model;

/**
 * Known job-type tags. A job carries its tag as plain text so that
 * tags without a registered executor can still be persisted.
 */
public enum JobType {
    /**
     * Standard containerized job
     */
    NORMAL("normal"),

    /**
     * GPU-accelerated job
     */
    GPU("gpu"),

    /**
     * MPI distributed computing job
     */
    MPI("mpi");

    private final String tag;

    JobType(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    @Override
    public String toString() {
        return tag;
    }
}
