package com.whereq.orbit.model;

/**
 * GPU access tiers a project may allow
 */
public enum GpuAccessType {
    /**
     * No GPU access
     */
    NONE("none"),

    /**
     * Shared GPU via MPS
     */
    SHARED("shared"),

    /**
     * Whole GPU
     */
    DEDICATED("dedicated");

    /**
     * Quota units consumed by one dedicated GPU (one shared GPU consumes one unit)
     */
    public static final int UNITS_PER_DEDICATED_GPU = 10;

    private final String tag;

    GpuAccessType(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    /**
     * Quota units consumed by {@code gpuCount} GPUs of the given access tag
     *
     * @throws ArithmeticException if the result does not fit in an int
     */
    public static int quotaUnits(int gpuCount, String accessTag) {
        if (DEDICATED.tag.equals(accessTag)) {
            return Math.multiplyExact(gpuCount, UNITS_PER_DEDICATED_GPU);
        }
        return gpuCount;
    }
}
