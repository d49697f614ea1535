package org.shadowide.st.analysis;

/**
 * Rough cost estimate of a program: scan-time share, variable memory and added scan time.
 */
public final class ResourceUsage {

    private final int estimatedCpuPercent;
    private final long memoryBytes;
    private final double scanTimeMillis;

    public ResourceUsage(int estimatedCpuPercent, long memoryBytes, double scanTimeMillis) {
        this.estimatedCpuPercent = estimatedCpuPercent;
        this.memoryBytes = memoryBytes;
        this.scanTimeMillis = scanTimeMillis;
    }

    /**
     * Capped at 100.
     */
    public int getEstimatedCpuPercent() {
        return estimatedCpuPercent;
    }

    public long getMemoryBytes() {
        return memoryBytes;
    }

    public double getScanTimeMillis() {
        return scanTimeMillis;
    }

    @Override
    public String toString() {
        return "ResourceUsage{cpu=" + estimatedCpuPercent + "%, memory=" + memoryBytes + "B, scan=" + scanTimeMillis
                + "ms}";
    }
}
