package de.bsommerfeld.dashboard.core.domain;

import java.util.List;

/**
 * Memory snapshot. Byte counts are absolute, percentages relative to
 * {@code total}.
 */
public record RamUsage(long used, long total, double percentage, List<ProcessInfo> topProcesses) {

    public RamUsage {
        topProcesses = List.copyOf(topProcesses);
    }

    /**
     * Builds a snapshot with {@code percentage} derived from the byte counts.
     * A zero total yields 0%.
     */
    public static RamUsage of(long used, long total, List<ProcessInfo> topProcesses) {
        double percentage = total > 0 ? (double) used / total * 100.0 : 0.0;
        return new RamUsage(used, total, percentage, topProcesses);
    }

    public record ProcessInfo(String name, long memory, double percentage) {
    }
}
