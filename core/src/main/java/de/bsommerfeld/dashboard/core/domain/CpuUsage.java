package de.bsommerfeld.dashboard.core.domain;

import java.util.List;

/**
 * CPU load snapshot. Usage values are percentages (0-100).
 *
 * @param overallUsage mean usage across all cores
 * @param cores        per-core usage, indexed from 0
 * @param topProcesses the heaviest processes, highest first
 */
public record CpuUsage(double overallUsage, List<CpuCore> cores, List<CpuProcessInfo> topProcesses) {

    public CpuUsage {
        cores = List.copyOf(cores);
        topProcesses = List.copyOf(topProcesses);
    }

    public record CpuCore(int coreId, double usage) {
    }

    public record CpuProcessInfo(String name, double cpuUsage) {
    }
}
