package de.bsommerfeld.dashboard.sources.live;

import com.sun.management.OperatingSystemMXBean;
import de.bsommerfeld.dashboard.core.domain.CpuUsage;
import de.bsommerfeld.dashboard.polling.SourceAdapter;
import de.bsommerfeld.dashboard.polling.SourceException;

import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Host CPU load from the JVM's operating system bean.
 *
 * <p>
 * Process usage is derived from the CPU time each process consumed since the
 * previous fetch, relative to the wall time that passed and the number of
 * processors. The first fetch only records a baseline. Per-core load is not
 * exposed by the JDK, so the core list stays empty.
 */
public class SystemCpuAdapter implements SourceAdapter<CpuUsage> {

    private static final int TOP_PROCESSES = 5;

    private final OperatingSystemMXBean os;
    private final Map<Long, Duration> previousCpuTime = new HashMap<>();
    private long previousNanos;

    public SystemCpuAdapter() {
        this(ManagementFactory.getPlatformMXBean(OperatingSystemMXBean.class));
    }

    SystemCpuAdapter(OperatingSystemMXBean os) {
        this.os = os;
    }

    @Override
    public CpuUsage fetch() throws SourceException {
        if (os == null) {
            throw new SourceException("CPU statistics are not supported on this JVM");
        }
        double load = os.getCpuLoad();
        if (load < 0) {
            // The bean needs two samples before it reports a value
            throw new SourceException("Loading CPU statistics...");
        }
        return new CpuUsage(round(load * 100), List.of(), topProcesses());
    }

    private List<CpuUsage.CpuProcessInfo> topProcesses() {
        long now = System.nanoTime();
        long elapsed = now - previousNanos;
        boolean baseline = previousNanos == 0;
        previousNanos = now;

        Map<Long, Duration> current = new HashMap<>();
        Map<Long, CpuUsage.CpuProcessInfo> usage = new HashMap<>();
        int processors = Math.max(1, os.getAvailableProcessors());

        ProcessHandle.allProcesses().forEach(process -> process.info().totalCpuDuration().ifPresent(cpu -> {
            current.put(process.pid(), cpu);
            Duration before = previousCpuTime.get(process.pid());
            if (!baseline && before != null && elapsed > 0) {
                double share = (cpu.minus(before).toNanos() * 100.0) / elapsed / processors;
                String name = process.info().command().map(SystemCpuAdapter::baseName).orElse("pid " + process.pid());
                usage.put(process.pid(), new CpuUsage.CpuProcessInfo(name, round(share)));
            }
        }));

        previousCpuTime.clear();
        previousCpuTime.putAll(current);

        return usage.values().stream()
                .sorted(Comparator.comparingDouble(CpuUsage.CpuProcessInfo::cpuUsage).reversed())
                .limit(TOP_PROCESSES)
                .toList();
    }

    private static String baseName(String command) {
        int slash = Math.max(command.lastIndexOf('/'), command.lastIndexOf('\\'));
        return slash < 0 ? command : command.substring(slash + 1);
    }

    private static double round(double value) {
        return Math.round(value * 10) / 10.0;
    }
}
