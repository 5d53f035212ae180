package de.bsommerfeld.dashboard.sources.live;

import com.sun.management.OperatingSystemMXBean;
import de.bsommerfeld.dashboard.core.domain.RamUsage;
import de.bsommerfeld.dashboard.polling.SourceAdapter;
import de.bsommerfeld.dashboard.polling.SourceException;

import java.lang.management.ManagementFactory;
import java.util.List;

/**
 * Physical memory of the host as reported by the JVM. The JDK exposes no
 * per-process memory figures, so the process list stays empty.
 */
public class SystemMemoryAdapter implements SourceAdapter<RamUsage> {

    private final OperatingSystemMXBean os;

    public SystemMemoryAdapter() {
        this(ManagementFactory.getPlatformMXBean(OperatingSystemMXBean.class));
    }

    SystemMemoryAdapter(OperatingSystemMXBean os) {
        this.os = os;
    }

    @Override
    public RamUsage fetch() throws SourceException {
        if (os == null) {
            throw new SourceException("Memory statistics are not supported on this JVM");
        }
        long total = os.getTotalMemorySize();
        long free = os.getFreeMemorySize();
        if (total <= 0) {
            throw new SourceException("Memory statistics are not supported on this platform");
        }
        return RamUsage.of(total - free, total, List.of());
    }
}
