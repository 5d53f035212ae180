package de.bsommerfeld.dashboard.sources.demo;

import de.bsommerfeld.dashboard.core.domain.CpuUsage;
import de.bsommerfeld.dashboard.core.domain.DockerContainer;
import de.bsommerfeld.dashboard.core.domain.MediaTrack;
import de.bsommerfeld.dashboard.core.domain.RamUsage;
import de.bsommerfeld.dashboard.core.domain.ServiceHealth;
import de.bsommerfeld.dashboard.core.domain.Ticket;
import de.bsommerfeld.dashboard.core.domain.TrackedIssue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Generates plausible widget payloads for offline development and TEST mode.
 *
 * <p>
 * Values are random but shaped like the real backends: CPU load per core,
 * memory in bytes, containers with docker-style status strings, Jira-style
 * ticket keys and uptime probes with occasional outages. The generator has no
 * side effects besides advancing its {@link Random}.
 */
public class DemoDataGenerator {

    private static final long GIB = 1024L * 1024 * 1024;

    // --- Data Pools ---

    private static final String[] PROCESSES = { "java", "node", "postgres", "docker", "chrome", "idea", "kworker",
            "redis-server" };

    private static final String[][] CONTAINERS = {
            { "api", "ghcr.io/acme/api:1.14.2", "0.0.0.0:8080->8080/tcp" },
            { "worker", "ghcr.io/acme/worker:1.14.2", "" },
            { "postgres", "postgres:16-alpine", "0.0.0.0:5432->5432/tcp" },
            { "redis", "redis:7", "6379/tcp" } };

    private static final String[][] TRACKS = {
            { "Teardrop", "Massive Attack", "Mezzanine" },
            { "Windowlicker", "Aphex Twin", "Windowlicker" },
            { "Innerbloom", "RÜFÜS DU SOL", "Bloom" } };

    private static final String[] TICKET_SUMMARIES = { "Poller drops results after resubscribe",
            "Add latency column to service health", "Rotate Sentry token", "Flaky container widget on Linux",
            "Document JIRA_EMAIL setup" };
    private static final String[] TICKET_STATUSES = { "To Do", "In Progress", "In Review" };
    private static final String[] ASSIGNEES = { "Alex", "Sam", "Robin", "Unassigned" };

    private static final String[] ISSUE_TITLES = { "NullPointerException in CheckoutService",
            "TimeoutError: upstream request took longer than 30s", "KeyError: 'user_id'",
            "ConnectionResetError in worker" };

    private static final String[][] SERVICES = {
            { "API", "https://api.example.com/health" },
            { "Website", "https://www.example.com" },
            { "Status Page", "https://status.example.com" } };

    private final Random random;

    public DemoDataGenerator() {
        this(new Random());
    }

    DemoDataGenerator(Random random) {
        this.random = random;
    }

    public CpuUsage cpuUsage(int coreCount) {
        List<CpuUsage.CpuCore> cores = new ArrayList<>();
        double sum = 0;
        for (int i = 0; i < coreCount; i++) {
            double usage = round(random.nextDouble() * 100);
            cores.add(new CpuUsage.CpuCore(i, usage));
            sum += usage;
        }
        List<CpuUsage.CpuProcessInfo> processes = pickProcesses(5).stream()
                .map(name -> new CpuUsage.CpuProcessInfo(name, round(random.nextDouble() * 40)))
                .sorted(Comparator.comparingDouble(CpuUsage.CpuProcessInfo::cpuUsage).reversed())
                .toList();
        return new CpuUsage(coreCount == 0 ? 0 : round(sum / coreCount), cores, processes);
    }

    public RamUsage ramUsage(long total) {
        long used = (long) (total * (0.35 + random.nextDouble() * 0.5));
        List<RamUsage.ProcessInfo> processes = pickProcesses(5).stream()
                .map(name -> {
                    long memory = (long) (random.nextDouble() * used / 4);
                    return new RamUsage.ProcessInfo(name, memory, round(memory * 100.0 / total));
                })
                .sorted(Comparator.comparingLong(RamUsage.ProcessInfo::memory).reversed())
                .toList();
        return RamUsage.of(used, total, processes);
    }

    public RamUsage ramUsage() {
        return ramUsage(16 * GIB);
    }

    public List<DockerContainer> containers() {
        List<DockerContainer> containers = new ArrayList<>();
        for (String[] container : CONTAINERS) {
            boolean running = random.nextInt(10) > 0;
            int hours = 1 + random.nextInt(72);
            containers.add(new DockerContainer(
                    String.format("%012x", random.nextLong() & 0xFFFF_FFFF_FFFFL),
                    container[0],
                    container[1],
                    running ? "running" : "exited",
                    container[2],
                    running ? "Up " + hours + " hours" : "Exited (1) " + hours + " hours ago"));
        }
        return containers;
    }

    public MediaTrack mediaTrack() {
        String[] track = TRACKS[random.nextInt(TRACKS.length)];
        return new MediaTrack(track[0], track[1], track[2], "", random.nextInt(4) > 0);
    }

    public List<Ticket> tickets(String baseUrl) {
        List<Ticket> tickets = new ArrayList<>();
        for (int i = 0; i < TICKET_SUMMARIES.length; i++) {
            String key = "OPS-" + (100 + i);
            tickets.add(new Ticket(key, TICKET_SUMMARIES[i],
                    TICKET_STATUSES[random.nextInt(TICKET_STATUSES.length)],
                    ASSIGNEES[random.nextInt(ASSIGNEES.length)],
                    baseUrl + "/browse/" + key));
        }
        return tickets;
    }

    public List<TrackedIssue> issues(String baseUrl) {
        List<TrackedIssue> issues = new ArrayList<>();
        for (int i = 0; i < ISSUE_TITLES.length; i++) {
            int firstSeenDays = 1 + random.nextInt(30);
            issues.add(new TrackedIssue(ISSUE_TITLES[i],
                    random.nextInt(59) + 1 + "m ago",
                    firstSeenDays + "d ago",
                    firstSeenDays + "d",
                    1 + random.nextInt(5_000),
                    1 + random.nextInt(300),
                    random.nextInt(5) == 0,
                    baseUrl + "/issues/" + (4_000_000 + i) + "/"));
        }
        return issues;
    }

    public List<ServiceHealth> services(Instant checkedAt) {
        List<ServiceHealth> services = new ArrayList<>();
        for (String[] service : SERVICES) {
            if (random.nextInt(10) == 0) {
                services.add(new ServiceHealth(service[0], service[1], false, null, null, checkedAt,
                        "connection refused"));
            } else {
                services.add(new ServiceHealth(service[0], service[1], true, 200, 20L + random.nextInt(300),
                        checkedAt, null));
            }
        }
        return services;
    }

    private List<String> pickProcesses(int count) {
        List<String> pool = new ArrayList<>(List.of(PROCESSES));
        List<String> picked = new ArrayList<>();
        for (int i = 0; i < count && !pool.isEmpty(); i++) {
            picked.add(pool.remove(random.nextInt(pool.size())));
        }
        return picked;
    }

    private static double round(double value) {
        return Math.round(value * 10) / 10.0;
    }
}
