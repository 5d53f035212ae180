package de.bsommerfeld.dashboard.app.view;

import com.google.inject.Singleton;
import de.bsommerfeld.dashboard.core.domain.CpuUsage;
import de.bsommerfeld.dashboard.core.domain.DockerContainer;
import de.bsommerfeld.dashboard.core.domain.Linkable;
import de.bsommerfeld.dashboard.core.domain.MediaTrack;
import de.bsommerfeld.dashboard.core.domain.RamUsage;
import de.bsommerfeld.dashboard.core.domain.ServiceHealth;
import de.bsommerfeld.dashboard.core.i18n.I18nService;
import de.bsommerfeld.dashboard.polling.SourceKind;
import de.bsommerfeld.dashboard.polling.WidgetId;
import de.bsommerfeld.dashboard.polling.aggregate.CheckTime;
import de.bsommerfeld.dashboard.polling.error.ClassifiedError;
import de.bsommerfeld.dashboard.polling.state.WidgetState;
import jakarta.inject.Inject;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Turns widget states into localized text.
 *
 * <p>
 * Error texts follow the failure kind: configuration and credential problems
 * get the source's own guidance when the bundle has it
 * ({@code status.not_configured.tickets}) and a generic sentence otherwise;
 * network and unclassified failures all read "Error loading ...". A widget
 * that is degraded but still holds data keeps showing it, marked as stale.
 */
@Singleton
public class WidgetStatusFormatter {

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss", Locale.ROOT);

    private final I18nService i18n;
    private final ZoneId zone;

    @Inject
    public WidgetStatusFormatter(I18nService i18n) {
        this(i18n, ZoneId.systemDefault());
    }

    public WidgetStatusFormatter(I18nService i18n, ZoneId zone) {
        this.i18n = i18n;
        this.zone = zone;
    }

    public String title(SourceKind kind) {
        return i18n.get("widget." + kind.key() + ".title");
    }

    public WidgetView format(WidgetId id, SourceKind kind, WidgetState<?> state) {
        String title = title(kind);
        Object data = state.data().orElse(null);
        String summary = data == null ? "" : summary(kind, data);
        List<Linkable> links = links(data);

        if (state instanceof WidgetState.Loading<?>) {
            return new WidgetView(id, title, "", i18n.get("status.loading", title), null, links);
        }
        if (state instanceof WidgetState.Degraded<?> degraded) {
            String status = errorText(kind, title, degraded.error());
            if (degraded.hasLastGood()) {
                status = status + " (" + i18n.get("status.stale") + ")";
            }
            return new WidgetView(id, title, summary, status, degraded.error().kind(), links);
        }
        return new WidgetView(id, title, summary, "", null, links);
    }

    /** Text for a failure of {@code kind}, preferring source-specific guidance. */
    public String errorText(SourceKind kind, String title, ClassifiedError error) {
        return switch (error.kind()) {
            case NOT_CONFIGURED -> guidance("status.not_configured", kind, title);
            case AUTH_FAILURE -> guidance("status.auth_failure", kind, title);
            case UNSUPPORTED_PLATFORM -> guidance("status.unsupported", kind, title);
            case STILL_LOADING -> i18n.get("status.loading", title);
            case TRANSIENT_NETWORK, UNKNOWN -> i18n.get("status.error", title);
        };
    }

    public String lastCheck(CheckTime checkTime) {
        return checkTime.instant()
                .map(instant -> i18n.get("status.last_check", time(instant)))
                .orElseGet(() -> i18n.get("status.no_data_yet"));
    }

    String summary(SourceKind kind, Object data) {
        return switch (kind) {
            case CPU -> data instanceof CpuUsage cpu ? i18n.get("summary.cpu", cpu.overallUsage()) : "";
            case RAM -> data instanceof RamUsage ram
                    ? i18n.get("summary.ram", bytes(ram.used()), bytes(ram.total()), ram.percentage())
                    : "";
            case CONTAINERS -> {
                List<DockerContainer> containers = listOf(data, DockerContainer.class);
                long running = containers.stream().filter(c -> "running".equalsIgnoreCase(c.status())).count();
                yield i18n.get("summary.containers", running, containers.size());
            }
            case MEDIA -> data instanceof MediaTrack track
                    ? i18n.get(track.playing() ? "summary.media.playing" : "summary.media.paused",
                            track.trackName(), track.artist())
                    : "";
            case TICKETS, ISSUES -> i18n.get("summary." + kind.key(), listOf(data, Object.class).size());
            case SERVICE_HEALTH -> {
                List<ServiceHealth> services = listOf(data, ServiceHealth.class);
                long up = services.stream().filter(ServiceHealth::up).count();
                yield i18n.get("summary.service_health", up, services.size());
            }
        };
    }

    private String guidance(String prefix, SourceKind kind, String title) {
        String specific = prefix + "." + kind.key();
        return i18n.has(specific) ? i18n.get(specific) : i18n.get(prefix, title);
    }

    private String time(Instant instant) {
        return TIME.format(instant.atZone(zone));
    }

    private static List<Linkable> links(Object data) {
        return listOf(data, Linkable.class).stream()
                .filter(link -> link.url() != null && !link.url().isBlank())
                .toList();
    }

    private static <T> List<T> listOf(Object data, Class<T> type) {
        if (!(data instanceof List<?> list)) {
            return List.of();
        }
        return list.stream().filter(type::isInstance).map(type::cast).toList();
    }

    private static String bytes(long bytes) {
        double gib = bytes / (1024.0 * 1024 * 1024);
        if (gib >= 1) {
            return String.format(Locale.ROOT, "%.1f GB", gib);
        }
        return String.format(Locale.ROOT, "%.0f MB", bytes / (1024.0 * 1024));
    }
}
