package de.bsommerfeld.dashboard.polling;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * The widget types the dashboard knows about. Each kind carries its fixed
 * poll interval: system metrics refresh fastest, rate-limited integrations
 * slowest.
 */
public enum SourceKind {

    CPU("cpu", Duration.ofSeconds(2)),
    RAM("ram", Duration.ofSeconds(2)),
    CONTAINERS("containers", Duration.ofSeconds(3)),
    MEDIA("media", Duration.ofSeconds(3)),
    TICKETS("tickets", Duration.ofSeconds(30)),
    ISSUES("issues", Duration.ofSeconds(30)),
    SERVICE_HEALTH("service_health", Duration.ofSeconds(3));

    private final String key;
    private final Duration defaultInterval;

    SourceKind(String key, Duration defaultInterval) {
        this.key = key;
        this.defaultInterval = defaultInterval;
    }

    /** Lower-case identifier used in config files and i18n keys. */
    public String key() {
        return key;
    }

    public Duration defaultInterval() {
        return defaultInterval;
    }

    /**
     * Resolves a kind from its {@link #key()} or enum name, ignoring case.
     */
    public static Optional<SourceKind> fromKey(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SourceKind kind : values()) {
            if (kind.key.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
