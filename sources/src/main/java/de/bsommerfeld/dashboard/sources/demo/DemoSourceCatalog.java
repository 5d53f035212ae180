package de.bsommerfeld.dashboard.sources.demo;

import com.google.common.collect.ImmutableList;
import com.google.inject.Singleton;
import de.bsommerfeld.dashboard.polling.SourceKind;
import de.bsommerfeld.dashboard.polling.WidgetCatalog;
import de.bsommerfeld.dashboard.polling.WidgetDefinition;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * Offline catalog used when the dashboard runs in TEST mode.
 *
 * <h3>No network access</h3>
 * Every adapter returns synthetic data from {@link DemoDataGenerator}. The
 * whole pipeline (polling, classification, reconciliation, aggregation)
 * runs exactly as in production.
 *
 * <h3>Warm-up</h3>
 * The media, ticket and issue adapters fail their first call with a
 * "Loading ..." message, the way their real clients do while resolving
 * credentials. Start-up therefore exercises the still-loading path.
 */
@Singleton
public class DemoSourceCatalog implements WidgetCatalog {

    private static final Logger LOG = LoggerFactory.getLogger(DemoSourceCatalog.class);

    static final String JIRA_BASE_URL = "https://example.atlassian.net";
    static final String SENTRY_BASE_URL = "https://example.sentry.io";
    private static final int CORE_COUNT = 8;

    private final List<WidgetDefinition<?>> definitions;

    @Inject
    public DemoSourceCatalog(Clock clock) {
        this(clock, new DemoDataGenerator());
    }

    DemoSourceCatalog(Clock clock, DemoDataGenerator generator) {
        LOG.warn("#######################################################");
        LOG.warn("#  TEST MODE ENABLED: widget sources are SIMULATED    #");
        LOG.warn("#######################################################");

        this.definitions = ImmutableList.<WidgetDefinition<?>>of(
                WidgetDefinition.of(SourceKind.CPU, () -> generator.cpuUsage(CORE_COUNT)),
                WidgetDefinition.of(SourceKind.RAM, generator::ramUsage),
                WidgetDefinition.of(SourceKind.CONTAINERS, generator::containers),
                WidgetDefinition.of(SourceKind.MEDIA,
                        new WarmUpAdapter<>("Loading Spotify data...", generator::mediaTrack)),
                WidgetDefinition.of(SourceKind.TICKETS,
                        new WarmUpAdapter<>("Loading Jira tickets...", () -> generator.tickets(JIRA_BASE_URL))),
                WidgetDefinition.of(SourceKind.ISSUES,
                        new WarmUpAdapter<>("Loading Sentry issues...", () -> generator.issues(SENTRY_BASE_URL))),
                WidgetDefinition.of(SourceKind.SERVICE_HEALTH, () -> generator.services(clock.instant())));
    }

    @Override
    public List<WidgetDefinition<?>> definitions() {
        return definitions;
    }
}
