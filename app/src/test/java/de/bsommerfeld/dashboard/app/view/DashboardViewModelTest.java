package de.bsommerfeld.dashboard.app.view;

import de.bsommerfeld.dashboard.app.config.SettingsService;
import de.bsommerfeld.dashboard.core.config.ConfigurationLoader;
import de.bsommerfeld.dashboard.core.config.DashboardConfig;
import de.bsommerfeld.dashboard.core.config.WidgetsConfig;
import de.bsommerfeld.dashboard.core.domain.Ticket;
import de.bsommerfeld.dashboard.core.event.ApplicationEventBus;
import de.bsommerfeld.dashboard.core.event.DashboardEvents.LanguageChangedEvent;
import de.bsommerfeld.dashboard.core.event.DashboardEvents.OpenLinkEvent;
import de.bsommerfeld.dashboard.core.i18n.I18nService;
import de.bsommerfeld.dashboard.polling.SourceException;
import de.bsommerfeld.dashboard.polling.SourceKind;
import de.bsommerfeld.dashboard.polling.WidgetCatalog;
import de.bsommerfeld.dashboard.polling.WidgetDefinition;
import de.bsommerfeld.dashboard.polling.WidgetId;
import de.bsommerfeld.dashboard.polling.aggregate.Aggregator;
import de.bsommerfeld.dashboard.polling.error.ErrorClassifier;
import de.bsommerfeld.dashboard.polling.error.ErrorKind;
import de.bsommerfeld.dashboard.polling.state.Reconciler;
import de.bsommerfeld.dashboard.polling.state.WidgetState;
import de.bsommerfeld.dashboard.polling.state.WidgetStateStore;
import de.bsommerfeld.dashboard.polling.subscription.WidgetSubscription;
import de.bsommerfeld.dashboard.polling.subscription.WidgetSubscriptions;
import com.google.common.eventbus.Subscribe;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DashboardViewModelTest {

    private static final WidgetId CPU = WidgetId.of(SourceKind.CPU);
    private static final WidgetId TICKETS = WidgetId.of(SourceKind.TICKETS);

    @TempDir
    Path tempDir;

    private ApplicationEventBus eventBus;
    private DashboardConfig config;
    private WidgetsConfig widgetsConfig;
    private I18nService i18n;
    private WidgetSubscriptions subscriptions;
    private DashboardViewModel viewModel;
    private volatile boolean jiraConfigured;

    @BeforeEach
    void setUp() {
        eventBus = new ApplicationEventBus();
        config = new DashboardConfig();
        widgetsConfig = config.getWidgets();
        widgetsConfig.setEnabled(List.of("tickets", "cpu", "weather"));
        i18n = new I18nService(Locale.ENGLISH);

        WidgetCatalog catalog = () -> List.of(
                WidgetDefinition.of(SourceKind.CPU, () -> "cpu"),
                WidgetDefinition.of(SourceKind.TICKETS, () -> {
                    if (!jiraConfigured) {
                        throw new SourceException("JIRA_API_TOKEN environment variable not set");
                    }
                    return List.of(new Ticket("OPS-1", "First", "To Do", "Sam",
                            "https://example.atlassian.net/browse/OPS-1"));
                }));

        WidgetStateStore store = new WidgetStateStore(eventBus);
        Reconciler reconciler = new Reconciler(store, new ErrorClassifier(), Clock.systemUTC());
        subscriptions = new WidgetSubscriptions(store, reconciler, eventBus, catalog);
        viewModel = new DashboardViewModel(subscriptions, catalog, widgetsConfig,
                new WidgetStatusFormatter(i18n, ZoneOffset.UTC), new Aggregator(store), eventBus);
    }

    @AfterEach
    void tearDown() {
        viewModel.stop();
        subscriptions.closeAll();
    }

    @Test
    void start_shouldSubscribeEnabledWidgetsInConfiguredOrder() {
        viewModel.start();

        assertEquals(List.of(TICKETS, CPU), viewModel.views().stream().map(WidgetView::id).toList());
        assertTrue(subscriptions.isPolling(CPU));
        assertTrue(subscriptions.isPolling(TICKETS));
    }

    @Test
    void start_shouldShowJiraGuidanceWhenTokenIsMissing() throws InterruptedException {
        viewModel.start();

        assertTrue(awaitCondition(() -> viewModel.view(TICKETS).map(WidgetView::isDegraded).orElse(false)));
        WidgetView view = viewModel.view(TICKETS).orElseThrow();
        assertEquals(ErrorKind.NOT_CONFIGURED, view.error());
        assertTrue(view.status().contains("Set JIRA_EMAIL and JIRA_API_TOKEN"));
    }

    @Test
    void lastCheck_shouldReportTimeOnceDataArrived() throws InterruptedException {
        viewModel.start();

        assertTrue(awaitCondition(() -> viewModel.view(CPU).map(view -> view.status().isEmpty()).orElse(false)));
        assertTrue(viewModel.lastCheck().startsWith("Last check: "));
    }

    @Test
    void lastCheck_shouldReportNoDataBeforeStart() {
        assertEquals("No data yet", viewModel.lastCheck());
    }

    @Test
    void select_shouldPostOpenLinkEvent() throws InterruptedException {
        jiraConfigured = true;
        List<String> opened = new CopyOnWriteArrayList<>();
        eventBus.register(new Object() {
            @Subscribe
            public void onOpenLink(OpenLinkEvent event) {
                opened.add(event.url());
            }
        });
        viewModel.start();
        assertTrue(awaitCondition(() -> viewModel.view(TICKETS).map(view -> !view.links().isEmpty()).orElse(false)));

        assertTrue(viewModel.select(TICKETS, 0));
        assertFalse(viewModel.select(TICKETS, 5));
        assertEquals(List.of("https://example.atlassian.net/browse/OPS-1"), opened);
    }

    @Test
    void setLanguage_shouldRerenderViews() throws InterruptedException {
        viewModel.start();
        assertTrue(awaitCondition(() -> viewModel.view(TICKETS).map(WidgetView::isDegraded).orElse(false)));

        Path configPath = tempDir.resolve("config.toml");
        new SettingsService(config, ConfigurationLoader.from(configPath), i18n, eventBus).setLanguage("de");

        assertEquals("de", ConfigurationLoader.from(configPath).load().getUser().getLanguage());
        assertTrue(viewModel.view(TICKETS).orElseThrow().status().startsWith("Setze JIRA_EMAIL"));
    }

    @Test
    void onLanguageChanged_shouldNotOverwriteNewerStateDeliveredMeanwhile() throws InterruptedException {
        WidgetState<?> older = new WidgetState.Ready<>("older", Instant.EPOCH);
        WidgetState<?> newer = new WidgetState.Ready<>("newer", Instant.EPOCH.plusSeconds(2));
        CountDownLatch renderingOlder = new CountDownLatch(1);
        CountDownLatch proceed = new CountDownLatch(1);
        AtomicBoolean holdNextRender = new AtomicBoolean();
        WidgetStatusFormatter slowFormatter = new WidgetStatusFormatter(i18n, ZoneOffset.UTC) {
            @Override
            public WidgetView format(WidgetId id, SourceKind kind, WidgetState<?> state) {
                if (holdNextRender.compareAndSet(true, false)) {
                    renderingOlder.countDown();
                    try {
                        proceed.await(2, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                return new WidgetView(id, "CPU", String.valueOf(state.data().orElse(null)), "", null, List.of());
            }
        };

        AtomicReference<Consumer<WidgetState<?>>> listener = new AtomicReference<>();
        WidgetSubscription subscription = mock(WidgetSubscription.class);
        when(subscription.widgetId()).thenReturn(CPU);
        when(subscription.current()).thenAnswer(invocation -> older);
        WidgetSubscriptions mockedSubscriptions = mock(WidgetSubscriptions.class);
        when(mockedSubscriptions.subscribe(eq(CPU), any())).thenAnswer(invocation -> {
            listener.set(invocation.getArgument(1));
            return subscription;
        });

        widgetsConfig.setEnabled(List.of("cpu"));
        WidgetCatalog catalog = () -> List.of(WidgetDefinition.of(SourceKind.CPU, () -> "cpu"));
        DashboardViewModel model = new DashboardViewModel(mockedSubscriptions, catalog, widgetsConfig,
                slowFormatter, mock(Aggregator.class), new ApplicationEventBus());
        model.start();

        holdNextRender.set(true);
        Thread languageSwitch = new Thread(() -> model.onLanguageChanged(new LanguageChangedEvent()));
        languageSwitch.start();
        assertTrue(renderingOlder.await(2, TimeUnit.SECONDS));

        Thread pollerDelivery = new Thread(() -> listener.get().accept(newer));
        pollerDelivery.start();
        Thread.sleep(50);
        proceed.countDown();
        languageSwitch.join(2000);
        pollerDelivery.join(2000);

        assertEquals("newer", model.view(CPU).orElseThrow().summary());
    }

    @Test
    void stop_shouldStopPolling() {
        viewModel.start();

        viewModel.stop();

        assertFalse(subscriptions.isPolling(CPU));
        assertTrue(viewModel.views().isEmpty());
    }

    private static boolean awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(5);
        }
        return false;
    }
}
