package de.bsommerfeld.dashboard.app.config;

import com.google.inject.AbstractModule;
import de.bsommerfeld.dashboard.app.link.DesktopLinkOpener;
import de.bsommerfeld.dashboard.app.link.LinkOpener;
import de.bsommerfeld.dashboard.app.link.LinkService;
import de.bsommerfeld.dashboard.core.config.ConfigurationLoader;
import de.bsommerfeld.dashboard.core.config.DashboardConfig;
import de.bsommerfeld.dashboard.core.config.Environment;
import de.bsommerfeld.dashboard.core.config.SourceMode;
import de.bsommerfeld.dashboard.core.config.UserConfig;
import de.bsommerfeld.dashboard.core.config.WidgetsConfig;
import de.bsommerfeld.dashboard.core.util.AppDirectories;
import de.bsommerfeld.dashboard.polling.WidgetCatalog;
import de.bsommerfeld.dashboard.sources.SourcesModule;
import de.bsommerfeld.dashboard.sources.demo.DemoSourceCatalog;
import de.bsommerfeld.dashboard.sources.live.LiveSourceCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Guice module for application wiring.
 */
public class AppModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(AppModule.class);

    private final Path configPath;
    private final SourceMode mode;
    private final Environment environment;

    public AppModule() {
        this(AppDirectories.configFile(AppDirectories.APP_NAME), SourceMode.get(), Environment.system());
    }

    public AppModule(Path configPath, SourceMode mode, Environment environment) {
        this.configPath = configPath;
        this.mode = mode;
        this.environment = environment;
    }

    @Override
    protected void configure() {
        // Config is vital, a ConfigurationException fails injector creation
        LOG.info("Loading configuration from: {}", configPath.toAbsolutePath());
        ConfigurationLoader loader = ConfigurationLoader.from(configPath);
        DashboardConfig config = loader.load();

        bind(ConfigurationLoader.class).toInstance(loader);
        bind(DashboardConfig.class).toInstance(config);
        bind(UserConfig.class).toInstance(config.getUser());
        bind(WidgetsConfig.class).toInstance(config.getWidgets());

        bind(Clock.class).toInstance(Clock.systemUTC());
        bind(Environment.class).toInstance(environment);
        bind(LinkOpener.class).to(DesktopLinkOpener.class);

        // --- MODE SWITCHING (PROD vs TEST) ---
        LOG.info("Source mode initialized: {}", mode);
        if (mode.isTest()) {
            bind(WidgetCatalog.class).to(DemoSourceCatalog.class);
        } else {
            install(new SourcesModule());
            bind(WidgetCatalog.class).to(LiveSourceCatalog.class);
        }

        bind(LinkService.class).asEagerSingleton();
    }
}
