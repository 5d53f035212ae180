package de.bsommerfeld.dashboard.app;

import ch.qos.logback.classic.Level;
import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.dashboard.app.config.AppModule;
import de.bsommerfeld.dashboard.app.view.DashboardViewModel;
import de.bsommerfeld.dashboard.core.config.DashboardConfig;
import de.bsommerfeld.dashboard.core.util.AppDirectories;
import de.bsommerfeld.dashboard.polling.subscription.WidgetSubscriptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;

/**
 * Headless entry point. Starts every enabled widget pipeline and keeps the
 * process alive until it is interrupted; widget changes are written to the
 * log.
 */
public final class DashboardApp {

    static {
        // Logback resolves LOG_DIR when the first logger is created
        Path logDir = AppDirectories.logsDir(AppDirectories.APP_NAME);
        try {
            Files.createDirectories(logDir);
            System.setProperty("LOG_DIR", logDir.toAbsolutePath().toString());
        } catch (Exception e) {
            System.err.println("Failed to create log directory: " + logDir);
            e.printStackTrace();
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(DashboardApp.class);

    private DashboardApp() {
    }

    public static void main(String[] args) throws InterruptedException {
        LOG.info("Initializing...");
        Injector injector = Guice.createInjector(new AppModule());
        if (injector.getInstance(DashboardConfig.class).isDebugMode()) {
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger("de.bsommerfeld.dashboard"))
                    .setLevel(Level.DEBUG);
            LOG.debug("Debug mode enabled");
        }

        DashboardViewModel viewModel = injector.getInstance(DashboardViewModel.class);
        WidgetSubscriptions subscriptions = injector.getInstance(WidgetSubscriptions.class);
        CountDownLatch shutdown = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down...");
            viewModel.stop();
            subscriptions.closeAll();
            shutdown.countDown();
        }, "dashboard-shutdown"));

        viewModel.start();
        LOG.info("Dashboard running with {} widget(s)", viewModel.views().size());
        shutdown.await();
    }
}
