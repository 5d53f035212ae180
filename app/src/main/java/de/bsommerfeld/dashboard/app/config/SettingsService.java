package de.bsommerfeld.dashboard.app.config;

import com.google.inject.Singleton;
import de.bsommerfeld.dashboard.core.config.ConfigurationException;
import de.bsommerfeld.dashboard.core.config.ConfigurationLoader;
import de.bsommerfeld.dashboard.core.config.DashboardConfig;
import de.bsommerfeld.dashboard.core.event.ApplicationEventBus;
import de.bsommerfeld.dashboard.core.event.DashboardEvents.LanguageChangedEvent;
import de.bsommerfeld.dashboard.core.i18n.I18nService;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Runtime changes to {@link DashboardConfig}. Every change is written back
 * to the config file immediately.
 */
@Singleton
public class SettingsService {

    private static final Logger LOG = LoggerFactory.getLogger(SettingsService.class);

    private final DashboardConfig config;
    private final ConfigurationLoader loader;
    private final I18nService i18n;
    private final ApplicationEventBus eventBus;

    @Inject
    public SettingsService(DashboardConfig config, ConfigurationLoader loader, I18nService i18n,
            ApplicationEventBus eventBus) {
        this.config = config;
        this.loader = loader;
        this.i18n = i18n;
        this.eventBus = eventBus;
    }

    /** Switches the display language; views re-render on the posted event. */
    public void setLanguage(String languageTag) {
        config.getUser().setLanguage(languageTag);
        persist();
        i18n.setLocale(Locale.forLanguageTag(languageTag));
        eventBus.post(new LanguageChangedEvent());
    }

    public void setOpenLinks(boolean openLinks) {
        config.getWidgets().setOpenLinks(openLinks);
        persist();
    }

    private void persist() {
        try {
            loader.save(config);
        } catch (ConfigurationException e) {
            // The change stays active for this session
            LOG.warn("Failed to save configuration: {}", e.getMessage());
        }
    }
}
