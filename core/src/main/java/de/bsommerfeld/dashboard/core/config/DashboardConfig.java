package de.bsommerfeld.dashboard.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of {@code config.toml}. Loaded once at startup by
 * {@link ConfigurationLoader}; unknown keys are ignored so older files keep
 * loading after keys are removed.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DashboardConfig {

    @JsonProperty("debug-mode")
    private boolean debugMode = false;

    @JsonProperty("user")
    private UserConfig user = new UserConfig();

    @JsonProperty("widgets")
    private WidgetsConfig widgets = new WidgetsConfig();

    public boolean isDebugMode() {
        return debugMode;
    }

    public UserConfig getUser() {
        return user;
    }

    public WidgetsConfig getWidgets() {
        return widgets;
    }
}
