package de.bsommerfeld.dashboard.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Widget grid settings. Poll intervals are fixed per widget kind and
 * deliberately absent here; this section only selects which widgets run.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class WidgetsConfig {

    /**
     * Widget kinds to subscribe at startup, by name (case-insensitive).
     * Unknown names are logged and skipped.
     */
    @JsonProperty("enabled")
    private List<String> enabled = List.of(
            "cpu", "ram", "containers", "media", "tickets", "issues", "service_health");

    /** Whether selecting a ticket, issue or service opens it in the browser. */
    @JsonProperty("open-links")
    private boolean openLinks = true;

    public List<String> getEnabled() {
        return enabled;
    }

    public void setEnabled(List<String> enabled) {
        this.enabled = enabled;
    }

    public boolean isOpenLinks() {
        return openLinks;
    }

    public void setOpenLinks(boolean openLinks) {
        this.openLinks = openLinks;
    }
}
