package de.bsommerfeld.dashboard.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * User-specific preferences. Controls the display language of widget titles
 * and status texts.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class UserConfig {

    /** Display language code, e.g. {@code en} or {@code de}. */
    @JsonProperty("language")
    private String language = "en";

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = language;
    }
}
