package de.bsommerfeld.dashboard.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects where widget data comes from. {@link #PROD} uses the installed
 * source adapters, {@link #TEST} swaps in synthetic sources that never touch
 * the network or the host.
 */
public enum SourceMode {

    PROD,
    TEST;

    static final String PROPERTY = "dashboard.mode";
    static final String ENV_VARIABLE = "DASHBOARD_MODE";

    private static final Logger LOG = LoggerFactory.getLogger(SourceMode.class);

    /**
     * Resolves the mode from the {@code dashboard.mode} system property, then
     * the {@code DASHBOARD_MODE} environment variable. Falls back to PROD when
     * neither is set or the value is not a known mode.
     */
    public static SourceMode get() {
        String mode = System.getProperty(PROPERTY);
        if (mode == null || mode.isBlank()) {
            mode = System.getenv(ENV_VARIABLE);
        }

        if (mode == null || mode.isBlank()) {
            return PROD;
        }

        try {
            return SourceMode.valueOf(mode.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown source mode '{}'. Falling back to PROD.", mode);
            return PROD;
        }
    }

    public boolean isTest() {
        return this == TEST;
    }
}
