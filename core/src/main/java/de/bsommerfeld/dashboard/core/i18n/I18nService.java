package de.bsommerfeld.dashboard.core.i18n;

import com.google.inject.Singleton;
import de.bsommerfeld.dashboard.core.config.DashboardConfig;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Provides localized widget titles and status texts from
 * {@code i18n/messages_{locale}.properties} bundles on the classpath.
 *
 * <p>
 * The locale comes from
 * {@link de.bsommerfeld.dashboard.core.config.UserConfig#getLanguage()} at
 * startup and can be switched at runtime via {@link #setLocale(Locale)}.
 *
 * <p>
 * Missing keys fail hard instead of returning a placeholder, so a
 * translation gap shows up the first time the text is rendered.
 */
@Singleton
public class I18nService {

    private static final Logger LOG = LoggerFactory.getLogger(I18nService.class);
    private static final String BUNDLE_NAME = "i18n.messages";

    private volatile Locale currentLocale;
    private volatile ResourceBundle resourceBundle;

    @Inject
    public I18nService(DashboardConfig config) {
        this(Locale.forLanguageTag(config.getUser().getLanguage()));
    }

    public I18nService(Locale locale) {
        this.currentLocale = locale;
        loadBundle();
    }

    /**
     * Switches the active locale and reloads the bundle.
     *
     * @param locale the new locale to activate
     */
    public void setLocale(Locale locale) {
        LOG.info("Switching locale from {} to {}", currentLocale, locale);
        this.currentLocale = locale;
        loadBundle();
    }

    public Locale getCurrentLocale() {
        return currentLocale;
    }

    /**
     * @param key message key as defined in the bundle
     * @return the translated string
     * @throws IllegalStateException if the key is missing
     */
    public String get(String key) {
        try {
            return resourceBundle.getString(key);
        } catch (MissingResourceException e) {
            LOG.error("Missing translation for key: {}", key);
            throw new IllegalStateException("Translation missing for key: " + key, e);
        }
    }

    /**
     * Returns the translated string with {@link MessageFormat} placeholders
     * resolved.
     *
     * @param key  the message key
     * @param args values for {@code {0}}, {@code {1}}, ...
     */
    public String get(String key, Object... args) {
        String pattern = get(key);
        try {
            return new MessageFormat(pattern, currentLocale).format(args);
        } catch (IllegalArgumentException e) {
            LOG.error("Error formatting string for key: {}", key, e);
            throw new IllegalStateException("I18n formatting error for key: " + key, e);
        }
    }

    /** Returns {@code true} if the active bundle defines the key. */
    public boolean has(String key) {
        return resourceBundle.containsKey(key);
    }

    private void loadBundle() {
        try {
            this.resourceBundle = ResourceBundle.getBundle(BUNDLE_NAME, currentLocale);
        } catch (MissingResourceException e) {
            LOG.error("CRITICAL: Failed to load resource bundle '{}' for locale '{}'",
                    BUNDLE_NAME, currentLocale, e);
            throw new IllegalStateException("Failed to load I18n bundle: " + BUNDLE_NAME, e);
        }
    }
}
