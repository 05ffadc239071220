package de.bsommerfeld.reviewinsights.core.i18n;

import com.google.inject.Singleton;
import de.bsommerfeld.reviewinsights.core.config.UserConfig;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Provides the localized strings of the menu and renderers, resolved from
 * {@code i18n/messages_{locale}.properties} on the classpath.
 *
 * <p>
 * The locale comes from {@link UserConfig#getLanguage()}. Missing keys fail
 * hard instead of falling back to the key.
 */
@Singleton
public class I18nService {

    private static final Logger LOG = LoggerFactory.getLogger(I18nService.class);
    private static final String BUNDLE_NAME = "i18n.messages";

    private final Locale locale;
    private final ResourceBundle resourceBundle;

    @Inject
    public I18nService(UserConfig config) {
        this.locale = Locale.forLanguageTag(config.getLanguage());
        this.resourceBundle = loadBundle(locale);
    }

    public Locale getLocale() {
        return locale;
    }

    /**
     * Returns the localized string for {@code key}.
     *
     * @throws IllegalStateException if the key is missing from the bundle
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
     * Returns the localized string with {@link MessageFormat} placeholders
     * ({@code {0}}, {@code {1}}, ...) replaced by {@code args}.
     */
    public String get(String key, Object... args) {
        return new MessageFormat(get(key), locale).format(args);
    }

    private static ResourceBundle loadBundle(Locale locale) {
        try {
            return ResourceBundle.getBundle(BUNDLE_NAME, locale);
        } catch (MissingResourceException e) {
            LOG.error("Failed to load resource bundle '{}' for locale '{}'", BUNDLE_NAME, locale, e);
            throw new IllegalStateException("Failed to load i18n bundle: " + BUNDLE_NAME, e);
        }
    }
}
