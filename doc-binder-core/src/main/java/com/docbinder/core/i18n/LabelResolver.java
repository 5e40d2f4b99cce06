package com.docbinder.core.i18n;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.MissingResourceException;
import java.util.ResourceBundle;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps locale tags to {@link Labels}.
 *
 * <p>Labels live in the {@code i18n/labels*.properties} bundles. Tags may use either
 * {@code en_US} or {@code en-US} form; a region without its own bundle falls back to the
 * language, and an unknown language falls back to English. The JVM default locale is never
 * consulted.
 */
public final class LabelResolver {

    private static final Logger log = LoggerFactory.getLogger(LabelResolver.class);

    private static final String BUNDLE = "i18n.labels";
    private static final ResourceBundle.Control NO_FALLBACK =
        ResourceBundle.Control.getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES);
    private static final Map<String, Labels> CACHE = new ConcurrentHashMap<>();

    private LabelResolver() {
    }

    /**
     * Resolves the labels for a locale tag.
     *
     * @param localeTag tag such as {@code en}, {@code es}, {@code de_DE}; null means English
     * @return labels for the closest available locale
     */
    public static Labels forLocale(String localeTag) {
        String tag = localeTag == null || localeTag.isBlank() ? "en" : localeTag.strip();
        return CACHE.computeIfAbsent(tag, LabelResolver::load);
    }

    private static Labels load(String tag) {
        Locale locale = Locale.forLanguageTag(tag.replace('_', '-'));
        ResourceBundle bundle;
        try {
            bundle = ResourceBundle.getBundle(BUNDLE, locale, LabelResolver.class.getClassLoader(), NO_FALLBACK);
        } catch (MissingResourceException e) {
            log.warn("No labels bundle found for locale {}: {}", tag, e.getMessage());
            throw new IllegalStateException("Labels bundle missing from classpath: " + BUNDLE, e);
        }
        if (!bundle.getLocale().getLanguage().equals(locale.getLanguage()) && !"en".equals(locale.getLanguage())) {
            log.debug("No labels for locale {}, using English", tag);
        }
        return new Labels(
            tag,
            bundle.getString("index"),
            bundle.getString("contents"),
            bundle.getString("in.prefix"),
            bundle.getString("in.suffix"),
            bundle.getString("date.format")
        );
    }
}
