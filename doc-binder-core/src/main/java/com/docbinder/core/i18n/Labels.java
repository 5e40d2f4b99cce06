package com.docbinder.core.i18n;

import java.util.Objects;

/**
 * Localized strings inserted into generated content.
 *
 * @param locale locale tag these labels were resolved for
 * @param index title of the general index
 * @param contents title of the table of contents
 * @param inPrefix text opening an "(in Title)" citation, including its leading space
 * @param inSuffix text closing an "(in Title)" citation
 * @param dateFormat default {@link java.time.format.DateTimeFormatter} pattern for cover dates
 */
public record Labels(
    String locale,
    String index,
    String contents,
    String inPrefix,
    String inSuffix,
    String dateFormat
) {
    /**
     * Compact constructor with validation.
     */
    public Labels {
        Objects.requireNonNull(locale, "locale must not be null");
        Objects.requireNonNull(index, "index must not be null");
        Objects.requireNonNull(contents, "contents must not be null");
        Objects.requireNonNull(inPrefix, "inPrefix must not be null");
        Objects.requireNonNull(inSuffix, "inSuffix must not be null");
        Objects.requireNonNull(dateFormat, "dateFormat must not be null");
    }
}
