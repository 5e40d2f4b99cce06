package com.docbinder.core.cover;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Values available to a cover page template.
 *
 * @param title document title
 * @param subtitle subtitle line, usually {@code "<prefix> <version>"}
 * @param authors author lines
 * @param date formatted date
 */
public record CoverData(String title, String subtitle, List<String> authors, String date) {

    /** Separator of the author lines in an author string. */
    public static final String AUTHOR_SEPARATOR = "\\";

    public CoverData {
        title = title == null ? "" : title;
        subtitle = subtitle == null ? "" : subtitle;
        authors = authors == null ? List.of() : List.copyOf(authors);
        date = Objects.requireNonNull(date, "date must not be null");
    }

    /**
     * Builds cover data from descriptor values.
     *
     * @param title document title
     * @param subtitlePrefix word preceding the version, e.g. {@code version}
     * @param version project version, may be blank
     * @param author author string, lines separated by a backslash
     * @param date formatted date
     * @return cover data
     */
    public static CoverData of(String title, String subtitlePrefix, String version, String author, String date) {
        String subtitle = ((subtitlePrefix == null ? "" : subtitlePrefix) + " " + (version == null ? "" : version)).strip();
        List<String> authors = author == null || author.isBlank()
            ? List.of()
            : Arrays.stream(author.split("\\\\")).map(String::strip).filter(line -> !line.isEmpty()).toList();
        return new CoverData(title, subtitle, authors, date);
    }
}
