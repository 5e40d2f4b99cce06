package com.docbinder.core.toc;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Where section titles link back to once a table of contents exists.
 */
public enum BacklinkPolicy {
    /** Titles are left alone. */
    NONE,
    /** A title links to its own entry in the contents. */
    ENTRY,
    /** A title links to the top of the contents. */
    TOP;

    /**
     * Parses a policy name case-insensitively; {@code null}, blank and {@code false} mean
     * {@link #NONE}.
     *
     * @param value policy name
     * @return policy
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static BacklinkPolicy parse(String value) {
        if (value == null || value.isBlank() || "false".equalsIgnoreCase(value)) {
            return NONE;
        }
        return valueOf(value.strip().toUpperCase(Locale.ROOT));
    }
}
