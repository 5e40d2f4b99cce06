package com.docbinder.core.index;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One index entry as recorded by the host toolchain.
 *
 * <p>For general index entries {@code groupKind} is one of {@code single}, {@code pair},
 * {@code triple}, {@code see} or {@code seealso}, and the term uses {@code ;} to separate
 * its parts ({@code "parrot; dead"}). For domain index rows it carries the row subtype.
 *
 * @param term entry text
 * @param groupKind entry kind or row subtype
 * @param page DocumentID of the document defining the entry
 * @param anchor target id inside that document
 * @param extra extra text, rendered in parentheses
 * @param qualifier qualifier, rendered in brackets
 * @param description free text description
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IndexEntry(
    @JsonProperty("term") String term,
    @JsonProperty("groupKind") String groupKind,
    @JsonProperty("page") String page,
    @JsonProperty("anchor") String anchor,
    @JsonProperty("extra") String extra,
    @JsonProperty("qualifier") String qualifier,
    @JsonProperty("description") String description
) {
    /**
     * Compact constructor with validation.
     */
    public IndexEntry {
        Objects.requireNonNull(term, "term must not be null");
        if (groupKind == null) {
            groupKind = "single";
        }
        if (page == null) {
            page = "";
        }
        if (anchor == null) {
            anchor = "";
        }
        if (extra == null) {
            extra = "";
        }
        if (qualifier == null) {
            qualifier = "";
        }
        if (description == null) {
            description = "";
        }
    }

    /**
     * Creates a {@code single} general index entry.
     *
     * @param term entry text
     * @param page defining document
     * @param anchor target id
     * @return index entry
     */
    public static IndexEntry single(String term, String page, String anchor) {
        return new IndexEntry(term, "single", page, anchor, null, null, null);
    }
}
