package com.docbinder.core.index;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Generated content of a domain index.
 *
 * @param groups letter groups in display order
 * @param collapse hint that sub-entries may be collapsed by the renderer
 */
public record DomainIndexContent(List<Group> groups, boolean collapse) {

    public DomainIndexContent {
        groups = groups == null ? List.of() : List.copyOf(groups);
    }

    public boolean isEmpty() {
        return groups.stream().allMatch(group -> group.entries().isEmpty());
    }

    /**
     * Rows of a domain index sharing a heading letter.
     *
     * @param letter group heading
     * @param entries rows in display order
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Group(
        @JsonProperty("letter") String letter,
        @JsonProperty("entries") List<IndexEntry> entries
    ) {
        public Group {
            Objects.requireNonNull(letter, "letter must not be null");
            entries = entries == null ? List.of() : List.copyOf(entries);
        }
    }
}
