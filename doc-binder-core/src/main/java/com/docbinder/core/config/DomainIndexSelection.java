package com.docbinder.core.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;
import java.util.List;

/**
 * Which domain indices an output document carries: all of them, none, or those named.
 *
 * <p>In YAML this is either a boolean or a list of {@code <domain>-<index>} names:
 * <pre>{@code
 * domainIndices: true
 * domainIndices: [py-modindex]
 * }</pre>
 *
 * @param all whether every index is selected
 * @param names selected index names when {@code all} is false
 */
public record DomainIndexSelection(boolean all, List<String> names) {

    public DomainIndexSelection {
        names = names == null ? List.of() : List.copyOf(names);
    }

    public static DomainIndexSelection allIndices() {
        return new DomainIndexSelection(true, List.of());
    }

    public static DomainIndexSelection none() {
        return new DomainIndexSelection(false, List.of());
    }

    /**
     * Parses the YAML form.
     *
     * @param value boolean, list of names, or null (all)
     * @return selection
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static DomainIndexSelection fromValue(Object value) {
        if (value == null) {
            return allIndices();
        }
        if (value instanceof Boolean enabled) {
            return enabled ? allIndices() : none();
        }
        if (value instanceof Collection<?> collection) {
            return new DomainIndexSelection(false, collection.stream().map(String::valueOf).toList());
        }
        if (value instanceof String text) {
            return fromValue(Boolean.parseBoolean(text.strip()));
        }
        throw new IllegalArgumentException("domainIndices must be a boolean or a list of names: " + value);
    }

    public boolean includes(String fullName) {
        return all || names.contains(fullName);
    }

    @JsonValue
    public Object toValue() {
        return all ? Boolean.TRUE : names.isEmpty() ? Boolean.FALSE : names;
    }
}
