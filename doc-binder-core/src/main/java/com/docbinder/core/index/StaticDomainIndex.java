package com.docbinder.core.index;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Domain index whose content was computed ahead of time by the host toolchain.
 *
 * @param domainName domain, e.g. {@code py}
 * @param indexName index within the domain, e.g. {@code modindex}
 * @param localName displayed title
 * @param collapse collapse hint
 * @param groups precomputed groups
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StaticDomainIndex(
    @JsonProperty("domainName") String domainName,
    @JsonProperty("indexName") String indexName,
    @JsonProperty("localName") String localName,
    @JsonProperty("collapse") boolean collapse,
    @JsonProperty("groups") List<DomainIndexContent.Group> groups
) implements DomainIndex {

    public StaticDomainIndex {
        Objects.requireNonNull(domainName, "domainName must not be null");
        Objects.requireNonNull(indexName, "indexName must not be null");
        if (localName == null) {
            localName = domainName + "-" + indexName;
        }
        groups = groups == null ? List.of() : List.copyOf(groups);
    }

    @Override
    public DomainIndexContent generate() {
        return new DomainIndexContent(groups, collapse);
    }
}
