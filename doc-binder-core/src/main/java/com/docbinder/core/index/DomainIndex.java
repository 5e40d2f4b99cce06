package com.docbinder.core.index;

/**
 * Provider of a specialized secondary index, such as a module index.
 *
 * <p>Identified by {@code <domainName>-<indexName>} (e.g. {@code py-modindex}), which is
 * the name used to select domain indices in configuration.
 */
public interface DomainIndex {

    String domainName();

    String indexName();

    /**
     * Returns the human readable title of the index.
     *
     * @return title such as "Python Module Index"
     */
    String localName();

    /**
     * Generates the grouped content of the index.
     *
     * @return content, possibly empty
     */
    DomainIndexContent generate();

    default String fullName() {
        return domainName() + "-" + indexName();
    }
}
