package com.docbinder.core.index;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads index side data written next to the serialized trees.
 *
 * <ul>
 *   <li>{@code _index.json}: object mapping DocumentID to a list of {@link IndexEntry}</li>
 *   <li>{@code _domains.json}: list of {@link StaticDomainIndex}</li>
 * </ul>
 * Missing files mean "no data" and are not errors.
 */
public class JsonIndexDataLoader {

    private static final Logger log = LoggerFactory.getLogger(JsonIndexDataLoader.class);

    public static final String INDEX_FILE = "_index.json";
    public static final String DOMAINS_FILE = "_domains.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Loads the general index entries.
     *
     * @param sourceDir directory holding the serialized trees
     * @return entry table, empty if the file is absent
     * @throws IllegalStateException if the file exists but cannot be parsed
     */
    public IndexEntryTable loadEntries(Path sourceDir) {
        Path file = sourceDir.resolve(INDEX_FILE);
        if (!Files.isRegularFile(file)) {
            log.debug("No index entries file at {}", file);
            return new IndexEntryTable();
        }
        try {
            Map<String, List<IndexEntry>> entries = MAPPER.readValue(file.toFile(),
                new TypeReference<LinkedHashMap<String, List<IndexEntry>>>() { });
            log.info("Loaded index entries for {} documents from {}", entries.size(), file);
            return new IndexEntryTable(entries);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read index entries: " + file, e);
        }
    }

    /**
     * Loads the domain indices.
     *
     * @param sourceDir directory holding the serialized trees
     * @return domain indices, empty if the file is absent
     * @throws IllegalStateException if the file exists but cannot be parsed
     */
    public List<DomainIndex> loadDomainIndices(Path sourceDir) {
        Path file = sourceDir.resolve(DOMAINS_FILE);
        if (!Files.isRegularFile(file)) {
            log.debug("No domain indices file at {}", file);
            return List.of();
        }
        try {
            List<StaticDomainIndex> indices = MAPPER.readValue(file.toFile(),
                new TypeReference<List<StaticDomainIndex>>() { });
            log.info("Loaded {} domain indices from {}", indices.size(), file);
            return new ArrayList<>(indices);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read domain indices: " + file, e);
        }
    }
}
