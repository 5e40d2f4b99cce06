package com.docbinder.core.pipeline;

import com.docbinder.core.config.OutputDocument;
import com.docbinder.core.source.SourceTreeProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Finds output documents whose rendered file is missing or older than one of the sources
 * it is built from: the root, every document reachable through its toctrees, and its
 * appendices.
 */
public class OutdatedDocumentDetector {

    private static final Logger log = LoggerFactory.getLogger(OutdatedDocumentDetector.class);

    private final SourceTreeProvider provider;

    public OutdatedDocumentDetector(SourceTreeProvider provider) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
    }

    /**
     * Lists the target names that need rebuilding.
     *
     * @param documents output documents with their appendices
     * @param outputDirectory directory of the rendered files
     * @param extension rendered file extension, without dot
     * @return outdated target names, in input order
     */
    public List<String> outdatedTargets(List<DocumentSources> documents, Path outputDirectory, String extension) {
        List<String> outdated = new ArrayList<>();
        for (DocumentSources sources : documents) {
            OutputDocument document = sources.document();
            Path output = outputDirectory.resolve(document.targetName() + "." + extension);
            if (isOutdated(sources, output)) {
                outdated.add(document.targetName());
            }
        }
        return outdated;
    }

    private boolean isOutdated(DocumentSources sources, Path output) {
        if (!Files.isRegularFile(output)) {
            log.debug("{} has not been written yet", output);
            return true;
        }
        Instant written;
        try {
            written = Files.getLastModifiedTime(output).toInstant();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read modification time: " + output, e);
        }

        Set<String> docnames = new LinkedHashSet<>(provider.navigationGraph().reachableFrom(sources.document().docname()));
        docnames.addAll(sources.appendices());
        for (String docname : docnames) {
            Optional<Instant> modified = provider.lastModified(docname);
            if (modified.isPresent() && modified.get().isAfter(written)) {
                log.debug("{} is newer than {}", docname, output);
                return true;
            }
        }
        return false;
    }

    /**
     * An output document with the appendices it is built with.
     *
     * @param document descriptor
     * @param appendices effective appendices
     */
    public record DocumentSources(OutputDocument document, List<String> appendices) {
        public DocumentSources {
            Objects.requireNonNull(document, "document must not be null");
            appendices = appendices == null ? List.of() : List.copyOf(appendices);
        }
    }
}
