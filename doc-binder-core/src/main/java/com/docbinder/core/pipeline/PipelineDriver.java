package com.docbinder.core.pipeline;

import com.docbinder.core.assembly.AssembledTree;
import com.docbinder.core.assembly.TreeAssembler;
import com.docbinder.core.config.BinderConfig;
import com.docbinder.core.config.DocumentSettings;
import com.docbinder.core.config.OutputDocument;
import com.docbinder.core.cover.CoverData;
import com.docbinder.core.cover.CoverPageRenderer;
import com.docbinder.core.i18n.LabelResolver;
import com.docbinder.core.i18n.Labels;
import com.docbinder.core.index.DomainIndex;
import com.docbinder.core.index.DomainIndexContent;
import com.docbinder.core.index.GeneralIndexGroup;
import com.docbinder.core.index.IndexBuilder;
import com.docbinder.core.index.IndexEntries;
import com.docbinder.core.index.IndexEntry;
import com.docbinder.core.index.IndexScope;
import com.docbinder.core.renderer.PageRenderer;
import com.docbinder.core.renderer.RenderOptions;
import com.docbinder.core.report.BuildWarnings;
import com.docbinder.core.source.NavigationGraph;
import com.docbinder.core.source.SimpleMarkupParser;
import com.docbinder.core.source.SourceTreeException;
import com.docbinder.core.source.SourceTreeProvider;
import com.docbinder.core.source.UnknownDocumentException;
import com.docbinder.core.toc.ContentsBuilder;
import com.docbinder.core.translate.TranslationContext;
import com.docbinder.core.translate.TranslationPass;
import com.docbinder.core.translate.highlight.Highlighter;
import com.docbinder.core.translate.highlight.LanguageDetector;
import com.docbinder.core.translate.highlight.PlainHighlighter;
import com.docbinder.core.tree.Node;
import com.docbinder.core.tree.NodeKind;
import com.docbinder.core.tree.Nodes;
import com.docbinder.core.xref.NoUriException;
import com.docbinder.core.xref.ReferenceResolver;
import com.docbinder.core.xref.TargetUriResolver;
import com.docbinder.core.xref.TitleIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;

/**
 * Builds every output document of a run.
 *
 * <p><b>Per output document:</b>
 * <ol>
 *   <li>Assemble the composite tree from the root document ({@link TreeAssembler}).</li>
 *   <li>Append the general index, the selected domain indices and the appendices, each
 *       preceded by a page-break directive.</li>
 *   <li>Resolve pending references ({@link ReferenceResolver}).</li>
 *   <li>Run the {@link TranslationPass}.</li>
 *   <li>Prepend the contents topic, framed by page-counter directives, and the cover page.</li>
 *   <li>Hand the tree to the {@link PageRenderer}.</li>
 * </ol>
 *
 * <p>Documents are isolated: any failure while building one is logged, reported as a
 * failed {@link DocumentBuildResult}, and the run continues with the next document.
 * With {@code parallelBuild} the documents are built on a thread pool; the shared index
 * table is then scoped through private copies ({@link IndexScope#forBuildMode(boolean)}).
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * BinderConfig config = ConfigLoader.load(sourceDir.resolve("docbinder.yaml"));
 * PipelineDriver driver = new PipelineDriver(config, BuildEnvironment.load(sourceDir, outDir), new JsonTreeRenderer());
 * BuildReport report = driver.buildAll();
 * }</pre>
 */
public class PipelineDriver {

    private static final Logger log = LoggerFactory.getLogger(PipelineDriver.class);

    /** Cover date used in invariant mode. */
    public static final LocalDate INVARIANT_DATE = LocalDate.of(2000, 1, 1);

    static final String TWO_COLUMN_BREAK = "OddPageBreak twoColumn";
    static final String PY_MODINDEX = "py-modindex";

    private final BinderConfig config;
    private final BuildEnvironment environment;
    private final PageRenderer renderer;
    private final Highlighter highlighter;
    private final Clock clock;
    private final IndexScope indexScope;
    private final LanguageDetector languageDetector = new LanguageDetector();
    private final BuildWarnings warnings = new BuildWarnings();

    public PipelineDriver(BinderConfig config, BuildEnvironment environment, PageRenderer renderer,
                          Highlighter highlighter, Clock clock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
        this.highlighter = Objects.requireNonNull(highlighter, "highlighter must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.indexScope = IndexScope.forBuildMode(config.parallelBuild());
    }

    public PipelineDriver(BinderConfig config, BuildEnvironment environment, PageRenderer renderer) {
        this(config, environment, renderer, new PlainHighlighter(), Clock.systemDefaultZone());
    }

    public BuildWarnings warnings() {
        return warnings;
    }

    // ==================== Run level ====================

    /**
     * Returns the output documents to build: the configured ones whose root is known.
     *
     * @return buildable documents, in configuration order
     */
    public List<OutputDocument> documentData() {
        SourceTreeProvider provider = environment.provider();
        List<OutputDocument> documents = new ArrayList<>();
        for (OutputDocument document : config.effectiveDocuments()) {
            if (!provider.isKnown(document.docname())) {
                warnings.warn(log, "\"documents\" config value references unknown document {}", document.docname());
                continue;
            }
            documents.add(document);
        }
        if (documents.isEmpty()) {
            log.warn("No output documents to write");
        }
        return documents;
    }

    /**
     * Builds the title index of the given output documents.
     *
     * @param documents output documents
     * @return prefix/title pairs in document order
     */
    public TitleIndex titleIndex(List<OutputDocument> documents) {
        List<TitleIndex.Entry> entries = new ArrayList<>();
        for (OutputDocument document : documents) {
            entries.add(new TitleIndex.Entry(TitleIndex.prefixOf(document.docname()), document.title()));
        }
        return new TitleIndex(entries);
    }

    /**
     * Creates the URI resolver of a run.
     *
     * @param documents output documents
     * @return resolver addressing those documents
     */
    public TargetUriResolver targetUriResolver(List<OutputDocument> documents) {
        Map<String, String> targets = new LinkedHashMap<>();
        for (OutputDocument document : documents) {
            targets.putIfAbsent(document.docname(), document.targetName());
        }
        SourceTreeProvider provider = environment.provider();
        NavigationGraph graph = provider.navigationGraph();
        for (String docname : provider.unreadableDocuments()) {
            warnings.warn(log, "{}: source tree could not be read, document skipped", docname);
        }
        return new TargetUriResolver(targets, graph, renderer.linkScheme(), renderer.linkExtension());
    }

    /**
     * Builds and renders every output document.
     *
     * @return per-document results and all warnings
     */
    public BuildReport buildAll() {
        List<OutputDocument> documents = documentData();
        TitleIndex titles;
        TargetUriResolver uris;
        try {
            titles = titleIndex(documents);
            uris = targetUriResolver(documents);
        } catch (RuntimeException e) {
            log.error("Failed to prepare build: {}", e.getMessage(), e);
            List<DocumentBuildResult> failed = documents.stream()
                .map(document -> DocumentBuildResult.failed(document.targetName(), document.docname(), e.getMessage()))
                .toList();
            return new BuildReport(failed, warnings.messages());
        }

        List<DocumentBuildResult> results = config.parallelBuild() && documents.size() > 1
            ? buildInParallel(documents, uris, titles)
            : documents.stream().map(document -> buildAndRender(document, uris, titles)).toList();

        BuildReport report = new BuildReport(results, warnings.messages());
        log.info("Built {} of {} documents with {} warnings",
            report.successCount(), results.size(), report.warnings().size());
        return report;
    }

    private List<DocumentBuildResult> buildInParallel(List<OutputDocument> documents, TargetUriResolver uris,
                                                      TitleIndex titles) {
        int poolSize = Math.min(documents.size(), Runtime.getRuntime().availableProcessors());
        ExecutorService executor = Executors.newFixedThreadPool(poolSize);
        try {
            List<Future<DocumentBuildResult>> futures = new ArrayList<>();
            for (OutputDocument document : documents) {
                futures.add(executor.submit(() -> buildAndRender(document, uris, titles)));
            }
            List<DocumentBuildResult> results = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                OutputDocument document = documents.get(i);
                try {
                    results.add(futures.get(i).get());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    results.add(DocumentBuildResult.failed(document.targetName(), document.docname(), "interrupted"));
                } catch (ExecutionException e) {
                    results.add(DocumentBuildResult.failed(document.targetName(), document.docname(),
                        String.valueOf(e.getCause())));
                }
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Builds and renders one output document; never throws.
     *
     * @param document descriptor
     * @param uris URI resolver of the run
     * @param titles title index of the run
     * @return build result
     */
    public DocumentBuildResult buildAndRender(OutputDocument document, TargetUriResolver uris, TitleIndex titles) {
        log.info("Processing {}...", document.targetName());
        try {
            DocumentSettings settings = DocumentSettings.resolve(config, document);
            Node tree = buildDocument(settings, uris, titles);
            Path output = environment.outputDirectory().resolve(document.targetName() + "." + renderer.fileExtension());
            log.info("Writing {}...", document.targetName());
            renderer.render(tree, output, settings.render());
            return DocumentBuildResult.succeeded(document.targetName(), document.docname(), output);
        } catch (RuntimeException e) {
            log.error("Failed to build {}: {}", document.targetName(), e.getMessage(), e);
            return DocumentBuildResult.failed(document.targetName(), document.docname(), e.getMessage());
        }
    }

    // ==================== Document level ====================

    /**
     * Builds the final tree of one output document, ready for rendering.
     *
     * @param settings effective settings of the document
     * @param uris URI resolver of the run
     * @param titles title index of the run
     * @return final composite tree
     */
    public Node buildDocument(DocumentSettings settings, TargetUriResolver uris, TitleIndex titles) {
        OutputDocument document = settings.document();
        RenderOptions render = settings.render();
        Labels labels = LabelResolver.forLocale(settings.language());

        Node tree = assembleDocument(settings, uris, titles).tree();

        TranslationPass translation = TranslationPass.standard(languageDetector, highlighter, warnings);
        translation.translate(tree, new TranslationContext(config.highlightLanguage(), config.tabWidth()));

        CoverData cover = coverData(tree, settings, labels);
        if (render.useToc()) {
            Node contents = new ContentsBuilder(render.tocDepth(), config.tocBacklinks())
                .buildContentsTopic(tree, labels.contents());
            tree.insert(0, Nodes.rendererDirective("SetPageCounter 1 arabic"));
            tree.insert(0, Nodes.rendererDirective("OddPageBreak " + render.pageTemplate()));
            tree.insert(0, contents);
            tree.insert(0, Nodes.rendererDirective("SetPageCounter 1 lowerroman"));
        }

        if (render.useCoverpage()) {
            tree.insert(0, coverPageRenderer().render(config.coverTemplate(), cover));
        }

        tree.set("title", document.title());
        tree.set("author", document.author());
        return tree;
    }

    /**
     * Assembles one output document and resolves its references, without translating it.
     *
     * @param settings effective settings of the document
     * @param uris URI resolver of the run
     * @param titles title index of the run
     * @return resolved composite tree and the documents it consumed
     */
    public AssembledTree assembleDocument(DocumentSettings settings, TargetUriResolver uris, TitleIndex titles) {
        String docname = settings.document().docname();
        Labels labels = LabelResolver.forLocale(settings.language());
        IndexBuilder indexBuilder = new IndexBuilder(labels);

        AssembledTree assembled = new TreeAssembler(environment.provider(), warnings).assemble(docname);
        Node tree = assembled.tree();
        Set<String> consumed = assembled.consumedDocuments();

        if (settings.useIndex()) {
            List<GeneralIndexGroup> groups = generalIndex(docname, consumed, uris);
            indexBuilder.buildGeneralIndex(groups).ifPresent(index -> {
                tree.append(Nodes.rendererDirective(TWO_COLUMN_BREAK));
                tree.append(index);
            });
        }

        appendDomainIndices(tree, indexBuilder);
        appendAppendices(tree, docname, settings);

        new ReferenceResolver(uris, labels, settings.useIndex(), warnings)
            .resolveReferences(tree, docname, consumed, titles);
        return assembled;
    }

    private List<GeneralIndexGroup> generalIndex(String docname, Set<String> consumed, TargetUriResolver uris) {
        IndexEntries shared = new IndexEntries(environment.indexEntries());
        Map<String, List<IndexEntry>> view = environment.indexEntries().scopedView(docname, consumed);
        Function<String, Optional<String>> documentUri = entryDoc -> {
            try {
                return Optional.of(uris.targetUri(entryDoc, null, consumed));
            } catch (NoUriException e) {
                log.debug("Skipping index entries of {}: {}", entryDoc, e.getMessage());
                return Optional.empty();
            }
        };
        return indexScope.withEntries(shared, view, entries -> entries.createIndex(documentUri));
    }

    private void appendDomainIndices(Node tree, IndexBuilder indexBuilder) {
        boolean first = true;
        for (DomainIndex domainIndex : environment.domainIndices()) {
            String name = domainIndex.fullName();
            if (!config.domainIndices().includes(name)) {
                continue;
            }
            if (PY_MODINDEX.equals(name) && !config.useModindex()) {
                continue;
            }
            DomainIndexContent content = domainIndex.generate();
            if (content.isEmpty()) {
                continue;
            }
            Optional<Node> section = indexBuilder.buildDomainIndex(name, domainIndex.localName(), content.groups());
            if (section.isEmpty()) {
                continue;
            }
            log.info("Adding {}", name);
            tree.append(Nodes.rendererDirective(TWO_COLUMN_BREAK));
            if (first) {
                tree.append(Nodes.target(IndexBuilder.MODINDEX));
                first = false;
            }
            tree.append(section.get());
        }
    }

    private void appendAppendices(Node tree, String docname, DocumentSettings settings) {
        if (settings.appendices().isEmpty()) {
            return;
        }
        tree.append(Nodes.rendererDirective("OddPageBreak " + settings.render().pageTemplate()));
        log.info("Adding appendices...");
        for (String appendixName : settings.appendices()) {
            Node appendix;
            try {
                appendix = environment.provider().getTree(appendixName).deepCopy();
            } catch (UnknownDocumentException e) {
                warnings.warn(log, "{}: appendix references nonexisting file '{}'", docname, appendixName);
                continue;
            } catch (SourceTreeException e) {
                warnings.warn(log, "{}: appendix '{}' could not be loaded: {}", docname, appendixName, e.getMessage());
                continue;
            }
            appendix.set(Node.DOCNAME, appendixName);
            tree.append(appendix);
        }
    }

    // ==================== Cover page ====================

    private CoverPageRenderer coverPageRenderer() {
        Path sourceDirectory = environment.sourceDirectory();
        List<Path> searchPath = new ArrayList<>();
        searchPath.add(sourceDirectory);
        searchPath.add(Path.of(System.getProperty("user.home"), ".docbinder"));
        for (String templatesPath : config.templatesPath()) {
            searchPath.add(sourceDirectory.resolve(templatesPath));
        }
        return new CoverPageRenderer(searchPath, new SimpleMarkupParser(), warnings);
    }

    CoverData coverData(Node tree, DocumentSettings settings, Labels labels) {
        OutputDocument document = settings.document();
        String title = document.title().isBlank()
            ? tree.traverse(NodeKind.TITLE).stream().findFirst().map(Node::astext).orElse("")
            : document.title();
        return CoverData.of(title, config.subtitlePrefix(), config.project().version(), document.author(),
            coverDate(settings, labels));
    }

    String coverDate(DocumentSettings settings, Labels labels) {
        if (!config.today().isBlank()) {
            return config.today();
        }
        String pattern = config.todayFormat().isBlank() ? labels.dateFormat() : config.todayFormat();
        LocalDate date = settings.render().invariant() ? INVARIANT_DATE : LocalDate.now(clock);
        return date.format(DateTimeFormatter.ofPattern(pattern, localeOf(settings.language())));
    }

    private static Locale localeOf(String language) {
        return Locale.forLanguageTag(language.replace('_', '-'));
    }
}
