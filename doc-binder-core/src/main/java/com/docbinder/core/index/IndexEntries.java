package com.docbinder.core.index;

import com.docbinder.core.index.GeneralIndexGroup.IndexTerm;
import com.docbinder.core.index.GeneralIndexGroup.SubEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Adapter over an {@link IndexEntryTable} that groups and sorts its entries into the
 * letter-grouped shape rendered by {@link IndexBuilder#buildGeneralIndex(List)}.
 *
 * <p>Entry kinds are expanded the usual way:
 * <ul>
 *   <li>{@code single}: {@code "term"} or {@code "term; sub"}</li>
 *   <li>{@code pair}: {@code "a; b"} is listed under both {@code a} (sub {@code b}) and
 *       {@code b} (sub {@code a})</li>
 *   <li>{@code triple}: {@code "a; b; c"} is listed under each of its three parts</li>
 *   <li>{@code see} / {@code seealso}: {@code "term; other"} adds an unlinked
 *       "see other" / "see also other" sub-entry</li>
 * </ul>
 * Terms are sorted case-insensitively; terms not starting with a letter are grouped under
 * {@code Symbols}, which comes first.
 */
public class IndexEntries {

    private static final Logger log = LoggerFactory.getLogger(IndexEntries.class);

    public static final String SYMBOLS = "Symbols";

    private final IndexEntryTable table;

    public IndexEntries(IndexEntryTable table) {
        this.table = Objects.requireNonNull(table, "table must not be null");
    }

    /**
     * Returns the underlying table.
     *
     * @return shared entry table
     */
    public IndexEntryTable indexEntries() {
        return table;
    }

    /**
     * Groups the current contents of the table into a general index.
     *
     * @param documentUri maps a DocumentID to the URI of its output document ({@code ""} when
     *                    local); empty when the document cannot be linked, in which case its
     *                    entries are skipped
     * @return letter groups in display order
     */
    public List<GeneralIndexGroup> createIndex(Function<String, Optional<String>> documentUri) {
        Map<String, TermAccumulator> terms = new LinkedHashMap<>();

        for (Map.Entry<String, List<IndexEntry>> bucket : table.snapshot().entrySet()) {
            String docname = bucket.getKey();
            Optional<String> base = documentUri.apply(docname);
            if (base.isEmpty()) {
                log.debug("Skipping index entries of {}: no URI", docname);
                continue;
            }
            for (IndexEntry entry : bucket.getValue()) {
                String uri = entry.anchor().isEmpty() ? base.get() : base.get() + "#" + entry.anchor();
                addEntry(terms, entry, uri);
            }
        }

        Map<String, List<IndexTerm>> groups = new TreeMap<>(GROUP_ORDER);
        terms.values().stream()
            .sorted(Comparator.comparing(TermAccumulator::sortKey))
            .forEach(accumulator -> groups
                .computeIfAbsent(groupKey(accumulator.term), key -> new ArrayList<>())
                .add(accumulator.toTerm()));

        List<GeneralIndexGroup> result = new ArrayList<>();
        groups.forEach((key, groupTerms) -> result.add(new GeneralIndexGroup(key, groupTerms)));
        return result;
    }

    private void addEntry(Map<String, TermAccumulator> terms, IndexEntry entry, String uri) {
        List<String> parts = splitParts(entry.term());
        switch (entry.groupKind()) {
            case "single" -> {
                if (parts.size() > 1) {
                    term(terms, parts.get(0)).addSub(parts.get(1), uri);
                } else {
                    term(terms, parts.get(0)).links.add(uri);
                }
            }
            case "pair" -> {
                if (!hasParts(entry, parts, 2)) {
                    return;
                }
                term(terms, parts.get(0)).addSub(parts.get(1), uri);
                term(terms, parts.get(1)).addSub(parts.get(0), uri);
            }
            case "triple" -> {
                if (!hasParts(entry, parts, 3)) {
                    return;
                }
                term(terms, parts.get(0)).addSub(parts.get(1) + " " + parts.get(2), uri);
                term(terms, parts.get(1)).addSub(parts.get(2) + ", " + parts.get(0), uri);
                term(terms, parts.get(2)).addSub(parts.get(0) + " " + parts.get(1), uri);
            }
            case "see" -> {
                if (!hasParts(entry, parts, 2)) {
                    return;
                }
                term(terms, parts.get(0)).addSub("see " + parts.get(1), null);
            }
            case "seealso" -> {
                if (!hasParts(entry, parts, 2)) {
                    return;
                }
                term(terms, parts.get(0)).addSub("see also " + parts.get(1), null);
            }
            default -> log.warn("Ignoring index entry '{}' of unknown kind '{}'", entry.term(), entry.groupKind());
        }
    }

    private static boolean hasParts(IndexEntry entry, List<String> parts, int expected) {
        if (parts.size() < expected) {
            log.warn("Ignoring index entry '{}': kind {} needs {} parts", entry.term(), entry.groupKind(), expected);
            return false;
        }
        return true;
    }

    private static List<String> splitParts(String term) {
        List<String> parts = new ArrayList<>();
        for (String part : term.split(";")) {
            if (!part.isBlank()) {
                parts.add(part.strip());
            }
        }
        if (parts.isEmpty()) {
            parts.add(term.strip());
        }
        return parts;
    }

    private static TermAccumulator term(Map<String, TermAccumulator> terms, String term) {
        return terms.computeIfAbsent(term, TermAccumulator::new);
    }

    private static String groupKey(String term) {
        if (!term.isEmpty() && Character.isLetter(term.codePointAt(0))) {
            return new String(Character.toChars(term.codePointAt(0))).toUpperCase(Locale.ROOT);
        }
        return SYMBOLS;
    }

    private static final Comparator<String> GROUP_ORDER = (a, b) -> {
        if (a.equals(b)) {
            return 0;
        }
        if (SYMBOLS.equals(a)) {
            return -1;
        }
        if (SYMBOLS.equals(b)) {
            return 1;
        }
        return a.compareTo(b);
    };

    private static final class TermAccumulator {
        private final String term;
        private final List<String> links = new ArrayList<>();
        private final Map<String, List<String>> subEntries = new LinkedHashMap<>();

        private TermAccumulator(String term) {
            this.term = term;
        }

        private void addSub(String sub, String uri) {
            List<String> subLinks = subEntries.computeIfAbsent(sub, key -> new ArrayList<>());
            if (uri != null) {
                subLinks.add(uri);
            }
        }

        private String sortKey() {
            return term.toLowerCase(Locale.ROOT) + "\u0000" + term;
        }

        private IndexTerm toTerm() {
            List<SubEntry> subs = new ArrayList<>();
            subEntries.entrySet().stream()
                .sorted(Map.Entry.comparingByKey(String.CASE_INSENSITIVE_ORDER))
                .forEach(entry -> subs.add(new SubEntry(entry.getKey(), entry.getValue())));
            return new IndexTerm(term, links, subs);
        }
    }
}
