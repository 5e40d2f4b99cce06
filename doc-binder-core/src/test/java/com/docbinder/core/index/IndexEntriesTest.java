package com.docbinder.core.index;

import com.docbinder.core.index.GeneralIndexGroup.IndexTerm;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class IndexEntriesTest {

    @Test
    void createIndex_mixedTerms_groupsSymbolsFirstThenLetters() {
        // Given
        IndexEntryTable table = new IndexEntryTable(Map.of("doc", List.of(
            IndexEntry.single("zebra", "doc", "z"),
            IndexEntry.single("_private", "doc", "p"),
            IndexEntry.single("Apple", "doc", "a"),
            IndexEntry.single("avocado", "doc", "v"))));

        // When
        List<GeneralIndexGroup> groups = new IndexEntries(table).createIndex(docname -> Optional.of(""));

        // Then
        assertThat(groups).extracting(GeneralIndexGroup::key).containsExactly(IndexEntries.SYMBOLS, "A", "Z");
        assertThat(groups.get(1).terms()).extracting(IndexTerm::term).containsExactly("Apple", "avocado");
        assertThat(groups.get(1).terms().get(0).links()).containsExactly("#a");
    }

    @Test
    void createIndex_pairEntry_listedUnderBothParts() {
        // Given
        IndexEntryTable table = new IndexEntryTable(Map.of("doc", List.of(
            new IndexEntry("parrot; dead", "pair", "doc", "sketch", null, null, null))));

        // When
        List<GeneralIndexGroup> groups = new IndexEntries(table).createIndex(docname -> Optional.of("pdf:m.pdf"));

        // Then
        assertThat(groups).extracting(GeneralIndexGroup::key).containsExactly("D", "P");
        IndexTerm dead = groups.get(0).terms().get(0);
        assertThat(dead.term()).isEqualTo("dead");
        assertThat(dead.subEntries()).singleElement().satisfies(sub -> {
            assertThat(sub.term()).isEqualTo("parrot");
            assertThat(sub.links()).containsExactly("pdf:m.pdf#sketch");
        });
    }

    @Test
    void createIndex_seeAlso_addsUnlinkedSubEntry() {
        // Given
        IndexEntryTable table = new IndexEntryTable(Map.of("doc", List.of(
            new IndexEntry("car; automobile", "seealso", "doc", "cars", null, null, null))));

        // When
        List<GeneralIndexGroup> groups = new IndexEntries(table).createIndex(docname -> Optional.of(""));

        // Then
        IndexTerm car = groups.get(0).terms().get(0);
        assertThat(car.links()).isEmpty();
        assertThat(car.subEntries()).singleElement().satisfies(sub -> {
            assertThat(sub.term()).isEqualTo("see also automobile");
            assertThat(sub.links()).isEmpty();
        });
    }

    @Test
    void createIndex_malformedOrUnknownEntries_areSkipped() {
        // Given
        IndexEntryTable table = new IndexEntryTable(Map.of("doc", List.of(
            new IndexEntry("lonely", "triple", "doc", "x", null, null, null),
            new IndexEntry("odd", "mystery", "doc", "y", null, null, null),
            IndexEntry.single("kept", "doc", "k"))));

        // When
        List<GeneralIndexGroup> groups = new IndexEntries(table).createIndex(docname -> Optional.of(""));

        // Then
        assertThat(groups).flatExtracting(GeneralIndexGroup::terms).extracting(IndexTerm::term).containsExactly("kept");
    }

    @Test
    void createIndex_documentWithoutUri_entriesSkipped() {
        // Given
        Map<String, List<IndexEntry>> buckets = new LinkedHashMap<>();
        buckets.put("local", List.of(IndexEntry.single("here", "local", "h")));
        buckets.put("elsewhere", List.of(IndexEntry.single("there", "elsewhere", "t")));
        IndexEntries entries = new IndexEntries(new IndexEntryTable(buckets));

        // When
        List<GeneralIndexGroup> groups = entries.createIndex(
            docname -> "local".equals(docname) ? Optional.of("") : Optional.empty());

        // Then
        assertThat(groups).flatExtracting(GeneralIndexGroup::terms).extracting(IndexTerm::term).containsExactly("here");
    }
}
