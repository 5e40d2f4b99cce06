package com.docbinder.core.index;

import com.docbinder.core.i18n.LabelResolver;
import com.docbinder.core.index.GeneralIndexGroup.IndexTerm;
import com.docbinder.core.index.GeneralIndexGroup.SubEntry;
import com.docbinder.core.tree.Node;
import com.docbinder.core.tree.NodeKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class IndexBuilderTest {

    private final IndexBuilder builder = new IndexBuilder(LabelResolver.forLocale("en"));

    @Test
    void buildGeneralIndex_onlyEmptyGroups_returnsEmpty() {
        assertThat(builder.buildGeneralIndex(List.of(new GeneralIndexGroup("A", List.of())))).isEmpty();
        assertThat(builder.buildGeneralIndex(List.of())).isEmpty();
    }

    @Test
    void buildGeneralIndex_groups_renderHeadingsInOrderAndSkipEmptyOnes() {
        // Given
        List<GeneralIndexGroup> groups = List.of(
            new GeneralIndexGroup("A", List.of(new IndexTerm("apple", List.of("#apple"), List.of()))),
            new GeneralIndexGroup("B", List.of()),
            new GeneralIndexGroup("C", List.of(new IndexTerm("cherry", List.of("#cherry"), List.of()))));

        // When
        Node section = builder.buildGeneralIndex(groups).orElseThrow();

        // Then
        assertThat(section.ids()).containsExactly(IndexBuilder.GENINDEX);
        assertThat(section.firstChild().orElseThrow().astext()).isEqualTo("Index");
        assertThat(section.traverse(NodeKind.PARAGRAPH).stream()
            .filter(paragraph -> paragraph.hasClass(IndexBuilder.HEADING_CLASS))
            .map(Node::astext))
            .containsExactly("A", "C");
    }

    @Test
    void buildGeneralIndex_extraOccurrences_numberedMiniLinks() {
        // Given
        IndexTerm term = new IndexTerm("widget", List.of("#first", "pdf:api.pdf#second", "#third"),
            List.of(new SubEntry("see gadget", List.of())));

        // When
        Node section = builder.buildGeneralIndex(List.of(new GeneralIndexGroup("W", List.of(term)))).orElseThrow();

        // Then
        List<Node> references = section.traverse(NodeKind.REFERENCE);
        assertThat(references).extracting(Node::astext).containsExactly("widget", "[1]", "[2]");
        assertThat(references.get(0).getString(Node.REFID)).isEqualTo("first");
        assertThat(references.get(1).getString(Node.REFURI)).isEqualTo("pdf:api.pdf#second");
        assertThat(section.astext()).contains("see gadget");
    }

    @Test
    void buildDomainIndex_rows_showExtraQualifierAndDescription() {
        // Given
        IndexEntry row = new IndexEntry("widgets.core", "0", "api", "module-widgets.core", "Unix", "Deprecated",
            "Core widget classes");
        List<DomainIndexContent.Group> groups = List.of(new DomainIndexContent.Group("w", List.of(row)));

        // When
        Node section = builder.buildDomainIndex("py-modindex", "Python Module Index", groups).orElseThrow();

        // Then
        assertThat(section.ids()).containsExactly("py-modindex");
        assertThat(section.astext()).contains("widgets.core (Unix) [Deprecated]", "Core widget classes");
        assertThat(section.traverse(NodeKind.REFERENCE).get(0).getString(Node.REFID)).isEqualTo("module-widgets.core");
    }

    @Test
    void buildDomainIndex_emptyGroups_returnsEmpty() {
        assertThat(builder.buildDomainIndex("py-modindex", "Modules",
            List.of(new DomainIndexContent.Group("a", List.of())))).isEmpty();
    }
}
