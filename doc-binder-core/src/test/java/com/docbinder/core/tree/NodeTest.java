package com.docbinder.core.tree;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodeTest {

    @Test
    void append_movesChildFromPreviousParent() {
        // Given
        Node child = Node.text("x");
        Node first = Node.of(NodeKind.PARAGRAPH, child);
        Node second = Node.of(NodeKind.PARAGRAPH);

        // When
        second.append(child);

        // Then
        assertThat(first.children()).isEmpty();
        assertThat(child.parent()).isSameAs(second);
    }

    @Test
    void replaceSelf_splicesReplacementsInPlace() {
        // Given
        Node middle = Node.text("b");
        Node parent = Node.of(NodeKind.PARAGRAPH, Node.text("a"), middle, Node.text("d"));

        // When
        middle.replaceSelf(List.of(Node.text("b1"), Node.text("b2")));

        // Then
        assertThat(parent.astext()).isEqualTo("ab1b2d");
        assertThat(middle.parent()).isNull();
    }

    @Test
    void replaceSelf_rootNode_throws() {
        assertThatThrownBy(() -> Node.of(NodeKind.DOCUMENT).replaceSelf(List.of()))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void deepCopy_isIndependentOfOriginal() {
        // Given
        Node original = Node.of(NodeKind.SECTION, Nodes.title("T")).set(Node.IDS, List.of("t"));

        // When
        Node copy = original.deepCopy();
        copy.ids().add("extra");
        copy.firstChild().orElseThrow().takeChildren();

        // Then
        assertThat(original.ids()).containsExactly("t");
        assertThat(original.astext()).isEqualTo("T");
        assertThat(copy.parent()).isNull();
    }

    @Test
    void set_unsupportedValue_throws() {
        assertThatThrownBy(() -> Node.of(NodeKind.PARAGRAPH).set("when", new Object()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void getInt_parsesStringsAndFallsBack() {
        Node node = Node.of(NodeKind.HIGHLIGHT_LANG).set("a", "12").set("b", "x");

        assertThat(node.getInt("a", 0)).isEqualTo(12);
        assertThat(node.getInt("b", 7)).isEqualTo(7);
        assertThat(node.getInt("c", 5)).isEqualTo(5);
    }

    @Test
    void traverse_returnsPreOrderSnapshot() {
        // Given
        Node inner = Node.of(NodeKind.SECTION);
        Node outer = Node.of(NodeKind.SECTION, Nodes.paragraph("p"), inner);

        // When
        List<Node> sections = outer.traverse(NodeKind.SECTION);

        // Then
        assertThat(sections).containsExactly(outer, inner);
        assertThat(outer.nextNode(NodeKind.SECTION)).contains(inner);
    }

    @Test
    void setText_nonTextNode_throws() {
        assertThatThrownBy(() -> Node.of(NodeKind.PARAGRAPH).setText("x"))
            .isInstanceOf(IllegalStateException.class);
    }
}
