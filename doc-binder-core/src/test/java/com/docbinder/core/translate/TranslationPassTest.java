package com.docbinder.core.translate;

import com.docbinder.core.report.BuildWarnings;
import com.docbinder.core.translate.highlight.LanguageDetector;
import com.docbinder.core.translate.highlight.PlainHighlighter;
import com.docbinder.core.tree.Node;
import com.docbinder.core.tree.NodeKind;
import com.docbinder.core.tree.Nodes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.docbinder.core.TestTrees.document;
import static com.docbinder.core.TestTrees.footnote;
import static com.docbinder.core.TestTrees.footnoteReference;
import static com.docbinder.core.TestTrees.literalBlock;
import static com.docbinder.core.TestTrees.section;
import static org.assertj.core.api.Assertions.assertThat;

class TranslationPassTest {

    private BuildWarnings warnings;
    private TranslationPass pass;

    @BeforeEach
    void setUp() {
        warnings = new BuildWarnings();
        pass = TranslationPass.standard(new LanguageDetector(), new PlainHighlighter(), warnings);
    }

    private static Node startOfFile(String docname, Node... children) {
        return Node.of(NodeKind.START_OF_FILE, children).set(Node.DOCNAME, docname);
    }

    @Test
    void translate_footnotesAcrossFiles_numberedInDocumentOrder() {
        // Given
        Node tree = document("index",
            startOfFile("one", footnote("a"), footnote("b")),
            startOfFile("two", footnote("a")));

        // When
        TranslationContext context = pass.translate(tree, "python");

        // Then
        List<Node> footnotes = tree.traverse(NodeKind.FOOTNOTE);
        assertThat(footnotes).extracting(footnote -> footnote.firstChild().orElseThrow().astext())
            .containsExactly("1", "2", "3");
        assertThat(footnotes).extracting(footnote -> footnote.firstId().orElseThrow())
            .containsExactly("one_a", "one_b", "two_a");
        assertThat(context.footnoteCounter()).isEqualTo(4);
    }

    @Test
    void translate_referenceBeforeFootnote_showsFootnoteNumber() {
        // Given
        Node reference = footnoteReference("r1", "n");
        Node tree = document("index", startOfFile("doc",
            Nodes.paragraph(reference),
            footnote("n", "r1")));

        // When
        pass.translate(tree, "python");

        // Then
        assertThat(reference.astext()).isEqualTo("1");
        assertThat(reference.getString(Node.REFID)).isEqualTo("doc_n");
        assertThat(reference.ids()).containsExactly("doc_r1");
    }

    @Test
    void translate_referenceAfterFootnote_showsFootnoteNumber() {
        // Given
        Node reference = footnoteReference("r1", "n");
        Node tree = document("index", startOfFile("doc", footnote("m"), footnote("n", "r1"), Nodes.paragraph(reference)));

        // When
        pass.translate(tree, "python");

        // Then
        assertThat(reference.astext()).isEqualTo("2");
    }

    @Test
    void translate_sameDocumentIncludedTwice_idsStayUnique() {
        // Given
        Node tree = document("index",
            startOfFile("shared", footnote("x")),
            startOfFile("shared", footnote("x")));

        // When
        pass.translate(tree, "python");

        // Then
        assertThat(tree.traverse(NodeKind.FOOTNOTE)).extracting(footnote -> footnote.firstId().orElseThrow())
            .containsExactly("shared_x", "shared-2_x");
    }

    @Test
    void translate_repeatedInclusionNextToSuffixedDocname_idsStayUnique() {
        // Given
        Node tree = document("index",
            startOfFile("intro", footnote("x")),
            startOfFile("intro", footnote("x")),
            startOfFile("intro-2", footnote("x")));

        // When
        pass.translate(tree, "python");

        // Then
        assertThat(tree.traverse(NodeKind.FOOTNOTE)).extracting(footnote -> footnote.firstId().orElseThrow())
            .containsExactly("intro_x", "intro-2_x", "intro-2-2_x");
    }

    @Test
    void translate_footnoteWithoutLabel_getsLabel() {
        // Given
        Node bare = Node.of(NodeKind.FOOTNOTE, Nodes.paragraph("note")).set(Node.IDS, List.of("f"));
        Node tree = document("index", bare);

        // When
        pass.translate(tree, "python");

        // Then
        assertThat(bare.firstChild().orElseThrow().is(NodeKind.LABEL)).isTrue();
        assertThat(bare.firstChild().orElseThrow().astext()).isEqualTo("1");
        assertThat(bare.firstId()).contains("index_f");
    }

    @Test
    void translate_literalBlock_becomesCodeBlockWithDetectedLanguage() {
        // Given
        Node tree = document("index", literalBlock(">>> print('hi')\nhi"));

        // When
        pass.translate(tree, "python");

        // Then
        Node block = tree.children().get(0);
        assertThat(block.hasClass("code")).isTrue();
        assertThat(block.getString("language")).isEqualTo("pycon");
        assertThat(block.getBoolean("linenos")).isFalse();
        assertThat(block.astext()).isEqualTo(">>> print('hi')\nhi\n");
    }

    @Test
    void translate_tabs_expandedToTabWidth() {
        // Given
        Node tree = document("index", literalBlock("if x:\n\treturn 1").set("language", "python"));

        // When
        pass.translate(tree, new TranslationContext("python", 4));

        // Then
        assertThat(tree.children().get(0).astext()).contains("\n    return 1");
    }

    @Test
    void translate_highlightLangDirective_appliesToFollowingBlocksAndIsRemoved() {
        // Given
        Node directive = Node.of(NodeKind.HIGHLIGHT_LANG).set("lang", "bash").set("linenothreshold", 1);
        Node tree = document("index", literalBlock("echo 1"), directive, literalBlock("echo 2\necho 3"));

        // When
        pass.translate(tree, "python");

        // Then
        assertThat(tree.traverse(NodeKind.HIGHLIGHT_LANG)).isEmpty();
        List<Node> blocks = tree.traverse(NodeKind.LITERAL_BLOCK);
        assertThat(blocks).extracting(block -> block.getString("language")).containsExactly("python", "bash");
        assertThat(blocks.get(1).getBoolean("linenos")).isTrue();
        assertThat(blocks.get(1).astext()).startsWith("1 echo 2");
    }

    @Test
    void translate_alreadyHighlightedBlock_isLeftAlone() {
        // Given
        Node block = Nodes.withClasses(literalBlock("x = 1"), "code");
        Node tree = document("index", block);

        // When
        pass.translate(tree, "python");

        // Then
        assertThat(tree.children()).containsExactly(block);
        assertThat(block.has("language")).isFalse();
    }

    @Test
    void translate_productionList_alignsNamesAndContinuations() {
        // Given
        Node list = Node.of(NodeKind.PRODUCTION_LIST,
            Node.of(NodeKind.PRODUCTION, Node.text("digit+")).set("tokenname", "number"),
            Node.of(NodeKind.PRODUCTION, Node.text("| \"-\" digit+")),
            Node.of(NodeKind.PRODUCTION, Node.text("\"a\"...\"z\"")).set("tokenname", "id"));
        Node tree = document("index", list);

        // When
        pass.translate(tree, "python");

        // Then
        Node block = tree.children().get(0);
        assertThat(block.is(NodeKind.LITERAL_BLOCK)).isTrue();
        assertThat(block.astext()).isEqualTo("""
            number ::= digit+
                       | "-" digit+
            id     ::= "a"..."z"
            """);
        assertThat(block.traverse(NodeKind.STRONG)).extracting(Node::astext).containsExactly("number", "id    ");
    }

    @Test
    void translate_versionModified_flattenedToParagraph() {
        // Given
        Node changed = Node.of(NodeKind.VERSION_MODIFIED, Node.text("New in 2.0: "), Nodes.emphasis("widgets"));
        Node tree = document("index", changed);

        // When
        pass.translate(tree, "python");

        // Then
        Node paragraph = tree.children().get(0);
        assertThat(paragraph.is(NodeKind.PARAGRAPH)).isTrue();
        assertThat(paragraph.astext()).isEqualTo("New in 2.0: widgets");
    }

    @Test
    void translate_leftoverToctree_isRemoved() {
        // Given
        Node tree = document("index", section("s", "S", Node.of(NodeKind.TOCTREE)));

        // When
        pass.translate(tree, "python");

        // Then
        assertThat(tree.traverse(NodeKind.TOCTREE)).isEmpty();
    }

    @Test
    void translate_failingHandler_substitutesPlainTextAndContinues() {
        // Given
        NodeHandler failing = (node, context) -> {
            throw new IllegalStateException("cannot render");
        };
        TranslationPass fragile = new TranslationPass(Map.of(NodeKind.EMPHASIS, failing), warnings);
        Node tree = document("guide", Nodes.paragraph(Nodes.emphasis("broken")), Nodes.paragraph("fine"));

        // When
        fragile.translate(tree, "python");

        // Then
        Node fallback = tree.children().get(0).children().get(0);
        assertThat(fallback.hasClass(TranslationPass.FALLBACK_CLASS)).isTrue();
        assertThat(fallback.astext()).isEqualTo("broken");
        assertThat(tree.children().get(1).astext()).isEqualTo("fine");
        assertThat(warnings.messages()).singleElement().asString()
            .startsWith("guide: could not translate emphasis node");
    }

    @Test
    void translate_failingLiteralBlockHandler_fallsBackToCodeBlock() {
        // Given
        TranslationPass fragile = TranslationPass.standard(new LanguageDetector(), (lines, language, linenos) -> {
            throw new IllegalArgumentException("no lexer");
        }, warnings);
        Node tree = document("guide", literalBlock("code here"));

        // When
        fragile.translate(tree, "python");

        // Then
        Node fallback = tree.children().get(0);
        assertThat(fallback.is(NodeKind.LITERAL_BLOCK)).isTrue();
        assertThat(fallback.hasClass("code")).isTrue();
        assertThat(fallback.astext()).isEqualTo("code here");
        assertThat(warnings.size()).isEqualTo(1);
    }

    @Test
    void translate_subtreeWithContext_continuesNumbering() {
        // Given
        TranslationContext context = new TranslationContext("python");
        context.enterFile("appendix");
        context.nextFootnoteNumber();
        Node subtree = Node.of(NodeKind.SECTION, footnote("z"));

        // When
        pass.translate(subtree, context);

        // Then
        assertThat(subtree.traverse(NodeKind.FOOTNOTE).get(0).firstChild().orElseThrow().astext()).isEqualTo("2");
        assertThat(subtree.traverse(NodeKind.FOOTNOTE).get(0).firstId()).contains("appendix_z");
    }
}
