package com.docbinder.core.source;

import com.docbinder.core.tree.Node;
import com.docbinder.core.tree.NodeKind;
import com.docbinder.core.tree.Nodes;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parser for the small markup subset used by generated content.
 *
 * <p>Supported constructs, separated by blank lines:
 * <ul>
 *   <li>Titles: a text line followed by an underline of at least three {@code =} or
 *       {@code -} characters ({@code -} marks a subtitle)</li>
 *   <li>{@code .. raw:: <format>} followed by an indented body, producing a {@code raw} node</li>
 *   <li>{@code .. class:: <names>} applying classes to the next block</li>
 *   <li>Paragraphs: any other run of non-blank lines, joined with single spaces</li>
 * </ul>
 */
public class SimpleMarkupParser implements MarkupParser {

    private static final String RAW_DIRECTIVE = ".. raw::";
    private static final String CLASS_DIRECTIVE = ".. class::";
    private static final Pattern TITLE_UNDERLINE = Pattern.compile("={3,}");
    private static final Pattern SUBTITLE_UNDERLINE = Pattern.compile("-{3,}");

    @Override
    public Node parse(String markup) {
        Node document = Node.of(NodeKind.DOCUMENT);
        List<String> lines = markup.lines().toList();
        List<String> pendingClasses = new ArrayList<>();

        int i = 0;
        while (i < lines.size()) {
            String line = lines.get(i);
            if (line.isBlank()) {
                i++;
                continue;
            }

            String trimmed = line.strip();
            if (trimmed.startsWith(RAW_DIRECTIVE)) {
                String format = trimmed.substring(RAW_DIRECTIVE.length()).strip();
                i++;
                List<String> body = new ArrayList<>();
                while (i < lines.size() && (lines.get(i).isBlank() || Character.isWhitespace(lines.get(i).charAt(0)))) {
                    if (!lines.get(i).isBlank()) {
                        body.add(lines.get(i).strip());
                    }
                    i++;
                }
                Node raw = Node.of(NodeKind.RAW, Node.text(String.join("\n", body))).set("format", format);
                document.append(applyClasses(raw, pendingClasses));
                continue;
            }
            if (trimmed.startsWith(CLASS_DIRECTIVE)) {
                pendingClasses.addAll(List.of(trimmed.substring(CLASS_DIRECTIVE.length()).strip().split("\\s+")));
                i++;
                continue;
            }

            List<String> block = new ArrayList<>();
            while (i < lines.size() && !lines.get(i).isBlank()) {
                block.add(lines.get(i).strip());
                i++;
            }
            document.append(applyClasses(toBlock(block), pendingClasses));
        }
        return document;
    }

    private Node toBlock(List<String> block) {
        if (block.size() == 2 && TITLE_UNDERLINE.matcher(block.get(1)).matches()) {
            return Nodes.title(block.get(0));
        }
        if (block.size() == 2 && SUBTITLE_UNDERLINE.matcher(block.get(1)).matches()) {
            return Nodes.withClasses(Nodes.paragraph(block.get(0)), "subtitle");
        }
        return Nodes.paragraph(String.join(" ", block));
    }

    private Node applyClasses(Node node, List<String> pendingClasses) {
        if (!pendingClasses.isEmpty()) {
            Nodes.withClasses(node, pendingClasses.toArray(String[]::new));
            pendingClasses.clear();
        }
        return node;
    }
}
