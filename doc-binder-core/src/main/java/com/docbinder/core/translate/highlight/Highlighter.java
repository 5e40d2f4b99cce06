package com.docbinder.core.translate.highlight;

import com.docbinder.core.tree.Node;

import java.util.List;

/**
 * Turns the lines of a code block into token nodes.
 *
 * <p>Implementations own the language rule tables; the translation pass only chooses the
 * language and options and hands the lines over.
 */
@FunctionalInterface
public interface Highlighter {

    /**
     * Tokenizes the lines of one code block.
     *
     * @param lines block content, tabs already expanded, without line terminators
     * @param language detected language, {@link LanguageDetector#UNKNOWN} if none
     * @param linenos whether line numbers should be emitted
     * @return children of the highlighted literal block
     */
    List<Node> highlight(List<String> lines, String language, boolean linenos);
}
