package com.docbinder.core.translate;

import com.docbinder.core.tree.Node;

/**
 * Applies a {@code highlightlang} directive to the blocks that follow it and drops the
 * directive from the tree.
 */
class HighlightLanguageHandler implements NodeHandler {

    static final String LANG = "lang";
    static final String LINENOTHRESHOLD = "linenothreshold";

    @Override
    public Visit enter(Node node, TranslationContext context) {
        context.setHighlighting(
            node.getString(LANG, context.highlightLanguage()),
            node.getInt(LINENOTHRESHOLD, TranslationContext.NO_LINENO_THRESHOLD));
        return Visit.remove();
    }
}
