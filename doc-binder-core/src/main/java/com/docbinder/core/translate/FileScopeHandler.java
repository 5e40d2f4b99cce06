package com.docbinder.core.translate;

import com.docbinder.core.tree.Node;

/**
 * Opens a footnote namespace for the document root and for every {@code start_of_file}
 * wrapper, and closes it again when the walk leaves the node.
 */
class FileScopeHandler implements NodeHandler {

    @Override
    public Visit enter(Node node, TranslationContext context) {
        context.enterFile(node.getString(Node.DOCNAME, ""));
        return Visit.proceed();
    }

    @Override
    public void leave(Node node, TranslationContext context) {
        context.leaveFile();
    }
}
