package com.docbinder.core.xref;

/**
 * Signals that no URI can be produced for a DocumentID: it is neither part of the current
 * output document nor reachable through another output document of the run.
 */
public class NoUriException extends Exception {

    public NoUriException(String docname) {
        super("No URI for document: " + docname);
    }
}
