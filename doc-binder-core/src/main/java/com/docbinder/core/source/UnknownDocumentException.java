package com.docbinder.core.source;

/**
 * Raised by a {@link SourceTreeProvider} when asked for a DocumentID it does not know.
 */
public class UnknownDocumentException extends RuntimeException {

    private final String docname;

    public UnknownDocumentException(String docname) {
        super("Unknown document: " + docname);
        this.docname = docname;
    }

    public UnknownDocumentException(String docname, Throwable cause) {
        super("Unknown document: " + docname, cause);
        this.docname = docname;
    }

    public String getDocname() {
        return docname;
    }
}
