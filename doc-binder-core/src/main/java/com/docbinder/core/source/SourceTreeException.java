package com.docbinder.core.source;

/**
 * Raised by a {@link SourceTreeProvider} when a known document cannot be read or does not
 * hold a valid tree.
 */
public class SourceTreeException extends RuntimeException {

    private final String docname;

    public SourceTreeException(String docname, String message, Throwable cause) {
        super(message, cause);
        this.docname = docname;
    }

    public SourceTreeException(String docname, String message) {
        this(docname, message, null);
    }

    public String getDocname() {
        return docname;
    }
}
