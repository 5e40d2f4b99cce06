package com.docbinder.core.xref;

/**
 * Internal invariant violation: a pending reference survived resolution.
 */
public class UnresolvedReferenceException extends IllegalStateException {

    public UnresolvedReferenceException(String message) {
        super(message);
    }
}
