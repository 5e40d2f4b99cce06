package com.docbinder.core.assembly;

/**
 * Raised when a navigation graph is malformed beyond what assembly tolerates: a cyclic
 * toctree or an inclusion chain deeper than the configured limit.
 *
 * <p>Fails the output document being assembled, not the run.
 */
public class AssemblyException extends RuntimeException {

    public AssemblyException(String message) {
        super(message);
    }
}
