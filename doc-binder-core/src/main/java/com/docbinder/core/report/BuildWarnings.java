package com.docbinder.core.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.MessageFormatter;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the user-visible, non-fatal problems found while building output documents.
 *
 * <p>Every warning is logged at WARN level through the caller's logger and kept so that the
 * CLI can summarize them and tests can assert on them. Messages use SLF4J's {@code {}}
 * placeholders. Safe for concurrent use by parallel document builds.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * warnings.warn(log, "{}: toctree contains ref to nonexisting file '{}'", docname, include);
 * }</pre>
 */
public class BuildWarnings {

    private static final Logger log = LoggerFactory.getLogger(BuildWarnings.class);

    private final List<String> messages = new ArrayList<>();

    /**
     * Records a warning and logs it through the given logger.
     *
     * @param logger logger of the reporting component
     * @param pattern SLF4J message pattern
     * @param arguments pattern arguments
     * @return the formatted message
     */
    public String warn(Logger logger, String pattern, Object... arguments) {
        String message = MessageFormatter.arrayFormat(pattern, arguments).getMessage();
        logger.warn(message);
        synchronized (messages) {
            messages.add(message);
        }
        return message;
    }

    /**
     * Records a warning logged under this class's logger.
     *
     * @param pattern SLF4J message pattern
     * @param arguments pattern arguments
     * @return the formatted message
     */
    public String warn(String pattern, Object... arguments) {
        return warn(log, pattern, arguments);
    }

    /**
     * Returns a snapshot of all recorded warnings, oldest first.
     *
     * @return recorded messages
     */
    public List<String> messages() {
        synchronized (messages) {
            return List.copyOf(messages);
        }
    }

    /**
     * Counts recorded warnings containing the given text.
     *
     * @param fragment text to look for
     * @return number of matching warnings
     */
    public long count(String fragment) {
        return messages().stream().filter(message -> message.contains(fragment)).count();
    }

    public boolean isEmpty() {
        return messages().isEmpty();
    }

    public int size() {
        return messages().size();
    }
}
