package com.docbinder.core.translate.highlight;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Chooses the highlighting language of a code block.
 *
 * <p>An explicit language is kept as-is, except for the Python family:
 * <ul>
 *   <li>{@code python}/{@code py} blocks starting with {@code >>>} are interactive sessions
 *       ({@code pycon}); otherwise a light syntax sniff decides between {@code python} and a
 *       heuristic guess.</li>
 *   <li>{@code python3}/{@code py3} blocks starting with {@code >>>} become {@code pycon3}.</li>
 *   <li>{@code guess} is resolved from the content alone.</li>
 * </ul>
 * A guess that finds nothing yields {@link #UNKNOWN}.
 */
public class LanguageDetector {

    public static final String UNKNOWN = "text";
    public static final String GUESS = "guess";

    private static final String ELLIPSIS_MARK = "__highlighting__ellipsis__";
    private static final Pattern PLACEHOLDER_LINE = Pattern.compile("(?m)^(\\s*)" + ELLIPSIS_MARK + "(.)");
    private static final Set<String> PYTHON = Set.of("python", "py");
    private static final Set<String> PYTHON3 = Set.of("python3", "py3");

    /**
     * Selects the language of a block.
     *
     * @param source block text
     * @param language language requested by the block or the current default, may be null
     * @return language name, never null
     */
    public String langForBlock(String source, String language) {
        String lang = language == null ? GUESS : language.strip().toLowerCase(Locale.ROOT);
        if (PYTHON.contains(lang)) {
            if (source.startsWith(">>>")) {
                return "pycon";
            }
            return looksLikePython(source) ? "python" : guess(source);
        }
        if (PYTHON3.contains(lang) && source.startsWith(">>>")) {
            return "pycon3";
        }
        if (GUESS.equals(lang) || lang.isEmpty()) {
            return guess(source);
        }
        return lang;
    }

    /**
     * Cheap plausibility check for Python source: brackets balance outside string literals
     * and comments, and no line carries C-style statement syntax.
     *
     * @param source candidate source
     * @return true if the snippet could be Python
     */
    boolean looksLikePython(String source) {
        String src = source.replace("...", ELLIPSIS_MARK) + "\n";
        // lines starting with "..." are placeholders for a suite
        src = PLACEHOLDER_LINE.matcher(src).replaceAll("$1" + ELLIPSIS_MARK + "# $2");

        for (String line : src.split("\n")) {
            String trimmed = line.strip();
            if (trimmed.endsWith(";") && !trimmed.startsWith("#")
                || trimmed.startsWith("//") || trimmed.startsWith("/*")) {
                return false;
            }
        }
        return bracketsBalance(src);
    }

    private static boolean bracketsBalance(String src) {
        Deque<Character> open = new ArrayDeque<>();
        char quote = 0;
        boolean comment = false;
        for (int i = 0; i < src.length(); i++) {
            char c = src.charAt(i);
            if (comment) {
                comment = c != '\n';
            } else if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '#') {
                comment = true;
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '(' || c == '[' || c == '{') {
                open.push(c);
            } else if (c == ')' || c == ']' || c == '}') {
                if (open.isEmpty() || open.pop() != matching(c)) {
                    return false;
                }
            }
        }
        return open.isEmpty() && quote == 0;
    }

    private static char matching(char close) {
        return switch (close) {
            case ')' -> '(';
            case ']' -> '[';
            default -> '{';
        };
    }

    private String guess(String source) {
        String text = source.stripLeading();
        if (text.isEmpty()) {
            return UNKNOWN;
        }
        if (text.startsWith(">>>")) {
            return "pycon";
        }
        if (text.startsWith("#!")) {
            String shebang = text.lines().findFirst().orElse("");
            if (shebang.contains("python")) {
                return "python";
            }
            if (shebang.contains("sh")) {
                return "bash";
            }
        }
        if (text.startsWith("<?xml")) {
            return "xml";
        }
        if (text.regionMatches(true, 0, "<!doctype html", 0, 14) || text.regionMatches(true, 0, "<html", 0, 5)) {
            return "html";
        }
        if (text.startsWith("$ ")) {
            return "console";
        }
        if ((text.startsWith("{") || text.startsWith("[")) && text.contains("\":")) {
            return "json";
        }
        if (text.startsWith("#include")) {
            return "c";
        }
        if (text.startsWith("package ") || text.contains("public class ") || text.contains("public interface ")) {
            return "java";
        }
        String upper = text.toUpperCase(Locale.ROOT);
        if (upper.startsWith("SELECT ") || upper.startsWith("CREATE TABLE") || upper.startsWith("INSERT INTO")) {
            return "sql";
        }
        if (text.startsWith("def ") || text.startsWith("import ") || text.startsWith("from ")
            || text.startsWith("class ") && text.contains(":")) {
            return "python";
        }
        return UNKNOWN;
    }
}
