package com.sentinel.core.diff;

import java.util.ArrayList;
import java.util.List;

/**
 * Source code with comments removed, plus a same-length "masked" copy in which
 * string literal contents are replaced by {@code '_'}. Structure (braces, parens,
 * line starts) is read from the masked copy; signature text is cut from the
 * stripped copy at the same offsets.
 */
final class SourceText {

    /** Comment and string conventions of a language family. */
    enum Syntax {
        C_LIKE(false, false, List.of("\"\"\"")),
        SCRIPT(false, true, List.of()),
        GO(false, true, List.of()),
        PYTHON(true, false, List.of("\"\"\"", "'''"));

        final boolean hashComments;
        final boolean backtickStrings;
        /** Delimiters of multi-line literals: Java text blocks, Python triple-quoted strings. */
        final List<String> tripleQuotes;

        Syntax(boolean hashComments, boolean backtickStrings, List<String> tripleQuotes) {
            this.hashComments = hashComments;
            this.backtickStrings = backtickStrings;
            this.tripleQuotes = tripleQuotes;
        }

        String tripleQuoteAt(String src, int i) {
            for (String quote : tripleQuotes) {
                if (src.startsWith(quote, i)) {
                    return quote;
                }
            }
            return null;
        }
    }

    /**
     * One physical line.
     *
     * @param start  offset of the first character
     * @param depth  brace depth at the start of the line
     * @param masked masked text of the line without its terminator
     */
    record Line(int start, int depth, String masked) {

        boolean isBlank() {
            return masked.isBlank();
        }

        int indent() {
            int i = 0;
            while (i < masked.length() && Character.isWhitespace(masked.charAt(i))) {
                i++;
            }
            return i;
        }

        String trimmed() {
            return masked.substring(indent()).stripTrailing();
        }
    }

    private final String stripped;
    private final String masked;

    private SourceText(String stripped, String masked) {
        this.stripped = stripped;
        this.masked = masked;
    }

    static SourceText of(String source, Syntax syntax) {
        String src = source != null ? source.replace("\r\n", "\n") : "";
        int n = src.length();
        var out = new StringBuilder(n);
        var mask = new StringBuilder(n);
        int i = 0;
        while (i < n) {
            char c = src.charAt(i);
            char next = i + 1 < n ? src.charAt(i + 1) : '\0';

            boolean lineComment = syntax.hashComments ? c == '#' : c == '/' && next == '/';
            if (lineComment) {
                while (i < n && src.charAt(i) != '\n') {
                    out.append(' ');
                    mask.append(' ');
                    i++;
                }
                continue;
            }
            if (!syntax.hashComments && c == '/' && next == '*') {
                int end = src.indexOf("*/", i + 2);
                end = end < 0 ? n : end + 2;
                for (int k = i; k < end; k++) {
                    char blank = src.charAt(k) == '\n' ? '\n' : ' ';
                    out.append(blank);
                    mask.append(blank);
                }
                i = end;
                continue;
            }
            String triple = syntax.tripleQuoteAt(src, i);
            if (triple != null) {
                int end = tripleQuoteEnd(src, i + 3, triple);
                appendLiteral(src, i, end, 3, out, mask);
                i = end;
                continue;
            }
            if (c == '"' || c == '\'' || (syntax.backtickStrings && c == '`')) {
                int end = literalEnd(src, i, c == '`');
                appendLiteral(src, i, end, 1, out, mask);
                i = end;
                continue;
            }
            out.append(c);
            mask.append(c);
            i++;
        }
        return new SourceText(out.toString(), mask.toString());
    }

    /** Offset just past the closing delimiter; escaped quotes do not close the literal. */
    private static int tripleQuoteEnd(String src, int from, String quote) {
        int j = from;
        while (j < src.length()) {
            if (src.charAt(j) == '\\') {
                j += 2;
                continue;
            }
            if (src.startsWith(quote, j)) {
                return j + quote.length();
            }
            j++;
        }
        return src.length();
    }

    private static int literalEnd(String src, int start, boolean multiline) {
        char quote = src.charAt(start);
        int j = start + 1;
        while (j < src.length()) {
            char ch = src.charAt(j);
            if (ch == '\\' && quote != '`') {
                j += 2;
                continue;
            }
            if (ch == quote) {
                return j + 1;
            }
            if (ch == '\n' && !multiline) {
                return j;
            }
            j++;
        }
        return src.length();
    }

    private static void appendLiteral(String src, int start, int end, int quoteLen,
                                      StringBuilder out, StringBuilder mask) {
        for (int k = start; k < end; k++) {
            char ch = src.charAt(k);
            out.append(ch);
            boolean delimiter = k < start + quoteLen || k >= end - quoteLen;
            mask.append(delimiter || ch == '\n' ? ch : '_');
        }
    }

    List<Line> lines() {
        var lines = new ArrayList<Line>();
        int depth = 0;
        int start = 0;
        while (start <= masked.length()) {
            int nl = masked.indexOf('\n', start);
            int end = nl < 0 ? masked.length() : nl;
            String text = masked.substring(start, end);
            lines.add(new Line(start, depth, text));
            for (int k = 0; k < text.length(); k++) {
                char ch = text.charAt(k);
                if (ch == '{') {
                    depth++;
                } else if (ch == '}') {
                    depth = Math.max(0, depth - 1);
                }
            }
            if (nl < 0) {
                break;
            }
            start = nl + 1;
        }
        return lines;
    }

    /**
     * Reads from {@code start} up to (excluding) the first of {@code stopChars} outside
     * parentheses/brackets, or a newline there when {@code newlineStops}.
     */
    String readHeader(int start, String stopChars, boolean newlineStops) {
        int parens = 0;
        for (int j = start; j < masked.length(); j++) {
            char ch = masked.charAt(j);
            if (ch == '(' || ch == '[') {
                parens++;
            } else if (ch == ')' || ch == ']') {
                parens = Math.max(0, parens - 1);
            } else if (parens == 0 && (stopChars.indexOf(ch) >= 0 || (newlineStops && ch == '\n'))) {
                return stripped.substring(start, j);
            }
        }
        return stripped.substring(start);
    }

    /**
     * Reads a declaration including its braced body. Without a body the declaration
     * ends at {@code ';'}, or at a newline when {@code newlineStops}.
     */
    String readBody(int start, boolean newlineStops) {
        int parens = 0;
        int braces = 0;
        for (int j = start; j < masked.length(); j++) {
            char ch = masked.charAt(j);
            if (ch == '(' || ch == '[') {
                parens++;
            } else if (ch == ')' || ch == ']') {
                parens = Math.max(0, parens - 1);
            } else if (parens == 0 && ch == '{') {
                braces++;
            } else if (parens == 0 && ch == '}') {
                braces--;
                if (braces <= 0) {
                    return stripped.substring(start, j + 1);
                }
            } else if (parens == 0 && braces == 0 && (ch == ';' || (newlineStops && ch == '\n'))) {
                return stripped.substring(start, j);
            }
        }
        return stripped.substring(start);
    }

    /**
     * Whitespace-insensitive form of a signature: runs of whitespace collapse and
     * disappear entirely next to punctuation.
     */
    static String normalize(String signature) {
        return signature
                .replaceAll("\\s+", " ")
                .replaceAll(" ?([(){}\\[\\],:;=<>|&?*+\\-]) ?", "$1")
                .trim();
    }
}
