package com.theoremextractor;

/**
 * Balanced-brace scanning for LaTeX source.
 *
 * <p>Every capture of a macro body, macro argument or declaration field goes through this class.
 * Escaped braces ({@code \{}, {@code \}}) are ignored, and an escaped backslash ({@code \\}) does
 * not escape the character after it.
 */
public final class BraceMatcher {

    public static final int NOT_FOUND = -1;

    private BraceMatcher() {
    }

    /**
     * A delimited group: {@code content} is the text between the delimiters, {@code start} the
     * index of the opening delimiter and {@code end} the index just after the closing one.
     */
    public record Group(String content, int start, int end) {}

    /**
     * Returns the index of the closing brace matching an already consumed opening brace, or
     * {@link #NOT_FOUND}.
     *
     * @param text source text
     * @param afterOpen index just after the opening brace
     */
    public static int findClosing(String text, int afterOpen) {
        if (text == null || afterOpen < 0) return NOT_FOUND;

        int n = text.length();
        int depth = 1;
        boolean escaped = false;

        for (int p = afterOpen; p < n; p++) {
            char c = text.charAt(p);
            if (escaped) {
                escaped = false;
            } else if (c == '\\') {
                escaped = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) return p;
            }
        }
        return NOT_FOUND;
    }

    /**
     * Reads a brace group starting at {@code pos}, skipping leading whitespace.
     *
     * @return the group, or {@code null} if the next non-blank character is not an opening brace
     *     or the group is never closed
     */
    public static Group readGroup(String text, int pos) {
        int open = skipWhitespace(text, pos);
        if (open >= text.length() || text.charAt(open) != '{') return null;

        int close = findClosing(text, open + 1);
        if (close == NOT_FOUND) return null;
        return new Group(text.substring(open + 1, close), open, close + 1);
    }

    /**
     * Reads an optional bracket group ({@code [...]}) starting at {@code pos}, skipping leading
     * whitespace. Braces inside the brackets are honoured, so {@code [a={]}]} is one group.
     */
    public static Group readOptional(String text, int pos) {
        int open = skipWhitespace(text, pos);
        if (open >= text.length() || text.charAt(open) != '[') return null;

        int n = text.length();
        int braceDepth = 0;
        boolean escaped = false;
        for (int p = open + 1; p < n; p++) {
            char c = text.charAt(p);
            if (escaped) {
                escaped = false;
            } else if (c == '\\') {
                escaped = true;
            } else if (c == '{') {
                braceDepth++;
            } else if (c == '}') {
                braceDepth = Math.max(0, braceDepth - 1);
            } else if (c == ']' && braceDepth == 0) {
                return new Group(text.substring(open + 1, p), open, p + 1);
            }
        }
        return null;
    }

    /**
     * Returns the index just after the control sequence starting at {@code backslash}: a control
     * word ({@code \foo}, letters and {@code @}) or a control symbol ({@code \!}).
     */
    public static int controlSequenceEnd(String text, int backslash) {
        int n = text.length();
        int p = backslash + 1;
        if (p >= n) return n;
        if (!isLetter(text.charAt(p))) return p + 1;
        while (p < n && isLetter(text.charAt(p))) p++;
        return p;
    }

    public static int skipWhitespace(String text, int pos) {
        int p = Math.max(0, pos);
        while (p < text.length() && Character.isWhitespace(text.charAt(p))) p++;
        return p;
    }

    static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '@';
    }
}
