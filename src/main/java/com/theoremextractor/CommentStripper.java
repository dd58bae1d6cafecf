package com.theoremextractor;

import java.util.regex.Pattern;

/**
 * Removes LaTeX comments before any other pass sees the text.
 *
 * <p>A line comment runs from the first {@code %} not preceded by a backslash to the end of the
 * line; the newline itself is kept so offsets of later lines stay meaningful. Whole
 * {@code comment} environments are dropped as well.
 */
public final class CommentStripper {

    private static final Pattern LINE_COMMENT = Pattern.compile("(?<!\\\\)%.*");

    private static final Pattern COMMENT_ENVIRONMENT = Pattern.compile(
            "\\\\begin\\s*\\{comment\\}.*?\\\\end\\s*\\{comment\\}",
            Pattern.DOTALL
    );

    private CommentStripper() {
    }

    public static String strip(String input) {
        if (input == null || input.isEmpty()) return "";

        String withoutLineComments = LINE_COMMENT.matcher(input).replaceAll("");
        return COMMENT_ENVIRONMENT.matcher(withoutLineComments).replaceAll("");
    }
}
