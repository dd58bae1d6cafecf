package com.theoremextractor;

/**
 * A theorem-like environment as declared by {@code \newtheorem} and friends.
 *
 * @param name environment name used in {@code \begin{...}}
 * @param caption heading text, e.g. {@code Theorem}
 * @param starred unnumbered environment
 * @param shared counter borrowed from another environment, or {@code null}
 * @param within counter whose increments reset this one, or {@code null}
 */
public record TheoremDeclaration(String name, String caption, boolean starred, String shared, String within) {

    public TheoremDeclaration {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Environment name must not be blank");
        }
        name = name.trim();
        caption = caption == null || caption.isBlank() ? defaultCaption(name) : caption.trim();
        shared = blankToNull(shared);
        within = blankToNull(within);
        if (shared != null && within != null) {
            throw new IllegalArgumentException(
                    "Use either shared=[" + shared + "] or within=[" + within + "] for " + name + ", not both");
        }
    }

    public static TheoremDeclaration numbered(String name, String caption) {
        return new TheoremDeclaration(name, caption, false, null, null);
    }

    /**
     * The counter stepped by {@code \begin{name}}.
     */
    public String counter() {
        return shared != null ? shared : name;
    }

    public TheoremDeclaration withShared(String newShared) {
        return new TheoremDeclaration(name, caption, starred, newShared, within);
    }

    static String defaultCaption(String name) {
        String trimmed = name.trim();
        if (trimmed.isEmpty()) return trimmed;
        return Character.toUpperCase(trimmed.charAt(0)) + trimmed.substring(1);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
