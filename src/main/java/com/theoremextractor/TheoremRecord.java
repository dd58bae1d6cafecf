package com.theoremextractor;

/**
 * One extracted statement: {@code Theorem 2.1.}, its body and its label (may be {@code null}).
 */
public record TheoremRecord(String title, String body, String label) {

    public TheoremRecord {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Theorem title must not be blank");
        }
        body = body == null ? "" : body;
    }

    public boolean hasLabel() {
        return label != null;
    }
}
