package com.theoremextractor;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A LaTeX counter: a named value with an optional parent whose increments reset it.
 */
public final class Counter {

    private final String name;
    private final boolean alphabeticInAppendix;
    private int value;
    private Counter parent;
    private final Set<Counter> children = new LinkedHashSet<>();

    Counter(String name, boolean alphabeticInAppendix) {
        this.name = name;
        this.alphabeticInAppendix = alphabeticInAppendix;
    }

    public String name() {
        return name;
    }

    public int value() {
        return value;
    }

    public Counter parent() {
        return parent;
    }

    public Set<Counter> children() {
        return Collections.unmodifiableSet(children);
    }

    void step() {
        value++;
    }

    void reset() {
        value = 0;
    }

    void reparent(Counter newParent) {
        if (parent != null) {
            parent.children.remove(this);
        }
        parent = newParent;
        if (newParent != null) {
            newParent.children.add(this);
        }
    }

    /**
     * Current value as printed: letters (A, B, ..., Z, AA, ...) for an appendix root while in the
     * appendix, digits otherwise.
     */
    public String render(boolean inAppendix) {
        return inAppendix && alphabeticInAppendix ? toAlpha(value) : Integer.toString(value);
    }

    /**
     * 1 -> A, 26 -> Z, 27 -> AA. A counter that was never stepped prints as A.
     */
    static String toAlpha(int n) {
        if (n <= 0) return "A";
        StringBuilder out = new StringBuilder();
        int rest = n;
        while (rest > 0) {
            int rem = (rest - 1) % 26;
            out.append((char) ('A' + rem));
            rest = (rest - 1) / 26;
        }
        return out.reverse().toString();
    }

    @Override
    public String toString() {
        return name + "=" + value;
    }
}
