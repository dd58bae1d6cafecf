package com.theoremextractor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Model of LaTeX's counter hierarchy for one region of one document.
 *
 * <p>Counters are created on first reference with value 0. Stepping a counter zeroes all of its
 * descendants. A theorem number is the chain of counter values from the root ancestor down to the
 * theorem's own counter, joined with dots and terminated by a dot ({@code 2.1.}).
 *
 * <p>Not thread-safe; build one per region and discard it.
 */
public final class TheoremNumberer {

    private final Map<String, Counter> counters = new LinkedHashMap<>();
    private final Map<String, TheoremDeclaration> environments = new LinkedHashMap<>();
    private final boolean inAppendix;
    private final Set<String> alphaRoots;
    private final boolean swapNumbers;

    public TheoremNumberer(boolean inAppendix, Set<String> alphaRoots, boolean swapNumbers) {
        this.inAppendix = inAppendix;
        this.alphaRoots = alphaRoots == null ? Set.of() : Set.copyOf(alphaRoots);
        this.swapNumbers = swapNumbers;
    }

    public TheoremNumberer(boolean inAppendix) {
        this(inAppendix, Set.of("section"), false);
    }

    public boolean inAppendix() {
        return inAppendix;
    }

    /**
     * Registers an environment. A {@code within} counter becomes the parent of the environment's
     * counter.
     *
     * @return false if the environment was already defined; the first definition stays
     */
    public boolean define(TheoremDeclaration declaration) {
        if (environments.containsKey(declaration.name())) return false;

        environments.put(declaration.name(), declaration);
        counter(declaration.counter());
        if (declaration.within() != null) {
            numberWithin(declaration.counter(), declaration.within());
        }
        return true;
    }

    public boolean isDefined(String environment) {
        return environments.containsKey(environment);
    }

    /**
     * {@code \numberwithin{child}{parent}}: moves {@code child} under {@code parent}.
     *
     * @return false if the edge would make a cycle; the hierarchy is left unchanged
     */
    public boolean numberWithin(String child, String parent) {
        Counter c = counter(child);
        Counter p = counter(parent);
        for (Counter a = p; a != null; a = a.parent()) {
            if (a == c) return false;
        }
        c.reparent(p);
        return true;
    }

    /**
     * Steps a counter, as a sectioning command or {@code \refstepcounter} would.
     */
    public void increment(String name) {
        Counter c = counter(name);
        c.step();
        for (Counter d : descendants(c)) {
            d.reset();
        }
    }

    /**
     * Simulates {@code \begin{env}} and returns the heading LaTeX would print.
     *
     * @param note optional head note, appended in parentheses; may be {@code null}
     */
    public String begin(String environment, String note) {
        TheoremDeclaration d = environments.get(environment);
        if (d == null) {
            d = TheoremDeclaration.numbered(environment, null);
            define(d);
        }

        String head;
        if (d.starred()) {
            head = d.caption();
        } else {
            increment(d.counter());
            String number = formattedNumber(d.counter());
            head = swapNumbers ? number + " " + d.caption() : d.caption() + " " + number;
        }
        return note == null || note.isBlank() ? head : head + " (" + note + ")";
    }

    public String begin(String environment) {
        return begin(environment, null);
    }

    public int value(String name) {
        Counter c = counters.get(name);
        return c == null ? 0 : c.value();
    }

    /**
     * Walks the parent chain from the root to {@code name}.
     */
    public String formattedNumber(String name) {
        List<Counter> chain = new ArrayList<>();
        Set<Counter> seen = new HashSet<>();
        for (Counter c = counter(name); c != null && seen.add(c); c = c.parent()) {
            chain.add(c);
        }
        Collections.reverse(chain);

        StringBuilder out = new StringBuilder();
        for (Counter c : chain) {
            out.append(c.render(inAppendix)).append('.');
        }
        return out.toString();
    }

    Counter counter(String name) {
        return counters.computeIfAbsent(name, n -> new Counter(n, alphaRoots.contains(n)));
    }

    private static List<Counter> descendants(Counter root) {
        List<Counter> out = new ArrayList<>();
        Set<Counter> seen = new HashSet<>();
        Deque<Counter> stack = new ArrayDeque<>(root.children());
        while (!stack.isEmpty()) {
            Counter c = stack.pop();
            if (seen.add(c)) {
                out.add(c);
                stack.addAll(c.children());
            }
        }
        return out;
    }
}
