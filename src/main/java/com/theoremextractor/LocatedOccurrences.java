package com.theoremextractor;

import java.util.List;

/**
 * Occurrences split at the appendix cut-point, each list sorted by offset.
 *
 * @param appendixOffset index of the first appendix marker, or -1 when there is none
 */
public record LocatedOccurrences(List<Occurrence> main, List<Occurrence> appendix, int appendixOffset) {

    public LocatedOccurrences {
        main = List.copyOf(main);
        appendix = List.copyOf(appendix);
    }

    public boolean hasAppendix() {
        return appendixOffset >= 0;
    }

    public int size() {
        return main.size() + appendix.size();
    }
}
