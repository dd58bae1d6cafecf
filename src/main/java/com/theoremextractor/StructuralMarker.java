package com.theoremextractor;

/**
 * A sectioning command in the expanded text. Starred markers never step a counter.
 */
public record StructuralMarker(Level level, int offset, boolean starred) {

    public enum Level {
        CHAPTER("chapter"),
        SECTION("section"),
        SUBSECTION("subsection"),
        SUBSUBSECTION("subsubsection");

        private final String counter;

        Level(String counter) {
            this.counter = counter;
        }

        public String counter() {
            return counter;
        }

        static Level of(String command) {
            for (Level l : values()) {
                if (l.counter.equals(command)) return l;
            }
            throw new IllegalArgumentException("Not a sectioning command: " + command);
        }
    }
}
