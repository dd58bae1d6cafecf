package com.theoremextractor;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OccurrenceLocatorJUnitTest {

    private static final EnvironmentSet DEFAULTS =
            EnvironmentSet.resolve(List.of(), EnvironmentSet.DEFAULT_ENVIRONMENTS);

    @Test
    void locate_splitsAtAppendix() {
        String text = """
                \\begin{theorem}a\\end{theorem}
                \\begin{lemma}b\\end{lemma}
                \\appendix
                \\begin{theorem}c\\end{theorem}
                """;
        var located = OccurrenceLocator.locate(text, DEFAULTS);
        assertEquals(2, located.main().size());
        assertEquals(1, located.appendix().size());
        assertEquals(text.indexOf("\\appendix"), located.appendixOffset());

        assertEquals("theorem", located.main().get(0).environment());
        assertEquals("lemma", located.main().get(1).environment());
        assertEquals(1, located.main().get(1).index());
        assertEquals(Occurrence.Region.APPENDIX, located.appendix().get(0).region());
        assertEquals(0, located.appendix().get(0).index());
    }

    @Test
    void locate_noAppendix() {
        var located = OccurrenceLocator.locate("\\begin{claim}x\\end{claim}", DEFAULTS);
        assertFalse(located.hasAppendix());
        assertEquals(1, located.main().size());
        assertTrue(located.appendix().isEmpty());
    }

    @Test
    void locate_ignoresUnclosedBegin() {
        var located = OccurrenceLocator.locate("\\begin{lemma}dangling", DEFAULTS);
        assertEquals(0, located.size());
    }

    @Test
    void locate_skipsPreamble() {
        String text = """
                \\newenvironment{x}{\\begin{theorem}}{\\end{theorem}}
                \\begin{document}
                \\begin{theorem}t\\end{theorem}
                \\end{document}
                """;
        assertEquals(1, OccurrenceLocator.locate(text, DEFAULTS).size());
    }

    @Test
    void locate_readsHeadNote() {
        var located = OccurrenceLocator.locate("\\begin{theorem}[Fermat] body\\end{theorem}", DEFAULTS);
        assertEquals("Fermat", located.main().get(0).note());
    }

    @Test
    void appendixOffset_environmentFormPreferred() {
        String text = "x \\appendix y \\begin{appendix} z \\end{appendix}";
        assertEquals(text.indexOf("\\begin{appendix}"), OccurrenceLocator.appendixOffset(text));
        assertEquals(-1, OccurrenceLocator.appendixOffset("\\appendixname only"));
    }

    @Test
    void resolve_declaredSetReplacesDefaults() {
        var declared = EnvironmentSet.resolve(List.of(TheoremDeclaration.numbered("thm", "Theorem")),
                EnvironmentSet.DEFAULT_ENVIRONMENTS);
        assertEquals(EnvironmentSet.Source.DECLARED, declared.source());
        assertEquals(List.of("thm"), declared.names());
        assertEquals(0, OccurrenceLocator.locate("\\begin{theorem}x\\end{theorem}", declared).size());
    }
}
