package com.theoremextractor;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BodyExtractorJUnitTest {

    private static final EnvironmentSet DEFAULTS =
            EnvironmentSet.resolve(List.of(), EnvironmentSet.DEFAULT_ENVIRONMENTS);

    @Test
    void extract_laterDuplicateKeepsLabel() {
        String text = """
                \\begin{theorem}First.\\label{x}\\end{theorem}
                \\begin{theorem}Second.\\label{x}\\end{theorem}
                """;
        var bodies = BodyExtractor.extract(text, DEFAULTS, true).main();
        assertEquals(2, bodies.size());
        assertNull(bodies.get(0).label());
        assertEquals("First.", bodies.get(0).body());
        assertEquals("x", bodies.get(1).label());
        assertEquals("Second.", bodies.get(1).body());
    }

    @Test
    void extract_flattensLinesAndStripsLabelAnywhere() {
        String text = """
                \\begin{lemma}
                  Let $x$.\\label{lem:a}
                  Then $y$.
                \\end{lemma}
                """;
        var body = BodyExtractor.extract(text, DEFAULTS, true).main().get(0);
        assertEquals("Let $x$. Then $y$.", body.body());
        assertEquals("lem:a", body.label());
    }

    @Test
    void extract_headNoteStrippedOnlyWhenRequested() {
        String text = "\\begin{theorem}[Cauchy] Body.\\end{theorem}";
        assertEquals("Body.", BodyExtractor.extract(text, DEFAULTS, true).main().get(0).body());
        assertEquals("[Cauchy] Body.", BodyExtractor.extract(text, DEFAULTS, false).main().get(0).body());
    }

    @Test
    void extract_nestedRegionsInDocumentOrder() {
        String text = "\\begin{theorem}outer \\begin{claim}inner\\end{claim} tail\\end{theorem}";
        var bodies = BodyExtractor.extract(text, DEFAULTS, true).main();
        assertEquals(2, bodies.size());
        assertEquals("outer \\begin{claim}inner\\end{claim} tail", bodies.get(0).body());
        assertEquals("inner", bodies.get(1).body());
    }

    @Test
    void extract_nestedRegionKeepsOwnLabelAndOriginalTags() {
        String text = "\\begin{theorem}Outer \\begin{lemma}Inner\\label{in}\\end{lemma} more\\label{out}\\end{theorem}";
        var bodies = BodyExtractor.extract(text, DEFAULTS, true).main();
        assertEquals(2, bodies.size());
        assertEquals("Outer \\begin{lemma}Inner\\end{lemma} more", bodies.get(0).body());
        assertEquals("out", bodies.get(0).label());
        assertEquals("Inner", bodies.get(1).body());
        assertEquals("in", bodies.get(1).label());
        assertFalse(bodies.get(0).body().contains(BodyExtractor.CANONICAL_TAG));
    }

    @Test
    void extract_outerWithoutLabelDoesNotTakeNestedOne() {
        String text = "\\begin{theorem}[Note] A \\begin{claim}B\\label{c}\\end{claim}\\end{theorem}";
        var bodies = BodyExtractor.extract(text, DEFAULTS, true).main();
        assertNull(bodies.get(0).label());
        assertEquals("A \\begin{claim}B\\end{claim}", bodies.get(0).body());
        assertEquals("c", bodies.get(1).label());
    }

    @Test
    void extract_appendixSplit() {
        String text = """
                \\begin{theorem}a\\end{theorem}
                \\begin{appendix}
                \\begin{remark}b\\end{remark}
                \\end{appendix}
                """;
        var extraction = BodyExtractor.extract(text, DEFAULTS, true);
        assertEquals(1, extraction.main().size());
        assertEquals(1, extraction.appendix().size());
        assertEquals("b", extraction.appendix().get(0).body());
    }

    @Test
    void canonicalize_rewritesEveryEnvironment() {
        String out = BodyExtractor.canonicalize("\\begin{lemma}x\\end{ lemma }", DEFAULTS);
        assertEquals("\\begin{thmextract@region}x\\end{thmextract@region}", out);
    }
}
