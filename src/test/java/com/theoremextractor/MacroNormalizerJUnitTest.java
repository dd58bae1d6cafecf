package com.theoremextractor;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MacroNormalizerJUnitTest {

    @Test
    void normalize_expandsAllMacroFamilies() {
        String raw = """
                \\def\\R{\\mathbb{R}}
                \\newcommand{\\norm}[1]{\\|#1\\|}
                \\DeclareMathOperator{\\tr}{tr}
                $\\norm{x} \\in \\R$, $\\tr A$ % \\R in a comment
                """;
        var doc = MacroNormalizer.normalize(raw);
        assertTrue(doc.text().contains("$\\|x\\| \\in \\mathbb{R}$, $\\text{tr} A$"));
        assertFalse(doc.text().contains("comment"));
        assertTrue(doc.warnings().isEmpty());
    }

    @Test
    void normalize_aliasCounterResolvedToTarget() {
        String raw = """
                \\newtheorem{thm}{Theorem}
                \\newaliascnt{lem}{thm}
                \\newtheorem{lem}[lem]{Lemma}
                """;
        var doc = MacroNormalizer.normalize(raw);
        assertEquals(2, doc.declarations().size());
        assertEquals("thm", doc.declarations().get(1).shared());
        assertEquals("thm", doc.declarations().get(1).counter());
    }

    @Test
    void normalize_newenvironmentWrapperBecomesTheorem() {
        String raw = """
                \\newtheorem{thm}{Theorem}[section]
                \\newenvironment{mythm}{\\begin{thm}}{\\end{thm}}
                """;
        var doc = MacroNormalizer.normalize(raw);
        assertEquals(2, doc.declarations().size());
        var wrapper = doc.declarations().get(1);
        assertEquals("mythm", wrapper.name());
        assertEquals("Theorem", wrapper.caption());
        assertEquals("thm", wrapper.shared());
        assertNull(wrapper.within());
    }

    @Test
    void normalize_declarationsHiddenInMacrosAreFound() {
        String raw = "\\newcommand{\\thmdecl}[2]{\\newtheorem{#1}{#2}}\n\\thmdecl{conj}{Conjecture}\n";
        var doc = MacroNormalizer.normalize(raw);
        assertEquals(1, doc.declarations().size());
        assertEquals("Conjecture", doc.declarations().get(0).caption());
    }

    @Test
    void normalizeBeginEnd_shorthandTags() {
        assertEquals("\\begin{theorem}x\\end{theorem}",
                MacroNormalizer.normalizeBeginEnd("\\beginn{theorem}x\\endd{theorem}"));
    }

    @Test
    void normalizeBeginEnd_leavesGroupingPrimitivesAlone() {
        String text = "\\begingroup{theorem}\\endgroup{theorem}\\endcsname{lemma}";
        assertEquals(text, MacroNormalizer.normalizeBeginEnd(text));
        assertEquals("\\begin{claim}", MacroNormalizer.normalizeBeginEnd("\\begingrp{claim}"));
    }
}
