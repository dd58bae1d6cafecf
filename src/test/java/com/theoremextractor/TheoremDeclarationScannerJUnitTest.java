package com.theoremextractor;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TheoremDeclarationScannerJUnitTest {

    @Test
    void scan_newtheoremForms() {
        String text = """
                \\newtheorem{thm}{Theorem}[section]
                \\newtheorem{lem}[thm]{Lemma}
                \\newtheorem*{rem}{Remark}
                \\newtheorem<+->{fact}{Fact}
                """;
        var decls = TheoremDeclarationScanner.scan(text, new ArrayList<>());
        assertEquals(4, decls.size());

        assertEquals("thm", decls.get(0).name());
        assertEquals("section", decls.get(0).within());

        assertEquals("Lemma", decls.get(1).caption());
        assertEquals("thm", decls.get(1).shared());

        assertTrue(decls.get(2).starred());
        assertEquals("Remark", decls.get(2).caption());

        assertEquals("fact", decls.get(3).name());
    }

    @Test
    void scan_declaretheoremKeys() {
        String text = """
                \\declaretheorem[name=Proposition, sibling=thm]{prop}
                \\declaretheorem{conj}[numberwithin=section]
                \\declaretheorem[numbered=no, name={Main Theorem}]{mainthm}
                """;
        var decls = TheoremDeclarationScanner.scan(text, new ArrayList<>());
        assertEquals(3, decls.size());

        assertEquals("Proposition", decls.get(0).caption());
        assertEquals("thm", decls.get(0).shared());

        assertEquals("Conj", decls.get(1).caption());
        assertEquals("section", decls.get(1).within());

        assertTrue(decls.get(2).starred());
        assertEquals("Main Theorem", decls.get(2).caption());
    }

    @Test
    void scan_llncsAndMdframed() {
        String text = """
                \\spnewtheorem{case}{Case}{\\itshape}{\\rmfamily}
                \\newmdtheoremenv[linecolor=red]{boxthm}{Theorem}
                """;
        var decls = TheoremDeclarationScanner.scan(text, new ArrayList<>());
        assertEquals(List.of("case", "boxthm"), List.of(decls.get(0).name(), decls.get(1).name()));
        assertEquals("Case", decls.get(0).caption());
        assertEquals("Theorem", decls.get(1).caption());
    }

    @Test
    void scan_duplicateKeepsFirst() {
        List<String> warnings = new ArrayList<>();
        var decls = TheoremDeclarationScanner.scan("\\newtheorem{thm}{Theorem}\\newtheorem{thm}{Other}", warnings);
        assertEquals(1, decls.size());
        assertEquals("Theorem", decls.get(0).caption());
        assertTrue(warnings.get(0).contains("already defined"));
    }

    @Test
    void scan_sharedAndWithinKeepsShared() {
        List<String> warnings = new ArrayList<>();
        var decls = TheoremDeclarationScanner.scan("\\newtheorem{odd}[thm]{Odd}[section]", warnings);
        assertEquals("thm", decls.get(0).shared());
        assertNull(decls.get(0).within());
        assertEquals(1, warnings.size());
    }

    @Test
    void resolveAliases_followsChains() {
        var lem = new TheoremDeclaration("lem", "Lemma", false, "a", null);
        var resolved = TheoremDeclarationScanner.resolveAliases(List.of(lem), Map.of("a", "b", "b", "thm"));
        assertEquals("thm", resolved.get(0).shared());
    }

    @Test
    void resolveWrappers_primitiveCallAndStarredTarget() {
        var decls = List.of(
                TheoremDeclaration.numbered("thm", "Theorem"),
                new TheoremDeclaration("rem", "Remark", true, null, null));
        String text = """
                \\newenvironment{boxedthm}[1][]{\\thm\\textbf{#1}}{\\endthm}
                \\renewenvironment{note}{\\begin{rem}}{\\end{rem}}
                \\newenvironment{plain}{\\bfseries}{}
                """;
        var out = TheoremDeclarationScanner.resolveWrappers(text, decls, new ArrayList<>());
        assertEquals(4, out.size());
        assertEquals("thm", out.get(2).shared());
        assertTrue(out.get(3).starred());
        assertNull(out.get(3).shared());
    }

    @Test
    void parseKeyValues_topLevelCommasOnly() {
        var kv = TheoremDeclarationScanner.parseKeyValues("Name={A, B}, sibling=thm");
        assertEquals("A, B", kv.get("name"));
        assertEquals("thm", kv.get("sibling"));
    }
}
