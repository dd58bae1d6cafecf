package com.theoremextractor;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class TheoremExtractorJUnitTest {

    private final TheoremExtractor extractor = new TheoremExtractor();

    private static List<String> titles(List<TheoremRecord> records) {
        return records.stream().map(TheoremRecord::title).toList();
    }

    @Test
    void extract_defaultEnvironmentsWhenNothingDeclared() {
        String tex = """
                \\documentclass{article}
                \\begin{document}
                \\begin{theorem}Main.\\end{theorem}
                \\begin{lemma}Helper.\\end{lemma}
                \\appendix
                \\section{Proofs}
                \\begin{lemma}Technical.\\end{lemma}
                \\end{document}
                """;
        var result = extractor.extractDetailed(tex);
        assertEquals(2, result.mainCount());
        assertEquals(1, result.appendixCount());
        assertEquals(List.of("Theorem 1.", "Lemma 1.", "Lemma 1."), titles(result.theorems()));
        assertEquals("Technical.", result.appendix().get(0).body());
    }

    @Test
    void extract_defMacroExpandedInBody() {
        String tex = """
                \\def\\foo#1{bar #1}
                \\begin{document}
                \\begin{theorem}\\foo{baz}\\end{theorem}
                \\end{document}
                """;
        assertEquals("bar baz", extractor.extract(tex).get(0).body());
    }

    @Test
    void extract_sharedCounterNumbersConsecutively() {
        String tex = """
                \\newtheorem{thm}{Theorem}
                \\newtheorem{lem}[thm]{Lemma}
                \\begin{document}
                \\begin{thm}A\\end{thm}
                \\begin{lem}B\\end{lem}
                \\end{document}
                """;
        var records = extractor.extract(tex);
        assertEquals(List.of("Theorem 1.", "Lemma 2."), titles(records));
        assertEquals("A", records.get(0).body());
        assertEquals("B", records.get(1).body());
    }

    @Test
    void extract_withinSectionResets() {
        String tex = """
                \\newtheorem{thm}{Theorem}[section]
                \\begin{document}
                \\section{One}
                \\begin{thm}A\\end{thm}
                \\section{Two}
                \\begin{thm}B\\end{thm}
                \\end{document}
                """;
        assertEquals(List.of("Theorem 1.1.", "Theorem 2.1."), titles(extractor.extract(tex)));
    }

    @Test
    void extract_appendixNumbersAlphabetically() {
        String tex = """
                \\newtheorem{theorem}{Theorem}[section]
                \\begin{document}
                \\section{Intro}
                \\begin{theorem}Main.\\end{theorem}
                \\appendix
                \\section{App}
                \\begin{theorem}Extra.\\end{theorem}
                \\end{document}
                """;
        var records = extractor.extract(tex);
        assertEquals("Theorem 1.1.", records.get(0).title());
        assertEquals("Theorem A.1.", records.get(1).title());
    }

    @Test
    void extract_duplicateLabelBindsToLaterOccurrence() {
        String tex = """
                \\begin{document}
                \\begin{theorem}Copy one.\\label{x}\\end{theorem}
                \\begin{theorem}Copy two.\\label{x}\\end{theorem}
                \\end{document}
                """;
        var records = extractor.extract(tex);
        assertNull(records.get(0).label());
        assertEquals("x", records.get(1).label());
        assertFalse(records.get(0).hasLabel());
    }

    @Test
    void extract_countMatchesOccurrencesAndBodiesAreLabelFree() {
        String tex = """
                \\newtheorem{thm}{Theorem}[section]
                \\newtheorem{prop}[thm]{Proposition}
                \\newtheorem*{rem}{Remark}
                \\begin{document}
                \\section{S}
                \\begin{thm}\\label{a} One.\\end{thm}
                \\begin{rem}Unnumbered.\\label{r}\\end{rem}
                \\begin{prop}Two.
                \\label{b}
                \\end{prop}
                \\appendix
                \\section{T}
                \\begin{prop}Three.\\label{c}\\end{prop}
                \\end{document}
                """;
        var doc = MacroNormalizer.normalize(tex);
        var envs = EnvironmentSet.resolve(doc.declarations(), EnvironmentSet.DEFAULT_ENVIRONMENTS);
        var located = OccurrenceLocator.locate(doc.text(), envs);

        var records = extractor.extract(tex);
        assertEquals(located.main().size() + located.appendix().size(), records.size());
        assertEquals(List.of("Theorem 1.1.", "Remark", "Proposition 1.2.", "Proposition A.1."), titles(records));
        for (TheoremRecord r : records) {
            assertFalse(r.body().contains("\\label"), r.body());
        }
        assertEquals(List.of("a", "r", "b", "c"), records.stream().map(TheoremRecord::label).toList());
    }

    @Test
    void extract_headNoteMovesIntoTitle() {
        String tex = "\\begin{theorem}[Cauchy--Schwarz] $|\\langle x,y\\rangle| \\le \\|x\\|\\|y\\|$.\\end{theorem}";
        var record = extractor.extract(tex).get(0);
        assertEquals("Theorem 1. (Cauchy--Schwarz)", record.title());
        assertTrue(record.body().startsWith("$|"));
    }

    @Test
    void extract_headNoteKeptInBodyWhenDisabled() {
        Properties props = new Properties();
        props.setProperty("extractor.headnote-in-title", "false");
        var plain = new TheoremExtractor(ExtractorOptions.fromProperties(props));
        var record = plain.extract("\\begin{theorem}[Cauchy] Body.\\end{theorem}").get(0);
        assertEquals("Theorem 1.", record.title());
        assertEquals("[Cauchy] Body.", record.body());
    }

    @Test
    void extract_customEnvironmentsThroughMacrosAndWrappers() {
        String tex = """
                \\newtheorem{thm}{Theorem}
                \\newenvironment{mainthm}{\\begin{thm}}{\\end{thm}}
                \\newcommand{\\bthm}{\\begin{thm}}
                \\newcommand{\\ethm}{\\end{thm}}
                \\begin{document}
                \\bthm First.\\ethm
                \\begin{mainthm}Second.\\end{mainthm}
                \\end{document}
                """;
        var records = extractor.extract(tex);
        assertEquals(List.of("Theorem 1.", "Theorem 2."), titles(records));
        assertEquals("First.", records.get(0).body());
        assertEquals("Second.", records.get(1).body());
    }

    @Test
    void extract_nothingToExtract() {
        var result = extractor.extractDetailed("\\begin{document}Just prose.\\end{document}");
        assertTrue(result.isEmpty());
        assertTrue(extractor.extract("").isEmpty());
        assertTrue(extractor.extract(null).isEmpty());
    }

    @Test
    void extract_unbalancedRegionsReportMismatch() {
        var result = extractor.extractDetailed("\\begin{theorem}a\\begin{theorem}b\\end{theorem}");
        assertEquals(2, result.theorems().size());
        assertTrue(result.warnings().stream().anyMatch(w -> w.contains("numbering may be approximate")));
    }

    @Test
    void extract_recoverableProblemsSurfaceAsWarnings() {
        String tex = """
                \\def\\loop{\\loop}
                \\newtheorem{thm}{Theorem}
                \\newtheorem{thm}{Again}
                \\begin{document}
                \\begin{thm}\\loop\\end{thm}
                \\end{document}
                """;
        var result = extractor.extractDetailed(tex);
        assertEquals(1, result.theorems().size());
        assertEquals("\\loop", result.theorems().get(0).body());
        assertEquals(2, result.warnings().size());
    }

    @Test
    void extract_nestedRegionsKeepTheirOwnLabels() {
        String tex = """
                \\begin{document}
                \\begin{theorem}Outer \\begin{lemma}Inner\\label{in}\\end{lemma} more\\label{out}\\end{theorem}
                \\end{document}
                """;
        var records = extractor.extract(tex);
        assertEquals(List.of("Theorem 1.", "Lemma 1."), titles(records));
        assertEquals("Outer \\begin{lemma}Inner\\end{lemma} more", records.get(0).body());
        assertEquals("out", records.get(0).label());
        assertEquals("Inner", records.get(1).body());
        assertEquals("in", records.get(1).label());
    }

    @Test
    void extract_groupingPrimitiveIsNotAnOccurrence() {
        String tex = """
                \\begin{document}
                \\begingroup{theorem}\\endgroup
                \\begin{theorem}Only.\\end{theorem}
                \\end{document}
                """;
        var result = extractor.extractDetailed(tex);
        assertEquals(List.of("Theorem 1."), titles(result.theorems()));
        assertEquals("Only.", result.theorems().get(0).body());
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void extract_defInsideCommandBodyKeepsParameters() {
        String tex = """
                \\newcommand{\\setname}[1]{\\def\\thename{#1}}
                \\begin{document}
                \\begin{theorem}Let $\\setname{x}$ hold.\\end{theorem}
                \\end{document}
                """;
        var result = extractor.extractDetailed(tex);
        String body = result.theorems().get(0).body();
        assertFalse(body.contains("#1"));
        assertEquals("Let $\\def\\thename{x}$ hold.", body);
    }
}
