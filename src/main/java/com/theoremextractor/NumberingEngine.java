package com.theoremextractor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Computes the heading of every located occurrence by replaying sectioning commands and theorem
 * environments in document order against a {@link TheoremNumberer}.
 *
 * <p>Main matter and appendix each get their own numberer, so counters restart at the appendix
 * and its root counters print as letters.
 */
public final class NumberingEngine {

    private static final Logger log = LoggerFactory.getLogger(NumberingEngine.class);

    private static final Pattern SECTIONING = Pattern.compile(
            "\\\\(chapter|section|subsection|subsubsection)(?![A-Za-z@])\\s*(\\*)?\\s*(?:\\[[^\\]]*\\]\\s*)?\\{"
    );

    private static final Pattern NUMBER_WITHIN = Pattern.compile(
            "\\\\(?:numberwithin|counterwithin\\*?)(?![A-Za-z@])\\s*(?:\\[[^\\]]*\\]\\s*)?"
                    + "\\{\\s*([A-Za-z@]+)\\s*\\}\\s*\\{\\s*([A-Za-z@]+)\\s*\\}"
    );

    private static final Pattern SWAP_NUMBERS = Pattern.compile("\\\\swapnumbers(?![A-Za-z@])");

    private NumberingEngine() {
    }

    /**
     * Headings for each region, positionally aligned with the occurrence lists.
     */
    public record NumberedTitles(List<String> main, List<String> appendix) {

        public NumberedTitles {
            main = List.copyOf(main);
            appendix = List.copyOf(appendix);
        }
    }

    public static NumberedTitles number(String text, EnvironmentSet environments, LocatedOccurrences occurrences,
                                        ExtractorOptions options, List<String> warnings) {
        List<StructuralMarker> markers = scanMarkers(text);
        boolean chapters = markers.stream()
                .anyMatch(m -> m.level() == StructuralMarker.Level.CHAPTER && !m.starred());
        boolean swapNumbers = SWAP_NUMBERS.matcher(text).find();
        List<CounterEdge> withinEdges = scanNumberWithin(text);

        Set<String> alphaRoots = new LinkedHashSet<>(options.alphaRoots());
        if (chapters && alphaRoots.remove("section")) {
            alphaRoots.add("chapter");
        }

        int cut = occurrences.appendixOffset();
        List<StructuralMarker> mainMarkers = new ArrayList<>();
        List<StructuralMarker> appendixMarkers = new ArrayList<>();
        for (StructuralMarker m : markers) {
            if (cut >= 0 && m.offset() >= cut) {
                appendixMarkers.add(m);
            } else {
                mainMarkers.add(m);
            }
        }

        TheoremNumberer mainNumberer = numberer(false, alphaRoots, swapNumbers, chapters, environments, withinEdges, warnings);
        List<String> main = replay(mainNumberer, mainMarkers, occurrences.main(), options);

        List<String> appendix = List.of();
        if (!occurrences.appendix().isEmpty()) {
            TheoremNumberer appendixNumberer = numberer(true, alphaRoots, swapNumbers, chapters, environments, withinEdges, null);
            appendix = replay(appendixNumberer, appendixMarkers, occurrences.appendix(), options);
        }

        log.debug("Numbered {} main and {} appendix occurrences", main.size(), appendix.size());
        return new NumberedTitles(main, appendix);
    }

    record CounterEdge(String child, String parent) {}

    /**
     * Sectioning commands after {@code \begin{document}}, in document order.
     */
    public static List<StructuralMarker> scanMarkers(String text) {
        List<StructuralMarker> markers = new ArrayList<>();
        Matcher m = SECTIONING.matcher(text);
        m.region(OccurrenceLocator.documentStart(text), text.length());
        while (m.find()) {
            markers.add(new StructuralMarker(StructuralMarker.Level.of(m.group(1)), m.start(), m.group(2) != null));
        }
        return markers;
    }

    static List<CounterEdge> scanNumberWithin(String text) {
        List<CounterEdge> edges = new ArrayList<>();
        Matcher m = NUMBER_WITHIN.matcher(text);
        while (m.find()) {
            edges.add(new CounterEdge(m.group(1), m.group(2)));
        }
        return edges;
    }

    private static TheoremNumberer numberer(boolean inAppendix, Set<String> alphaRoots, boolean swapNumbers,
                                            boolean chapters, EnvironmentSet environments,
                                            List<CounterEdge> withinEdges, List<String> warnings) {
        TheoremNumberer tn = new TheoremNumberer(inAppendix, alphaRoots, swapNumbers);

        if (chapters) {
            tn.numberWithin("section", "chapter");
        }
        tn.numberWithin("subsection", "section");
        tn.numberWithin("subsubsection", "subsection");

        for (TheoremDeclaration d : environments.declarations()) {
            tn.define(d);
        }
        for (CounterEdge edge : withinEdges) {
            if (!tn.numberWithin(edge.child(), edge.parent()) && warnings != null) {
                warn(warnings, "Ignoring \\numberwithin{" + edge.child() + "}{" + edge.parent() + "}: counters would form a cycle");
            }
        }
        return tn;
    }

    private static List<String> replay(TheoremNumberer tn, List<StructuralMarker> markers,
                                       List<Occurrence> occurrences, ExtractorOptions options) {
        List<String> titles = new ArrayList<>(occurrences.size());
        int mi = 0;
        for (Occurrence o : occurrences) {
            while (mi < markers.size() && markers.get(mi).offset() < o.offset()) {
                StructuralMarker marker = markers.get(mi++);
                if (!marker.starred()) {
                    tn.increment(marker.level().counter());
                }
            }
            titles.add(tn.begin(o.environment(), options.headnoteInTitle() ? o.note() : null));
        }
        return titles;
    }

    private static void warn(List<String> warnings, String message) {
        log.warn(message);
        warnings.add(message);
    }
}
