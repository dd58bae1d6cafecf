package com.theoremextractor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the body and label out of every theorem-like region.
 *
 * <p>All environments are first rewritten to one canonical tag pair so a single scan returns
 * every region in document order. Labels are bound walking the regions backwards: when two regions
 * carry the same label, the later one keeps it and the earlier one is returned unlabelled.
 */
public final class BodyExtractor {

    private static final Logger log = LoggerFactory.getLogger(BodyExtractor.class);

    public static final String CANONICAL_TAG = "thmextract@region";

    private static final Pattern CANONICAL = Pattern.compile(
            "\\\\(begin|end)\\{" + Pattern.quote(CANONICAL_TAG) + "\\}"
    );

    private static final Pattern LINE_BREAK = Pattern.compile("\\s*\\n\\s*");
    private static final Pattern FIRST_LABEL = Pattern.compile("\\\\label\\s*\\{([^{}]+)\\}");
    private static final Pattern ANY_LABEL = Pattern.compile("\\\\label\\s*\\{[^{}]*\\}");

    private BodyExtractor() {
    }

    /**
     * Bodies split at the appendix cut of the canonical text, each list in document order.
     */
    public record Extraction(List<ExtractedBody> main, List<ExtractedBody> appendix) {

        public Extraction {
            main = List.copyOf(main);
            appendix = List.copyOf(appendix);
        }

        public int size() {
            return main.size() + appendix.size();
        }
    }

    private record Region(int beginStart, int bodyStart, int bodyEnd) {}

    // canonical text plus the original tag text of every rewritten tag, in document order
    private record Canonical(String text, int[] tagStarts, List<String> originals) {

        // a tag already canonical in the source has no original and stays as is
        String original(int tagStart, String tag) {
            int i = Arrays.binarySearch(tagStarts, tagStart);
            return i < 0 ? tag : originals.get(i);
        }
    }

    public static Extraction extract(String text, EnvironmentSet environments, boolean stripHeadnote) {
        Canonical canonical = canonical(text, environments);
        List<Region> regions = regions(canonical.text());

        ExtractedBody[] bodies = new ExtractedBody[regions.size()];
        Set<String> seen = new HashSet<>();
        for (int i = regions.size() - 1; i >= 0; i--) {
            Region r = regions.get(i);
            int from = r.bodyStart();
            if (stripHeadnote) {
                from += headnoteLength(canonical.text().substring(r.bodyStart(), r.bodyEnd()));
            }
            StringBuilder full = new StringBuilder();
            StringBuilder own = new StringBuilder();
            restore(canonical, from, r.bodyEnd(), full, own);

            // only labels outside nested regions belong to this one
            String label = null;
            Matcher m = FIRST_LABEL.matcher(own);
            if (m.find()) {
                String candidate = m.group(1).trim();
                if (seen.add(candidate)) {
                    label = candidate;
                } else {
                    log.debug("Label {} already bound to a later region", candidate);
                }
            }
            String flat = LINE_BREAK.matcher(full).replaceAll(" ");
            String body = ANY_LABEL.matcher(flat).replaceAll("").trim();
            bodies[i] = new ExtractedBody(body, label, r.beginStart());
        }

        int cut = OccurrenceLocator.appendixOffset(canonical.text());
        List<ExtractedBody> main = new ArrayList<>();
        List<ExtractedBody> appendix = new ArrayList<>();
        for (ExtractedBody b : Arrays.asList(bodies)) {
            if (cut >= 0 && b.offset() >= cut) {
                appendix.add(b);
            } else {
                main.add(b);
            }
        }
        log.debug("Extracted {} main and {} appendix bodies", main.size(), appendix.size());
        return new Extraction(main, appendix);
    }

    /**
     * Rewrites {@code \begin{env}}/{@code \end{env}} of every scanned environment to the canonical tag.
     */
    static String canonicalize(String text, EnvironmentSet environments) {
        return canonical(text, environments).text();
    }

    private static Canonical canonical(String text, EnvironmentSet environments) {
        List<String> names = environments.names();
        if (names.isEmpty()) {
            return new Canonical(text, new int[0], List.of());
        }
        StringBuilder alternatives = new StringBuilder();
        for (String name : names) {
            if (alternatives.length() > 0) {
                alternatives.append('|');
            }
            alternatives.append(Pattern.quote(name));
        }
        Pattern tags = Pattern.compile("\\\\(begin|end)\\s*\\{\\s*(?:" + alternatives + ")\\s*\\}");

        StringBuilder out = new StringBuilder(text.length());
        List<Integer> starts = new ArrayList<>();
        List<String> originals = new ArrayList<>();
        Matcher m = tags.matcher(text);
        int copied = 0;
        while (m.find()) {
            out.append(text, copied, m.start());
            starts.add(out.length());
            originals.add(m.group());
            out.append('\\').append(m.group(1)).append('{').append(CANONICAL_TAG).append('}');
            copied = m.end();
        }
        out.append(text, copied, text.length());

        int[] tagStarts = new int[starts.size()];
        for (int i = 0; i < tagStarts.length; i++) {
            tagStarts[i] = starts.get(i);
        }
        return new Canonical(out.toString(), tagStarts, originals);
    }

    // copies [from, to) with nested canonical tags put back to their original form; own gets depth 0 text only
    private static void restore(Canonical canonical, int from, int to, StringBuilder full, StringBuilder own) {
        String text = canonical.text();
        Matcher m = CANONICAL.matcher(text);
        m.region(from, to);
        int depth = 0;
        int copied = from;
        while (m.find()) {
            full.append(text, copied, m.start());
            if (depth == 0) {
                own.append(text, copied, m.start());
            }
            full.append(canonical.original(m.start(), m.group()));
            depth = "begin".equals(m.group(1)) ? depth + 1 : Math.max(0, depth - 1);
            copied = m.end();
        }
        full.append(text, copied, to);
        if (depth == 0) {
            own.append(text, copied, to);
        }
    }

    // matched begin/end pairs after \begin{document}, nesting honoured, sorted by begin
    private static List<Region> regions(String canonical) {
        List<Region> regions = new ArrayList<>();
        Deque<int[]> open = new ArrayDeque<>();
        Matcher m = CANONICAL.matcher(canonical);
        m.region(OccurrenceLocator.documentStart(canonical), canonical.length());
        while (m.find()) {
            if ("begin".equals(m.group(1))) {
                open.push(new int[]{m.start(), m.end()});
            } else if (!open.isEmpty()) {
                int[] b = open.pop();
                regions.add(new Region(b[0], b[1], m.start()));
            }
        }
        regions.sort(Comparator.comparingInt(Region::beginStart));
        return regions;
    }

    private static int headnoteLength(String raw) {
        BraceMatcher.Group note = BraceMatcher.readOptional(raw, 0);
        return note == null ? 0 : note.end();
    }
}
