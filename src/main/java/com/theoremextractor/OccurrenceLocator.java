package com.theoremextractor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds every theorem-like region in the expanded text and splits them into main matter and
 * appendix.
 *
 * <p>Only text after {@code \begin{document}} is scanned when the document has one, so
 * {@code \newenvironment} bodies in the preamble are never counted.
 */
public final class OccurrenceLocator {

    private static final Logger log = LoggerFactory.getLogger(OccurrenceLocator.class);

    private static final Pattern BEGIN_DOCUMENT = Pattern.compile("\\\\begin\\s*\\{document\\}");
    private static final Pattern BEGIN_APPENDIX = Pattern.compile("\\\\begin\\s*\\{appendix\\}");
    private static final Pattern APPENDIX = Pattern.compile("\\\\appendix(?![A-Za-z@])");

    private OccurrenceLocator() {
    }

    public static LocatedOccurrences locate(String text, EnvironmentSet environments) {
        int documentStart = documentStart(text);

        List<Occurrence> all = new ArrayList<>();
        for (String name : environments.names()) {
            Pattern begin = beginPattern(name);
            int lastEnd = lastEndStart(text, name);
            if (lastEnd < 0) continue;

            Matcher m = begin.matcher(text);
            m.region(documentStart, text.length());
            while (m.find()) {
                if (m.end() > lastEnd) break;
                all.add(new Occurrence(name, m.start(), Occurrence.Region.MAIN, 0, readNote(text, m.end())));
            }
        }
        all.sort(Comparator.comparingInt(Occurrence::offset));

        int cut = appendixOffset(text);
        int split = cut < 0 ? all.size() : lowerBound(all, cut);

        List<Occurrence> main = new ArrayList<>(split);
        for (int i = 0; i < split; i++) {
            Occurrence o = all.get(i);
            main.add(new Occurrence(o.environment(), o.offset(), Occurrence.Region.MAIN, i, o.note()));
        }
        List<Occurrence> appendix = new ArrayList<>(all.size() - split);
        for (int i = split; i < all.size(); i++) {
            Occurrence o = all.get(i);
            appendix.add(new Occurrence(o.environment(), o.offset(), Occurrence.Region.APPENDIX, i - split, o.note()));
        }

        log.debug("Located {} main and {} appendix occurrences ({} environments)",
                main.size(), appendix.size(), environments.source());
        return new LocatedOccurrences(main, appendix, cut);
    }

    /**
     * Index of {@code \begin{document}}, or 0 for a fragment without one.
     */
    public static int documentStart(String text) {
        Matcher m = BEGIN_DOCUMENT.matcher(text);
        return m.find() ? m.start() : 0;
    }

    /**
     * Index of the first {@code \begin{appendix}}, else of the first {@code \appendix}, else -1.
     */
    public static int appendixOffset(String text) {
        int from = documentStart(text);

        Matcher env = BEGIN_APPENDIX.matcher(text);
        if (env.find(from)) return env.start();

        Matcher cmd = APPENDIX.matcher(text);
        if (cmd.find(from)) return cmd.start();

        return -1;
    }

    static Pattern beginPattern(String name) {
        return Pattern.compile("\\\\begin\\s*\\{\\s*" + Pattern.quote(name) + "\\s*\\}");
    }

    static Pattern endPattern(String name) {
        return Pattern.compile("\\\\end\\s*\\{\\s*" + Pattern.quote(name) + "\\s*\\}");
    }

    // a \begin only counts when some \end of the same name follows it
    private static int lastEndStart(String text, String name) {
        Matcher m = endPattern(name).matcher(text);
        int last = -1;
        while (m.find()) {
            last = m.start();
        }
        return last;
    }

    static String readNote(String text, int afterBegin) {
        BraceMatcher.Group note = BraceMatcher.readOptional(text, afterBegin);
        if (note == null) return null;
        String content = note.content().trim();
        return content.isEmpty() ? null : content;
    }

    // first index whose offset is >= cut
    private static int lowerBound(List<Occurrence> sorted, int cut) {
        int lo = 0;
        int hi = sorted.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (sorted.get(mid).offset() < cut) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }
}
