package com.theoremextractor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point of the engine: LaTeX source in, numbered theorem records out.
 *
 * <p>Pure and deterministic. Holds only its options, so one instance may be shared between
 * threads; all counter state lives in the call.
 *
 * <pre>{@code
 * List<TheoremRecord> records = new TheoremExtractor().extract(tex);
 * }</pre>
 */
public final class TheoremExtractor {

    private static final Logger log = LoggerFactory.getLogger(TheoremExtractor.class);

    private final ExtractorOptions options;

    public TheoremExtractor() {
        this(ExtractorOptions.defaults());
    }

    public TheoremExtractor(ExtractorOptions options) {
        this.options = options == null ? ExtractorOptions.defaults() : options;
    }

    public ExtractorOptions options() {
        return options;
    }

    public List<TheoremRecord> extract(String documentText) {
        return extractDetailed(documentText).theorems();
    }

    public ExtractionResult extractDetailed(String documentText) {
        NormalizedDocument doc = MacroNormalizer.normalize(documentText);
        List<String> warnings = new ArrayList<>(doc.warnings());

        EnvironmentSet environments = EnvironmentSet.resolve(doc.declarations(), options.defaultEnvironments());
        LocatedOccurrences located = OccurrenceLocator.locate(doc.text(), environments);
        if (located.size() == 0) {
            log.debug("No theorem-like regions ({} environments)", environments.source());
            return new ExtractionResult(List.of(), 0, 0, warnings);
        }

        NumberingEngine.NumberedTitles titles =
                NumberingEngine.number(doc.text(), environments, located, options, warnings);
        BodyExtractor.Extraction bodies =
                BodyExtractor.extract(doc.text(), environments, options.headnoteInTitle());

        List<TheoremRecord> records = new ArrayList<>(located.size());
        bundle("main matter", titles.main(), bodies.main(), records, warnings);
        int mainCount = records.size();
        bundle("appendix", titles.appendix(), bodies.appendix(), records, warnings);

        log.debug("Extracted {} theorems ({} in appendix)", records.size(), records.size() - mainCount);
        return new ExtractionResult(records, mainCount, records.size() - mainCount, warnings);
    }

    // one record per numbered title; bodies are matched by position
    private static void bundle(String region, List<String> titles, List<ExtractedBody> bodies,
                               List<TheoremRecord> out, List<String> warnings) {
        if (titles.size() != bodies.size()) {
            String message = "Found " + bodies.size() + " bodies but numbered " + titles.size()
                    + " occurrences in the " + region + "; numbering may be approximate";
            log.warn(message);
            warnings.add(message);
        }
        for (int i = 0; i < titles.size(); i++) {
            ExtractedBody b = i < bodies.size() ? bodies.get(i) : null;
            out.add(new TheoremRecord(titles.get(i), b == null ? "" : b.body(), b == null ? null : b.label()));
        }
    }
}
