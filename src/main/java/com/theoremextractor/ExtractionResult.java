package com.theoremextractor;

import java.util.List;

/**
 * Full output of {@link TheoremExtractor#extractDetailed(String)}.
 *
 * @param theorems main-matter records followed by appendix records
 * @param mainCount number of main-matter records
 * @param appendixCount number of appendix records
 * @param warnings recoverable problems met while processing, in the order they occurred
 */
public record ExtractionResult(List<TheoremRecord> theorems, int mainCount, int appendixCount, List<String> warnings) {

    public ExtractionResult {
        theorems = List.copyOf(theorems);
        warnings = List.copyOf(warnings);
    }

    public boolean isEmpty() {
        return theorems.isEmpty();
    }

    public List<TheoremRecord> main() {
        return theorems.subList(0, mainCount);
    }

    public List<TheoremRecord> appendix() {
        return theorems.subList(mainCount, theorems.size());
    }
}
