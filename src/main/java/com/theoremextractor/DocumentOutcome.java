package com.theoremextractor;

import java.nio.file.Path;
import java.util.List;

/**
 * What happened to one document of a batch.
 *
 * @param source the file or source directory that was given
 * @param message failure description for {@link Status#UNPARSABLE} and {@link Status#TIMED_OUT}, else {@code null}
 */
public record DocumentOutcome(Path source, Status status, List<TheoremRecord> theorems, List<String> warnings,
                              String message) {

    public enum Status {
        PARSED,
        EMPTY,
        UNPARSABLE,
        TIMED_OUT
    }

    public DocumentOutcome {
        theorems = List.copyOf(theorems);
        warnings = List.copyOf(warnings);
    }

    public static DocumentOutcome of(Path source, ExtractionResult result) {
        Status status = result.isEmpty() ? Status.EMPTY : Status.PARSED;
        return new DocumentOutcome(source, status, result.theorems(), result.warnings(), null);
    }

    public static DocumentOutcome failed(Path source, Status status, String message) {
        return new DocumentOutcome(source, status, List.of(), List.of(), message);
    }

    public boolean succeeded() {
        return status == Status.PARSED || status == Status.EMPTY;
    }
}
