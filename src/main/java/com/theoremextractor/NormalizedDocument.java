package com.theoremextractor;

import java.util.List;

/**
 * Output of {@link MacroNormalizer}: the fully expanded text, the declared theorem environments
 * in declaration order, and the recoverable problems met on the way.
 */
public record NormalizedDocument(String text, List<TheoremDeclaration> declarations, List<String> warnings) {

    public NormalizedDocument {
        text = text == null ? "" : text;
        declarations = List.copyOf(declarations);
        warnings = List.copyOf(warnings);
    }
}
