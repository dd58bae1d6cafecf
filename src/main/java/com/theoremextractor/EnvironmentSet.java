package com.theoremextractor;

import java.util.ArrayList;
import java.util.List;

/**
 * The theorem-like environments a document is scanned for, chosen once per document: the
 * declared ones when the document declares any, otherwise a fixed default list.
 */
public record EnvironmentSet(Source source, List<TheoremDeclaration> declarations) {

    public static final List<String> DEFAULT_ENVIRONMENTS = List.of(
            "theorem", "lemma", "proposition", "corollary", "claim", "definition", "remark", "example"
    );

    public enum Source {
        DECLARED,
        DEFAULT
    }

    public EnvironmentSet {
        declarations = List.copyOf(declarations);
    }

    public static EnvironmentSet resolve(List<TheoremDeclaration> declared, List<String> defaultNames) {
        if (!declared.isEmpty()) {
            return new EnvironmentSet(Source.DECLARED, declared);
        }
        List<TheoremDeclaration> defaults = new ArrayList<>(defaultNames.size());
        for (String name : defaultNames) {
            defaults.add(TheoremDeclaration.numbered(name, null));
        }
        return new EnvironmentSet(Source.DEFAULT, defaults);
    }

    public List<String> names() {
        List<String> names = new ArrayList<>(declarations.size());
        for (TheoremDeclaration d : declarations) {
            names.add(d.name());
        }
        return names;
    }
}
