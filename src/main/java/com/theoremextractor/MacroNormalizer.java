package com.theoremextractor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Expands user macros and collects theorem declarations.
 *
 * <p>Passes run in a fixed order and each sees the previous one's output:
 * <ol>
 *   <li>comments</li>
 *   <li>{@code \def}, {@code \edef}, {@code \gdef}, {@code \xdef}</li>
 *   <li>{@code \newaliascnt} (applied to declarations once they are known)</li>
 *   <li>{@code \DeclareMathOperator}</li>
 *   <li>{@code \newcommand}, {@code \renewcommand}, {@code \providecommand}, {@code \DeclareRobustCommand}</li>
 *   <li>theorem declarations, then {@code \newenvironment} wrappers around them</li>
 * </ol>
 */
public final class MacroNormalizer {

    private static final Logger log = LoggerFactory.getLogger(MacroNormalizer.class);

    // TeX primitives that share the prefix and are never begin/end shorthands
    private static final String PRIMITIVES = "(?!(?:begingroup|endgroup|endinput|endcsname|endgraf|endlinechar)(?![a-zA-Z]))";

    // \begthm{x}, \beginn{x} -> \begin{x}; same for \end...
    private static final Pattern BEGIN_ALIAS =
            Pattern.compile("\\\\" + PRIMITIVES + "beg[a-zA-Z]*\\s*\\{([A-Za-z@]+\\*?)\\}");
    private static final Pattern END_ALIAS =
            Pattern.compile("\\\\" + PRIMITIVES + "end[a-zA-Z]*\\s*\\{([A-Za-z@]+\\*?)\\}");

    private MacroNormalizer() {
    }

    public static NormalizedDocument normalize(String raw) {
        List<String> warnings = new ArrayList<>();
        String text = CommentStripper.strip(raw);

        MacroExpander.Collected defs = MacroExpander.collectDefs(text, warnings);
        text = MacroExpander.expand(defs.text(), MacroExpander.resolve(defs.definitions(), warnings));

        Map<String, String> aliases = TheoremDeclarationScanner.scanAliases(text);

        MacroExpander.Collected operators = MacroExpander.collectOperators(text, warnings);
        text = MacroExpander.expand(operators.text(), MacroExpander.resolve(operators.definitions(), warnings));

        MacroExpander.Collected commands = MacroExpander.collectCommands(text, warnings);
        text = MacroExpander.expand(commands.text(), MacroExpander.resolve(commands.definitions(), warnings));

        text = normalizeBeginEnd(text);

        List<TheoremDeclaration> declarations = TheoremDeclarationScanner.scan(text, warnings);
        declarations = TheoremDeclarationScanner.resolveAliases(declarations, aliases);
        declarations = TheoremDeclarationScanner.resolveWrappers(text, declarations, warnings);

        log.debug("Normalized document: {} macros, {} operators, {} commands, {} declarations",
                defs.definitions().size(), operators.definitions().size(),
                commands.definitions().size(), declarations.size());
        return new NormalizedDocument(text, declarations, warnings);
    }

    static String normalizeBeginEnd(String text) {
        String begins = BEGIN_ALIAS.matcher(text).replaceAll("\\\\begin{$1}");
        return END_ALIAS.matcher(begins).replaceAll("\\\\end{$1}");
    }
}
