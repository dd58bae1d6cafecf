package com.theoremextractor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds theorem-like environment declarations in expanded LaTeX source.
 *
 * <p>Recognised forms:
 * <ul>
 *   <li>{@code \newtheorem{env}[shared]{Caption}[within]}, {@code \newtheorem*{env}{Caption}},
 *       with an optional beamer overlay {@code <...>}</li>
 *   <li>{@code \declaretheorem[name=..., sibling=..., within=..., numbered=no]{env}}</li>
 *   <li>{@code \spnewtheorem} (LLNCS) and {@code \newmdtheoremenv} (mdframed)</li>
 *   <li>{@code \newaliascnt{alias}{target}} counter aliases</li>
 *   <li>{@code \newenvironment{name}{...\begin{env}...}{...}} wrappers around declared environments</li>
 * </ul>
 */
public final class TheoremDeclarationScanner {

    private static final Logger log = LoggerFactory.getLogger(TheoremDeclarationScanner.class);

    private static final Pattern NEWTHEOREM = Pattern.compile(
            "\\\\newtheorem(?![A-Za-z@])\\s*(\\*)?\\s*(?:<[^>]*>)?"
    );

    private static final Pattern SPNEWTHEOREM = Pattern.compile(
            "\\\\spnewtheorem(?![A-Za-z@])\\s*(\\*)?"
    );

    private static final Pattern NEWMDTHEOREMENV = Pattern.compile(
            "\\\\newmdtheoremenv(?![A-Za-z@])"
    );

    private static final Pattern DECLARETHEOREM = Pattern.compile(
            "\\\\declaretheorem(?![A-Za-z@])"
    );

    private static final Pattern NEWALIASCNT = Pattern.compile(
            "\\\\newaliascnt\\s*\\{\\s*([A-Za-z@]+)\\s*\\}\\s*\\{\\s*([A-Za-z@]+)\\s*\\}"
    );

    private static final Pattern NEWENVIRONMENT = Pattern.compile(
            "\\\\(?:re)?newenvironment(?![A-Za-z@])\\s*\\*?"
    );

    private TheoremDeclarationScanner() {
    }

    /**
     * Scans every declaration form in source order. The first declaration of a name wins.
     */
    public static List<TheoremDeclaration> scan(String text, List<String> warnings) {
        List<Found> found = new ArrayList<>();
        scanNewTheorem(text, found, warnings);
        scanSpNewTheorem(text, found, warnings);
        scanMdTheoremEnv(text, found, warnings);
        scanDeclareTheorem(text, found, warnings);
        found.sort((a, b) -> Integer.compare(a.offset(), b.offset()));

        Map<String, TheoremDeclaration> byName = new LinkedHashMap<>();
        for (Found f : found) {
            TheoremDeclaration d = f.declaration();
            if (byName.containsKey(d.name())) {
                warn(warnings, "Environment '" + d.name() + "' already defined; keeping the first declaration");
                continue;
            }
            byName.put(d.name(), d);
        }

        log.debug("Found {} theorem declarations", byName.size());
        return new ArrayList<>(byName.values());
    }

    /**
     * Reads {@code \newaliascnt} pairs, alias to target.
     */
    public static Map<String, String> scanAliases(String text) {
        Map<String, String> aliases = new LinkedHashMap<>();
        Matcher m = NEWALIASCNT.matcher(text);
        while (m.find()) {
            aliases.put(m.group(1), m.group(2));
        }
        return aliases;
    }

    /**
     * Rewrites each declaration's shared counter through the alias table, following chains of
     * aliases to their canonical counter.
     */
    public static List<TheoremDeclaration> resolveAliases(List<TheoremDeclaration> declarations, Map<String, String> aliases) {
        if (aliases.isEmpty()) return declarations;

        List<TheoremDeclaration> resolved = new ArrayList<>(declarations.size());
        for (TheoremDeclaration d : declarations) {
            if (d.shared() == null || !aliases.containsKey(d.shared())) {
                resolved.add(d);
                continue;
            }
            String target = d.shared();
            Set<String> seen = new HashSet<>();
            while (aliases.containsKey(target) && seen.add(target)) {
                target = aliases.get(target);
            }
            resolved.add(d.withShared(target));
        }
        return resolved;
    }

    /**
     * Adds a declaration for every {@code \newenvironment} whose begin code opens an environment
     * already known to be theorem-like. The wrapper numbers in the wrapped environment's counter
     * stream and shows its caption. Wrappers may wrap earlier wrappers.
     */
    public static List<TheoremDeclaration> resolveWrappers(String text, List<TheoremDeclaration> declarations, List<String> warnings) {
        Map<String, TheoremDeclaration> known = new LinkedHashMap<>();
        for (TheoremDeclaration d : declarations) {
            known.put(d.name(), d);
        }

        Matcher m = NEWENVIRONMENT.matcher(text);
        int from = 0;
        while (m.find(from)) {
            from = m.end();

            BraceMatcher.Group name = BraceMatcher.readGroup(text, m.end());
            if (name == null) continue;
            int pos = name.end();

            BraceMatcher.Group count = BraceMatcher.readOptional(text, pos);
            if (count != null) {
                pos = count.end();
                BraceMatcher.Group def = BraceMatcher.readOptional(text, pos);
                if (def != null) pos = def.end();
            }

            BraceMatcher.Group begin = BraceMatcher.readGroup(text, pos);
            if (begin == null) {
                warn(warnings, "Unmatched brace in \\newenvironment{" + name.content() + "}; skipped");
                continue;
            }
            BraceMatcher.Group end = BraceMatcher.readGroup(text, begin.end());
            if (end != null) from = end.end();

            String envName = name.content().trim();
            if (envName.isEmpty() || known.containsKey(envName)) continue;

            TheoremDeclaration wrapped = findWrapped(begin.content(), known);
            if (wrapped == null) continue;

            TheoremDeclaration synthesized = new TheoremDeclaration(
                    envName, wrapped.caption(), wrapped.starred(),
                    wrapped.starred() ? null : wrapped.counter(), null);
            known.put(envName, synthesized);
            log.debug("Environment '{}' wraps theorem environment '{}'", envName, wrapped.name());
        }

        return new ArrayList<>(known.values());
    }

    private static TheoremDeclaration findWrapped(String beginCode, Map<String, TheoremDeclaration> known) {
        for (TheoremDeclaration d : known.values()) {
            Pattern viaBegin = Pattern.compile("\\\\begin\\s*\\{\\s*" + Pattern.quote(d.name()) + "\\s*\\}");
            if (viaBegin.matcher(beginCode).find()) return d;

            Pattern viaPrimitive = Pattern.compile("\\\\" + Pattern.quote(d.name()) + "(?![A-Za-z@])");
            if (viaPrimitive.matcher(beginCode).find()) return d;
        }
        return null;
    }

    private record Found(int offset, TheoremDeclaration declaration) {}

    // \newtheorem{env}[shared]{Caption}[within] / \newtheorem*{env}{Caption}
    private static void scanNewTheorem(String text, List<Found> found, List<String> warnings) {
        Matcher m = NEWTHEOREM.matcher(text);
        while (m.find()) {
            boolean starred = m.group(1) != null;
            BraceMatcher.Group env = BraceMatcher.readGroup(text, m.end());
            if (env == null) continue;

            int pos = env.end();
            BraceMatcher.Group shared = BraceMatcher.readOptional(text, pos);
            if (shared != null) pos = shared.end();

            BraceMatcher.Group caption = BraceMatcher.readGroup(text, pos);
            if (caption == null) {
                warn(warnings, "\\newtheorem{" + env.content() + "} has no caption; skipped");
                continue;
            }
            BraceMatcher.Group within = BraceMatcher.readOptional(text, caption.end());

            add(found, m.start(), env.content(), caption.content(), starred,
                    shared == null ? null : shared.content(),
                    within == null ? null : within.content(), warnings);
        }
    }

    // \spnewtheorem{env}[shared]{Caption}[within]{headfont}{bodyfont}
    private static void scanSpNewTheorem(String text, List<Found> found, List<String> warnings) {
        Matcher m = SPNEWTHEOREM.matcher(text);
        while (m.find()) {
            boolean starred = m.group(1) != null;
            BraceMatcher.Group env = BraceMatcher.readGroup(text, m.end());
            if (env == null) continue;

            int pos = env.end();
            BraceMatcher.Group shared = BraceMatcher.readOptional(text, pos);
            if (shared != null) pos = shared.end();

            BraceMatcher.Group caption = BraceMatcher.readGroup(text, pos);
            if (caption == null) continue;
            BraceMatcher.Group within = BraceMatcher.readOptional(text, caption.end());

            add(found, m.start(), env.content(), caption.content(), starred,
                    shared == null ? null : shared.content(),
                    within == null ? null : within.content(), warnings);
        }
    }

    // \newmdtheoremenv[options]{env}[shared]{Caption}[within]
    private static void scanMdTheoremEnv(String text, List<Found> found, List<String> warnings) {
        Matcher m = NEWMDTHEOREMENV.matcher(text);
        while (m.find()) {
            int pos = m.end();
            BraceMatcher.Group options = BraceMatcher.readOptional(text, pos);
            if (options != null) pos = options.end();

            BraceMatcher.Group env = BraceMatcher.readGroup(text, pos);
            if (env == null) continue;
            pos = env.end();

            BraceMatcher.Group shared = BraceMatcher.readOptional(text, pos);
            if (shared != null) pos = shared.end();

            BraceMatcher.Group caption = BraceMatcher.readGroup(text, pos);
            if (caption == null) continue;
            BraceMatcher.Group within = BraceMatcher.readOptional(text, caption.end());

            add(found, m.start(), env.content(), caption.content(), false,
                    shared == null ? null : shared.content(),
                    within == null ? null : within.content(), warnings);
        }
    }

    // \declaretheorem[key=value,...]{env} or \declaretheorem{env}[key=value,...]
    private static void scanDeclareTheorem(String text, List<Found> found, List<String> warnings) {
        Matcher m = DECLARETHEOREM.matcher(text);
        while (m.find()) {
            int pos = m.end();
            BraceMatcher.Group options = BraceMatcher.readOptional(text, pos);
            if (options != null) pos = options.end();

            BraceMatcher.Group env = BraceMatcher.readGroup(text, pos);
            if (env == null) continue;
            if (options == null) {
                options = BraceMatcher.readOptional(text, env.end());
            }

            Map<String, String> keys = options == null ? Map.of() : parseKeyValues(options.content());
            String caption = firstOf(keys, "name", "title");
            String shared = firstOf(keys, "sibling", "sharenumber", "numberlike");
            String within = firstOf(keys, "within", "numberwithin", "parent");
            boolean starred = "no".equalsIgnoreCase(keys.getOrDefault("numbered", ""));

            add(found, m.start(), env.content(), caption, starred, shared, within, warnings);
        }
    }

    private static void add(List<Found> found, int offset, String env, String caption, boolean starred,
                            String shared, String within, List<String> warnings) {
        String name = env.trim();
        if (name.isEmpty()) return;

        if (starred) {
            // unnumbered environments have no counter to share or reset
            shared = null;
            within = null;
        }

        TheoremDeclaration declaration;
        try {
            declaration = new TheoremDeclaration(name, stripBraces(caption), starred, shared, within);
        } catch (IllegalArgumentException e) {
            warn(warnings, e.getMessage() + "; ignoring within=[" + within + "]");
            declaration = new TheoremDeclaration(name, stripBraces(caption), false, shared, null);
        }
        found.add(new Found(offset, declaration));
    }

    /**
     * Splits {@code key=value} options on top-level commas. Keys are lower-cased; values lose one
     * layer of surrounding braces.
     */
    static Map<String, String> parseKeyValues(String options) {
        Map<String, String> out = new LinkedHashMap<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i <= options.length(); i++) {
            char c = i < options.length() ? options.charAt(i) : ',';
            if (c == '{') depth++;
            else if (c == '}') depth = Math.max(0, depth - 1);
            else if (c == ',' && depth == 0) {
                String item = options.substring(start, i);
                int eq = item.indexOf('=');
                if (eq > 0) {
                    String key = item.substring(0, eq).trim().toLowerCase(Locale.ROOT);
                    out.putIfAbsent(key, stripBraces(item.substring(eq + 1)));
                }
                start = i + 1;
            }
        }
        return out;
    }

    private static String firstOf(Map<String, String> keys, String... names) {
        for (String n : names) {
            String v = keys.get(n);
            if (v != null && !v.isBlank()) return v;
        }
        return null;
    }

    private static String stripBraces(String value) {
        if (value == null) return null;
        String v = value.trim();
        if (v.length() >= 2 && v.charAt(0) == '{' && BraceMatcher.findClosing(v, 1) == v.length() - 1) {
            v = v.substring(1, v.length() - 1).trim();
        }
        return v;
    }

    private static void warn(List<String> warnings, String message) {
        log.warn(message);
        warnings.add(message);
    }
}
