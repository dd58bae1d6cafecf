package com.theoremextractor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collects macro definitions from LaTeX source and substitutes their call sites.
 *
 * <p>Collection removes each definition from the text, so a definition is never mistaken for a
 * call of the macro it defines. Substitution walks the text token by token: a control word is
 * always read to its full length, so {@code \foo} never matches inside {@code \foobar}.
 */
public final class MacroExpander {

    private static final Logger log = LoggerFactory.getLogger(MacroExpander.class);

    // \def, \edef, \gdef, \xdef with optional \long/\global/\protected/\outer prefixes
    private static final Pattern DEF_START = Pattern.compile(
            "(?:\\\\(?:long|global|protected|outer)(?![A-Za-z@])\\s*)*\\\\([egx]?)def(?![A-Za-z@])"
    );

    private static final Pattern COMMAND_START = Pattern.compile(
            "\\\\(newcommand|renewcommand|providecommand|DeclareRobustCommand)(?![A-Za-z@])\\s*\\*?"
    );

    private static final Pattern OPERATOR_START = Pattern.compile(
            "\\\\DeclareMathOperator(?![A-Za-z@])\\s*\\*?"
    );

    private static final Pattern PARAMETER_TEXT = Pattern.compile("(?:#[1-9])*");
    private static final Pattern PLACEHOLDER = Pattern.compile("(?<!#)#([1-9])");

    private MacroExpander() {
    }

    /**
     * Text with the collected definitions cut out, plus the definitions in source order.
     */
    public record Collected(String text, List<MacroDefinition> definitions) {}

    /**
     * Collects {@code \def}-family definitions. Arity is the number of {@code #} tokens in the
     * parameter text; delimited parameter text is not supported and leaves the definition alone.
     */
    public static Collected collectDefs(String text, List<String> warnings) {
        List<MacroDefinition> definitions = new ArrayList<>();
        StringBuilder out = new StringBuilder(text.length());
        Matcher m = DEF_START.matcher(text);
        int copied = 0;
        int from = 0;

        while (m.find(from)) {
            from = m.end();

            int nameStart = BraceMatcher.skipWhitespace(text, m.end());
            if (nameStart >= text.length() || text.charAt(nameStart) != '\\') {
                // active character definition such as \def~{...}
                continue;
            }
            int nameEnd = BraceMatcher.controlSequenceEnd(text, nameStart);
            String name = text.substring(nameStart, nameEnd);

            int brace = text.indexOf('{', nameEnd);
            if (brace < 0) {
                warn(warnings, "Definition of " + name + " has no body; dropped");
                continue;
            }
            String params = text.substring(nameEnd, brace).replaceAll("\\s+", "");
            if (!PARAMETER_TEXT.matcher(params).matches()) {
                warn(warnings, "Definition of " + name + " uses delimited parameters; not expanded");
                continue;
            }

            BraceMatcher.Group body = BraceMatcher.readGroup(text, brace);
            if (body == null) {
                warn(warnings, "Unmatched brace in definition of " + name + "; dropped");
                continue;
            }

            int arity = countHashes(params);
            if (highestPlaceholder(body.content()) > arity) {
                // parameters of an enclosing definition; left in place for that one to substitute
                log.debug("Definition of {} refers to outer parameters; left in place", name);
                continue;
            }
            definitions.add(new MacroDefinition(name, arity, body.content()));
            out.append(text, copied, m.start());
            copied = body.end();
            from = body.end();
        }

        out.append(text, copied, text.length());
        log.debug("Collected {} \\def-style macros", definitions.size());
        return new Collected(out.toString(), definitions);
    }

    /**
     * Collects {@code \newcommand}, {@code \renewcommand}, {@code \providecommand} and
     * {@code \DeclareRobustCommand} definitions. The name may be braced or bare; the arity comes
     * from the bracketed integer, and a second bracket group is the default of an optional first
     * parameter.
     */
    public static Collected collectCommands(String text, List<String> warnings) {
        List<MacroDefinition> definitions = new ArrayList<>();
        StringBuilder out = new StringBuilder(text.length());
        Matcher m = COMMAND_START.matcher(text);
        int copied = 0;
        int from = 0;

        while (m.find(from)) {
            from = m.end();

            NameAt name = readCommandName(text, m.end());
            if (name == null) {
                warn(warnings, "Could not read command name after \\" + m.group(1) + " at index " + m.start());
                continue;
            }

            int pos = name.end();
            int arity = 0;
            String optionalDefault = null;

            BraceMatcher.Group count = BraceMatcher.readOptional(text, pos);
            if (count != null) {
                try {
                    arity = Integer.parseInt(count.content().trim());
                } catch (NumberFormatException e) {
                    warn(warnings, "Bad argument count for " + name.name() + ": [" + count.content() + "]; dropped");
                    continue;
                }
                pos = count.end();

                BraceMatcher.Group def = BraceMatcher.readOptional(text, pos);
                if (def != null) {
                    optionalDefault = def.content();
                    pos = def.end();
                }
            }

            BraceMatcher.Group body = BraceMatcher.readGroup(text, pos);
            if (body == null) {
                warn(warnings, "Unmatched brace in definition of " + name.name() + "; dropped");
                continue;
            }

            MacroDefinition definition;
            try {
                definition = new MacroDefinition(name.name(), arity, body.content(), arity == 0 ? null : optionalDefault);
            } catch (IllegalArgumentException e) {
                warn(warnings, e.getMessage() + "; dropped");
                continue;
            }

            definitions.add(definition);
            out.append(text, copied, m.start());
            copied = body.end();
            from = body.end();
        }

        out.append(text, copied, text.length());
        log.debug("Collected {} \\newcommand-style macros", definitions.size());
        return new Collected(out.toString(), definitions);
    }

    /**
     * Collects {@code \DeclareMathOperator{\cmd}{text}}. Each operator becomes a parameterless
     * macro expanding to {@code \text{text}}.
     */
    public static Collected collectOperators(String text, List<String> warnings) {
        List<MacroDefinition> definitions = new ArrayList<>();
        StringBuilder out = new StringBuilder(text.length());
        Matcher m = OPERATOR_START.matcher(text);
        int copied = 0;
        int from = 0;

        while (m.find(from)) {
            from = m.end();

            NameAt name = readCommandName(text, m.end());
            if (name == null) {
                warn(warnings, "Could not read operator name at index " + m.start());
                continue;
            }
            BraceMatcher.Group body = BraceMatcher.readGroup(text, name.end());
            if (body == null) {
                warn(warnings, "Unmatched brace in operator " + name.name() + "; dropped");
                continue;
            }

            definitions.add(new MacroDefinition(name.name(), 0, "\\text{" + body.content() + "}"));
            out.append(text, copied, m.start());
            copied = body.end();
            from = body.end();
        }

        out.append(text, copied, text.length());
        return new Collected(out.toString(), definitions);
    }

    /**
     * Builds the expansion table: later definitions of a name replace earlier ones, macros that
     * reach themselves through their bodies are dropped, and the remaining bodies are expanded
     * against each other until nothing changes.
     */
    public static Map<String, MacroDefinition> resolve(List<MacroDefinition> definitions, List<String> warnings) {
        Map<String, MacroDefinition> table = new LinkedHashMap<>();
        for (MacroDefinition d : definitions) {
            table.put(d.name(), d);
        }

        Map<String, Set<String>> dependencies = new LinkedHashMap<>();
        for (MacroDefinition d : table.values()) {
            dependencies.put(d.name(), referencedNames(d.body(), table.keySet()));
        }

        Set<String> cyclic = new HashSet<>();
        for (String name : table.keySet()) {
            if (reaches(name, name, dependencies)) {
                cyclic.add(name);
            }
        }
        for (String name : cyclic) {
            table.remove(name);
            warn(warnings, "Macro " + name + " refers to itself; not expanded");
        }

        // Acyclic now, so each round settles at least one more level of nesting.
        for (int round = 0; round <= table.size(); round++) {
            boolean changed = false;
            for (Map.Entry<String, MacroDefinition> e : table.entrySet()) {
                MacroDefinition d = e.getValue();
                String expanded = expand(d.body(), table);
                if (!expanded.equals(d.body())) {
                    e.setValue(new MacroDefinition(d.name(), d.arity(), expanded, d.optionalDefault()));
                    changed = true;
                }
            }
            if (!changed) break;
        }

        return table;
    }

    /**
     * Replaces every call site of a macro in {@code table} with its instantiated body. A call site
     * is the macro name followed by its brace-delimited arguments (an optional first argument in
     * brackets when the macro has a default). Call sites lacking their arguments are left as is.
     * Replacement text is not rescanned.
     */
    public static String expand(String text, Map<String, MacroDefinition> table) {
        if (table.isEmpty() || text.indexOf('\\') < 0) return text;

        StringBuilder out = new StringBuilder(text.length());
        int n = text.length();
        int i = 0;

        while (i < n) {
            int backslash = text.indexOf('\\', i);
            if (backslash < 0) {
                out.append(text, i, n);
                break;
            }
            out.append(text, i, backslash);

            int csEnd = BraceMatcher.controlSequenceEnd(text, backslash);
            MacroDefinition d = table.get(text.substring(backslash, csEnd));
            if (d == null) {
                out.append(text, backslash, csEnd);
                i = csEnd;
                continue;
            }

            List<String> args = new ArrayList<>(d.arity());
            int pos = csEnd;
            int required = d.arity();
            if (d.hasOptionalArgument()) {
                BraceMatcher.Group opt = BraceMatcher.readOptional(text, pos);
                if (opt != null) {
                    args.add(opt.content());
                    pos = opt.end();
                } else {
                    args.add(d.optionalDefault());
                }
                required--;
            }

            boolean complete = true;
            for (int a = 0; a < required; a++) {
                BraceMatcher.Group arg = BraceMatcher.readGroup(text, pos);
                if (arg == null) {
                    complete = false;
                    break;
                }
                args.add(arg.content());
                pos = arg.end();
            }

            if (complete) {
                out.append(d.instantiate(args));
                i = pos;
            } else {
                out.append(text, backslash, csEnd);
                i = csEnd;
            }
        }

        return out.toString();
    }

    private record NameAt(String name, int end) {}

    // \name or {\name}
    private static NameAt readCommandName(String text, int pos) {
        int p = BraceMatcher.skipWhitespace(text, pos);
        if (p >= text.length()) return null;

        if (text.charAt(p) == '\\') {
            int end = BraceMatcher.controlSequenceEnd(text, p);
            return new NameAt(text.substring(p, end), end);
        }

        BraceMatcher.Group braced = BraceMatcher.readGroup(text, p);
        if (braced == null) return null;
        String name = braced.content().trim();
        if (name.length() < 2 || name.charAt(0) != '\\'
                || BraceMatcher.controlSequenceEnd(name, 0) != name.length()) {
            return null;
        }
        return new NameAt(name, braced.end());
    }

    private static Set<String> referencedNames(String body, Set<String> known) {
        Set<String> names = new HashSet<>();
        int i = body.indexOf('\\');
        while (i >= 0) {
            int end = BraceMatcher.controlSequenceEnd(body, i);
            String cs = body.substring(i, end);
            if (known.contains(cs)) names.add(cs);
            i = body.indexOf('\\', end);
        }
        return names;
    }

    private static boolean reaches(String from, String target, Map<String, Set<String>> dependencies) {
        Set<String> seen = new HashSet<>();
        List<String> stack = new ArrayList<>(dependencies.getOrDefault(from, Set.of()));
        while (!stack.isEmpty()) {
            String current = stack.remove(stack.size() - 1);
            if (current.equals(target)) return true;
            if (seen.add(current)) {
                stack.addAll(dependencies.getOrDefault(current, Set.of()));
            }
        }
        return false;
    }

    private static int highestPlaceholder(String body) {
        int highest = 0;
        Matcher m = PLACEHOLDER.matcher(body);
        while (m.find()) {
            highest = Math.max(highest, m.group(1).charAt(0) - '0');
        }
        return highest;
    }

    private static int countHashes(String params) {
        int count = 0;
        for (int i = 0; i < params.length(); i++) {
            if (params.charAt(i) == '#') count++;
        }
        return count;
    }

    private static void warn(List<String> warnings, String message) {
        log.warn(message);
        warnings.add(message);
    }
}
