package com.theoremextractor;

import java.util.List;

/**
 * A user-defined text substitution rule.
 *
 * @param name control sequence including the backslash, e.g. {@code \foo}
 * @param arity number of positional parameters, 0..9
 * @param body replacement template with {@code #1..#9} placeholders
 * @param optionalDefault default for the first parameter when it is optional
 *     ({@code \newcommand{\foo}[2][x]{...}}), otherwise {@code null}
 */
public record MacroDefinition(String name, int arity, String body, String optionalDefault) {

    public MacroDefinition {
        if (name == null || name.length() < 2 || name.charAt(0) != '\\') {
            throw new IllegalArgumentException("Macro name must be a control sequence: " + name);
        }
        if (arity < 0 || arity > 9) {
            throw new IllegalArgumentException("Arity out of range for " + name + ": " + arity);
        }
        if (optionalDefault != null && arity == 0) {
            throw new IllegalArgumentException("Optional default given for parameterless " + name);
        }
        body = body == null ? "" : body;
    }

    public MacroDefinition(String name, int arity, String body) {
        this(name, arity, body, null);
    }

    public boolean hasOptionalArgument() {
        return optionalDefault != null;
    }

    /**
     * Fills the body template. Placeholders are replaced in one left-to-right scan, so argument
     * text that itself contains {@code #n} is never substituted a second time.
     */
    public String instantiate(List<String> args) {
        if (arity == 0) return body;

        StringBuilder out = new StringBuilder(body.length() + 16);
        int n = body.length();
        for (int i = 0; i < n; i++) {
            char c = body.charAt(i);
            if (c == '#' && i + 1 < n) {
                char d = body.charAt(i + 1);
                if (d >= '1' && d <= '9' && d - '1' < args.size()) {
                    out.append(args.get(d - '1'));
                    i++;
                    continue;
                }
            }
            out.append(c);
        }
        return out.toString();
    }
}
