package com.theoremextractor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds one buffer from a main file and the files it pulls in.
 *
 * <p>{@code \input}, {@code \include} and {@code \subfile} are replaced in place by the content of
 * their target, recursively. Targets resolve against the main file's directory first, then against
 * the including file's directory; a missing {@code .tex} extension is added. Local style files named
 * by a usepackage line are prepended, so macros and theorem declarations kept there are seen.
 * Unresolvable and cyclic includes are left untouched, and so are targets outside the main file's
 * directory tree.
 */
public final class ImportInliner {

    private static final Logger log = LoggerFactory.getLogger(ImportInliner.class);

    private static final Pattern INCLUDE = Pattern.compile(
            "\\\\(input|include|subfile)(?![A-Za-z@])\\s*\\{([^{}]+)\\}"
    );
    private static final Pattern USEPACKAGE = Pattern.compile(
            "\\\\usepackage(?![A-Za-z@])\\s*(?:\\[[^\\]]*\\]\\s*)?\\{([^{}]+)\\}"
    );

    private static final Pattern BEGIN_DOCUMENT = Pattern.compile("\\\\begin\\s*\\{document\\}");
    private static final Pattern END_DOCUMENT = Pattern.compile("\\\\end\\s*\\{document\\}");

    private ImportInliner() {
    }

    public static String inline(Path mainFile) throws IOException {
        Path root = mainFile.toAbsolutePath().normalize().getParent();
        String main = TexSource.read(mainFile);

        Set<Path> stack = new HashSet<>();
        stack.add(mainFile.toAbsolutePath().normalize());
        String body = inlineIncludes(main, root, root, stack);

        String packages = localPackages(body, root);
        return packages.isEmpty() ? body : packages + "\n" + body;
    }

    private static String inlineIncludes(String text, Path root, Path currentDir, Set<Path> stack) throws IOException {
        StringBuilder out = new StringBuilder(text.length());
        Matcher m = INCLUDE.matcher(text);
        int copied = 0;
        while (m.find()) {
            if (commentedOut(text, m.start())) continue;

            Path target = resolve(m.group(2).trim(), ".tex", root, currentDir);
            if (target == null) {
                log.debug("Cannot resolve {} target {}", m.group(1), m.group(2));
                continue;
            }
            if (!stack.add(target)) {
                log.warn("Not inlining {} again: include cycle", target);
                continue;
            }
            String included;
            try {
                String content = TexSource.read(target);
                if ("subfile".equals(m.group(1))) content = subfileBody(content);
                included = inlineIncludes(content, root, target.getParent(), stack);
            } finally {
                stack.remove(target);
            }
            out.append(text, copied, m.start()).append(included).append('\n');
            copied = m.end();
        }
        out.append(text, copied, text.length());
        return out.toString();
    }

    // a subfile is a complete document; only its document body belongs in the main file
    static String subfileBody(String content) {
        Matcher begin = BEGIN_DOCUMENT.matcher(content);
        if (!begin.find()) return content;
        Matcher end = END_DOCUMENT.matcher(content);
        int stop = end.find(begin.end()) ? end.start() : content.length();
        return content.substring(begin.end(), stop);
    }

    private static String localPackages(String text, Path root) throws IOException {
        StringBuilder out = new StringBuilder();
        Set<Path> seen = new HashSet<>();
        Matcher m = USEPACKAGE.matcher(text);
        while (m.find()) {
            if (commentedOut(text, m.start())) continue;
            for (String name : m.group(1).split(",")) {
                String trimmed = name.trim();
                if (trimmed.isEmpty()) continue;
                Path sty = resolve(trimmed, ".sty", root, root);
                if (sty != null && seen.add(sty)) {
                    log.debug("Prepending local package {}", sty.getFileName());
                    out.append(TexSource.read(sty)).append('\n');
                }
            }
        }
        return out.toString();
    }

    private static Path resolve(String target, String extension, Path root, Path currentDir) {
        String withExt = target.endsWith(extension) ? target : target + extension;
        List<Path> tries = new ArrayList<>();
        tries.add(root.resolve(withExt));
        if (!currentDir.equals(root)) tries.add(currentDir.resolve(withExt));
        tries.add(root.resolve(target));
        for (Path p : tries) {
            Path normalized = p.toAbsolutePath().normalize();
            if (!normalized.startsWith(root)) {
                log.debug("Skipping {}: outside {}", normalized, root);
                continue;
            }
            if (Files.isRegularFile(normalized)) return normalized;
        }
        return null;
    }

    // an unescaped % earlier on the same line
    static boolean commentedOut(String text, int pos) {
        int lineStart = text.lastIndexOf('\n', pos - 1) + 1;
        for (int p = lineStart; p < pos; p++) {
            char c = text.charAt(p);
            if (c == '\\') {
                p++;
            } else if (c == '%') {
                return true;
            }
        }
        return false;
    }
}
