package com.theoremextractor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Picks the main {@code .tex} file of a source directory.
 *
 * <p>Candidates are the files with a {@code \documentclass} that no other file includes. When
 * several remain, the one that looks most like a finished paper wins: document structure, title
 * matter, sections, theorems and citations score up; beamer, referee replies and draft markers
 * score down.
 */
public final class MainTexLocator {

    private static final Logger log = LoggerFactory.getLogger(MainTexLocator.class);

    static final Pattern DOCUMENT_CLASS = Pattern.compile("(?m)^[^%\\n]*\\\\documentclass(\\[[^\\]\\n]*\\])?\\{[^}\\n]*\\}");
    static final Pattern INCLUDE = Pattern.compile("(?m)^[^%\\n]*\\\\(input|include|subfile)\\{([^}]+)\\}");

    private static final Pattern SECTION_LIKE = Pattern.compile("\\\\(section|subsection|subsubsection)(?![A-Za-z@])");
    private static final Pattern THEOREM_ENV = Pattern.compile("\\\\begin\\{(theorem|lemma|proposition|corollary|remark)\\}");
    private static final Pattern CITE = Pattern.compile("\\\\cite[tp]?\\{");

    private static final List<String> DRAFT_FILE_WORDS = List.of("draft", "notes", "slides", "talk", "reply", "response");
    private static final List<String> DRAFT_MACROS = List.of(
            "\\fixme", "\\FIXME", "\\todo", "\\TODO", "\\missingfigure", "\\XXX", "\\xx"
    );
    private static final List<String> DRAFT_TOKENS = List.of(
            "todo", "tbd", "fixme", "xxx", "fill in", "to be completed", "to be filled"
    );

    private MainTexLocator() {
    }

    /**
     * A {@code .tex} file with its decoded content.
     *
     * @param relative path relative to the searched root, used as the key of the inclusion graph
     */
    record Candidate(Path path, Path relative, String content) {}

    public static Optional<Path> locate(Path root) throws IOException {
        Map<Path, Candidate> candidates = findTexFiles(root);
        if (candidates.isEmpty()) return Optional.empty();

        Set<Path> included = includedFiles(candidates);

        List<Candidate> withClass = candidates.values().stream()
                .filter(c -> DOCUMENT_CLASS.matcher(c.content()).find())
                .collect(Collectors.toList());
        if (withClass.isEmpty()) {
            log.debug("No \\documentclass under {}", root);
            return Optional.empty();
        }

        List<Candidate> roots = withClass.stream()
                .filter(c -> !included.contains(c.relative()))
                .collect(Collectors.toList());
        if (roots.isEmpty()) roots = withClass;

        Candidate best = roots.size() == 1
                ? roots.get(0)
                : roots.stream()
                        .max(Comparator.comparingDouble(MainTexLocator::score)
                                .thenComparing(c -> c.relative().toString(), Comparator.reverseOrder()))
                        .orElseThrow();
        log.debug("Main file of {} is {} ({} candidates)", root, best.relative(), roots.size());
        return Optional.of(best.path());
    }

    static double score(Candidate candidate) {
        String c = candidate.content();
        double score = 0;

        if (c.contains("\\begin{document}")) score += 3;
        if (c.contains("\\end{document}")) score += 3;
        if (c.contains("\\title")) score += 2;
        if (c.contains("\\author")) score += 2;
        if (c.contains("\\maketitle")) score += 2;
        if (c.contains("\\begin{abstract}")) score += 2;

        score += 0.5 * count(SECTION_LIKE, c);
        score += 0.5 * count(THEOREM_ENV, c);
        score += 0.2 * count(CITE, c);

        long lines = c.chars().filter(ch -> ch == '\n').count();
        score += Math.min(lines / 200.0, 5.0);

        Matcher docClass = DOCUMENT_CLASS.matcher(c);
        String docClassLine = docClass.find() ? docClass.group().toLowerCase(Locale.ROOT) : "";
        if (docClassLine.contains("beamer")) score -= 5;
        if (docClassLine.contains("draft")) score -= 4;

        String fileName = candidate.relative().getFileName().toString().toLowerCase(Locale.ROOT);
        if (DRAFT_FILE_WORDS.stream().anyMatch(fileName::contains)) score -= 3;

        String lower = c.toLowerCase(Locale.ROOT);
        if (lower.contains("response to referee") || lower.contains("reply to referee")) score -= 5;
        if (DRAFT_MACROS.stream().anyMatch(c::contains)) score -= 8;
        if (DRAFT_TOKENS.stream().anyMatch(lower::contains)) score -= 4;

        return score;
    }

    private static Map<Path, Candidate> findTexFiles(Path root) throws IOException {
        Map<Path, Candidate> out = new LinkedHashMap<>();
        List<Path> files;
        try (Stream<Path> walk = Files.walk(root)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".tex"))
                    .sorted()
                    .collect(Collectors.toList());
        }
        for (Path file : files) {
            Path relative = root.relativize(file).normalize();
            try {
                out.put(relative, new Candidate(file, relative, TexSource.read(file)));
            } catch (DocumentDecodingException e) {
                log.warn("Skipping {}: {}", relative, e.getMessage());
            }
        }
        return out;
    }

    private static Set<Path> includedFiles(Map<Path, Candidate> candidates) {
        Set<Path> included = new HashSet<>();
        for (Candidate c : candidates.values()) {
            for (Path target : includeTargets(c)) {
                if (candidates.containsKey(target) && !target.equals(c.relative())) {
                    included.add(target);
                }
            }
        }
        return included;
    }

    private static List<Path> includeTargets(Candidate c) {
        List<Path> targets = new ArrayList<>();
        Path dir = c.relative().getParent();
        Matcher m = INCLUDE.matcher(c.content());
        while (m.find()) {
            String target = m.group(2).trim();
            if (!target.endsWith(".tex")) target = target + ".tex";
            targets.add((dir == null ? Path.of(target) : dir.resolve(target)).normalize());
        }
        return targets;
    }

    private static int count(Pattern p, String text) {
        Matcher m = p.matcher(text);
        int n = 0;
        while (m.find()) n++;
        return n;
    }
}
