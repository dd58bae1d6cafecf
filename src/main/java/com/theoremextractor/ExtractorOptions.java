package com.theoremextractor;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;

/**
 * Tunable settings of the extractor.
 *
 * <p>Defaults live in the classpath resource {@value #RESOURCE}; a properties file given on the
 * command line overrides individual keys.
 *
 * @param defaultEnvironments environments scanned when a document declares none
 * @param alphaRoots counters printed as letters in the appendix
 * @param headnoteInTitle move {@code \begin{thm}[note]} into the title
 * @param batchThreads documents processed at once by {@link BatchExtractor}
 * @param batchTimeoutSeconds time allowed per document
 */
public record ExtractorOptions(
        List<String> defaultEnvironments,
        Set<String> alphaRoots,
        boolean headnoteInTitle,
        int batchThreads,
        int batchTimeoutSeconds
) {

    public static final String RESOURCE = "theorem-extractor.properties";

    static final String KEY_DEFAULT_ENVIRONMENTS = "extractor.default-environments";
    static final String KEY_ALPHA_ROOTS = "extractor.alpha-roots";
    static final String KEY_HEADNOTE_IN_TITLE = "extractor.headnote-in-title";
    static final String KEY_BATCH_THREADS = "extractor.batch.threads";
    static final String KEY_BATCH_TIMEOUT = "extractor.batch.timeout-seconds";

    public ExtractorOptions {
        defaultEnvironments = List.copyOf(defaultEnvironments);
        alphaRoots = Set.copyOf(alphaRoots);
        if (batchThreads < 1) {
            throw new IllegalArgumentException(KEY_BATCH_THREADS + " must be >= 1, not " + batchThreads);
        }
        if (batchTimeoutSeconds < 1) {
            throw new IllegalArgumentException(KEY_BATCH_TIMEOUT + " must be >= 1, not " + batchTimeoutSeconds);
        }
    }

    public static ExtractorOptions defaults() {
        return new ExtractorOptions(EnvironmentSet.DEFAULT_ENVIRONMENTS, Set.of("section"), true, 4, 60);
    }

    /**
     * Reads the bundled defaults; falls back to {@link #defaults()} when the resource is missing.
     */
    public static ExtractorOptions load() throws IOException {
        Properties props = new Properties();
        try (InputStream in = ExtractorOptions.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) return defaults();
            props.load(in);
        }
        return fromProperties(props);
    }

    /**
     * Bundled defaults overridden by the keys present in {@code file}.
     */
    public static ExtractorOptions load(Path file) throws IOException {
        ExtractorOptions base = load();
        Properties props = new Properties();
        try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            props.load(in);
        }
        return base.with(props);
    }

    public static ExtractorOptions fromProperties(Properties props) {
        return defaults().with(props);
    }

    /**
     * Copy of these options with the keys present in {@code props} applied.
     */
    public ExtractorOptions with(Properties props) {
        List<String> envs = props.containsKey(KEY_DEFAULT_ENVIRONMENTS)
                ? splitList(props.getProperty(KEY_DEFAULT_ENVIRONMENTS))
                : defaultEnvironments;
        Set<String> roots = props.containsKey(KEY_ALPHA_ROOTS)
                ? new LinkedHashSet<>(splitList(props.getProperty(KEY_ALPHA_ROOTS)))
                : alphaRoots;
        boolean headnote = props.containsKey(KEY_HEADNOTE_IN_TITLE)
                ? Boolean.parseBoolean(props.getProperty(KEY_HEADNOTE_IN_TITLE).trim())
                : headnoteInTitle;
        int threads = parseInt(props, KEY_BATCH_THREADS, batchThreads);
        int timeout = parseInt(props, KEY_BATCH_TIMEOUT, batchTimeoutSeconds);
        return new ExtractorOptions(envs, roots, headnote, threads, timeout);
    }

    private static int parseInt(Properties props, String key, int fallback) {
        String v = props.getProperty(key);
        if (v == null || v.isBlank()) return fallback;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number: " + v, e);
        }
    }

    private static List<String> splitList(String value) {
        List<String> out = new ArrayList<>();
        if (value == null) return out;
        for (String part : value.split(",")) {
            String p = part.trim();
            if (!p.isEmpty()) out.add(p);
        }
        return out;
    }
}
