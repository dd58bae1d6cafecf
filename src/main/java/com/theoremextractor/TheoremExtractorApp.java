package com.theoremextractor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line driver.
 *
 * <pre>
 * theorem-extractor [--config FILE] [--out DIR] INPUT...
 * </pre>
 *
 * Each INPUT is a {@code .tex} file or a directory holding a paper's sources. Every document that
 * parses gets {@code <name>.json} in the output directory, an array of {@code {title, body, label}}
 * objects. Re-running overwrites earlier output.
 */
public final class TheoremExtractorApp {

    private static final Logger log = LoggerFactory.getLogger(TheoremExtractorApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURES = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = "Usage: theorem-extractor [--config FILE] [--out DIR] INPUT...";

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public static void main(String[] args) {
        int code = new TheoremExtractorApp().run(args, System.out, System.err);
        System.exit(code);
    }

    int run(String[] args, PrintStream out, PrintStream err) {
        Path config = null;
        Path outDir = Path.of(".");
        List<Path> inputs = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if ("--help".equals(a) || "-h".equals(a)) {
                out.println(USAGE);
                return EXIT_OK;
            } else if ("--config".equals(a) || "--out".equals(a)) {
                if (i + 1 >= args.length) {
                    err.println(a + " needs a value");
                    err.println(USAGE);
                    return EXIT_USAGE;
                }
                Path value = Path.of(args[++i]);
                if ("--config".equals(a)) config = value; else outDir = value;
            } else if (a.startsWith("--")) {
                err.println("Unknown option: " + a);
                err.println(USAGE);
                return EXIT_USAGE;
            } else {
                inputs.add(Path.of(a));
            }
        }
        if (inputs.isEmpty()) {
            err.println(USAGE);
            return EXIT_USAGE;
        }

        ExtractorOptions options;
        try {
            options = config == null ? ExtractorOptions.load() : ExtractorOptions.load(config);
            Files.createDirectories(outDir);
        } catch (IOException | IllegalArgumentException e) {
            err.println("Cannot start: " + e.getMessage());
            return EXIT_USAGE;
        }

        List<DocumentOutcome> outcomes;
        try (BatchExtractor batch = new BatchExtractor(new TheoremExtractor(options))) {
            outcomes = batch.extractAll(inputs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Interrupted");
            return EXIT_FAILURES;
        }

        int failures = 0;
        int theorems = 0;
        for (DocumentOutcome o : outcomes) {
            if (!o.succeeded()) {
                failures++;
                out.printf("%-10s %s: %s%n", o.status(), o.source(), o.message());
                continue;
            }
            Path target = outDir.resolve(outputName(o.source()));
            try {
                mapper.writeValue(target.toFile(), o.theorems());
            } catch (IOException e) {
                log.error("Cannot write {}", target, e);
                failures++;
                out.printf("%-10s %s: cannot write %s%n", "FAILED", o.source(), target);
                continue;
            }
            theorems += o.theorems().size();
            out.printf("%-10s %s: %d theorems, %d warnings -> %s%n",
                    o.status(), o.source(), o.theorems().size(), o.warnings().size(), target);
        }
        out.printf("%d documents, %d theorems, %d failed%n", outcomes.size(), theorems, failures);
        return failures == 0 ? EXIT_OK : EXIT_FAILURES;
    }

    static String outputName(Path source) {
        Path fileName = source.toAbsolutePath().normalize().getFileName();
        String name = fileName == null ? "document" : fileName.toString();
        if (name.endsWith(".tex")) name = name.substring(0, name.length() - 4);
        return name + ".json";
    }
}
