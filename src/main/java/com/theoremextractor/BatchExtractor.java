package com.theoremextractor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Extracts many documents concurrently, each with its own timeout.
 *
 * <p>A fixed pool of supervisors hands every document to a worker thread and waits at most the
 * configured time for it. A document that fails or runs out of time becomes an
 * {@link DocumentOutcome.Status#UNPARSABLE} or {@link DocumentOutcome.Status#TIMED_OUT} outcome;
 * it never stops the rest of the batch. Outcomes come back in input order.
 *
 * <p>Timing out cancels the worker with an interrupt, but regex matching does not check for
 * interrupts, so a runaway document keeps its worker busy until it finishes on its own. The worker
 * pool is therefore fixed at twice the supervisor count: up to that many runaway documents can
 * linger beside live ones, and once every worker is stuck the next documents wait for a free worker
 * inside their own timeout.
 */
public final class BatchExtractor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BatchExtractor.class);

    /**
     * Turns one input path into an extraction result.
     */
    @FunctionalInterface
    interface DocumentTask {
        ExtractionResult run(Path source) throws Exception;
    }

    static final int WORKERS_PER_SUPERVISOR = 2;

    private final ExecutorService supervisors;
    private final ExecutorService workers;
    private final DocumentTask task;
    private final long timeoutMillis;

    public BatchExtractor(TheoremExtractor extractor) {
        this(extractor.options().batchThreads(), extractor.options().batchTimeoutSeconds() * 1000L,
                source -> extractor.extractDetailed(loadDocument(source)));
    }

    BatchExtractor(int threads, long timeoutMillis, DocumentTask task) {
        this.supervisors = Executors.newFixedThreadPool(threads, daemonThreads("batch-supervisor"));
        this.workers = Executors.newFixedThreadPool(threads * WORKERS_PER_SUPERVISOR, daemonThreads("batch-worker"));
        this.task = task;
        this.timeoutMillis = timeoutMillis;
    }

    public List<DocumentOutcome> extractAll(List<Path> sources) throws InterruptedException {
        List<Future<DocumentOutcome>> pending = new ArrayList<>(sources.size());
        for (Path source : sources) {
            pending.add(supervisors.submit(() -> supervise(source)));
        }

        List<DocumentOutcome> outcomes = new ArrayList<>(sources.size());
        for (int i = 0; i < pending.size(); i++) {
            try {
                outcomes.add(pending.get(i).get());
            } catch (ExecutionException e) {
                // supervise() catches everything a document can throw; this is a bug in the driver
                log.error("Supervisor failed for {}", sources.get(i), e.getCause());
                outcomes.add(DocumentOutcome.failed(sources.get(i), DocumentOutcome.Status.UNPARSABLE,
                        String.valueOf(e.getCause())));
            }
        }
        return outcomes;
    }

    /**
     * Reads a document: a {@code .tex} file as is, a directory through its main file with includes inlined.
     */
    public static String loadDocument(Path source) throws IOException {
        if (!Files.isDirectory(source)) {
            return ImportInliner.inline(source);
        }
        Path main = MainTexLocator.locate(source)
                .orElseThrow(() -> new IOException("No main .tex file in " + source));
        return ImportInliner.inline(main);
    }

    private DocumentOutcome supervise(Path source) throws InterruptedException {
        Future<ExtractionResult> work = workers.submit(() -> task.run(source));
        try {
            ExtractionResult result = work.get(timeoutMillis, TimeUnit.MILLISECONDS);
            log.debug("{}: {} theorems", source, result.theorems().size());
            return DocumentOutcome.of(source, result);
        } catch (TimeoutException e) {
            work.cancel(true);
            log.error("{}: timed out after {} ms", source, timeoutMillis);
            return DocumentOutcome.failed(source, DocumentOutcome.Status.TIMED_OUT,
                    "Timed out after " + timeoutMillis + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Error error) {
                throw error;
            }
            log.error("{}: unparsable", source, cause);
            return DocumentOutcome.failed(source, DocumentOutcome.Status.UNPARSABLE, String.valueOf(cause.getMessage()));
        }
    }

    @Override
    public void close() {
        supervisors.shutdownNow();
        workers.shutdownNow();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
