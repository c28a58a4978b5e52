package im.arun.docoutline.service;

import im.arun.docoutline.model.DocumentOutline;
import im.arun.docoutline.util.JsonFiles;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Outlines many documents in parallel and writes one {@code <stem>.json} per document. Each
 * document has its own timeout, counted from when a worker starts it. Failures are isolated:
 * a failed document is logged and produces no output file, the rest of the batch continues.
 */
public class BatchProcessor {
    private static final Logger logger = LoggerFactory.getLogger(BatchProcessor.class);

    private final OutlineService outlineService;
    private final ExecutorService executor;

    public BatchProcessor(OutlineService outlineService, ExecutorService executor) {
        this.outlineService = outlineService;
        this.executor = executor;
    }

    public BatchReport process(List<Path> pdfs, Path outputDir, Duration timeout) {
        ScheduledExecutorService deadlines = Executors.newSingleThreadScheduledExecutor(task -> {
            Thread thread = new Thread(task, "docoutline-deadline");
            thread.setDaemon(true);
            return thread;
        });
        try {
            Map<Path, CompletableFuture<Path>> futures = new LinkedHashMap<>();
            for (Path pdf : pdfs) {
                DocumentTask task = new DocumentTask(pdf, outputDir, timeout, deadlines);
                executor.execute(task);
                futures.put(pdf, task.result);
            }

            List<Path> written = new ArrayList<>();
            Map<Path, String> failures = new LinkedHashMap<>();
            futures.forEach((pdf, future) -> {
                try {
                    written.add(future.join());
                } catch (CompletionException e) {
                    String reason = describe(e.getCause() != null ? e.getCause() : e);
                    logger.error("Failed to process {}: {}", pdf.getFileName(), reason);
                    failures.put(pdf, reason);
                }
            });
            return new BatchReport(written, failures);
        } finally {
            deadlines.shutdownNow();
        }
    }

    /**
     * One document on a worker thread. The deadline starts when a worker picks the document
     * up, not when it is queued; an overrun fails the result and interrupts the worker. The
     * interrupt is only delivered while this task still owns the thread.
     */
    private final class DocumentTask implements Runnable {
        private final Path pdf;
        private final Path outputDir;
        private final Duration timeout;
        private final ScheduledExecutorService deadlines;
        private final CompletableFuture<Path> result = new CompletableFuture<>();

        private Thread worker;
        private boolean finished;

        DocumentTask(Path pdf, Path outputDir, Duration timeout, ScheduledExecutorService deadlines) {
            this.pdf = pdf;
            this.outputDir = outputDir;
            this.timeout = timeout;
            this.deadlines = deadlines;
        }

        @Override
        public void run() {
            long started = System.nanoTime();
            synchronized (this) {
                worker = Thread.currentThread();
            }
            ScheduledFuture<?> deadline = deadlines.schedule(this::expire, timeout.toMillis(), TimeUnit.MILLISECONDS);
            try {
                DocumentOutline outline = outlineService.extractOutline(pdf);
                synchronized (this) {
                    // a timed out document writes nothing
                    if (!result.isDone()) {
                        result.complete(write(pdf, outline, outputDir));
                    }
                }
                if (!result.isCompletedExceptionally()) {
                    logger.info("Processed {} in {} ms", pdf.getFileName(),
                        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
                }
            } catch (Exception e) {
                result.completeExceptionally(e);
            } finally {
                deadline.cancel(false);
                synchronized (this) {
                    finished = true;
                    if (!result.isDone()) {
                        result.completeExceptionally(new IllegalStateException("Processing stopped unexpectedly"));
                    }
                }
                Thread.interrupted();
            }
        }

        private synchronized void expire() {
            if (!finished && result.completeExceptionally(new TimeoutException("Exceeded " + timeout.toMillis() + " ms"))) {
                logger.debug("Interrupting {} after {} ms", pdf.getFileName(), timeout.toMillis());
                worker.interrupt();
            }
        }
    }

    private static Path write(Path pdf, DocumentOutline outline, Path outputDir) {
        Path target = outputDir.resolve(JsonFiles.baseName(pdf) + ".json");
        try {
            JsonFiles.writeAtomically(target, outline);
            return target;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String describe(Throwable error) {
        if (error instanceof TimeoutException) {
            return "timed out";
        }
        if (error instanceof UncheckedIOException && error.getCause() != null) {
            error = error.getCause();
        }
        return error.getClass().getSimpleName() + ": " + error.getMessage();
    }

    @Value
    public static class BatchReport {
        List<Path> written;
        Map<Path, String> failures;

        public boolean hasFailures() {
            return !failures.isEmpty();
        }
    }
}
