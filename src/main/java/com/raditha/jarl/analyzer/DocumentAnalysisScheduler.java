package com.raditha.jarl.analyzer;

import com.raditha.jarl.document.RmdChunkExtractor;
import com.raditha.jarl.model.Diagnostic;
import com.raditha.jarl.syntax.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Consumer;

/**
 * Analyzes open editor documents in the background.
 * <p>
 * Each new version of a document cancels the analysis of the previous one.
 * A result is published only while its version is still the latest known
 * for that document, so stale diagnostics never reach the editor.
 */
public class DocumentAnalysisScheduler implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DocumentAnalysisScheduler.class);

    private final LintAnalyzer analyzer;
    private final Consumer<PublishedDiagnostics> publisher;
    private final ExecutorService executor;
    private final Map<String, Submission> latest = new HashMap<>();

    /**
     * Diagnostics of one document version.
     */
    public record PublishedDiagnostics(String uri, int version, List<Diagnostic> diagnostics) {
    }

    private record Submission(int version, Future<?> future) {
    }

    public DocumentAnalysisScheduler(LintAnalyzer analyzer, Consumer<PublishedDiagnostics> publisher) {
        this(analyzer, publisher, Executors.newFixedThreadPool(Runtime.getRuntime().availableProcessors()));
    }

    DocumentAnalysisScheduler(LintAnalyzer analyzer, Consumer<PublishedDiagnostics> publisher,
            ExecutorService executor) {
        this.analyzer = analyzer;
        this.publisher = publisher;
        this.executor = executor;
    }

    /**
     * Schedule analysis of a document version. Versions older than the
     * latest one already submitted are ignored.
     *
     * @return the scheduled analysis
     */
    public synchronized Future<?> submit(String uri, int version, String text) {
        Submission previous = latest.get(uri);
        if (previous != null) {
            if (previous.version() > version) {
                logger.debug("Ignoring stale version {} of {}", version, uri);
                return CompletableFuture.completedFuture(null);
            }
            previous.future().cancel(true);
        }
        Future<?> future = executor.submit(() -> analyze(uri, version, text));
        latest.put(uri, new Submission(version, future));
        return future;
    }

    /**
     * Forget a closed document, cancelling any analysis in flight.
     */
    public synchronized void forget(String uri) {
        Submission previous = latest.remove(uri);
        if (previous != null) {
            previous.future().cancel(true);
        }
    }

    public synchronized boolean isLatest(String uri, int version) {
        Submission current = latest.get(uri);
        return current != null && current.version() == version;
    }

    private void analyze(String uri, int version, String text) {
        List<Diagnostic> diagnostics;
        try {
            diagnostics = analyzer.lintText(text, RmdChunkExtractor.isDocument(Path.of(fileName(uri))));
        } catch (ParseException e) {
            diagnostics = List.of(LintAnalyzer.parseError(e, text));
        }
        if (Thread.currentThread().isInterrupted()) {
            return;
        }
        synchronized (this) {
            if (!isLatest(uri, version)) {
                logger.debug("Discarding result for superseded version {} of {}", version, uri);
                return;
            }
            publisher.accept(new PublishedDiagnostics(uri, version, diagnostics));
        }
    }

    private static String fileName(String uri) {
        int slash = uri.lastIndexOf('/');
        return slash >= 0 ? uri.substring(slash + 1) : uri;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
