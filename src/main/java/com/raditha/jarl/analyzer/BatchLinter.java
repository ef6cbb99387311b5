package com.raditha.jarl.analyzer;

import com.raditha.jarl.model.Diagnostic;
import com.raditha.jarl.rules.RuleNames;
import com.raditha.jarl.syntax.TextRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Lints many files on a fixed pool of workers.
 * <p>
 * Workers share only the immutable analyzer. Reports come back in input
 * order whatever order the workers finish in.
 */
public class BatchLinter {

    private static final Logger logger = LoggerFactory.getLogger(BatchLinter.class);

    private final LintAnalyzer analyzer;
    private final int threads;

    public BatchLinter(LintAnalyzer analyzer) {
        this(analyzer, Runtime.getRuntime().availableProcessors());
    }

    public BatchLinter(LintAnalyzer analyzer, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1");
        }
        this.analyzer = analyzer;
        this.threads = threads;
    }

    /**
     * Lint every file, one report per file in the same order.
     */
    public List<FileReport> lint(List<Path> files) throws InterruptedException {
        if (files.isEmpty()) {
            return List.of();
        }
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, files.size()));
        try {
            List<Callable<FileReport>> tasks = new ArrayList<>();
            for (Path file : files) {
                tasks.add(() -> analyzer.analyzeFile(file));
            }
            List<Future<FileReport>> futures = executor.invokeAll(tasks);

            List<FileReport> reports = new ArrayList<>(files.size());
            for (int i = 0; i < files.size(); i++) {
                reports.add(collect(files.get(i), futures.get(i)));
            }
            logger.debug("Linted {} file(s) on {} thread(s)", files.size(), threads);
            return reports;
        } finally {
            executor.shutdownNow();
        }
    }

    private static FileReport collect(Path file, Future<FileReport> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.error("Unexpected failure while linting {}", file, cause);
            return FileReport.failed(file, "", Diagnostic.of(RuleNames.PARSE_ERROR,
                    "Internal error: " + cause.getMessage(), TextRange.empty(0)));
        }
    }
}
