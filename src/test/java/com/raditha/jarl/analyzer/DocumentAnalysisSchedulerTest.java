package com.raditha.jarl.analyzer;

import com.raditha.jarl.analyzer.DocumentAnalysisScheduler.PublishedDiagnostics;
import com.raditha.jarl.config.JarlConfig;
import com.raditha.jarl.rules.RuleNames;
import com.raditha.jarl.rules.RuleTable;
import com.raditha.jarl.syntax.ParseException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for DocumentAnalysisScheduler - only the latest version is published.
 */
class DocumentAnalysisSchedulerTest {

    private static final String URI = "file:///project/R/a.R";

    private final List<PublishedDiagnostics> published = new CopyOnWriteArrayList<>();

    private static LintAnalyzer realAnalyzer() {
        RuleTable table = RuleTable.defaults();
        return new LintAnalyzer(table, JarlConfig.defaults(table));
    }

    @Test
    void testPublishesDiagnostics() throws Exception {
        try (DocumentAnalysisScheduler scheduler = new DocumentAnalysisScheduler(realAnalyzer(), published::add)) {
            scheduler.submit(URI, 1, "browser()\n").get(5, TimeUnit.SECONDS);
        }
        assertEquals(1, published.size());
        PublishedDiagnostics result = published.get(0);
        assertEquals(URI, result.uri());
        assertEquals(1, result.version());
        assertEquals(RuleNames.BROWSER, result.diagnostics().get(0).rule());
    }

    @Test
    void testParseErrorPublished() throws Exception {
        try (DocumentAnalysisScheduler scheduler = new DocumentAnalysisScheduler(realAnalyzer(), published::add)) {
            scheduler.submit(URI, 1, "f(").get(5, TimeUnit.SECONDS);
        }
        assertEquals(RuleNames.PARSE_ERROR, published.get(0).diagnostics().get(0).rule());
    }

    @Test
    void testStaleVersionIgnored() throws Exception {
        try (DocumentAnalysisScheduler scheduler = new DocumentAnalysisScheduler(realAnalyzer(), published::add)) {
            scheduler.submit(URI, 3, "x <- 1\n").get(5, TimeUnit.SECONDS);
            Future<?> stale = scheduler.submit(URI, 2, "browser()\n");
            assertTrue(stale.isDone());
            assertTrue(scheduler.isLatest(URI, 3));
        }
        assertEquals(1, published.size());
        assertEquals(3, published.get(0).version());
    }

    @Test
    void testSupersededVersionNotPublished() throws Exception {
        LintAnalyzer analyzer = mock(LintAnalyzer.class);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(analyzer.lintText(eq("slow"), anyBoolean())).thenAnswer(invocation -> {
            started.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return List.of();
        });
        when(analyzer.lintText(eq("fast"), anyBoolean())).thenReturn(List.of());

        try (DocumentAnalysisScheduler scheduler = new DocumentAnalysisScheduler(analyzer, published::add,
                Executors.newFixedThreadPool(2))) {
            Future<?> first = scheduler.submit(URI, 1, "slow");
            assertTrue(started.await(5, TimeUnit.SECONDS));
            scheduler.submit(URI, 2, "fast").get(5, TimeUnit.SECONDS);
            release.countDown();
            assertTrue(first.isCancelled());
        }
        assertEquals(1, published.size());
        assertEquals(2, published.get(0).version());
    }

    @Test
    void testForget() throws ParseException, InterruptedException, ExecutionException, TimeoutException {
        LintAnalyzer analyzer = mock(LintAnalyzer.class);
        when(analyzer.lintText(anyString(), anyBoolean())).thenReturn(List.of());
        try (DocumentAnalysisScheduler scheduler = new DocumentAnalysisScheduler(analyzer, published::add)) {
            scheduler.submit(URI, 1, "x").get(5, TimeUnit.SECONDS);
            assertTrue(scheduler.isLatest(URI, 1));
            scheduler.forget(URI);
            assertFalse(scheduler.isLatest(URI, 1));
        }
        verify(analyzer).lintText("x", false);
    }

    @Test
    void testDocumentsDetectedByExtension() throws Exception {
        LintAnalyzer analyzer = mock(LintAnalyzer.class);
        when(analyzer.lintText(anyString(), anyBoolean())).thenReturn(List.of());
        try (DocumentAnalysisScheduler scheduler = new DocumentAnalysisScheduler(analyzer, published::add)) {
            scheduler.submit("file:///project/report.qmd", 1, "text").get(5, TimeUnit.SECONDS);
        }
        verify(analyzer).lintText("text", true);
    }
}
