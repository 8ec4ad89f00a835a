package com.dcgraph.extract;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dcgraph.index.GraphIndex;
import com.dcgraph.index.GraphIndexBuilder;
import com.dcgraph.lex.LexException;
import com.dcgraph.runtime.AppConfig;

public class ExtractionService {
    private static final Logger log = LoggerFactory.getLogger(ExtractionService.class);

    private final CallSiteExtractor extractor;
    private final SourceFileFinder finder;
    private final SkipDecision skipDecision;
    private final int workerThreads;

    public ExtractionService(ExtractionPolicy policy, String extension, int workerThreads, SkipDecision skipDecision) {
        this.extractor = new CallSiteExtractor(policy);
        this.finder = new SourceFileFinder(extension, skipDecision);
        this.skipDecision = skipDecision;
        this.workerThreads = workerThreads > 0 ? workerThreads : Runtime.getRuntime().availableProcessors();
    }

    public static ExtractionService fromConfig(AppConfig.ExtractionConfig config, SkipDecision skipDecision) {
        return new ExtractionService(
                ExtractionPolicy.from(config),
                config.getExtension(),
                config.getWorkerThreads(),
                skipDecision);
    }

    public ExtractionResult extract(List<Path> inputs) throws IOException {
        long start = System.nanoTime();
        SourceFileFinder.Discovery discovery = finder.find(inputs);
        List<Path> files = discovery.files();
        log.info("Parsing {} TCL files with {} worker(s)...", files.size(), Math.min(workerThreads, Math.max(1, files.size())));

        GraphIndexBuilder merged = new GraphIndexBuilder();
        int parsed = 0;
        int lexFailures = 0;
        int skipped = discovery.skippedInputs();

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(workerThreads, Math.max(1, files.size())));
        try {
            List<Future<GraphIndexBuilder>> futures = new ArrayList<>(files.size());
            for (Path file : files) {
                futures.add(executor.submit(() -> extractFile(file)));
            }
            for (int i = 0; i < files.size(); i++) {
                Path file = files.get(i);
                try {
                    merged.merge(futures.get(i).get());
                    parsed++;
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof LexException lexError) {
                        log.warn("Skipping {}: {}", file, lexError.getMessage());
                        lexFailures++;
                    } else if (cause instanceof IOException || cause instanceof UncheckedIOException) {
                        String reason = String.valueOf(cause.getMessage());
                        if (!skipDecision.skip(file, reason)) {
                            throw new IOException("Build aborted at " + file + ": " + reason, cause);
                        }
                        log.warn("Skipping unreadable {}: {}", file, reason);
                        skipped++;
                    } else if (cause instanceof RuntimeException runtime) {
                        throw runtime;
                    } else {
                        throw new IllegalStateException("Extraction failed for " + file, cause);
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Extraction interrupted");
        } finally {
            executor.shutdownNow();
        }

        GraphIndex index = merged.build();
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        ExtractionReport report = new ExtractionReport(
                parsed,
                lexFailures,
                skipped,
                merged.procedureCount(),
                merged.edgeCount(),
                elapsedMs);
        log.info("Parsed TCL files in {} ms", elapsedMs);
        return new ExtractionResult(index, report);
    }

    public GraphIndexBuilder extractFile(Path file) throws IOException, LexException {
        String source = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        GraphIndexBuilder builder = extractor.extract(source);
        log.debug("{}: {} procedures, {} call sites", file, builder.procedureCount(), builder.edgeCount());
        return builder;
    }
}
