package com.dcgraph;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dcgraph.extract.ExtractionReport;
import com.dcgraph.extract.ExtractionResult;
import com.dcgraph.extract.ExtractionService;
import com.dcgraph.index.CorruptIndexException;
import com.dcgraph.index.GraphIndex;
import com.dcgraph.index.IndexStore;
import com.dcgraph.query.InteractiveSession;
import com.dcgraph.query.QueryEngine;
import com.dcgraph.runtime.AppConfig;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "dcgraph",
        mixinStandardHelpOptions = true,
        version = "dcgraph 0.1.0",
        description = {
                "Parses TCL code and extracts the procedure call dependencies.",
                "",
                "Without -b or -f the program runs in interactive mode: type a procedure name to print its call "
                        + "sequence, or add -d after the name to print the procedures that call it directly."
        })
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE_ERROR = 2;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = { "-b", "--build" }, arity = "1..*", paramLabel = "PATH",
            description = "Build the index from TCL files or directories searched recursively")
    List<Path> buildPaths;

    @Option(names = { "-f", "--function" }, arity = "1..*", paramLabel = "PROCEDURE",
            description = "Query the call sequence of the given procedure(s)")
    List<String> procedures;

    @Option(names = { "-d", "--dependencies" },
            description = "With -f, print the procedures that call each name instead of its call sequence")
    boolean printDependencies;

    @Option(names = "--max-depth", paramLabel = "NUMBER",
            description = "Maximum depth of a printed call sequence. Must be positive (default: from config, 5)")
    Integer maxDepth;

    @Option(names = "--delete-index", description = "Delete the index file, if any")
    boolean deleteIndex;

    @Option(names = "--index-path", description = "Index file location (default: from config, ~/.dcgraph/call-index.bin)")
    Path indexPath;

    private final InputStream in;
    private final PrintStream out;
    private final IndexStore indexStore = new IndexStore();
    private BufferedReader reader;

    public Main() {
        this(System.in, System.out);
    }

    Main(InputStream in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = AppConfig.load(Path.of(configPath));
        int depth = maxDepth != null ? maxDepth : config.getQuery().getMaxDepth();
        if (depth <= 0) {
            log.error("You must provide a positive number as the max depth, got {}", depth);
            return EXIT_USAGE_ERROR;
        }
        Path index = indexPath != null ? indexPath : config.getIndex().resolvePath();

        if (deleteIndex) {
            if (indexStore.delete(index)) {
                log.info("Deleted index file {}", index);
            } else {
                log.info("No index file at {}", index);
            }
            return EXIT_OK;
        }
        if (buildPaths != null && !buildPaths.isEmpty()) {
            return runBuild(config, index);
        }
        return runQuery(index, depth);
    }

    private int runBuild(AppConfig config, Path index) throws IOException {
        ExtractionService service = ExtractionService.fromConfig(config.getExtraction(), this::confirmSkip);
        ExtractionResult result;
        try {
            result = service.extract(buildPaths);
        } catch (IOException e) {
            log.error("{}", e.getMessage());
            return EXIT_FAILURE;
        }
        ExtractionReport report = result.report();
        log.info("Number of TCL files parsed: {}", report.filesParsed());
        if (report.lexFailures() > 0 || report.skippedInputs() > 0) {
            log.warn("Skipped {} file(s) with malformed delimiters and {} unreadable input(s)",
                    report.lexFailures(),
                    report.skippedInputs());
        }
        log.info("Building and writing index...");
        indexStore.save(result.index(), index);
        log.info("Index written to {} procedures={} callSites={}", index, report.procedures(), report.callSites());
        return EXIT_OK;
    }

    private int runQuery(Path index, int depth) throws IOException {
        log.info("Reading index...");
        GraphIndex graph;
        try {
            graph = indexStore.load(index);
        } catch (NoSuchFileException e) {
            log.error("No index file at {}. Build one first with -b <PATH>...", index);
            return EXIT_FAILURE;
        } catch (CorruptIndexException e) {
            log.error("{}. Rebuild it with -b <PATH>...", e.getMessage());
            return EXIT_FAILURE;
        }

        QueryEngine engine = new QueryEngine(graph, out);
        if (procedures != null && !procedures.isEmpty()) {
            for (String procedure : procedures) {
                if (printDependencies) {
                    engine.printDependencies(procedure);
                } else {
                    engine.printCallSequence(procedure, depth);
                }
            }
            out.flush();
            return EXIT_OK;
        }

        int answered = new InteractiveSession(engine, reader(), out, depth).run();
        log.debug("Interactive session ended after {} queries", answered);
        return EXIT_OK;
    }

    boolean confirmSkip(Path path, String reason) {
        log.error("Cannot read {}: {}", path, reason);
        out.print("Do you want to continue and skip this file? [y/N] ");
        out.flush();
        try {
            String answer = reader().readLine();
            return answer != null && answer.strip().toLowerCase(Locale.ROOT).startsWith("y");
        } catch (IOException e) {
            log.warn("Unable to read confirmation from stdin", e);
            return false;
        }
    }

    private BufferedReader reader() {
        if (reader == null) {
            reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        }
        return reader;
    }
}
