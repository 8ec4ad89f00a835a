package com.dcgraph.query;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;

public class InteractiveSession {
    static final String PROMPT = "Enter a procedure name (add -d at the end to print the dependencies): ";
    private static final String DEPENDENCY_SUFFIX = "-d";

    private final QueryEngine engine;
    private final BufferedReader reader;
    private final PrintStream out;
    private final int maxDepth;

    public InteractiveSession(QueryEngine engine, BufferedReader reader, PrintStream out, int maxDepth) {
        this.engine = engine;
        this.reader = reader;
        this.out = out;
        this.maxDepth = maxDepth;
    }

    public int run() throws IOException {
        int answered = 0;
        while (true) {
            out.println();
            out.print(PROMPT);
            out.flush();
            String line = reader.readLine();
            if (line == null) {
                out.println();
                return answered;
            }
            Query query = parse(line);
            if (query == null) {
                continue;
            }
            if (query.dependencies()) {
                engine.printDependencies(query.procedureName());
            } else {
                out.println();
                engine.printCallSequence(query.procedureName(), maxDepth);
            }
            answered++;
        }
    }

    static Query parse(String line) {
        String text = line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
        if (text.isBlank()) {
            return null;
        }
        int suffixAt = text.length() - DEPENDENCY_SUFFIX.length();
        if (text.endsWith(DEPENDENCY_SUFFIX) && suffixAt > 0 && Character.isWhitespace(text.charAt(suffixAt - 1))) {
            String name = text.substring(0, suffixAt).strip();
            if (!name.isEmpty()) {
                return new Query(name, true);
            }
        }
        return new Query(text, false);
    }

    record Query(String procedureName, boolean dependencies) {
    }
}
