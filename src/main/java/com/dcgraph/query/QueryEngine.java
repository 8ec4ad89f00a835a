package com.dcgraph.query;

import java.io.PrintStream;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import com.dcgraph.index.GraphIndex;

public class QueryEngine {
    static final int INDENT_STEP = 2;
    static final String PLACEHOLDER = "...";

    private final GraphIndex index;
    private final PrintStream out;

    public QueryEngine(GraphIndex index, PrintStream out) {
        this.index = index;
        this.out = out;
    }

    /**
     * Prints the depth-first call sequence starting at {@code entry}. A direct self-call is skipped; longer cycles
     * are cut only by {@code maxDepth}.
     *
     * @return {@code false} when no definition of {@code entry} is indexed
     */
    public boolean printCallSequence(String entry, int maxDepth) {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
        }
        if (!index.contains(entry)) {
            out.printf("There's no info available for procedure \"%s\"%n", entry);
            return false;
        }

        Deque<Frame> stack = new ArrayDeque<>();
        Frame root = enter(entry, maxDepth, 0);
        if (root != null) {
            stack.push(root);
        }
        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.next >= frame.callees.size()) {
                stack.pop();
                line(frame.indent, "<- ", frame.name);
                continue;
            }
            String callee = frame.callees.get(frame.next++);
            if (callee.equals(frame.name) || frame.remainingDepth - 1 == 0) {
                continue;
            }
            Frame child = enter(callee, frame.remainingDepth - 1, frame.indent + INDENT_STEP);
            if (child != null) {
                stack.push(child);
            }
        }
        return true;
    }

    public boolean printDependencies(String name) {
        if (!index.hasDependencyInfo(name)) {
            out.printf("There's no dependency info available for procedure \"%s\"%n", name);
            return false;
        }
        List<String> callers = index.callersOf(name);
        int width = String.valueOf(callers.size()).length();
        out.println();
        for (int i = 0; i < callers.size(); i++) {
            out.printf("%" + width + "d. %s%n", i + 1, callers.get(i));
        }
        out.println();
        return true;
    }

    private Frame enter(String name, int remainingDepth, int indent) {
        line(indent, "-> ", name);
        if (!index.contains(name)) {
            if (remainingDepth > 1) {
                line(indent + INDENT_STEP, "-> ", PLACEHOLDER);
                line(indent + INDENT_STEP, "<- ", PLACEHOLDER);
            }
            line(indent, "<- ", name);
            return null;
        }
        return new Frame(name, index.calleesOf(name), remainingDepth, indent);
    }

    private void line(int indent, String arrow, String name) {
        out.println(" ".repeat(indent) + arrow + name);
    }

    private static final class Frame {
        final String name;
        final List<String> callees;
        final int remainingDepth;
        final int indent;
        int next;

        private Frame(String name, List<String> callees, int remainingDepth, int indent) {
            this.name = name;
            this.callees = callees;
            this.remainingDepth = remainingDepth;
            this.indent = indent;
        }
    }
}
