package com.dcgraph.extract;

import java.nio.file.Path;

@FunctionalInterface
public interface SkipDecision {
    boolean skip(Path path, String reason);
}
