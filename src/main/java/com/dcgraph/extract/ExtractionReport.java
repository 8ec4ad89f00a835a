package com.dcgraph.extract;

public record ExtractionReport(
        int filesParsed,
        int lexFailures,
        int skippedInputs,
        int procedures,
        int callSites,
        long elapsedMs) {
}
