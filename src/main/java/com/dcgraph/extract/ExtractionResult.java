package com.dcgraph.extract;

import com.dcgraph.index.GraphIndex;

public record ExtractionResult(GraphIndex index, ExtractionReport report) {
}
