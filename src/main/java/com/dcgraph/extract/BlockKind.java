package com.dcgraph.extract;

public enum BlockKind {
    SCRIPT,
    EXPRESSION,
    SWITCH_BODY,
    DATA
}
