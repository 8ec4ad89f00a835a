package com.dcgraph.lex;

public class LexException extends Exception {
    private final int line;

    public LexException(String message, int line) {
        super(message + " (line " + line + ")");
        this.line = line;
    }

    public int line() {
        return line;
    }
}
