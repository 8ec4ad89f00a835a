package com.dcgraph.lex;

public enum TokenKind {
    WORD,
    OPEN_BRACE,
    CLOSE_BRACE,
    OPEN_BRACKET,
    CLOSE_BRACKET,
    QUOTE,
    COMMENT,
    LINE_END,
    END_OF_INPUT
}
