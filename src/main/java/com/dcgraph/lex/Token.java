package com.dcgraph.lex;

public record Token(TokenKind kind, String text, int line) {

    public boolean is(TokenKind other) {
        return kind == other;
    }

    public boolean isWord(String value) {
        return kind == TokenKind.WORD && text.equals(value);
    }

    public String unquoted() {
        if (kind == TokenKind.QUOTE && text.length() >= 2) {
            return text.substring(1, text.length() - 1);
        }
        return text;
    }
}
