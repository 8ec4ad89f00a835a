package com.dcgraph.lex;

import java.util.ArrayDeque;
import java.util.Deque;

public class TclLexer {
    public static final String EXPANSION = "{*}";

    private final String source;
    private final Deque<OpenDelimiter> open = new ArrayDeque<>();
    private int pos;
    private int line = 1;
    private int openBraces;
    private boolean commandStart = true;
    private boolean finished;

    public TclLexer(String source) {
        this.source = source == null ? "" : source;
    }

    public boolean hasNext() {
        return !finished;
    }

    public Token next() throws LexException {
        if (finished) {
            throw new IllegalStateException("Token stream already reached end of input");
        }
        skipBlanks();
        if (pos >= source.length()) {
            if (!open.isEmpty()) {
                OpenDelimiter unclosed = open.peek();
                throw new LexException("Unclosed '" + unclosed.symbol() + "' opened on line " + unclosed.line()
                        + " at end of input", line);
            }
            finished = true;
            return new Token(TokenKind.END_OF_INPUT, "", line);
        }

        char c = source.charAt(pos);
        switch (c) {
            case '\n': {
                Token token = single(TokenKind.LINE_END, c);
                line++;
                commandStart = true;
                return token;
            }
            case ';':
                commandStart = true;
                return single(TokenKind.LINE_END, c);
            case '{':
                if (expansionPrefix()) {
                    pos += EXPANSION.length();
                    commandStart = false;
                    return new Token(TokenKind.WORD, EXPANSION, line);
                }
                open.push(new OpenDelimiter('{', line));
                openBraces++;
                commandStart = true;
                return single(TokenKind.OPEN_BRACE, c);
            case '}':
                closeBrace();
                commandStart = false;
                return single(TokenKind.CLOSE_BRACE, c);
            case '[':
                open.push(new OpenDelimiter('[', line));
                commandStart = true;
                return single(TokenKind.OPEN_BRACKET, c);
            case ']':
                if (bracketOnTop()) {
                    open.pop();
                    commandStart = false;
                    return single(TokenKind.CLOSE_BRACKET, c);
                }
                return word();
            case '#':
                if (commandStart) {
                    return comment();
                }
                return word();
            case '"':
                return openBraces > 0 ? quotedInBraces() : quoted();
            default:
                return word();
        }
    }

    private void skipBlanks() {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\r' || c == '\f') {
                pos++;
            } else if (c == '\\' && continuationLength(pos) > 0) {
                pos += continuationLength(pos);
                line++;
            } else {
                break;
            }
        }
    }

    private int continuationLength(int at) {
        if (at + 1 < source.length() && source.charAt(at + 1) == '\n') {
            return 2;
        }
        if (at + 2 < source.length() && source.charAt(at + 1) == '\r' && source.charAt(at + 2) == '\n') {
            return 3;
        }
        return 0;
    }

    private Token single(TokenKind kind, char c) {
        pos++;
        return new Token(kind, String.valueOf(c), line);
    }

    private void closeBrace() throws LexException {
        if (openBraces == 0) {
            throw new LexException("Unexpected '}' without a matching '{'", line);
        }
        while (open.peek().symbol() == '[') {
            open.pop();
        }
        open.pop();
        openBraces--;
    }

    private boolean bracketOnTop() {
        return !open.isEmpty() && open.peek().symbol() == '[';
    }

    private Token word() {
        int start = pos;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\r' || c == '\f' || c == '\n' || c == ';' || c == '[') {
                break;
            }
            if ((c == '{' || c == '}') && openBraces > 0) {
                break;
            }
            if (c == ']' && bracketOnTop()) {
                break;
            }
            if (c == '\\') {
                if (continuationLength(pos) > 0) {
                    break;
                }
                pos = Math.min(source.length(), pos + 2);
                continue;
            }
            if (c == '$' && pos + 1 < source.length() && source.charAt(pos + 1) == '{') {
                int close = source.indexOf('}', pos + 2);
                int newline = source.indexOf('\n', pos + 2);
                if (close > 0 && (newline < 0 || close < newline)) {
                    pos = close + 1;
                    continue;
                }
            }
            pos++;
        }
        commandStart = false;
        return new Token(TokenKind.WORD, source.substring(start, pos), line);
    }

    private Token quoted() throws LexException {
        int start = pos;
        int startLine = line;
        pos++;
        while (true) {
            if (pos >= source.length()) {
                throw new LexException("Unclosed '\"' opened on line " + startLine + " at end of input", line);
            }
            char c = source.charAt(pos);
            if (c == '\\') {
                if (pos + 1 < source.length() && source.charAt(pos + 1) == '\n') {
                    line++;
                }
                pos = Math.min(source.length(), pos + 2);
                continue;
            }
            pos++;
            if (c == '"') {
                break;
            }
            if (c == '\n') {
                line++;
            }
        }
        commandStart = false;
        return new Token(TokenKind.QUOTE, source.substring(start, pos), startLine);
    }

    private Token quotedInBraces() {
        int start = pos;
        int startLine = line;
        int balance = 0;
        pos++;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\\') {
                if (pos + 1 < source.length() && source.charAt(pos + 1) == '\n') {
                    line++;
                }
                pos = Math.min(source.length(), pos + 2);
                continue;
            }
            if (c == '"') {
                pos++;
                commandStart = false;
                return new Token(TokenKind.QUOTE, source.substring(start, pos), startLine);
            }
            if (c == '{') {
                balance++;
            } else if (c == '}') {
                if (balance == 0) {
                    break;
                }
                balance--;
            } else if (c == '\n') {
                line++;
            }
            pos++;
        }
        commandStart = false;
        return new Token(TokenKind.WORD, source.substring(start, pos), startLine);
    }

    private boolean expansionPrefix() {
        int after = pos + EXPANSION.length();
        if (!source.startsWith(EXPANSION, pos) || after >= source.length()) {
            return false;
        }
        char c = source.charAt(after);
        return !Character.isWhitespace(c) && c != ';' && c != '}';
    }

    private Token comment() {
        int start = pos;
        int startLine = line;
        int balance = 0;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\\') {
                if (continuationLength(pos) > 0) {
                    pos += continuationLength(pos);
                    line++;
                } else {
                    pos = Math.min(source.length(), pos + 2);
                }
                continue;
            }
            if (c == '\n') {
                break;
            }
            if (c == '{') {
                balance++;
            } else if (c == '}') {
                if (balance == 0 && openBraces > 0) {
                    break;
                }
                balance = Math.max(0, balance - 1);
            }
            pos++;
        }
        return new Token(TokenKind.COMMENT, source.substring(start, pos), startLine);
    }

    private record OpenDelimiter(char symbol, int line) {
    }
}
