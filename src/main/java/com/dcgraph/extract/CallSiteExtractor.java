package com.dcgraph.extract;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dcgraph.index.GraphIndexBuilder;
import com.dcgraph.lex.LexException;
import com.dcgraph.lex.TclLexer;
import com.dcgraph.lex.Token;
import com.dcgraph.lex.TokenKind;

/**
 * Recognizes {@code proc name args body} definitions and records the leading word of every command inside a body
 * as a call of the enclosing procedure. Braced arguments are followed only where {@link ExtractionPolicy} says they
 * hold a script or an expression; other braces are data. Nothing is evaluated and names built by substitution are
 * ignored.
 */
public class CallSiteExtractor {
    private static final Logger log = LoggerFactory.getLogger(CallSiteExtractor.class);

    private final ExtractionPolicy policy;

    public CallSiteExtractor(ExtractionPolicy policy) {
        this.policy = policy;
    }

    public GraphIndexBuilder extract(String source) throws LexException {
        return new Pass(new TclLexer(source)).run();
    }

    private static final class Block {
        final BlockKind kind;
        final boolean bracket;
        final List<String> words = new ArrayList<>();

        private Block(BlockKind kind, boolean bracket) {
            this.kind = kind;
            this.bracket = bracket;
        }

        boolean substitutes() {
            return kind == BlockKind.SCRIPT || kind == BlockKind.EXPRESSION;
        }
    }

    private enum ProcState {
        NONE,
        EXPECT_NAME,
        IN_NAME_BLOCK,
        EXPECT_ARGS,
        IN_ARGS_BLOCK,
        EXPECT_BODY
    }

    private final class Pass {
        private final TclLexer lexer;
        private final GraphIndexBuilder builder = new GraphIndexBuilder();

        private int depth;
        private boolean commandStart = true;

        private ProcState procState = ProcState.NONE;
        private int procLine;
        private int blockDepth;
        private final List<String> nameWords = new ArrayList<>();
        private String pendingName;

        private String currentProc;
        private final Deque<Block> blocks = new ArrayDeque<>();

        private Pass(TclLexer lexer) {
            this.lexer = lexer;
        }

        private GraphIndexBuilder run() throws LexException {
            while (true) {
                Token token = lexer.next();
                if (token.is(TokenKind.END_OF_INPUT)) {
                    return builder;
                }
                if (token.is(TokenKind.COMMENT)) {
                    continue;
                }
                if (currentProc != null) {
                    inBody(token);
                } else if (procState != ProcState.NONE) {
                    inDefinition(token);
                } else {
                    outside(token);
                }
            }
        }

        private void outside(Token token) {
            if (commandStart && token.isWord("proc")) {
                procState = ProcState.EXPECT_NAME;
                procLine = token.line();
                commandStart = false;
                return;
            }
            track(token);
        }

        private void inDefinition(Token token) {
            switch (procState) {
                case EXPECT_NAME -> {
                    if (token.is(TokenKind.WORD) || token.is(TokenKind.QUOTE)) {
                        pendingName = token.unquoted();
                        procState = ProcState.EXPECT_ARGS;
                    } else if (token.is(TokenKind.OPEN_BRACE)) {
                        depth++;
                        blockDepth = depth;
                        nameWords.clear();
                        procState = ProcState.IN_NAME_BLOCK;
                    } else {
                        abandon(token);
                    }
                }
                case IN_NAME_BLOCK -> {
                    if (token.is(TokenKind.CLOSE_BRACE) && depth == blockDepth) {
                        depth--;
                        if (nameWords.size() == 1) {
                            pendingName = nameWords.get(0);
                            procState = ProcState.EXPECT_ARGS;
                        } else {
                            log.debug("Ignoring proc on line {} with name block {}", procLine, nameWords);
                            procState = ProcState.NONE;
                        }
                    } else {
                        trackDepth(token);
                        if (token.is(TokenKind.WORD)) {
                            nameWords.add(token.text());
                        }
                    }
                }
                case EXPECT_ARGS -> {
                    if (token.is(TokenKind.WORD) || token.is(TokenKind.QUOTE)) {
                        procState = ProcState.EXPECT_BODY;
                    } else if (token.is(TokenKind.OPEN_BRACE)) {
                        depth++;
                        blockDepth = depth;
                        procState = ProcState.IN_ARGS_BLOCK;
                    } else {
                        abandon(token);
                    }
                }
                case IN_ARGS_BLOCK -> {
                    if (token.is(TokenKind.CLOSE_BRACE) && depth == blockDepth) {
                        depth--;
                        procState = ProcState.EXPECT_BODY;
                    } else {
                        trackDepth(token);
                    }
                }
                case EXPECT_BODY -> {
                    if (token.is(TokenKind.OPEN_BRACE)) {
                        currentProc = pendingName;
                        procState = ProcState.NONE;
                        blocks.push(new Block(BlockKind.SCRIPT, false));
                        builder.defineProcedure(currentProc);
                        log.debug("proc {} defined on line {}", currentProc, procLine);
                    } else {
                        abandon(token);
                    }
                }
                default -> throw new IllegalStateException("Unexpected state " + procState);
            }
        }

        private void abandon(Token token) {
            log.debug("Ignoring malformed proc on line {} at {} '{}'", procLine, token.kind(), token.text());
            procState = ProcState.NONE;
            pendingName = null;
            outside(token);
        }

        private void inBody(Token token) {
            Block block = blocks.peek();
            switch (token.kind()) {
                case WORD -> word(block, token.text());
                case QUOTE -> {
                    if (block.substitutes()) {
                        recordQuotedSubstitutions(token.unquoted());
                    }
                    block.words.add(token.text());
                }
                case OPEN_BRACE -> {
                    BlockKind kind = nestedKind(block);
                    block.words.add(ScriptArguments.BLOCK);
                    blocks.push(new Block(kind, false));
                }
                case CLOSE_BRACE -> {
                    while (!blocks.isEmpty() && blocks.peek().bracket) {
                        blocks.pop();
                    }
                    blocks.pop();
                    if (blocks.isEmpty()) {
                        currentProc = null;
                        commandStart = false;
                    }
                }
                case OPEN_BRACKET -> {
                    if (block.substitutes()) {
                        block.words.add(ScriptArguments.SUBSTITUTION);
                        blocks.push(new Block(BlockKind.SCRIPT, true));
                    } else {
                        blocks.push(new Block(BlockKind.DATA, true));
                    }
                }
                case CLOSE_BRACKET -> {
                    if (block.bracket) {
                        blocks.pop();
                    }
                }
                case LINE_END -> {
                    if (block.kind == BlockKind.SCRIPT) {
                        block.words.clear();
                    }
                }
                default -> {
                }
            }
        }

        private void word(Block block, String text) {
            if (TclLexer.EXPANSION.equals(text)) {
                return;
            }
            if (block.kind == BlockKind.SCRIPT && block.words.isEmpty() && policy.isCallSite(text)) {
                builder.recordCall(currentProc, text);
            }
            block.words.add(text);
        }

        private BlockKind nestedKind(Block block) {
            return switch (block.kind) {
                case SCRIPT -> policy.blockKind(block.words);
                case SWITCH_BODY -> block.words.size() % 2 == 1 ? BlockKind.SCRIPT : BlockKind.DATA;
                default -> BlockKind.DATA;
            };
        }

        private void recordQuotedSubstitutions(String text) {
            int i = 0;
            while (i < text.length()) {
                char c = text.charAt(i);
                if (c == '\\') {
                    i += 2;
                    continue;
                }
                i++;
                if (c != '[') {
                    continue;
                }
                while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
                    i++;
                }
                int start = i;
                while (i < text.length() && !isCommandNameEnd(text.charAt(i))) {
                    i++;
                }
                String command = text.substring(start, i);
                if (policy.isCallSite(command)) {
                    builder.recordCall(currentProc, command);
                }
            }
        }

        private boolean isCommandNameEnd(char c) {
            return Character.isWhitespace(c) || c == '[' || c == ']' || c == ';' || c == '"';
        }

        private void track(Token token) {
            trackDepth(token);
            switch (token.kind()) {
                case LINE_END, OPEN_BRACE, OPEN_BRACKET -> commandStart = true;
                default -> commandStart = false;
            }
        }

        private void trackDepth(Token token) {
            if (token.is(TokenKind.OPEN_BRACE)) {
                depth++;
            } else if (token.is(TokenKind.CLOSE_BRACE)) {
                depth--;
            }
        }
    }
}
