package com.dcgraph.extract;

import java.util.List;

final class ScriptArguments {
    static final String BLOCK = "{}";
    static final String SUBSTITUTION = "[]";

    private ScriptArguments() {
    }

    static BlockKind classify(List<String> words) {
        int index = words.size();
        return switch (words.get(0)) {
            case "if" -> index == 1 || "elseif".equals(words.get(index - 1)) ? BlockKind.EXPRESSION : BlockKind.SCRIPT;
            case "while" -> index == 1 ? BlockKind.EXPRESSION : index == 2 ? BlockKind.SCRIPT : BlockKind.DATA;
            case "for" -> index == 2 ? BlockKind.EXPRESSION : index == 1 || index == 3 || index == 4 ? BlockKind.SCRIPT : BlockKind.DATA;
            case "foreach", "lmap" -> index >= 3 && index % 2 == 1 ? BlockKind.SCRIPT : BlockKind.DATA;
            case "catch", "time" -> index == 1 ? BlockKind.SCRIPT : BlockKind.DATA;
            case "expr" -> BlockKind.EXPRESSION;
            case "namespace" -> index >= 3 && "eval".equals(words.get(1)) ? BlockKind.SCRIPT : BlockKind.DATA;
            case "dict" -> dictArgument(words, index);
            case "switch" -> switchArgument(words, index);
            case "try" -> tryArgument(words, index);
            default -> BlockKind.SCRIPT;
        };
    }

    private static BlockKind dictArgument(List<String> words, int index) {
        if (index < 2) {
            return BlockKind.DATA;
        }
        return switch (words.get(1)) {
            case "for", "map" -> index == 4 ? BlockKind.SCRIPT : BlockKind.DATA;
            case "update", "with" -> index >= 3 ? BlockKind.SCRIPT : BlockKind.DATA;
            default -> BlockKind.DATA;
        };
    }

    private static BlockKind switchArgument(List<String> words, int index) {
        int value = 1;
        while (value < index) {
            String word = words.get(value);
            if (word.equals("--")) {
                value++;
                break;
            }
            if (!word.startsWith("-")) {
                break;
            }
            value += word.equals("-matchvar") || word.equals("-indexvar") ? 2 : 1;
        }
        if (index <= value) {
            return BlockKind.DATA;
        }
        int offset = index - value;
        if (offset == 1) {
            return BlockKind.SWITCH_BODY;
        }
        return offset % 2 == 0 ? BlockKind.SCRIPT : BlockKind.DATA;
    }

    private static BlockKind tryArgument(List<String> words, int index) {
        if (index == 1) {
            return BlockKind.SCRIPT;
        }
        int at = 2;
        while (at < index) {
            String word = words.get(at);
            if (word.equals("on") || word.equals("trap")) {
                if (index == at + 3) {
                    return BlockKind.SCRIPT;
                }
                at += 4;
            } else if (word.equals("finally")) {
                if (index == at + 1) {
                    return BlockKind.SCRIPT;
                }
                at += 2;
            } else {
                at++;
            }
        }
        return BlockKind.DATA;
    }
}
