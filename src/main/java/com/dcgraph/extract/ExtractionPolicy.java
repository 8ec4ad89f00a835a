package com.dcgraph.extract;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.dcgraph.runtime.AppConfig;

public record ExtractionPolicy(Set<String> excludedCommands, boolean skipVariableCommands, Set<String> scriptCommands) {
    public static final Set<String> DEFAULT_SCRIPT_COMMANDS = Set.of(
            "if", "while", "for", "foreach", "lmap", "catch", "switch", "eval", "uplevel", "namespace", "try",
            "time", "expr", "dict");

    private static final Pattern NUMBER = Pattern.compile("[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?");

    public ExtractionPolicy {
        excludedCommands = excludedCommands == null ? Set.of() : Set.copyOf(excludedCommands);
        scriptCommands = scriptCommands == null ? DEFAULT_SCRIPT_COMMANDS : Set.copyOf(scriptCommands);
    }

    public static ExtractionPolicy defaults() {
        return new ExtractionPolicy(Set.of(), true, DEFAULT_SCRIPT_COMMANDS);
    }

    public static ExtractionPolicy from(AppConfig.ExtractionConfig config) {
        Set<String> scripts = config.getScriptCommands() == null ? DEFAULT_SCRIPT_COMMANDS : names(config.getScriptCommands());
        return new ExtractionPolicy(names(config.getExcludedCommands()), config.isSkipVariableCommands(), scripts);
    }

    public boolean isCallSite(String command) {
        if (command == null || command.isBlank()) {
            return false;
        }
        if (skipVariableCommands && command.startsWith("$")) {
            return false;
        }
        if (NUMBER.matcher(command).matches()) {
            return false;
        }
        return !excludedCommands.contains(command);
    }

    public BlockKind blockKind(List<String> commandWords) {
        if (commandWords.isEmpty() || !scriptCommands.contains(commandWords.get(0))) {
            return BlockKind.DATA;
        }
        return ScriptArguments.classify(commandWords);
    }

    private static Set<String> names(List<String> configured) {
        if (configured == null) {
            return Set.of();
        }
        return configured.stream()
                .filter(Objects::nonNull)
                .map(String::strip)
                .filter(name -> !name.isEmpty())
                .collect(Collectors.toSet());
    }
}
