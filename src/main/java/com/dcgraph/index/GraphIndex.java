package com.dcgraph.index;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable call graph ({@code caller -> callees}) and its transpose ({@code callee -> callers}). Both sequences keep
 * discovery order and retain duplicates.
 */
public final class GraphIndex {
    private final Map<String, List<String>> callMap;
    private final Map<String, List<String>> depMap;

    GraphIndex(Map<String, List<String>> callMap, Map<String, List<String>> depMap) {
        this.callMap = freeze(callMap);
        this.depMap = freeze(depMap);
    }

    public static GraphIndex empty() {
        return new GraphIndexBuilder().build();
    }

    public boolean contains(String name) {
        return callMap.containsKey(name);
    }

    public boolean hasDependencyInfo(String name) {
        return callMap.containsKey(name) || depMap.containsKey(name);
    }

    public List<String> calleesOf(String name) {
        return callMap.getOrDefault(name, List.of());
    }

    public List<String> callersOf(String name) {
        return depMap.getOrDefault(name, List.of());
    }

    public Set<String> procedureNames() {
        return callMap.keySet();
    }

    public Set<String> calleeNames() {
        return depMap.keySet();
    }

    public Map<String, List<String>> callMap() {
        return callMap;
    }

    public Map<String, List<String>> dependencyMap() {
        return depMap;
    }

    public int edgeCount() {
        return callMap.values().stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty() {
        return callMap.isEmpty() && depMap.isEmpty();
    }

    private static Map<String, List<String>> freeze(Map<String, List<String>> source) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : source.entrySet()) {
            copy.put(entry.getKey(), List.copyOf(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof GraphIndex that)) {
            return false;
        }
        return callMap.equals(that.callMap) && depMap.equals(that.depMap);
    }

    @Override
    public int hashCode() {
        return 31 * callMap.hashCode() + depMap.hashCode();
    }

    @Override
    public String toString() {
        return "GraphIndex{" +
                "procedures=" + callMap.size() +
                ", callees=" + depMap.size() +
                ", edges=" + edgeCount() +
                '}';
    }
}
