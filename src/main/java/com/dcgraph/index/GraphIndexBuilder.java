package com.dcgraph.index;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public class GraphIndexBuilder {
    private final Map<String, List<String>> callMap = new LinkedHashMap<>();
    private final Map<String, List<String>> depMap = new LinkedHashMap<>();
    private int edgeCount;

    public GraphIndexBuilder defineProcedure(String name) {
        Objects.requireNonNull(name, "name");
        callMap.computeIfAbsent(name, unused -> new ArrayList<>());
        return this;
    }

    public GraphIndexBuilder recordCall(String caller, String callee) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(callee, "callee");
        callMap.computeIfAbsent(caller, unused -> new ArrayList<>()).add(callee);
        depMap.computeIfAbsent(callee, unused -> new ArrayList<>()).add(caller);
        edgeCount++;
        return this;
    }

    public GraphIndexBuilder merge(GraphIndexBuilder other) {
        for (Map.Entry<String, List<String>> entry : other.callMap.entrySet()) {
            callMap.computeIfAbsent(entry.getKey(), unused -> new ArrayList<>()).addAll(entry.getValue());
        }
        for (Map.Entry<String, List<String>> entry : other.depMap.entrySet()) {
            depMap.computeIfAbsent(entry.getKey(), unused -> new ArrayList<>()).addAll(entry.getValue());
        }
        edgeCount += other.edgeCount;
        return this;
    }

    public int procedureCount() {
        return callMap.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    public boolean isEmpty() {
        return callMap.isEmpty() && depMap.isEmpty();
    }

    public GraphIndex build() {
        return new GraphIndex(callMap, depMap);
    }

    void appendCallEntry(String caller, List<String> callees) {
        callMap.computeIfAbsent(caller, unused -> new ArrayList<>()).addAll(callees);
        edgeCount += callees.size();
    }

    void appendDependencyEntry(String callee, List<String> callers) {
        depMap.computeIfAbsent(callee, unused -> new ArrayList<>()).addAll(callers);
    }

    boolean isTransposeConsistent() {
        Map<String, Map<String, Integer>> forward = countEdges(callMap, false);
        Map<String, Map<String, Integer>> backward = countEdges(depMap, true);
        return forward.equals(backward);
    }

    private static Map<String, Map<String, Integer>> countEdges(Map<String, List<String>> map, boolean reversed) {
        Map<String, Map<String, Integer>> counts = new HashMap<>();
        for (Map.Entry<String, List<String>> entry : map.entrySet()) {
            for (String value : entry.getValue()) {
                String caller = reversed ? value : entry.getKey();
                String callee = reversed ? entry.getKey() : value;
                counts.computeIfAbsent(caller, unused -> new HashMap<>()).merge(callee, 1, Integer::sum);
            }
        }
        return counts;
    }
}
