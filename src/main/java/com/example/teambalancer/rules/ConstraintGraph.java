package com.example.teambalancer.rules;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Undirected adjacency over identity keys. Every present key has an entry,
 * possibly empty.
 */
public class ConstraintGraph {

    private final Map<String, Set<String>> adjacency = new LinkedHashMap<>();

    public ConstraintGraph(Iterable<String> keys) {
        for (String key : keys) {
            adjacency.put(key, new LinkedHashSet<>());
        }
    }

    void connect(String a, String b) {
        adjacency.computeIfAbsent(a, k -> new LinkedHashSet<>()).add(b);
        adjacency.computeIfAbsent(b, k -> new LinkedHashSet<>()).add(a);
    }

    public Set<String> neighbours(String key) {
        Set<String> set = adjacency.get(key);
        return set == null ? Set.of() : Collections.unmodifiableSet(set);
    }

    boolean areAdjacent(String a, String b) {
        Set<String> set = adjacency.get(a);
        return set != null && set.contains(b);
    }

    public int degree(String key) {
        return neighbours(key).size();
    }

    Set<String> keys() {
        return Collections.unmodifiableSet(adjacency.keySet());
    }

    int edgeCount() {
        return adjacency.values().stream().mapToInt(Set::size).sum() / 2;
    }
}
