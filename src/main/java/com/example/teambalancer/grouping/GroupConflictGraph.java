package com.example.teambalancer.grouping;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Exclusion adjacency lifted to atomic groups, indexed by group id.
 */
public class GroupConflictGraph {

    private final List<Set<Integer>> adjacency;

    GroupConflictGraph(int groupCount) {
        adjacency = new ArrayList<>(groupCount);
        for (int i = 0; i < groupCount; i++) {
            adjacency.add(new LinkedHashSet<>());
        }
    }

    void connect(int a, int b) {
        adjacency.get(a).add(b);
        adjacency.get(b).add(a);
    }

    public boolean conflicts(int a, int b) {
        return adjacency.get(a).contains(b);
    }

    public int degree(int groupId) {
        return adjacency.get(groupId).size();
    }

    int groupCount() {
        return adjacency.size();
    }
}
