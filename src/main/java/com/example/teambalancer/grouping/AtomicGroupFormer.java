package com.example.teambalancer.grouping;

import com.example.teambalancer.roster.Member;
import com.example.teambalancer.rules.ConstraintGraph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses cohesion-connected members into atomic groups with a disjoint-set
 * union over member positions.
 */
public class AtomicGroupFormer {

    public List<AtomicGroup> form(List<Member> presentMembers, ConstraintGraph cohesion) {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < presentMembers.size(); i++) {
            index.put(presentMembers.get(i).identityKey(), i);
        }
        DisjointSet sets = new DisjointSet(presentMembers.size());
        for (Member m : presentMembers) {
            int from = index.get(m.identityKey());
            for (String other : cohesion.neighbours(m.identityKey())) {
                Integer to = index.get(other);
                if (to != null) {
                    sets.union(from, to);
                }
            }
        }

        // keyed by root, in order of each set's first member
        Map<Integer, List<Member>> byRoot = new LinkedHashMap<>();
        for (int i = 0; i < presentMembers.size(); i++) {
            byRoot.computeIfAbsent(sets.find(i), k -> new ArrayList<>()).add(presentMembers.get(i));
        }
        List<AtomicGroup> groups = new ArrayList<>(byRoot.size());
        for (List<Member> members : byRoot.values()) {
            groups.add(new AtomicGroup(groups.size(), members));
        }
        return groups;
    }

    static final class DisjointSet {
        private final int[] parent;
        private final int[] size;

        DisjointSet(int n) {
            parent = new int[n];
            size = new int[n];
            for (int i = 0; i < n; i++) {
                parent[i] = i;
                size[i] = 1;
            }
        }

        int find(int x) {
            int root = x;
            while (parent[root] != root) {
                root = parent[root];
            }
            while (parent[x] != root) {
                int next = parent[x];
                parent[x] = root;
                x = next;
            }
            return root;
        }

        void union(int a, int b) {
            int ra = find(a);
            int rb = find(b);
            if (ra == rb) {
                return;
            }
            if (size[ra] < size[rb]) {
                int tmp = ra;
                ra = rb;
                rb = tmp;
            }
            parent[rb] = ra;
            size[ra] += size[rb];
        }
    }
}
