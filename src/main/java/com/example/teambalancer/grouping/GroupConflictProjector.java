package com.example.teambalancer.grouping;

import com.example.teambalancer.exception.TeamGenerationException;
import com.example.teambalancer.generation.ErrorKind;
import com.example.teambalancer.roster.Member;
import com.example.teambalancer.rules.ConstraintGraph;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class GroupConflictProjector {

    /**
     * Projects exclusion edges onto groups. Fails with
     * {@link ErrorKind#CONTRADICTORY_RULES} when two members of one group exclude
     * each other, then with {@link ErrorKind#OVERSIZED_GROUP} when a group is
     * larger than {@code maxTeamSize}.
     */
    public GroupConflictGraph project(List<AtomicGroup> groups, ConstraintGraph exclusion, int maxTeamSize) {
        Map<String, Integer> groupOf = new HashMap<>();
        for (AtomicGroup g : groups) {
            for (Member m : g.members()) {
                groupOf.put(m.identityKey(), g.id());
            }
        }

        GroupConflictGraph graph = new GroupConflictGraph(groups.size());
        for (AtomicGroup g : groups) {
            for (Member m : g.members()) {
                for (String other : exclusion.neighbours(m.identityKey())) {
                    Integer otherGroup = groupOf.get(other);
                    if (otherGroup == null) {
                        continue;
                    }
                    if (otherGroup == g.id()) {
                        throw new TeamGenerationException(ErrorKind.CONTRADICTORY_RULES,
                                List.of(m.displayName() + " / " + displayName(g, other)));
                    }
                    graph.connect(g.id(), otherGroup);
                }
            }
        }

        for (AtomicGroup g : groups) {
            if (g.size() > maxTeamSize) {
                List<String> names = g.members().stream().map(Member::displayName).toList();
                throw new TeamGenerationException(ErrorKind.OVERSIZED_GROUP,
                        ErrorKind.OVERSIZED_GROUP.getMessage() + " (" + g.size() + " > " + maxTeamSize + ")",
                        names);
            }
        }
        return graph;
    }

    private String displayName(AtomicGroup group, String key) {
        return group.members().stream()
                .filter(m -> m.identityKey().equals(key))
                .map(Member::displayName)
                .findFirst()
                .orElse(key);
    }
}
