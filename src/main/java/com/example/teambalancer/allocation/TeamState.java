package com.example.teambalancer.allocation;

import com.example.teambalancer.grouping.AtomicGroup;
import com.example.teambalancer.grouping.GroupConflictGraph;
import com.example.teambalancer.roster.Member;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable team under construction within a single attempt.
 */
public class TeamState {

    private final int index;
    private final List<AtomicGroup> groups = new ArrayList<>();
    private TeamTally tally = TeamTally.EMPTY;

    public TeamState(int index) {
        this.index = index;
    }

    TeamState copy() {
        TeamState c = new TeamState(index);
        c.groups.addAll(groups);
        c.tally = tally;
        return c;
    }

    public void add(AtomicGroup group) {
        groups.add(group);
        tally = tally.plus(group);
    }

    public void remove(AtomicGroup group) {
        if (!groups.remove(group)) {
            throw new IllegalStateException("group " + group.id() + " is not in team " + index);
        }
        tally = tally.minus(group);
    }

    /**
     * True when {@code group} conflicts with no group of this team other than
     * {@code ignored}, which may be null.
     */
    public boolean acceptsWithoutConflict(AtomicGroup group, AtomicGroup ignored, GroupConflictGraph conflicts) {
        for (AtomicGroup g : groups) {
            if (g == ignored) {
                continue;
            }
            if (conflicts.conflicts(group.id(), g.id())) {
                return false;
            }
        }
        return true;
    }

    public int index() {
        return index;
    }

    public List<AtomicGroup> groups() {
        return Collections.unmodifiableList(groups);
    }

    public List<Member> members() {
        List<Member> members = new ArrayList<>(tally.size());
        groups.forEach(g -> members.addAll(g.members()));
        return members;
    }

    public TeamTally tally() {
        return tally;
    }

    public int size() {
        return tally.size();
    }
}
